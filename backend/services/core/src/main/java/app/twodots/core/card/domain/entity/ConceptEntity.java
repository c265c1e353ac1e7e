package app.twodots.core.card.domain.entity;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Table;

import java.time.Instant;
import java.util.UUID;

@Entity
@Table(name = "concepts", schema = "app_core")
public class ConceptEntity implements SourceEntity {

    @Id
    @Column(name = "entity_id", nullable = false)
    private UUID entityId;

    @Column(name = "user_id", nullable = false)
    private UUID userId;

    @Column(name = "title", nullable = false)
    private String title;

    @Column(name = "content")
    private String content;

    @Column(name = "concept_type", nullable = false)
    private String conceptType;

    @Column(name = "community_id")
    private UUID communityId;

    @Column(name = "merged_into_entity_id")
    private UUID mergedIntoEntityId;

    @Column(name = "importance_score")
    private Double importanceScore;

    @Column(name = "status", nullable = false)
    private String status;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "updated_at")
    private Instant updatedAt;

    public ConceptEntity() {
    }

    public ConceptEntity(UUID entityId, UUID userId, String title, String content, String conceptType, Instant createdAt) {
        this.entityId = entityId;
        this.userId = userId;
        this.title = title;
        this.content = content;
        this.conceptType = conceptType;
        this.status = "active";
        this.createdAt = createdAt;
    }

    @Override
    public UUID getEntityId() {
        return entityId;
    }

    public UUID getUserId() {
        return userId;
    }

    @Override
    public String getTitle() {
        return title;
    }

    @Override
    public String getContent() {
        return content;
    }

    public String getConceptType() {
        return conceptType;
    }

    public UUID getCommunityId() {
        return communityId;
    }

    public void setCommunityId(UUID communityId) {
        this.communityId = communityId;
    }

    public UUID getMergedIntoEntityId() {
        return mergedIntoEntityId;
    }

    public Double getImportanceScore() {
        return importanceScore;
    }

    public String getStatus() {
        return status;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public Instant getUpdatedAt() {
        return updatedAt;
    }
}
