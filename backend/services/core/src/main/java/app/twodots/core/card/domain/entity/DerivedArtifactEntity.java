package app.twodots.core.card.domain.entity;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Table;

import java.time.Instant;
import java.util.UUID;

@Entity
@Table(name = "derived_artifacts", schema = "app_core")
public class DerivedArtifactEntity implements SourceEntity {

    @Id
    @Column(name = "entity_id", nullable = false)
    private UUID entityId;

    @Column(name = "user_id", nullable = false)
    private UUID userId;

    @Column(name = "artifact_type", nullable = false)
    private String artifactType;

    @Column(name = "title", nullable = false)
    private String title;

    @Column(name = "content")
    private String content;

    @Column(name = "cycle_id")
    private UUID cycleId;

    @Column(name = "status", nullable = false)
    private String status;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "updated_at")
    private Instant updatedAt;

    public DerivedArtifactEntity() {
    }

    public DerivedArtifactEntity(UUID entityId, UUID userId, String artifactType, String title, String content, Instant createdAt) {
        this.entityId = entityId;
        this.userId = userId;
        this.artifactType = artifactType;
        this.title = title;
        this.content = content;
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

    public String getArtifactType() {
        return artifactType;
    }

    @Override
    public String getTitle() {
        return title;
    }

    @Override
    public String getContent() {
        return content;
    }

    public UUID getCycleId() {
        return cycleId;
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
