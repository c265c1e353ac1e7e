package app.twodots.core.card.domain.entity;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Table;

import java.time.Instant;
import java.util.UUID;

@Entity
@Table(name = "memory_units", schema = "app_core")
public class MemoryUnitEntity implements SourceEntity {

    @Id
    @Column(name = "entity_id", nullable = false)
    private UUID entityId;

    @Column(name = "user_id", nullable = false)
    private UUID userId;

    @Column(name = "title", nullable = false)
    private String title;

    @Column(name = "content", nullable = false)
    private String content;

    @Column(name = "importance_score")
    private Double importanceScore;

    @Column(name = "sentiment_score")
    private Double sentimentScore;

    @Column(name = "source_conversation_id")
    private UUID sourceConversationId;

    @Column(name = "status", nullable = false)
    private String status;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "updated_at")
    private Instant updatedAt;

    public MemoryUnitEntity() {
    }

    public MemoryUnitEntity(UUID entityId, UUID userId, String title, String content, Instant createdAt) {
        this.entityId = entityId;
        this.userId = userId;
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

    @Override
    public String getTitle() {
        return title;
    }

    @Override
    public String getContent() {
        return content;
    }

    public Double getImportanceScore() {
        return importanceScore;
    }

    public void setImportanceScore(Double importanceScore) {
        this.importanceScore = importanceScore;
    }

    public Double getSentimentScore() {
        return sentimentScore;
    }

    public UUID getSourceConversationId() {
        return sourceConversationId;
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
