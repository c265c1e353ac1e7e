package app.twodots.core.card.domain.entity;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Table;

import java.time.Instant;
import java.util.UUID;

@Entity
@Table(name = "proactive_prompts", schema = "app_core")
public class ProactivePromptEntity implements SourceEntity {

    @Id
    @Column(name = "entity_id", nullable = false)
    private UUID entityId;

    @Column(name = "user_id", nullable = false)
    private UUID userId;

    @Column(name = "title")
    private String title;

    @Column(name = "content", nullable = false)
    private String content;

    @Column(name = "source_agent", nullable = false)
    private String sourceAgent;

    @Column(name = "cycle_id")
    private UUID cycleId;

    @Column(name = "status", nullable = false)
    private String status;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "updated_at")
    private Instant updatedAt;

    public ProactivePromptEntity() {
    }

    public ProactivePromptEntity(UUID entityId, UUID userId, String title, String content, String sourceAgent, Instant createdAt) {
        this.entityId = entityId;
        this.userId = userId;
        this.title = title;
        this.content = content;
        this.sourceAgent = sourceAgent;
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

    public String getSourceAgent() {
        return sourceAgent;
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
