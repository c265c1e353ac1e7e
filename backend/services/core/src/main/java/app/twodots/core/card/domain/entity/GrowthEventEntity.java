package app.twodots.core.card.domain.entity;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Table;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

@Entity
@Table(name = "growth_events", schema = "app_core")
public class GrowthEventEntity implements SourceEntity {

    @Id
    @Column(name = "entity_id", nullable = false)
    private UUID entityId;

    @Column(name = "user_id", nullable = false)
    private UUID userId;

    @Column(name = "title")
    private String title;

    @Column(name = "content")
    private String content;

    @Column(name = "source", nullable = false)
    private String source;

    @Column(name = "dimension_key", nullable = false)
    private String dimensionKey;

    @Column(name = "delta_value", nullable = false, precision = 3, scale = 1)
    private BigDecimal deltaValue;

    @Column(name = "status", nullable = false)
    private String status;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "updated_at")
    private Instant updatedAt;

    public GrowthEventEntity() {
    }

    public GrowthEventEntity(UUID entityId,
                             UUID userId,
                             String title,
                             String content,
                             String source,
                             String dimensionKey,
                             BigDecimal deltaValue,
                             Instant createdAt) {
        this.entityId = entityId;
        this.userId = userId;
        this.title = title;
        this.content = content;
        this.source = source;
        this.dimensionKey = dimensionKey;
        this.deltaValue = deltaValue;
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

    public String getSource() {
        return source;
    }

    public String getDimensionKey() {
        return dimensionKey;
    }

    public BigDecimal getDeltaValue() {
        return deltaValue;
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
