package app.twodots.core.card.domain.entity;

import app.twodots.core.card.domain.type.CardStatus;
import app.twodots.core.card.domain.type.CardType;
import app.twodots.core.card.domain.type.SourceEntityType;
import app.twodots.core.card.domain.type.SourceEntityTypeConverter;
import jakarta.persistence.*;

import java.time.Instant;
import java.util.UUID;

@Entity
@Table(name = "cards", schema = "app_core")
public class CardEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    @Column(name = "card_id", nullable = false)
    private UUID cardId;

    @Column(name = "user_id", nullable = false)
    private UUID userId;

    @Enumerated(EnumType.STRING)
    @Column(name = "card_type", nullable = false)
    private CardType type;

    @Column(name = "source_entity_id", nullable = false)
    private UUID sourceEntityId;

    @Convert(converter = SourceEntityTypeConverter.class)
    @Column(name = "source_entity_type", nullable = false)
    private SourceEntityType sourceEntityType; // null when the stored label is unknown

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false)
    private CardStatus status;

    @Column(name = "is_favorited", nullable = false)
    private boolean favorited;

    @Column(name = "is_synced", nullable = false)
    private boolean synced;

    @Column(name = "is_selected", nullable = false)
    private boolean selected;

    @Column(name = "background_image_url")
    private String backgroundImageUrl;

    @Column(name = "custom_title")
    private String customTitle;

    @Column(name = "custom_content")
    private String customContent;

    @Column(name = "display_order")
    private Integer displayOrder;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    public CardEntity() {
    }

    public CardEntity(
            UUID userId,
            CardType type,
            UUID sourceEntityId,
            SourceEntityType sourceEntityType,
            CardStatus status,
            String customTitle,
            String customContent,
            String backgroundImageUrl,
            Instant createdAt,
            Instant updatedAt
    ) {
        this.userId = userId;
        this.type = type;
        this.sourceEntityId = sourceEntityId;
        this.sourceEntityType = sourceEntityType;
        this.status = status;
        this.customTitle = customTitle;
        this.customContent = customContent;
        this.backgroundImageUrl = backgroundImageUrl;
        this.createdAt = createdAt;
        this.updatedAt = updatedAt;
        this.synced = true;
    }

    public UUID getCardId() {
        return cardId;
    }

    public void setCardId(UUID cardId) {
        this.cardId = cardId;
    }

    public UUID getUserId() {
        return userId;
    }

    public void setUserId(UUID userId) {
        this.userId = userId;
    }

    public CardType getType() {
        return type;
    }

    public void setType(CardType type) {
        this.type = type;
    }

    public UUID getSourceEntityId() {
        return sourceEntityId;
    }

    public void setSourceEntityId(UUID sourceEntityId) {
        this.sourceEntityId = sourceEntityId;
    }

    public SourceEntityType getSourceEntityType() {
        return sourceEntityType;
    }

    public void setSourceEntityType(SourceEntityType sourceEntityType) {
        this.sourceEntityType = sourceEntityType;
    }

    public CardStatus getStatus() {
        return status;
    }

    public void setStatus(CardStatus status) {
        this.status = status;
    }

    public boolean isFavorited() {
        return favorited;
    }

    public void setFavorited(boolean favorited) {
        this.favorited = favorited;
    }

    public boolean isSynced() {
        return synced;
    }

    public void setSynced(boolean synced) {
        this.synced = synced;
    }

    public boolean isSelected() {
        return selected;
    }

    public void setSelected(boolean selected) {
        this.selected = selected;
    }

    public String getBackgroundImageUrl() {
        return backgroundImageUrl;
    }

    public void setBackgroundImageUrl(String backgroundImageUrl) {
        this.backgroundImageUrl = backgroundImageUrl;
    }

    public String getCustomTitle() {
        return customTitle;
    }

    public void setCustomTitle(String customTitle) {
        this.customTitle = customTitle;
    }

    public String getCustomContent() {
        return customContent;
    }

    public void setCustomContent(String customContent) {
        this.customContent = customContent;
    }

    public Integer getDisplayOrder() {
        return displayOrder;
    }

    public void setDisplayOrder(Integer displayOrder) {
        this.displayOrder = displayOrder;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public void setCreatedAt(Instant createdAt) {
        this.createdAt = createdAt;
    }

    public Instant getUpdatedAt() {
        return updatedAt;
    }

    public void setUpdatedAt(Instant updatedAt) {
        this.updatedAt = updatedAt;
    }
}
