package app.twodots.core.card.domain.dto;

import app.twodots.core.card.domain.type.CardStatus;
import app.twodots.core.card.domain.type.CardType;
import app.twodots.core.card.domain.type.SourceEntityType;

import java.time.Instant;
import java.util.UUID;

/**
 * Card row merged with the title and content of the entity it points at.
 * Custom overrides win over entity values; recomputed on every load.
 */
public record CardData(
        UUID cardId,
        UUID userId,
        CardType type,
        UUID sourceEntityId,
        SourceEntityType sourceEntityType,
        CardStatus status,
        boolean favorited,
        String backgroundImageUrl,
        String customTitle,
        String customContent,
        Integer displayOrder,
        String title,
        String content,
        Instant createdAt,
        Instant updatedAt
) {
}
