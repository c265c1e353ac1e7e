package app.twodots.core.support;

import app.twodots.core.card.domain.dto.CardData;
import app.twodots.core.card.domain.entity.CardEntity;
import app.twodots.core.card.domain.type.CardStatus;
import app.twodots.core.card.domain.type.CardType;
import app.twodots.core.card.domain.type.SourceEntityType;

import java.time.Instant;
import java.util.UUID;

public final class CardFixtures {

    public static final Instant NOW = Instant.parse("2025-03-01T10:00:00Z");

    private CardFixtures() {
    }

    public static CardEntity card(UUID userId, CardType type, UUID sourceEntityId) {
        CardEntity card = new CardEntity(
                userId,
                type,
                sourceEntityId,
                type.sourceEntityType(),
                CardStatus.ACTIVE_CANVAS,
                null,
                null,
                null,
                NOW,
                NOW
        );
        card.setCardId(UUID.randomUUID());
        return card;
    }

    public static CardData cardData(UUID cardId, String title, String content) {
        return cardData(cardId, CardType.CONCEPT, title, content);
    }

    public static CardData cardData(UUID cardId, CardType type, String title, String content) {
        return new CardData(
                cardId,
                UUID.randomUUID(),
                type,
                UUID.randomUUID(),
                type.sourceEntityType(),
                CardStatus.ACTIVE_CANVAS,
                false,
                null,
                null,
                null,
                null,
                title,
                content,
                NOW,
                NOW
        );
    }

    public static SourceEntityType typeOf(CardType type) {
        return type.sourceEntityType();
    }
}
