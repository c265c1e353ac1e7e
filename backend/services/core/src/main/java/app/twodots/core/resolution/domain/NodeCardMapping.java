package app.twodots.core.resolution.domain;

import app.twodots.core.card.domain.type.CardType;

import java.time.Instant;
import java.util.UUID;

public record NodeCardMapping(
        String nodeId,
        UUID cardId,
        CardType cardType,
        double confidence,
        Instant resolvedAt
) {
    public NodeCardMapping {
        if (confidence < 0.0 || confidence > 1.0) {
            throw new IllegalArgumentException("confidence must be within [0, 1]");
        }
    }
}
