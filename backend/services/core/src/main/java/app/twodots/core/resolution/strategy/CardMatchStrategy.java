package app.twodots.core.resolution.strategy;

import app.twodots.core.card.domain.dto.CardData;
import app.twodots.core.resolution.domain.NodeReference;

import java.util.Optional;
import java.util.UUID;

/**
 * One way of finding the card behind a graph node. Strategies are tried from
 * the highest {@link #confidence()} down; the first match wins.
 */
public interface CardMatchStrategy {

    String name();

    /**
     * Confidence recorded on a mapping produced by this strategy, within [0, 1].
     */
    double confidence();

    boolean appliesTo(NodeReference node);

    Optional<CardData> match(UUID userId, NodeReference node);
}
