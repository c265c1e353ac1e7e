package app.twodots.core.resolution.strategy;

import app.twodots.core.card.domain.dto.CardData;
import app.twodots.core.resolution.api.CardLookupPort;
import app.twodots.core.resolution.domain.NodeReference;
import org.springframework.stereotype.Component;

import java.util.Optional;
import java.util.UUID;

@Component
public class DirectIdMatchStrategy implements CardMatchStrategy {

    private final CardLookupPort cardLookupPort;

    public DirectIdMatchStrategy(CardLookupPort cardLookupPort) {
        this.cardLookupPort = cardLookupPort;
    }

    @Override
    public String name() {
        return "direct-id";
    }

    @Override
    public double confidence() {
        return 1.0;
    }

    @Override
    public boolean appliesTo(NodeReference node) {
        return node.id() != null && !node.id().isBlank();
    }

    @Override
    public Optional<CardData> match(UUID userId, NodeReference node) {
        UUID cardId;
        try {
            cardId = UUID.fromString(node.id().trim());
        } catch (IllegalArgumentException ex) {
            // graph ids that are not card ids fall through to the hint strategies
            return Optional.empty();
        }
        return cardLookupPort.findCard(userId, cardId);
    }
}
