package app.twodots.core.resolution.strategy;

import app.twodots.core.card.domain.dto.CardData;
import app.twodots.core.config.CardCoreProps;
import app.twodots.core.resolution.api.CardLookupPort;
import app.twodots.core.resolution.domain.NodeReference;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.UUID;

/**
 * Searches by the node's title. An exact case-insensitive title wins over a
 * partial one; partial means either title contains the other.
 */
@Component
public class TitleMatchStrategy implements CardMatchStrategy {

    private final CardLookupPort cardLookupPort;
    private final int searchLimit;

    public TitleMatchStrategy(CardLookupPort cardLookupPort, CardCoreProps props) {
        this.cardLookupPort = cardLookupPort;
        this.searchLimit = props.resolution().searchLimit();
    }

    @Override
    public String name() {
        return "title";
    }

    @Override
    public double confidence() {
        return 0.8;
    }

    @Override
    public boolean appliesTo(NodeReference node) {
        return node.hasTitle();
    }

    @Override
    public Optional<CardData> match(UUID userId, NodeReference node) {
        String wanted = node.title().trim().toLowerCase(Locale.ROOT);
        List<CardData> candidates = cardLookupPort.searchCards(userId, node.title().trim(), searchLimit);

        Optional<CardData> exact = candidates.stream()
                .filter(card -> wanted.equals(normalized(card.title())))
                .findFirst();
        if (exact.isPresent()) {
            return exact;
        }

        return candidates.stream()
                .filter(card -> {
                    String title = normalized(card.title());
                    return !title.isEmpty() && (title.contains(wanted) || wanted.contains(title));
                })
                .findFirst();
    }

    private static String normalized(String title) {
        return title == null ? "" : title.trim().toLowerCase(Locale.ROOT);
    }
}
