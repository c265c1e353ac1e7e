package app.twodots.core.resolution.strategy;

import app.twodots.core.card.domain.dto.CardData;
import app.twodots.core.config.CardCoreProps;
import app.twodots.core.resolution.api.CardLookupPort;
import app.twodots.core.resolution.domain.NodeReference;
import org.springframework.stereotype.Component;

import java.util.Arrays;
import java.util.Locale;
import java.util.Optional;
import java.util.UUID;
import java.util.stream.Collectors;

/**
 * Searches by the first few significant words of the node's content, then
 * accepts a candidate only if its content or title holds the whole node content.
 */
@Component
public class ContentMatchStrategy implements CardMatchStrategy {

    static final int KEYWORD_COUNT = 3;
    static final int MIN_KEYWORD_LENGTH = 4;

    private final CardLookupPort cardLookupPort;
    private final int searchLimit;

    public ContentMatchStrategy(CardLookupPort cardLookupPort, CardCoreProps props) {
        this.cardLookupPort = cardLookupPort;
        this.searchLimit = props.resolution().searchLimit();
    }

    @Override
    public String name() {
        return "content";
    }

    @Override
    public double confidence() {
        return 0.6;
    }

    @Override
    public boolean appliesTo(NodeReference node) {
        return node.hasContent();
    }

    @Override
    public Optional<CardData> match(UUID userId, NodeReference node) {
        String query = keywordQuery(node.content());
        if (query.isEmpty()) {
            return Optional.empty();
        }

        String needle = node.content().toLowerCase(Locale.ROOT);
        return cardLookupPort.searchCards(userId, query, searchLimit).stream()
                .filter(card -> containsIgnoreCase(card.content(), needle) || containsIgnoreCase(card.title(), needle))
                .findFirst();
    }

    static String keywordQuery(String content) {
        return Arrays.stream(content.toLowerCase(Locale.ROOT).trim().split("\\s+"))
                .filter(word -> word.length() >= MIN_KEYWORD_LENGTH)
                .limit(KEYWORD_COUNT)
                .collect(Collectors.joining(" "));
    }

    private static boolean containsIgnoreCase(String haystack, String lowerNeedle) {
        return haystack != null && haystack.toLowerCase(Locale.ROOT).contains(lowerNeedle);
    }
}
