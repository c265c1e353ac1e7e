package app.twodots.core.card.domain.dto;

import java.util.List;

public record CardPage(
        List<CardData> cards,
        long totalCount,
        boolean hasMore
) {
    public static CardPage empty() {
        return new CardPage(List.of(), 0, false);
    }
}
