package app.twodots.core.card.domain.request;

import app.twodots.core.card.domain.type.CardType;
import org.springframework.data.domain.Sort;

public record CardListQuery(
        int limit,
        int offset,
        CardSortField sortField,
        Sort.Direction sortOrder,
        boolean coverFirst,
        CardType cardType
) {
    public static final int DEFAULT_LIMIT = 200;
    public static final int MAX_LIMIT = 500;

    public CardListQuery {
        if (offset < 0) {
            throw new IllegalArgumentException("offset must be >= 0");
        }
        limit = limit < 1 ? DEFAULT_LIMIT : Math.min(limit, MAX_LIMIT);
        sortField = sortField == null ? CardSortField.CREATED_AT : sortField;
        sortOrder = sortOrder == null ? Sort.Direction.DESC : sortOrder;
    }

    public static CardListQuery page(int limit, int offset, CardSortField sortField, Sort.Direction sortOrder, boolean coverFirst) {
        return new CardListQuery(limit, offset, sortField, sortOrder, coverFirst, null);
    }
}
