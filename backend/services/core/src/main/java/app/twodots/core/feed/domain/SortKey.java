package app.twodots.core.feed.domain;

import app.twodots.core.card.domain.request.CardSortField;
import org.springframework.data.domain.Sort;

public enum SortKey {
    NEWEST(CardSortField.CREATED_AT, Sort.Direction.DESC),
    OLDEST(CardSortField.CREATED_AT, Sort.Direction.ASC),
    TITLE_ASC(CardSortField.TITLE, Sort.Direction.ASC),
    TITLE_DESC(CardSortField.TITLE, Sort.Direction.DESC);

    private final CardSortField sortField;
    private final Sort.Direction sortOrder;

    SortKey(CardSortField sortField, Sort.Direction sortOrder) {
        this.sortField = sortField;
        this.sortOrder = sortOrder;
    }

    public CardSortField sortField() {
        return sortField;
    }

    public Sort.Direction sortOrder() {
        return sortOrder;
    }
}
