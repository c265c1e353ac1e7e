package app.twodots.core.card.domain.request;

public enum CardSortField {
    CREATED_AT,
    TITLE;

    public static CardSortField fromString(String v) {
        if (v == null || v.isBlank()) {
            return CREATED_AT;
        }
        return CardSortField.valueOf(v.trim().toUpperCase());
    }
}
