package app.twodots.core.card.domain.type;

public enum CardStatus {
    ACTIVE_CANVAS,
    ACTIVE_ARCHIVE,
    COMPLETED
}
