package app.twodots.core.card.domain.type;

public enum CardType {
    MEMORY_UNIT(SourceEntityType.MEMORY_UNIT),
    CONCEPT(SourceEntityType.CONCEPT),
    DERIVED_ARTIFACT(SourceEntityType.DERIVED_ARTIFACT),
    PROACTIVE_PROMPT(SourceEntityType.PROACTIVE_PROMPT),
    COMMUNITY(SourceEntityType.COMMUNITY),
    GROWTH_EVENT(SourceEntityType.GROWTH_EVENT),
    USER(SourceEntityType.USER);

    private final SourceEntityType sourceEntityType;

    CardType(SourceEntityType sourceEntityType) {
        this.sourceEntityType = sourceEntityType;
    }

    public SourceEntityType sourceEntityType() {
        return sourceEntityType;
    }

    public static CardType fromString(String v) {
        return CardType.valueOf(v.trim().toUpperCase());
    }
}
