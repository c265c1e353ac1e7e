package app.twodots.core.card.domain.type;

import java.util.Locale;
import java.util.Optional;
import java.util.Set;

/**
 * Kinds of records a card can point at. The label is the value stored in
 * {@code cards.source_entity_type}; aliases cover the snake_case and plural
 * spellings used by older writers.
 */
public enum SourceEntityType {
    MEMORY_UNIT("MemoryUnit", "memory_unit", "memory_units", "memoryunit"),
    CONCEPT("Concept", "concept", "concepts"),
    DERIVED_ARTIFACT("DerivedArtifact", "derived_artifact", "derived_artifacts", "derivedartifact"),
    PROACTIVE_PROMPT("ProactivePrompt", "proactive_prompt", "proactive_prompts", "proactiveprompt"),
    COMMUNITY("Community", "community", "communities"),
    GROWTH_EVENT("GrowthEvent", "growth_event", "growth_events", "growthevent"),
    USER("User", "user", "users");

    private final String label;
    private final Set<String> aliases;

    SourceEntityType(String label, String... aliases) {
        this.label = label;
        this.aliases = Set.of(aliases);
    }

    public String label() {
        return label;
    }

    public static Optional<SourceEntityType> fromLabel(String value) {
        if (value == null || value.isBlank()) {
            return Optional.empty();
        }
        String trimmed = value.trim();
        String lower = trimmed.toLowerCase(Locale.ROOT);
        for (SourceEntityType type : values()) {
            if (type.label.equals(trimmed) || type.aliases.contains(lower)) {
                return Optional.of(type);
            }
        }
        return Optional.empty();
    }
}
