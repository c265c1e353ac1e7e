package app.twodots.core.card.domain.dto;

import app.twodots.core.card.domain.type.SourceEntityType;

import java.util.UUID;

public record SourceEntityView(
        SourceEntityType type,
        UUID entityId,
        String title,
        String content
) {
}
