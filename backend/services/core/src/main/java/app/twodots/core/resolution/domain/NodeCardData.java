package app.twodots.core.resolution.domain;

import app.twodots.core.card.domain.dto.CardData;
import com.fasterxml.jackson.databind.JsonNode;

import java.util.List;

public record NodeCardData(
        CardData card,
        List<CardData> relatedCards,
        List<JsonNode> connections
) {
    public static NodeCardData empty() {
        return new NodeCardData(null, List.of(), List.of());
    }
}
