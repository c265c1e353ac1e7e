package app.twodots.core.resolution.domain;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * A graph node as the canvas sends it. Only {@code id} is required; the
 * remaining fields are hints used when the id is not a card id.
 *
 * @param connections JSON array of edges, passed through untouched
 * @param metadata    free-form JSON object, may carry its own {@code connections} array
 */
public record NodeReference(
        String id,
        String title,
        String content,
        JsonNode connections,
        JsonNode metadata
) {
    public static NodeReference of(String id, String title, String content) {
        return new NodeReference(id, title, content, null, null);
    }

    public boolean hasTitle() {
        return title != null && !title.isBlank();
    }

    public boolean hasContent() {
        return content != null && !content.isBlank();
    }
}
