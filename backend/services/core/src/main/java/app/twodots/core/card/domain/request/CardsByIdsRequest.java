package app.twodots.core.card.domain.request;

import java.util.List;
import java.util.UUID;

public record CardsByIdsRequest(
        List<UUID> cardIds
) {
}
