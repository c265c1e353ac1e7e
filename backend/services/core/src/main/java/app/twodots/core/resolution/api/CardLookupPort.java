package app.twodots.core.resolution.api;

import app.twodots.core.card.domain.dto.CardData;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

public interface CardLookupPort {

    Optional<CardData> findCard(UUID userId, UUID cardId);

    List<CardData> searchCards(UUID userId, String query, int limit);

    List<CardData> findRelatedCards(UUID userId, UUID cardId, int limit);
}
