package app.twodots.core.card.adapter;

import app.twodots.core.card.domain.dto.CardData;
import app.twodots.core.card.service.CardQueryService;
import app.twodots.core.resolution.api.CardLookupPort;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Component
public class CardLookupAdapter implements CardLookupPort {

    private final CardQueryService cardQueryService;

    public CardLookupAdapter(CardQueryService cardQueryService) {
        this.cardQueryService = cardQueryService;
    }

    @Override
    public Optional<CardData> findCard(UUID userId, UUID cardId) {
        return cardQueryService.findById(userId, cardId);
    }

    @Override
    public List<CardData> searchCards(UUID userId, String query, int limit) {
        return cardQueryService.search(userId, query, limit);
    }

    @Override
    public List<CardData> findRelatedCards(UUID userId, UUID cardId, int limit) {
        return cardQueryService.findRelated(userId, cardId, limit);
    }
}
