package app.twodots.core.card.adapter;

import app.twodots.core.card.domain.dto.CardPage;
import app.twodots.core.card.domain.request.CardListQuery;
import app.twodots.core.card.service.CardQueryService;
import app.twodots.core.feed.api.CardListingPort;
import org.springframework.stereotype.Component;

import java.util.UUID;

@Component
public class CardListingAdapter implements CardListingPort {

    private final CardQueryService cardQueryService;

    public CardListingAdapter(CardQueryService cardQueryService) {
        this.cardQueryService = cardQueryService;
    }

    @Override
    public CardPage listCards(UUID userId, CardListQuery query) {
        return cardQueryService.list(userId, query);
    }
}
