package app.twodots.core.feed.api;

import app.twodots.core.card.domain.dto.CardPage;
import app.twodots.core.card.domain.request.CardListQuery;

import java.util.UUID;

public interface CardListingPort {

    CardPage listCards(UUID userId, CardListQuery query);
}
