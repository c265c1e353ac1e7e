package app.twodots.core.feed.service;

import app.twodots.core.config.CardCoreProps;
import app.twodots.core.config.CardExecutorConfig;
import app.twodots.core.feed.api.CardListingPort;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.util.UUID;
import java.util.concurrent.Executor;

@Component
public class CardFeedFactory {

    private final CardListingPort cardListingPort;
    private final Executor executor;
    private final CardCoreProps.Feed props;

    public CardFeedFactory(CardListingPort cardListingPort,
                           @Qualifier(CardExecutorConfig.CARD_LOADER_EXECUTOR) Executor executor,
                           CardCoreProps props) {
        this.cardListingPort = cardListingPort;
        this.executor = executor;
        this.props = props.feed();
    }

    public PaginatedSortedFeed newFeed(UUID userId) {
        return new PaginatedSortedFeed(userId, cardListingPort, executor, props.pageSize(), props.fetchTimeout());
    }
}
