package app.twodots.core.feed.service;

import app.twodots.core.card.domain.dto.CardData;
import app.twodots.core.card.domain.dto.CardPage;
import app.twodots.core.card.domain.request.CardListQuery;
import app.twodots.core.config.CardCoreProps;
import app.twodots.core.feed.api.CardListingPort;
import app.twodots.core.feed.domain.SortKey;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Duration;
import java.util.List;
import java.util.UUID;
import java.util.stream.IntStream;

import static app.twodots.core.support.CardFixtures.cardData;
import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class CardFeedFactoryTest {

    @Mock
    CardListingPort listingPort;

    @Test
    void newFeed_usesConfiguredPageSizeForItsUser() {
        UUID userId = UUID.randomUUID();
        when(listingPort.listCards(eq(userId), any(CardListQuery.class))).thenReturn(CardPage.empty());
        CardCoreProps props = new CardCoreProps(null, null, new CardCoreProps.Feed(25, Duration.ofSeconds(2)), null);
        CardFeedFactory factory = new CardFeedFactory(listingPort, Runnable::run, props);

        PaginatedSortedFeed feed = factory.newFeed(userId);
        feed.loadInitialCards(SortKey.TITLE_ASC, false).join();

        ArgumentCaptor<CardListQuery> captor = ArgumentCaptor.forClass(CardListQuery.class);
        verify(listingPort).listCards(eq(userId), captor.capture());
        assertThat(captor.getValue().limit()).isEqualTo(25);
        assertThat(feed.hasMoreCards()).isFalse();
        assertThat(feed.getTotalCount()).isZero();
    }

    @Test
    void oversizedPageSizeIsCappedSoPagesStayContiguous() {
        UUID userId = UUID.randomUUID();
        List<CardData> fullPage = IntStream.range(0, CardListQuery.MAX_LIMIT)
                .mapToObj(i -> cardData(UUID.randomUUID(), "card " + i, ""))
                .toList();
        when(listingPort.listCards(eq(userId), any(CardListQuery.class)))
                .thenReturn(new CardPage(fullPage, 1200, true));
        CardCoreProps props = new CardCoreProps(null, null, new CardCoreProps.Feed(1000, null), null);
        CardFeedFactory factory = new CardFeedFactory(listingPort, Runnable::run, props);

        PaginatedSortedFeed feed = factory.newFeed(userId);
        feed.loadInitialCards(SortKey.NEWEST, false).join();
        feed.loadNextPage().join();

        ArgumentCaptor<CardListQuery> captor = ArgumentCaptor.forClass(CardListQuery.class);
        verify(listingPort, times(2)).listCards(eq(userId), captor.capture());
        assertThat(props.feed().pageSize()).isEqualTo(CardListQuery.MAX_LIMIT);
        assertThat(captor.getAllValues()).extracting(CardListQuery::offset)
                .containsExactly(0, CardListQuery.MAX_LIMIT);
        assertThat(captor.getAllValues()).extracting(CardListQuery::limit)
                .containsOnly(CardListQuery.MAX_LIMIT);
        assertThat(feed.getLoadedCount()).isEqualTo(2 * CardListQuery.MAX_LIMIT);
    }

    @Test
    void defaultsApplyWhenFeedSettingsAreMissing() {
        CardCoreProps props = new CardCoreProps(null, null, null, null);

        assertThat(props.feed().pageSize()).isEqualTo(50);
        assertThat(props.feed().fetchTimeout()).isEqualTo(Duration.ofSeconds(10));
        assertThat(props.resolution().cacheTtl()).isEqualTo(Duration.ofMinutes(5));
        assertThat(props.loader().groupTimeout()).isEqualTo(Duration.ofSeconds(5));
    }
}
