package app.twodots.core.feed.service;

import app.twodots.core.card.domain.dto.CardData;
import app.twodots.core.card.domain.dto.CardPage;
import app.twodots.core.card.domain.request.CardListQuery;
import app.twodots.core.card.domain.request.CardSortField;
import app.twodots.core.feed.api.CardListingPort;
import app.twodots.core.feed.domain.SortKey;
import app.twodots.core.support.QueuedExecutor;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.data.domain.Sort;

import java.time.Duration;
import java.util.Arrays;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;

import static app.twodots.core.support.CardFixtures.cardData;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class PaginatedSortedFeedTest {

    @Mock
    CardListingPort listingPort;

    private final UUID userId = UUID.randomUUID();

    @Test
    void loadInitialCards_requestsFirstPageInChosenOrder() {
        CardPage first = page(5, true, "a", "b");
        CardPage second = page(5, true, "c", "d");
        when(listingPort.listCards(eq(userId), any(CardListQuery.class))).thenReturn(first, second);
        PaginatedSortedFeed feed = feed(Runnable::run, 2);

        List<CardData> loaded = feed.loadInitialCards(SortKey.OLDEST, true).join();
        feed.loadNextPage().join();

        ArgumentCaptor<CardListQuery> captor = ArgumentCaptor.forClass(CardListQuery.class);
        verify(listingPort, times(2)).listCards(eq(userId), captor.capture());
        CardListQuery firstQuery = captor.getAllValues().get(0);
        assertThat(firstQuery.limit()).isEqualTo(2);
        assertThat(firstQuery.offset()).isZero();
        assertThat(firstQuery.sortField()).isEqualTo(CardSortField.CREATED_AT);
        assertThat(firstQuery.sortOrder()).isEqualTo(Sort.Direction.ASC);
        assertThat(firstQuery.coverFirst()).isTrue();
        assertThat(captor.getAllValues().get(1).offset()).isEqualTo(2);

        assertThat(loaded).extracting(CardData::title).containsExactly("a", "b");
        assertThat(feed.getAllCards()).extracting(CardData::title).containsExactly("a", "b", "c", "d");
        assertThat(feed.getLoadedCount()).isEqualTo(4);
        assertThat(feed.getTotalCount()).isEqualTo(5);
        assertThat(feed.hasMoreCards()).isTrue();
        assertThat(feed.getCurrentSortKey()).isEqualTo(SortKey.OLDEST);
        assertThat(feed.isCoverFirst()).isTrue();
    }

    @Test
    void loadNextPage_whileLoadingDoesNotFetchAgain() {
        when(listingPort.listCards(eq(userId), any(CardListQuery.class))).thenReturn(page(4, true, "a", "b"));
        QueuedExecutor executor = new QueuedExecutor();
        PaginatedSortedFeed feed = feed(executor, 2);

        CompletableFuture<List<CardData>> first = feed.loadInitialCards(SortKey.NEWEST, false);
        CompletableFuture<List<CardData>> second = feed.loadNextPage();
        assertThat(feed.isCurrentlyLoading()).isTrue();
        executor.runAll();

        assertThat(second.join()).isEmpty();
        assertThat(first.join()).hasSize(2);
        assertThat(feed.getAllCards()).extracting(CardData::title).containsExactly("a", "b");
        assertThat(feed.isCurrentlyLoading()).isFalse();
        verify(listingPort, times(1)).listCards(eq(userId), any(CardListQuery.class));
    }

    @Test
    void changeSort_discardsStaleResultsEvenWhenTheyArriveLast() {
        when(listingPort.listCards(eq(userId), any(CardListQuery.class))).thenAnswer(invocation -> {
            CardListQuery query = invocation.getArgument(1);
            return query.sortField() == CardSortField.TITLE
                    ? page(2, false, "Apples", "Bananas")
                    : page(2, false, "newest", "older");
        });
        QueuedExecutor executor = new QueuedExecutor();
        PaginatedSortedFeed feed = feed(executor, 10);

        CompletableFuture<List<CardData>> stale = feed.loadInitialCards(SortKey.NEWEST, false);
        CompletableFuture<List<CardData>> current = feed.changeSort(SortKey.TITLE_ASC);
        executor.runLast();
        executor.runNext();

        assertThat(current.join()).extracting(CardData::title).containsExactly("Apples", "Bananas");
        assertThatThrownBy(stale::join).hasCauseInstanceOf(RequestCancelledException.class);
        assertThat(feed.getAllCards()).extracting(CardData::title).containsExactly("Apples", "Bananas");
        assertThat(feed.getCurrentSortKey()).isEqualTo(SortKey.TITLE_ASC);
        assertThat(feed.isCurrentlyLoading()).isFalse();
    }

    @Test
    void repeatedInitialLoadKeepsOnlyTheLatestPage() {
        when(listingPort.listCards(eq(userId), any(CardListQuery.class)))
                .thenReturn(page(2, false, "first-a", "first-b"), page(2, false, "second-a", "second-b"));
        QueuedExecutor executor = new QueuedExecutor();
        PaginatedSortedFeed feed = feed(executor, 10);

        CompletableFuture<List<CardData>> first = feed.loadInitialCards(SortKey.NEWEST, false);
        CompletableFuture<List<CardData>> second = feed.loadInitialCards(SortKey.NEWEST, false);
        executor.runAll();

        assertThatThrownBy(first::join).hasCauseInstanceOf(RequestCancelledException.class);
        assertThat(second.join()).extracting(CardData::title).containsExactly("second-a", "second-b");
        assertThat(feed.getAllCards()).extracting(CardData::title).containsExactly("second-a", "second-b");
    }

    @Test
    void changeSort_sameKeyReturnsLoadedCardsWithoutFetching() {
        when(listingPort.listCards(eq(userId), any(CardListQuery.class))).thenReturn(page(2, false, "a", "b"));
        PaginatedSortedFeed feed = feed(Runnable::run, 10);
        feed.loadInitialCards(SortKey.NEWEST, false).join();

        List<CardData> same = feed.changeSort(SortKey.NEWEST).join();

        assertThat(same).extracting(CardData::title).containsExactly("a", "b");
        verify(listingPort, times(1)).listCards(eq(userId), any(CardListQuery.class));
    }

    @Test
    void changeSort_keepsCoverFirstAndStartsFromFirstPage() {
        when(listingPort.listCards(eq(userId), any(CardListQuery.class)))
                .thenReturn(page(4, true, "a", "b"), page(4, true, "c", "d"), page(4, true, "z", "y"));
        PaginatedSortedFeed feed = feed(Runnable::run, 2);
        feed.loadInitialCards(SortKey.NEWEST, true).join();
        feed.loadNextPage().join();

        feed.changeSort(SortKey.TITLE_DESC).join();

        ArgumentCaptor<CardListQuery> captor = ArgumentCaptor.forClass(CardListQuery.class);
        verify(listingPort, times(3)).listCards(eq(userId), captor.capture());
        CardListQuery resorted = captor.getAllValues().get(2);
        assertThat(resorted.offset()).isZero();
        assertThat(resorted.sortField()).isEqualTo(CardSortField.TITLE);
        assertThat(resorted.sortOrder()).isEqualTo(Sort.Direction.DESC);
        assertThat(resorted.coverFirst()).isTrue();
        assertThat(feed.getAllCards()).extracting(CardData::title).containsExactly("z", "y");
    }

    @Test
    void listingFailureKeepsStateRetryable() {
        when(listingPort.listCards(eq(userId), any(CardListQuery.class)))
                .thenThrow(new DataAccessResourceFailureException("down"))
                .thenReturn(page(1, false, "a"));
        PaginatedSortedFeed feed = feed(Runnable::run, 10);

        CompletableFuture<List<CardData>> failed = feed.loadInitialCards(SortKey.NEWEST, false);

        assertThatThrownBy(failed::join)
                .hasCauseInstanceOf(CardFeedException.class)
                .cause()
                .hasMessage("Failed to load cards");
        assertThat(feed.getAllCards()).isEmpty();
        assertThat(feed.hasMoreCards()).isTrue();
        assertThat(feed.isCurrentlyLoading()).isFalse();

        assertThat(feed.loadNextPage().join()).extracting(CardData::title).containsExactly("a");
        assertThat(feed.hasMoreCards()).isFalse();
    }

    @Test
    void exhaustedFeedDoesNotFetch() {
        when(listingPort.listCards(eq(userId), any(CardListQuery.class))).thenReturn(page(1, false, "only"));
        PaginatedSortedFeed feed = feed(Runnable::run, 10);
        feed.loadInitialCards(SortKey.NEWEST, false).join();

        assertThat(feed.loadNextPage().join()).isEmpty();
        verify(listingPort, times(1)).listCards(eq(userId), any(CardListQuery.class));
    }

    @Test
    void zeroTotalFallsBackToLoadedCount() {
        when(listingPort.listCards(eq(userId), any(CardListQuery.class))).thenReturn(page(0, false, "a", "b"));
        PaginatedSortedFeed feed = feed(Runnable::run, 10);

        feed.loadInitialCards(SortKey.NEWEST, false).join();

        assertThat(feed.getTotalCount()).isEqualTo(2);
    }

    @Test
    void resetCancelsInFlightFetch() {
        when(listingPort.listCards(eq(userId), any(CardListQuery.class))).thenReturn(page(2, false, "a", "b"));
        QueuedExecutor executor = new QueuedExecutor();
        PaginatedSortedFeed feed = feed(executor, 10);

        CompletableFuture<List<CardData>> pending = feed.loadInitialCards(SortKey.NEWEST, false);
        feed.reset();
        executor.runAll();

        assertThatThrownBy(pending::join).hasCauseInstanceOf(RequestCancelledException.class);
        assertThat(feed.getAllCards()).isEmpty();
        assertThat(feed.getTotalCount()).isZero();
        assertThat(feed.hasMoreCards()).isTrue();
        assertThat(feed.isCurrentlyLoading()).isFalse();
    }

    @Test
    void getAllCardsReturnsDetachedCopy() {
        when(listingPort.listCards(eq(userId), any(CardListQuery.class))).thenReturn(page(1, false, "a"));
        PaginatedSortedFeed feed = feed(Runnable::run, 10);
        feed.loadInitialCards(SortKey.NEWEST, false).join();

        List<CardData> snapshot = feed.getAllCards();
        feed.reset();

        assertThat(snapshot).hasSize(1);
        assertThatThrownBy(() -> snapshot.add(cardData(UUID.randomUUID(), "x", "")))
                .isInstanceOf(UnsupportedOperationException.class);
    }

    @Test
    void freshFeedStartsEmpty() {
        PaginatedSortedFeed feed = feed(Runnable::run, 10);

        assertThat(feed.getAllCards()).isEmpty();
        assertThat(feed.getCurrentSortKey()).isEqualTo(SortKey.NEWEST);
        assertThat(feed.hasMoreCards()).isTrue();
        verifyNoInteractions(listingPort);
    }

    @Test
    void pageSizeLargerThanOneListingCallIsRejected() {
        assertThatThrownBy(() -> feed(Runnable::run, CardListQuery.MAX_LIMIT + 1))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("pageSize");
    }

    private PaginatedSortedFeed feed(Executor executor, int pageSize) {
        return new PaginatedSortedFeed(userId, listingPort, executor, pageSize, Duration.ofSeconds(10));
    }

    private static CardPage page(long total, boolean hasMore, String... titles) {
        List<CardData> cards = Arrays.stream(titles)
                .map(title -> cardData(UUID.randomUUID(), title, ""))
                .toList();
        return new CardPage(cards, total, hasMore);
    }
}
