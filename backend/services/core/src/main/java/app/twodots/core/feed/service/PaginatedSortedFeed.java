package app.twodots.core.feed.service;

import app.twodots.core.card.domain.dto.CardData;
import app.twodots.core.card.domain.dto.CardPage;
import app.twodots.core.card.domain.request.CardListQuery;
import app.twodots.core.feed.api.CardListingPort;
import app.twodots.core.feed.domain.SortKey;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;
import java.util.concurrent.TimeUnit;

/**
 * A user's cards loaded page by page in one sort order.
 *
 * <p>Only one page fetch is live at a time. Starting a new fetch, resetting or
 * changing the sort cancels the previous one, and a cancelled fetch never
 * touches the feed state. All state is guarded by the feed's monitor.
 */
public class PaginatedSortedFeed {

    private static final Logger log = LoggerFactory.getLogger(PaginatedSortedFeed.class);

    private final UUID userId;
    private final CardListingPort cardListingPort;
    private final Executor executor;
    private final int pageSize;
    private final Duration fetchTimeout;

    private final List<CardData> loadedCards = new ArrayList<>();
    private SortKey sortKey = SortKey.NEWEST;
    private boolean coverFirst;
    private int page;
    private long totalCount;
    private boolean hasMore = true;
    private boolean loading;
    private CancellationToken inFlightToken;

    public PaginatedSortedFeed(UUID userId,
                               CardListingPort cardListingPort,
                               Executor executor,
                               int pageSize,
                               Duration fetchTimeout) {
        if (pageSize < 1 || pageSize > CardListQuery.MAX_LIMIT) {
            throw new IllegalArgumentException("pageSize must be between 1 and " + CardListQuery.MAX_LIMIT);
        }
        this.userId = userId;
        this.cardListingPort = cardListingPort;
        this.executor = executor;
        this.pageSize = pageSize;
        this.fetchTimeout = fetchTimeout;
    }

    public CompletableFuture<List<CardData>> loadInitialCards(SortKey sortKey, boolean coverFirst) {
        synchronized (this) {
            resetState();
            this.sortKey = sortKey == null ? SortKey.NEWEST : sortKey;
            this.coverFirst = coverFirst;
        }
        return loadNextPage();
    }

    /**
     * Fetches the page after the last loaded one. Completes with an empty list
     * without fetching when a page is already loading or nothing is left.
     */
    public CompletableFuture<List<CardData>> loadNextPage() {
        CancellationToken token;
        CardListQuery query;
        synchronized (this) {
            if (loading || !hasMore) {
                return CompletableFuture.completedFuture(List.of());
            }
            if (inFlightToken != null) {
                inFlightToken.cancel();
            }
            token = new CancellationToken();
            inFlightToken = token;
            loading = true;
            query = CardListQuery.page(pageSize, page * pageSize, sortKey.sortField(), sortKey.sortOrder(), coverFirst);
            log.debug("Loading page {} of cards for user {} sorted {}", page + 1, userId, sortKey);
        }

        return CompletableFuture
                .supplyAsync(() -> cardListingPort.listCards(userId, query), executor)
                .orTimeout(fetchTimeout.toMillis(), TimeUnit.MILLISECONDS)
                .handle((result, error) -> applyPage(token, result, error));
    }

    /**
     * Switches to another sort order and reloads from the first page. The same
     * key completes immediately with the cards already loaded.
     */
    public CompletableFuture<List<CardData>> changeSort(SortKey newSortKey) {
        boolean keepCover;
        synchronized (this) {
            if (newSortKey == sortKey) {
                return CompletableFuture.completedFuture(List.copyOf(loadedCards));
            }
            log.debug("Changing card sort from {} to {}", sortKey, newSortKey);
            keepCover = coverFirst;
        }
        return loadInitialCards(newSortKey, keepCover);
    }

    public synchronized void reset() {
        resetState();
    }

    public synchronized List<CardData> getAllCards() {
        return List.copyOf(loadedCards);
    }

    public synchronized int getLoadedCount() {
        return loadedCards.size();
    }

    public synchronized long getTotalCount() {
        return totalCount;
    }

    public synchronized boolean hasMoreCards() {
        return hasMore;
    }

    public synchronized boolean isCurrentlyLoading() {
        return loading;
    }

    public synchronized SortKey getCurrentSortKey() {
        return sortKey;
    }

    public synchronized boolean isCoverFirst() {
        return coverFirst;
    }

    private synchronized List<CardData> applyPage(CancellationToken token, CardPage result, Throwable error) {
        if (token.isCancelled()) {
            log.debug("Card page request for user {} was cancelled", userId);
            throw new RequestCancelledException("Request was cancelled");
        }
        inFlightToken = null;
        loading = false;

        if (error != null || result == null) {
            Throwable cause = error instanceof CompletionException && error.getCause() != null ? error.getCause() : error;
            log.warn("Failed to load page {} of cards for user {}", page + 1, userId, cause);
            throw new CardFeedException("Failed to load cards", cause);
        }

        List<CardData> newCards = result.cards() == null ? List.of() : result.cards();
        loadedCards.addAll(newCards);
        page++;
        totalCount = result.totalCount() > 0 ? result.totalCount() : loadedCards.size();
        hasMore = result.hasMore();
        log.debug("Loaded {} cards for user {} ({}/{})", newCards.size(), userId, loadedCards.size(), totalCount);
        return List.copyOf(newCards);
    }

    private void resetState() {
        if (inFlightToken != null) {
            inFlightToken.cancel();
            inFlightToken = null;
        }
        loadedCards.clear();
        page = 0;
        totalCount = 0;
        hasMore = true;
        loading = false;
    }
}
