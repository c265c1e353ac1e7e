package app.twodots.core.resolution.service;

import app.twodots.core.card.domain.dto.CardData;
import app.twodots.core.resolution.api.CardLookupPort;
import app.twodots.core.resolution.domain.NodeCardData;
import app.twodots.core.resolution.domain.NodeCardMapping;
import app.twodots.core.resolution.domain.NodeReference;
import app.twodots.core.resolution.strategy.CardMatchStrategy;
import com.fasterxml.jackson.databind.JsonNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Maps graph nodes of one user onto that user's cards.
 *
 * <p>A node is looked up in the {@link EntityResolutionCache} first. On a miss the
 * strategies run one after another, highest confidence first, and the first
 * match is cached. Lookup failures and timeouts inside a strategy count as
 * "no match"; anything else fails the returned future with
 * {@link NodeResolutionException}.
 *
 * <p>Concurrent requests for the same node id share a single in-flight resolution.
 */
public class NodeToCardResolver {

    private static final Logger log = LoggerFactory.getLogger(NodeToCardResolver.class);

    private final UUID userId;
    private final List<CardMatchStrategy> strategies;
    private final CardLookupPort cardLookupPort;
    private final EntityResolutionCache cache;
    private final Executor executor;
    private final Duration strategyTimeout;
    private final int relatedLimit;
    private final Clock clock;

    private final Map<String, CompletableFuture<Optional<NodeCardMapping>>> inFlight = new ConcurrentHashMap<>();

    public NodeToCardResolver(UUID userId,
                              List<CardMatchStrategy> strategies,
                              CardLookupPort cardLookupPort,
                              EntityResolutionCache cache,
                              Executor executor,
                              Duration strategyTimeout,
                              int relatedLimit,
                              Clock clock) {
        this.userId = userId;
        this.strategies = strategies.stream()
                .sorted(Comparator.comparingDouble(CardMatchStrategy::confidence).reversed())
                .toList();
        this.cardLookupPort = cardLookupPort;
        this.cache = cache;
        this.executor = executor;
        this.strategyTimeout = strategyTimeout;
        this.relatedLimit = relatedLimit;
        this.clock = clock;
    }

    public CompletableFuture<Optional<NodeCardMapping>> resolveMapping(NodeReference node) {
        if (node == null || node.id() == null || node.id().isBlank()) {
            return CompletableFuture.completedFuture(Optional.empty());
        }
        String nodeId = node.id();

        Optional<NodeCardMapping> cached = cache.get(nodeId);
        if (cached.isPresent()) {
            log.debug("Node {} resolved from cache to card {}", nodeId, cached.get().cardId());
            return CompletableFuture.completedFuture(cached);
        }

        CompletableFuture<Optional<NodeCardMapping>> created = new CompletableFuture<>();
        CompletableFuture<Optional<NodeCardMapping>> existing = inFlight.putIfAbsent(nodeId, created);
        if (existing != null) {
            return existing;
        }

        runStrategies(node, 0).whenComplete((mapping, error) -> {
            inFlight.remove(nodeId, created);
            if (error != null) {
                created.completeExceptionally(unwrap(error));
            } else {
                created.complete(mapping);
            }
        });
        return created;
    }

    public CompletableFuture<Optional<UUID>> mapNodeToCard(NodeReference node) {
        return resolveMapping(node).thenApply(mapping -> mapping.map(NodeCardMapping::cardId));
    }

    public CompletableFuture<NodeCardData> getNodeCardData(NodeReference node) {
        return resolveMapping(node).thenCompose(mapping -> {
            if (mapping.isEmpty()) {
                return CompletableFuture.completedFuture(NodeCardData.empty());
            }
            UUID cardId = mapping.get().cardId();
            return CompletableFuture
                    .supplyAsync(() -> loadNodeCardData(cardId, node), executor)
                    .exceptionally(error -> {
                        Throwable cause = unwrap(error);
                        log.warn("Loading card {} for node {} failed: {}", cardId, node.id(), cause.getMessage());
                        return NodeCardData.empty();
                    });
        });
    }

    public void clearCache() {
        cache.clear();
    }

    public EntityResolutionCache cache() {
        return cache;
    }

    private CompletableFuture<Optional<NodeCardMapping>> runStrategies(NodeReference node, int index) {
        if (index >= strategies.size()) {
            log.debug("No card found for node {}", node.id());
            return CompletableFuture.completedFuture(Optional.empty());
        }
        CardMatchStrategy strategy = strategies.get(index);
        if (!strategy.appliesTo(node)) {
            return runStrategies(node, index + 1);
        }
        return attempt(strategy, node).thenCompose(mapping -> mapping.isPresent()
                ? CompletableFuture.completedFuture(mapping)
                : runStrategies(node, index + 1));
    }

    private CompletableFuture<Optional<NodeCardMapping>> attempt(CardMatchStrategy strategy, NodeReference node) {
        return CompletableFuture
                .supplyAsync(() -> strategy.match(userId, node), executor)
                .orTimeout(strategyTimeout.toMillis(), TimeUnit.MILLISECONDS)
                .handle((card, error) -> {
                    if (error == null) {
                        return card.map(found -> remember(node, found, strategy));
                    }
                    Throwable cause = unwrap(error);
                    if (cause instanceof DataAccessException || cause instanceof TimeoutException) {
                        log.warn("Strategy {} failed for node {}, trying next: {}",
                                strategy.name(), node.id(), cause.toString());
                        return Optional.empty();
                    }
                    throw new NodeResolutionException(
                            "Resolving node " + node.id() + " failed in " + strategy.name() + " strategy", cause);
                });
    }

    private NodeCardMapping remember(NodeReference node, CardData card, CardMatchStrategy strategy) {
        if (card.cardId() == null) {
            throw new NodeResolutionException(
                    "Strategy " + strategy.name() + " matched a card without an id for node " + node.id(), null);
        }
        NodeCardMapping mapping = new NodeCardMapping(
                node.id(),
                card.cardId(),
                card.type(),
                strategy.confidence(),
                clock.instant()
        );
        cache.set(node.id(), mapping);
        log.debug("Node {} mapped to card {} by {} ({})", node.id(), card.cardId(), strategy.name(), strategy.confidence());
        return mapping;
    }

    private NodeCardData loadNodeCardData(UUID cardId, NodeReference node) {
        Optional<CardData> card = cardLookupPort.findCard(userId, cardId);
        if (card.isEmpty()) {
            log.warn("Node {} maps to card {} which no longer exists", node.id(), cardId);
            return NodeCardData.empty();
        }
        List<CardData> related = cardLookupPort.findRelatedCards(userId, cardId, relatedLimit);
        return new NodeCardData(card.get(), related, extractConnections(node));
    }

    static List<JsonNode> extractConnections(NodeReference node) {
        List<JsonNode> connections = new ArrayList<>();
        addAll(connections, node.connections());
        if (node.metadata() != null && node.metadata().isObject()) {
            addAll(connections, node.metadata().get("connections"));
        }
        return connections;
    }

    private static void addAll(List<JsonNode> target, JsonNode array) {
        if (array != null && array.isArray()) {
            array.forEach(target::add);
        }
    }

    private static Throwable unwrap(Throwable error) {
        Throwable current = error;
        while ((current instanceof CompletionException || current instanceof ExecutionException)
                && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }
}
