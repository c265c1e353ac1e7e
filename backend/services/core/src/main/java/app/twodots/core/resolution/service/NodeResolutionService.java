package app.twodots.core.resolution.service;

import app.twodots.core.config.CardCoreProps;
import app.twodots.core.config.CardExecutorConfig;
import app.twodots.core.resolution.api.CardLookupPort;
import app.twodots.core.resolution.domain.CacheStats;
import app.twodots.core.resolution.domain.NodeCardData;
import app.twodots.core.resolution.domain.NodeCardMapping;
import app.twodots.core.resolution.domain.NodeReference;
import app.twodots.core.resolution.strategy.CardMatchStrategy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executor;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Keeps one {@link NodeToCardResolver} per user so mappings and their cache
 * never leak between accounts. Resolvers unused for longer than the configured
 * idle timeout are dropped the next time the registry is swept.
 */
@Service
public class NodeResolutionService {

    private static final Logger log = LoggerFactory.getLogger(NodeResolutionService.class);

    private final List<CardMatchStrategy> strategies;
    private final CardLookupPort cardLookupPort;
    private final Executor executor;
    private final CardCoreProps.Resolution props;
    private final Clock clock;

    private final Map<UUID, UserResolver> resolvers = new ConcurrentHashMap<>();
    private final AtomicReference<Instant> nextSweep;

    @Autowired
    public NodeResolutionService(List<CardMatchStrategy> strategies,
                                 CardLookupPort cardLookupPort,
                                 @Qualifier(CardExecutorConfig.CARD_LOADER_EXECUTOR) Executor executor,
                                 CardCoreProps props) {
        this(strategies, cardLookupPort, executor, props, Clock.systemUTC());
    }

    NodeResolutionService(List<CardMatchStrategy> strategies,
                          CardLookupPort cardLookupPort,
                          Executor executor,
                          CardCoreProps props,
                          Clock clock) {
        this.strategies = List.copyOf(strategies);
        this.cardLookupPort = cardLookupPort;
        this.executor = executor;
        this.props = props.resolution();
        this.clock = clock;
        this.nextSweep = new AtomicReference<>(clock.instant().plus(this.props.idleTimeout()));
    }

    public NodeCardData resolveNode(UUID userId, NodeReference node) {
        return await(resolverFor(userId).getNodeCardData(node));
    }

    public Optional<NodeCardMapping> mapNode(UUID userId, NodeReference node) {
        return await(resolverFor(userId).resolveMapping(node));
    }

    public void clearCache(UUID userId) {
        UserResolver entry = resolvers.get(userId);
        if (entry != null) {
            entry.touch(clock.instant());
            entry.resolver().clearCache();
        }
    }

    public CacheStats cacheStats(UUID userId) {
        UserResolver entry = resolvers.get(userId);
        if (entry == null) {
            return new CacheStats(0, List.of());
        }
        entry.touch(clock.instant());
        return entry.resolver().cache().stats();
    }

    NodeToCardResolver resolverFor(UUID userId) {
        Instant now = clock.instant();
        sweepIdle(now);
        UserResolver entry = resolvers.computeIfAbsent(userId, id -> new UserResolver(new NodeToCardResolver(
                id,
                strategies,
                cardLookupPort,
                new EntityResolutionCache(props.cacheTtl(), clock),
                executor,
                props.strategyTimeout(),
                props.relatedLimit(),
                clock
        ), now));
        entry.touch(now);
        return entry.resolver();
    }

    int activeUsers() {
        return resolvers.size();
    }

    private void sweepIdle(Instant now) {
        Instant due = nextSweep.get();
        if (now.isBefore(due) || !nextSweep.compareAndSet(due, now.plus(props.idleTimeout()))) {
            return;
        }
        Instant cutoff = now.minus(props.idleTimeout());
        int before = resolvers.size();
        resolvers.values().removeIf(entry -> !entry.lastUsed().isAfter(cutoff));
        int dropped = before - resolvers.size();
        if (dropped > 0) {
            log.debug("Dropped {} idle node resolvers", dropped);
        }
    }

    private static final class UserResolver {

        private final NodeToCardResolver resolver;
        private volatile Instant lastUsed;

        UserResolver(NodeToCardResolver resolver, Instant lastUsed) {
            this.resolver = resolver;
            this.lastUsed = lastUsed;
        }

        NodeToCardResolver resolver() {
            return resolver;
        }

        Instant lastUsed() {
            return lastUsed;
        }

        void touch(Instant now) {
            lastUsed = now;
        }
    }

    private static <T> T await(CompletableFuture<T> future) {
        try {
            return future.join();
        } catch (CompletionException ex) {
            if (ex.getCause() instanceof RuntimeException runtime) {
                throw runtime;
            }
            throw ex;
        }
    }
}
