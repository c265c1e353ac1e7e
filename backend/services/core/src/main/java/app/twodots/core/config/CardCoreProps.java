package app.twodots.core.config;

import app.twodots.core.card.domain.request.CardListQuery;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

@ConfigurationProperties(prefix = "app.cards")
public record CardCoreProps(
        Loader loader,
        Resolution resolution,
        Feed feed,
        Executor executor
) {

    public CardCoreProps {
        loader = loader == null ? new Loader(null, 0) : loader;
        resolution = resolution == null ? new Resolution(null, null, 0, 0, null) : resolution;
        feed = feed == null ? new Feed(0, null) : feed;
        executor = executor == null ? new Executor(0, 0, 0) : executor;
    }

    /**
     * @param groupTimeout upper bound for one entity type lookup
     * @param poolSize     threads reserved for entity type lookups
     */
    public record Loader(Duration groupTimeout, int poolSize) {
        public Loader {
            groupTimeout = positiveOr(groupTimeout, Duration.ofSeconds(5));
            poolSize = poolSize > 0 ? poolSize : 4;
        }
    }

    /**
     * @param cacheTtl        lifetime of a node to card mapping, zero or negative disables expiry
     * @param strategyTimeout upper bound for a single matching strategy call
     * @param searchLimit     candidates requested from card search per strategy
     * @param relatedLimit    related cards attached to a node payload
     * @param idleTimeout     a user's resolver and cache are dropped after this long without use
     */
    public record Resolution(Duration cacheTtl,
                             Duration strategyTimeout,
                             int searchLimit,
                             int relatedLimit,
                             Duration idleTimeout) {
        public Resolution {
            cacheTtl = cacheTtl == null ? Duration.ofMinutes(5) : cacheTtl;
            strategyTimeout = positiveOr(strategyTimeout, Duration.ofSeconds(3));
            searchLimit = searchLimit > 0 ? searchLimit : 10;
            relatedLimit = relatedLimit > 0 ? relatedLimit : 5;
            idleTimeout = positiveOr(idleTimeout, Duration.ofMinutes(30));
        }
    }

    public record Feed(int pageSize, Duration fetchTimeout) {
        public Feed {
            // pages larger than one listing call would leave gaps between pages
            pageSize = pageSize > 0 ? Math.min(pageSize, CardListQuery.MAX_LIMIT) : 50;
            fetchTimeout = positiveOr(fetchTimeout, Duration.ofSeconds(10));
        }
    }

    public record Executor(int corePoolSize, int maxPoolSize, int queueCapacity) {
        public Executor {
            corePoolSize = corePoolSize > 0 ? corePoolSize : 4;
            maxPoolSize = Math.max(maxPoolSize, corePoolSize);
            queueCapacity = queueCapacity > 0 ? queueCapacity : 256;
        }
    }

    private static Duration positiveOr(Duration value, Duration fallback) {
        if (value == null || value.isZero() || value.isNegative()) {
            return fallback;
        }
        return value;
    }
}
