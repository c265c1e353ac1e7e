package app.twodots.core.resolution.service;

import app.twodots.core.resolution.domain.CacheStats;
import app.twodots.core.resolution.domain.NodeCardMapping;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Node id to card mappings for one user. Hits are trusted as-is until the
 * entry's TTL runs out; a non-positive TTL keeps entries until {@link #clear()}.
 */
public class EntityResolutionCache {

    private final Map<String, CacheEntry> cache = new ConcurrentHashMap<>();
    private final Duration ttl;
    private final Clock clock;

    public EntityResolutionCache(Duration ttl, Clock clock) {
        this.ttl = ttl;
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    public Optional<NodeCardMapping> get(String nodeId) {
        if (nodeId == null) {
            return Optional.empty();
        }
        CacheEntry entry = cache.get(nodeId);
        if (entry == null) {
            return Optional.empty();
        }
        if (entry.isExpired(clock.instant())) {
            cache.remove(nodeId, entry);
            return Optional.empty();
        }
        return Optional.of(entry.mapping());
    }

    public void set(String nodeId, NodeCardMapping mapping) {
        Objects.requireNonNull(nodeId, "nodeId");
        Objects.requireNonNull(mapping, "mapping");
        Instant now = clock.instant();
        purgeExpired(now);
        cache.put(nodeId, new CacheEntry(mapping, expires() ? now.plus(ttl) : null));
    }

    public void clear() {
        cache.clear();
    }

    public CacheStats stats() {
        purgeExpired(clock.instant());
        List<String> keys = cache.keySet().stream().sorted().toList();
        return new CacheStats(keys.size(), keys);
    }

    // raw entry count, expired entries included
    int storedEntries() {
        return cache.size();
    }

    private void purgeExpired(Instant now) {
        if (expires()) {
            cache.entrySet().removeIf(e -> e.getValue().isExpired(now));
        }
    }

    private boolean expires() {
        return ttl != null && !ttl.isZero() && !ttl.isNegative();
    }

    private record CacheEntry(NodeCardMapping mapping, Instant expiresAt) {
        boolean isExpired(Instant now) {
            return expiresAt != null && !now.isBefore(expiresAt);
        }
    }
}
