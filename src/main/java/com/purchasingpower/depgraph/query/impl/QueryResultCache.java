package com.purchasingpower.depgraph.query.impl;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.purchasingpower.depgraph.query.CacheStats;
import com.purchasingpower.depgraph.query.QueryResult;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Query result cache with a write TTL and a size bound, backed by Caffeine.
 *
 * <p>Lookups never block. Expiry is measured on the injected {@link Clock} and
 * maintenance runs on the calling thread, so the size bound holds as soon as
 * a put returns.
 *
 * @since 2.0.0
 */
@Slf4j
public class QueryResultCache {

    private final Cache<String, Entry> cache;
    private final int maxSize;
    private final Clock clock;
    // Entries dropped by optimize(); Caffeine counts those as explicit removals.
    private final AtomicLong trimmed = new AtomicLong();

    public QueryResultCache(int maxSize, Duration ttl, Clock clock) {
        this.maxSize = Math.max(1, maxSize);
        this.clock = clock;
        Caffeine<Object, Object> builder = Caffeine.newBuilder()
                .maximumSize(this.maxSize)
                .ticker(() -> TimeUnit.MILLISECONDS.toNanos(clock.millis()))
                .executor(Runnable::run)
                .recordStats();
        if (ttl != null) {
            builder.expireAfterWrite(ttl);
        }
        this.cache = builder.build();
    }

    public Optional<QueryResult> get(String key) {
        return Optional.ofNullable(cache.getIfPresent(key)).map(Entry::result);
    }

    public void put(String key, QueryResult result) {
        cache.put(key, new Entry(result, clock.instant()));
    }

    public void invalidate(String key) {
        cache.invalidate(key);
    }

    public void clear() {
        long size = cache.estimatedSize();
        cache.invalidateAll();
        if (size > 0) {
            log.debug("Cleared {} cached query results", size);
        }
    }

    /**
     * Drops expired entries, then the entries the eviction policy would drop
     * first, until the cache is at most {@code targetRatio} full.
     *
     * @return Number of entries removed
     */
    public int optimize(double targetRatio) {
        long before = cache.estimatedSize();
        cache.cleanUp();
        long expired = before - cache.estimatedSize();

        int target = (int) Math.floor(maxSize * targetRatio);
        long excess = cache.estimatedSize() - target;
        if (excess > 0) {
            Set<String> coldest = cache.policy().eviction()
                    .map(eviction -> eviction.coldest((int) excess).keySet())
                    .orElse(Set.of());
            cache.invalidateAll(coldest);
            trimmed.addAndGet(coldest.size());
        }
        cache.cleanUp();
        int removed = (int) (before - cache.estimatedSize());
        log.info("Query cache optimized: removed {} entries ({} expired), {} remain",
                removed, expired, cache.estimatedSize());
        return removed;
    }

    public CacheStats stats() {
        cache.cleanUp();
        com.github.benmanes.caffeine.cache.stats.CacheStats counters = cache.stats();
        List<Instant> created = cache.asMap().values().stream().map(Entry::createdAt).sorted().toList();
        return new CacheStats(
                size(),
                maxSize,
                counters.hitCount(),
                counters.missCount(),
                counters.requestCount() == 0 ? 0.0 : counters.hitRate(),
                counters.evictionCount() + trimmed.get(),
                created.isEmpty() ? null : created.get(0),
                created.isEmpty() ? null : created.get(created.size() - 1));
    }

    public int size() {
        cache.cleanUp();
        return (int) cache.estimatedSize();
    }

    private record Entry(QueryResult result, Instant createdAt) {
    }
}
