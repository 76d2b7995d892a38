package com.purchasingpower.depgraph.inference.impl;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.RemovalCause;
import com.purchasingpower.depgraph.inference.InferenceKind;
import com.purchasingpower.depgraph.inference.InferenceResult;

import java.time.Clock;
import java.time.Duration;
import java.util.Collection;
import java.util.HashSet;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Caffeine memo of inference results with a TTL and a reverse index from
 * touched address to keys, so one graph write only drops the entries that read it.
 *
 * <p>The index may briefly name keys that are already gone; invalidating a
 * missing key is a no-op.
 */
class InferenceMemoCache {

    /**
     * @param options The caller's options with the timeout cleared; compared by value
     */
    record Key(InferenceKind kind, String rootId, String edgeType, Object options) {
    }

    private final Cache<Key, InferenceResult> cache;
    private final Map<String, Set<Key>> byAddress = new ConcurrentHashMap<>();
    private final AtomicLong invalidations = new AtomicLong();

    InferenceMemoCache(int maxEntries, Duration ttl, Clock clock) {
        Caffeine<Object, Object> builder = Caffeine.newBuilder()
                .maximumSize(Math.max(1, maxEntries))
                .ticker(() -> TimeUnit.MILLISECONDS.toNanos(clock.millis()))
                .executor(Runnable::run)
                .recordStats();
        if (ttl != null) {
            builder.expireAfterWrite(ttl);
        }
        this.cache = builder.<Key, InferenceResult>removalListener(this::unindex).build();
    }

    Optional<InferenceResult> get(Key key) {
        return Optional.ofNullable(cache.getIfPresent(key));
    }

    /**
     * Indexes before storing, so an invalidation can never find the entry
     * stored but not yet indexed.
     */
    void put(Key key, InferenceResult result) {
        for (String address : result.getTouchedAddresses()) {
            byAddress.computeIfAbsent(address, a -> ConcurrentHashMap.newKeySet()).add(key);
        }
        cache.put(key, result);
    }

    void remove(Key key) {
        cache.invalidate(key);
    }

    /**
     * Drops every entry whose computation read one of the given addresses.
     *
     * @return Number of entries removed
     */
    int invalidate(Collection<String> addresses) {
        Set<Key> doomed = new HashSet<>();
        for (String address : addresses) {
            doomed.addAll(byAddress.getOrDefault(address, Set.of()));
        }
        int removed = 0;
        for (Key key : doomed) {
            if (cache.asMap().remove(key) != null) {
                removed++;
            }
        }
        invalidations.addAndGet(removed);
        return removed;
    }

    void clear() {
        cache.invalidateAll();
        byAddress.clear();
    }

    int size() {
        cache.cleanUp();
        return (int) cache.estimatedSize();
    }

    long hits() {
        return cache.stats().hitCount();
    }

    long misses() {
        return cache.stats().missCount();
    }

    long invalidations() {
        return invalidations.get();
    }

    private void unindex(Key key, InferenceResult result, RemovalCause cause) {
        if (key == null || result == null || cause == RemovalCause.REPLACED || cache.asMap().containsKey(key)) {
            return;
        }
        for (String address : result.getTouchedAddresses()) {
            byAddress.computeIfPresent(address, (a, keys) -> {
                keys.remove(key);
                return keys.isEmpty() ? null : keys;
            });
        }
    }
}
