package com.purchasingpower.depgraph.query;

import java.time.Instant;

/**
 * Snapshot of the query result cache.
 *
 * @param hitRate Hits over lookups, 0 when nothing has been looked up
 */
public record CacheStats(int size,
                         int maxSize,
                         long hits,
                         long misses,
                         double hitRate,
                         long evictions,
                         Instant oldestEntry,
                         Instant newestEntry) {
}
