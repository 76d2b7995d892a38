package com.purchasingpower.depgraph.query.impl;

import com.purchasingpower.depgraph.query.CacheStats;
import com.purchasingpower.depgraph.query.QueryDialect;
import com.purchasingpower.depgraph.query.QueryResult;
import com.purchasingpower.depgraph.support.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class QueryResultCacheTest {

    private MutableClock clock;
    private QueryResultCache cache;

    @BeforeEach
    void setUp() {
        clock = MutableClock.startingAtEpoch();
        cache = new QueryResultCache(3, Duration.ofMinutes(5), clock);
    }

    private static QueryResult result(String address) {
        return QueryResult.builder()
                .dialect(QueryDialect.SQL)
                .rows(List.of(Map.of("address", address)))
                .totalMatched(1)
                .build();
    }

    @Test
    void hitAndMissAreCounted() {
        cache.put("q1", result("a"));

        assertThat(cache.get("q1")).isPresent();
        assertThat(cache.get("q2")).isEmpty();

        CacheStats stats = cache.stats();
        assertThat(stats.hits()).isEqualTo(1);
        assertThat(stats.misses()).isEqualTo(1);
        assertThat(stats.hitRate()).isEqualTo(0.5);
        assertThat(stats.size()).isEqualTo(1);
        assertThat(stats.maxSize()).isEqualTo(3);
    }

    @Test
    void expiredEntriesMiss() {
        cache.put("q1", result("a"));
        clock.advance(Duration.ofMinutes(5));

        assertThat(cache.get("q1")).isEmpty();
    }

    @Test
    void sizeBoundEvictsAsSoonAsPutReturns() {
        cache.put("q1", result("a"));
        cache.put("q2", result("b"));
        cache.put("q3", result("c"));
        cache.get("q1");

        cache.put("q4", result("d"));

        assertThat(cache.size()).isEqualTo(3);
        assertThat(cache.stats().evictions()).isEqualTo(1);
    }

    @Test
    void optimizeShrinksToTargetRatio() {
        cache.put("q1", result("a"));
        clock.advance(Duration.ofMinutes(3));
        cache.put("q2", result("b"));
        cache.put("q3", result("c"));
        clock.advance(Duration.ofMinutes(2));

        int removed = cache.optimize(0.34);

        assertThat(removed).isEqualTo(2);
        assertThat(cache.size()).isEqualTo(1);
        assertThat(cache.get("q1")).isEmpty();
        assertThat(cache.stats().evictions()).isEqualTo(2);
    }

    @Test
    void invalidateDropsOneKey() {
        cache.put("q1", result("a"));
        cache.put("q2", result("b"));

        cache.invalidate("q1");

        assertThat(cache.get("q1")).isEmpty();
        assertThat(cache.get("q2")).isPresent();
    }

    @Test
    void statsReportAges() {
        cache.put("q1", result("a"));
        clock.advance(Duration.ofSeconds(30));
        cache.put("q2", result("b"));

        CacheStats stats = cache.stats();

        assertThat(Duration.between(stats.oldestEntry(), stats.newestEntry())).isEqualTo(Duration.ofSeconds(30));
        cache.clear();
        assertThat(cache.stats().oldestEntry()).isNull();
    }
}
