package com.purchasingpower.depgraph.query;

import lombok.Builder;
import lombok.Value;

import java.time.Duration;
import java.util.List;
import java.util.Map;

/**
 * Rows produced by a query. Rows are ordered deterministically (by the ORDER BY
 * key when given, always with the address as tie-breaker), so repeated
 * execution against an unchanged graph yields identical results.
 *
 * @since 2.0.0
 */
@Value
@Builder(toBuilder = true)
public class QueryResult {

    QueryDialect dialect;

    @Builder.Default
    List<Map<String, Object>> rows = List.of();

    /** Matches before offset and limit were applied. */
    int totalMatched;

    boolean cached;

    Duration executionTime;

    public int size() {
        return rows.size();
    }
}
