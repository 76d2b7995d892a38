package com.purchasingpower.depgraph.api;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.purchasingpower.depgraph.query.QueryResult;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Query execution response.
 *
 * @since 2.0.0
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class QueryResponse {

    private boolean success;
    private String error;
    private String queryType;
    private Integer totalMatched;
    private Boolean cached;
    private Long executionTimeMs;

    /**
     * True when a timeout cut the query short and {@link #rows} holds what was produced.
     */
    private Boolean partial;

    @Builder.Default
    private List<Map<String, Object>> rows = new ArrayList<>();

    // ================================================================
    // Builder Helpers
    // ================================================================

    public static QueryResponse success(QueryResult result) {
        return QueryResponse.builder()
            .success(true)
            .queryType(result.getDialect().getLabel())
            .rows(result.getRows())
            .totalMatched(result.getTotalMatched())
            .cached(result.isCached())
            .executionTimeMs(result.getExecutionTime() == null ? null : result.getExecutionTime().toMillis())
            .build();
    }

    public static QueryResponse timedOut(String error, List<Map<String, Object>> partialRows) {
        return QueryResponse.builder()
            .success(false)
            .error(error)
            .partial(true)
            .rows(partialRows)
            .build();
    }

    public static QueryResponse error(String error) {
        return QueryResponse.builder()
            .success(false)
            .error(error)
            .build();
    }
}
