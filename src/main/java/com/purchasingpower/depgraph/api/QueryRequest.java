package com.purchasingpower.depgraph.api;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Query execution request.
 *
 * @since 2.0.0
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class QueryRequest {

    private String query;

    /**
     * SQL, GraphQL or NaturalLanguage. Detected from the query text when absent.
     */
    private String queryType;

    /**
     * Named data source, {@code default} when absent.
     */
    private String dataSource;

    private Long timeoutMs;
}
