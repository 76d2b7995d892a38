package com.purchasingpower.depgraph.api;

import com.purchasingpower.depgraph.exception.NodeNotFoundException;
import com.purchasingpower.depgraph.exception.QuerySyntaxException;
import com.purchasingpower.depgraph.exception.QueryTimeoutException;
import com.purchasingpower.depgraph.exception.UnsupportedDialectException;
import com.purchasingpower.depgraph.knowledge.DataSourceRegistry;
import com.purchasingpower.depgraph.knowledge.GraphStore;
import com.purchasingpower.depgraph.query.CacheStats;
import com.purchasingpower.depgraph.query.QueryDialect;
import com.purchasingpower.depgraph.query.QueryEngine;
import com.purchasingpower.depgraph.query.QueryResult;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.time.Duration;

/**
 * REST controller for graph queries.
 *
 * @since 2.0.0
 */
@Slf4j
@RestController
@RequestMapping("/api/v1/query")
@RequiredArgsConstructor
public class QueryController {

    private final QueryEngine queryEngine;
    private final DataSourceRegistry dataSources;

    /**
     * Execute a query in any dialect.
     *
     * POST /api/v1/query
     */
    @PostMapping
    public ResponseEntity<QueryResponse> execute(@RequestBody QueryRequest request) {
        if (request.getQuery() == null || request.getQuery().isBlank()) {
            return ResponseEntity.badRequest().body(QueryResponse.error("Query is required"));
        }

        try {
            GraphStore store = dataSources.resolve(request.getDataSource());
            Duration timeout = request.getTimeoutMs() == null ? null : Duration.ofMillis(request.getTimeoutMs());
            QueryDialect dialect = request.getQueryType() == null || request.getQueryType().isBlank()
                ? queryEngine.detectDialect(request.getQuery())
                : QueryDialect.fromString(request.getQueryType());

            log.info("🔍 Executing {} query: {}", dialect, request.getQuery());
            QueryResult result = queryEngine.execute(request.getQuery(), dialect, store, timeout);
            return ResponseEntity.ok(QueryResponse.success(result));

        } catch (QuerySyntaxException | UnsupportedDialectException | IllegalArgumentException e) {
            return ResponseEntity.badRequest().body(QueryResponse.error(e.getMessage()));
        } catch (NodeNotFoundException e) {
            return ResponseEntity.status(HttpStatus.NOT_FOUND).body(QueryResponse.error(e.getMessage()));
        } catch (QueryTimeoutException e) {
            log.warn("Query timed out with {} partial rows", e.getPartialRows().size());
            return ResponseEntity.status(HttpStatus.GATEWAY_TIMEOUT)
                .body(QueryResponse.timedOut(e.getMessage(), e.getPartialRows()));
        } catch (Exception e) {
            log.error("Query failed", e);
            return ResponseEntity.internalServerError()
                .body(QueryResponse.error("Query failed: " + e.getMessage()));
        }
    }

    /**
     * Manage the result cache: clear, stats or optimize.
     *
     * POST /api/v1/query/cache/{action}
     */
    @PostMapping("/cache/{action}")
    public ResponseEntity<?> manageCache(@PathVariable String action) {
        try {
            CacheStats stats = queryEngine.manageCache(action);
            return ResponseEntity.ok(stats);
        } catch (IllegalArgumentException e) {
            return ResponseEntity.badRequest().body(ErrorResponse.of(e.getMessage()));
        }
    }
}
