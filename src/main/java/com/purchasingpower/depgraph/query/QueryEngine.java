package com.purchasingpower.depgraph.query;

import com.purchasingpower.depgraph.knowledge.GraphStore;

import java.time.Duration;

/**
 * Executes SQL-like, GraphQL-like and natural-language queries against a graph store.
 *
 * <p>All dialects compile to a {@link QueryPlan} before the store is touched,
 * so syntax errors never cause partial reads. Execution is read-only.
 *
 * <p>Errors:
 * <ul>
 *   <li>{@link com.purchasingpower.depgraph.exception.QuerySyntaxException} - malformed query text
 *   <li>{@link com.purchasingpower.depgraph.exception.UnsupportedDialectException} - unknown dialect name
 *   <li>{@link com.purchasingpower.depgraph.exception.QueryTimeoutException} - deadline expired, carries partial rows
 *   <li>{@link com.purchasingpower.depgraph.exception.NodeNotFoundException} - traversal root does not resolve
 * </ul>
 *
 * @since 2.0.0
 */
public interface QueryEngine {

    QueryResult executeSqlQuery(String query, GraphStore dataSource);

    QueryResult executeSqlQuery(String query, GraphStore dataSource, Duration timeout);

    QueryResult executeGraphQlQuery(String query, GraphStore dataSource);

    QueryResult executeGraphQlQuery(String query, GraphStore dataSource, Duration timeout);

    QueryResult executeNaturalLanguageQuery(String query, GraphStore dataSource);

    QueryResult executeNaturalLanguageQuery(String query, GraphStore dataSource, Duration timeout);

    /**
     * Detects the dialect from the query text and executes it.
     */
    QueryResult executeQuery(String query, GraphStore dataSource);

    QueryResult executeQuery(String query, GraphStore dataSource, Duration timeout);

    QueryResult execute(String query, QueryDialect dialect, GraphStore dataSource, Duration timeout);

    /**
     * Compiles without executing.
     */
    QueryPlan compile(String query, QueryDialect dialect);

    /**
     * {@code SELECT}/{@code MATCH} prefix is SQL, a leading brace or {@code query {}
     * is GraphQL, anything else natural language.
     */
    QueryDialect detectDialect(String query);

    CacheStats manageCache(CacheAction action);

    default CacheStats manageCache(String action) {
        return manageCache(CacheAction.fromString(action));
    }

    /**
     * Drops every cached result. Called whenever the underlying graph changes.
     */
    void invalidateCache();
}
