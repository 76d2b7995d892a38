package com.purchasingpower.depgraph.query.impl;

import com.google.common.base.Preconditions;
import com.purchasingpower.depgraph.config.QueryProperties;
import com.purchasingpower.depgraph.core.Deadline;
import com.purchasingpower.depgraph.inference.InferenceEngineProvider;
import com.purchasingpower.depgraph.knowledge.GraphChangeEvent;
import com.purchasingpower.depgraph.knowledge.GraphChangeListener;
import com.purchasingpower.depgraph.knowledge.GraphStore;
import com.purchasingpower.depgraph.knowledge.ObservableGraphStore;
import com.purchasingpower.depgraph.query.CacheAction;
import com.purchasingpower.depgraph.query.CacheStats;
import com.purchasingpower.depgraph.query.QueryDialect;
import com.purchasingpower.depgraph.query.QueryEngine;
import com.purchasingpower.depgraph.query.QueryPlan;
import com.purchasingpower.depgraph.query.QueryResult;
import com.purchasingpower.depgraph.query.parser.GraphQlQueryParser;
import com.purchasingpower.depgraph.query.parser.NaturalLanguageQueryParser;
import com.purchasingpower.depgraph.query.parser.QueryParser;
import com.purchasingpower.depgraph.query.parser.SqlQueryParser;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.util.EnumMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;
import java.util.regex.Pattern;

/**
 * Default {@link QueryEngine}: parse, consult the cache, execute.
 *
 * <p>Only results read from an {@link ObservableGraphStore} are cached. The
 * engine subscribes to each such store the first time it queries it, and any
 * write to a subscribed store clears the whole result cache. Other stores
 * cannot report writes and are always queried directly.
 *
 * @since 2.0.0
 */
@Slf4j
@Service
public class GraphQueryEngine implements QueryEngine, GraphChangeListener {

    private static final Pattern SQL_PREFIX = Pattern.compile("^(SELECT|MATCH)\\b", Pattern.CASE_INSENSITIVE);
    private static final Pattern GRAPHQL_PREFIX = Pattern.compile("^(\\{|query\\b[^{]*\\{)", Pattern.CASE_INSENSITIVE);

    private final QueryProperties properties;
    private final InferenceEngineProvider inferenceEngines;
    private final Map<QueryDialect, QueryParser> parsers = new EnumMap<>(QueryDialect.class);
    private final QueryResultCache cache;
    private final QueryPlanExecutor executor;
    private final Set<ObservableGraphStore> subscribed = ConcurrentHashMap.newKeySet();
    // Bumped on every invalidation; a result computed across a bump is not stored.
    private final AtomicLong generation = new AtomicLong();

    public GraphQueryEngine(QueryProperties properties, InferenceEngineProvider inferenceEngines, Clock clock) {
        this.properties = Preconditions.checkNotNull(properties, "properties");
        this.inferenceEngines = Preconditions.checkNotNull(inferenceEngines, "inferenceEngines");
        this.cache = new QueryResultCache(properties.getCacheMaxSize(), properties.getCacheTtl(), clock);
        this.executor = new QueryPlanExecutor(properties.getDefaultLimit());
        register(new SqlQueryParser());
        register(new GraphQlQueryParser());
        register(new NaturalLanguageQueryParser());
    }

    private void register(QueryParser parser) {
        parsers.put(parser.dialect(), parser);
    }

    @Override
    public QueryResult executeSqlQuery(String query, GraphStore dataSource) {
        return execute(query, QueryDialect.SQL, dataSource, null);
    }

    @Override
    public QueryResult executeSqlQuery(String query, GraphStore dataSource, Duration timeout) {
        return execute(query, QueryDialect.SQL, dataSource, timeout);
    }

    @Override
    public QueryResult executeGraphQlQuery(String query, GraphStore dataSource) {
        return execute(query, QueryDialect.GRAPHQL, dataSource, null);
    }

    @Override
    public QueryResult executeGraphQlQuery(String query, GraphStore dataSource, Duration timeout) {
        return execute(query, QueryDialect.GRAPHQL, dataSource, timeout);
    }

    @Override
    public QueryResult executeNaturalLanguageQuery(String query, GraphStore dataSource) {
        return execute(query, QueryDialect.NATURAL_LANGUAGE, dataSource, null);
    }

    @Override
    public QueryResult executeNaturalLanguageQuery(String query, GraphStore dataSource, Duration timeout) {
        return execute(query, QueryDialect.NATURAL_LANGUAGE, dataSource, timeout);
    }

    @Override
    public QueryResult executeQuery(String query, GraphStore dataSource) {
        return execute(query, detectDialect(query), dataSource, null);
    }

    @Override
    public QueryResult executeQuery(String query, GraphStore dataSource, Duration timeout) {
        return execute(query, detectDialect(query), dataSource, timeout);
    }

    @Override
    public QueryResult execute(String query, QueryDialect dialect, GraphStore dataSource, Duration timeout) {
        Preconditions.checkNotNull(dialect, "dialect");
        Preconditions.checkNotNull(dataSource, "dataSource");
        long start = System.nanoTime();

        // Parse first: a syntax error must never reach the store.
        QueryPlan plan = compile(query, dialect);

        boolean cacheable = properties.isCacheEnabled() && observe(dataSource);
        String cacheKey = cacheKey(dialect, query, dataSource);
        if (cacheable) {
            Optional<QueryResult> cached = cache.get(cacheKey);
            if (cached.isPresent()) {
                log.debug("Query cache hit for {} query", dialect);
                return cached.get().toBuilder().cached(true).build();
            }
        }

        long startGeneration = generation.get();
        Deadline deadline = Deadline.after(timeout != null ? timeout : properties.getDefaultTimeout());
        QueryPlanExecutor.Outcome outcome = executor.execute(
                plan, dataSource, inferenceEngines.forStore(dataSource), deadline);

        QueryResult result = QueryResult.builder()
                .dialect(dialect)
                .rows(outcome.rows())
                .totalMatched(outcome.totalMatched())
                .cached(false)
                .executionTime(Duration.ofNanos(System.nanoTime() - start))
                .build();
        if (cacheable && generation.get() == startGeneration) {
            cache.put(cacheKey, result);
            // An invalidation racing the put may have missed it.
            if (generation.get() != startGeneration) {
                cache.invalidate(cacheKey);
            }
        }
        log.debug("{} query returned {} of {} rows in {} ms", dialect, result.size(),
                result.getTotalMatched(), result.getExecutionTime().toMillis());
        return result;
    }

    @Override
    public QueryPlan compile(String query, QueryDialect dialect) {
        QueryParser parser = parsers.get(dialect);
        return parser.parse(query);
    }

    @Override
    public QueryDialect detectDialect(String query) {
        String text = query == null ? "" : query.strip();
        if (SQL_PREFIX.matcher(text).find()) {
            return QueryDialect.SQL;
        }
        if (GRAPHQL_PREFIX.matcher(text).find()) {
            return QueryDialect.GRAPHQL;
        }
        return QueryDialect.NATURAL_LANGUAGE;
    }

    @Override
    public CacheStats manageCache(CacheAction action) {
        switch (action) {
            case CLEAR -> {
                cache.clear();
                log.info("Query cache cleared");
            }
            case OPTIMIZE -> cache.optimize(properties.getCacheOptimizeTargetRatio());
            case STATS -> {
                // reporting only
            }
        }
        return cache.stats();
    }

    @Override
    public void invalidateCache() {
        generation.incrementAndGet();
        cache.clear();
    }

    @Override
    public void onGraphChange(GraphChangeEvent event) {
        invalidateCache();
    }

    private boolean observe(GraphStore dataSource) {
        if (!(dataSource instanceof ObservableGraphStore observable)) {
            return false;
        }
        if (subscribed.add(observable)) {
            observable.addListener(this);
            log.debug("Query cache now invalidated by writes to {}", observable);
        }
        return true;
    }

    private static String cacheKey(QueryDialect dialect, String query, GraphStore dataSource) {
        return dialect.name() + '\u0000' + System.identityHashCode(dataSource) + '\u0000'
                + query.strip();
    }
}
