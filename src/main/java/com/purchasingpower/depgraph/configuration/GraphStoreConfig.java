package com.purchasingpower.depgraph.configuration;

import com.purchasingpower.depgraph.config.InferenceProperties;
import com.purchasingpower.depgraph.config.RealtimeProperties;
import com.purchasingpower.depgraph.inference.CustomRuleEngine;
import com.purchasingpower.depgraph.inference.InferenceEngine;
import com.purchasingpower.depgraph.inference.InferenceEngineProvider;
import com.purchasingpower.depgraph.inference.impl.CachingInferenceEngine;
import com.purchasingpower.depgraph.inference.impl.DefaultInferenceEngine;
import com.purchasingpower.depgraph.inference.impl.FrontierExpander;
import com.purchasingpower.depgraph.inference.impl.ParallelFrontierExpander;
import com.purchasingpower.depgraph.inference.impl.SequentialFrontierExpander;
import com.purchasingpower.depgraph.knowledge.DataSourceRegistry;
import com.purchasingpower.depgraph.knowledge.EdgeTypeRegistry;
import com.purchasingpower.depgraph.knowledge.ObservableGraphStore;
import com.purchasingpower.depgraph.knowledge.impl.InMemoryGraphStore;
import com.purchasingpower.depgraph.query.QueryEngine;
import com.purchasingpower.depgraph.realtime.RealtimeQuerySystem;
import com.purchasingpower.depgraph.realtime.impl.DefaultRealtimeQuerySystem;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.TaskScheduler;

import java.time.Clock;
import java.util.concurrent.Executor;

/**
 * Wires the graph store, the inference engine and the realtime query system.
 *
 * <p>The primary store is an {@link InMemoryGraphStore} behind an
 * {@link ObservableGraphStore}; the memoizing inference engine and the query
 * result cache listen to its writes.
 *
 * @since 2.0.0
 */
@Slf4j
@Configuration
public class GraphStoreConfig {

    @Bean
    public ObservableGraphStore graphStore() {
        log.info("🗄️ Using in-memory graph store");
        return new ObservableGraphStore(new InMemoryGraphStore());
    }

    @Bean
    public DataSourceRegistry dataSourceRegistry(ObservableGraphStore graphStore) {
        return new DataSourceRegistry(graphStore);
    }

    @Bean
    public InferenceEngine inferenceEngine(ObservableGraphStore graphStore,
                                           EdgeTypeRegistry edgeTypes,
                                           CustomRuleEngine ruleEngine,
                                           InferenceProperties properties,
                                           @Qualifier("inferenceExecutor") Executor inferenceExecutor) {
        InferenceEngine engine = new DefaultInferenceEngine(graphStore, edgeTypes, ruleEngine,
                expander(properties, inferenceExecutor), properties.getDefaultTimeout(),
                properties.isEnableCustomRules());
        if (!properties.isEnableCache()) {
            log.info("Inference cache disabled");
            return engine;
        }

        CachingInferenceEngine caching = new CachingInferenceEngine(engine, properties.getCacheMaxEntries(),
                properties.getCacheTtl());
        graphStore.addListener(caching);
        log.info("✅ Inference cache enabled: maxEntries={}, ttl={}",
                properties.getCacheMaxEntries(), properties.getCacheTtl());
        return caching;
    }

    /**
     * The primary store shares the memoizing engine; any other data source gets
     * an uncached engine of its own.
     */
    @Bean
    public InferenceEngineProvider inferenceEngineProvider(InferenceEngine inferenceEngine,
                                                           DataSourceRegistry dataSources,
                                                           EdgeTypeRegistry edgeTypes,
                                                           CustomRuleEngine ruleEngine,
                                                           InferenceProperties properties,
                                                           @Qualifier("inferenceExecutor") Executor inferenceExecutor) {
        return store -> store == dataSources.primary()
                ? inferenceEngine
                : new DefaultInferenceEngine(store, edgeTypes, ruleEngine, expander(properties, inferenceExecutor),
                        properties.getDefaultTimeout(), properties.isEnableCustomRules());
    }

    @Bean
    public RealtimeQuerySystem realtimeQuerySystem(QueryEngine queryEngine,
                                                   DataSourceRegistry dataSources,
                                                   RealtimeProperties properties,
                                                   Clock clock,
                                                   @Qualifier("queryRefreshExecutor") Executor refreshExecutor,
                                                   @Qualifier("realtimePollingScheduler") TaskScheduler scheduler) {
        DefaultRealtimeQuerySystem system = new DefaultRealtimeQuerySystem(queryEngine, dataSources, properties,
                clock, refreshExecutor);
        if (properties.isPollingEnabled()) {
            system.startPolling(scheduler);
        } else {
            log.info("Realtime polling disabled, queries refresh on data changes only");
        }
        return system;
    }

    private static FrontierExpander expander(InferenceProperties properties, Executor inferenceExecutor) {
        if (properties.isEnableParallel()) {
            return new ParallelFrontierExpander(inferenceExecutor, properties.getMaxConcurrency());
        }
        return new SequentialFrontierExpander();
    }
}
