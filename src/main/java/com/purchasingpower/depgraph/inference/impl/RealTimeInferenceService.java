package com.purchasingpower.depgraph.inference.impl;

import com.purchasingpower.depgraph.config.InferenceProperties;
import com.purchasingpower.depgraph.core.GraphEdge;
import com.purchasingpower.depgraph.core.GraphNode;
import com.purchasingpower.depgraph.inference.CustomRuleEngine;
import com.purchasingpower.depgraph.inference.InferenceTaskStats;
import com.purchasingpower.depgraph.inference.RuleApplication;
import com.purchasingpower.depgraph.knowledge.GraphStore;
import com.purchasingpower.depgraph.realtime.DataChangeEvent;
import com.purchasingpower.depgraph.realtime.RealtimeEvent;
import com.purchasingpower.depgraph.realtime.RealtimeEventListener;
import com.purchasingpower.depgraph.realtime.RealtimeEventType;
import com.purchasingpower.depgraph.realtime.RealtimeQuerySystem;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Re-applies custom inference rules when the realtime layer reports a data
 * change.
 *
 * <p>Every address named by a {@link DataChangeEvent} (record keys
 * {@code addresses} or {@code address}) is re-evaluated on the auto-inference
 * pool, whose size caps concurrent inferences. The latest rule output is kept
 * per node; a node that no longer exists drops its entry.
 *
 * @since 2.0.0
 */
@Slf4j
@Service
public class RealTimeInferenceService {

    private static final String ADDRESS = "address";

    private final RealtimeQuerySystem realtime;
    private final CustomRuleEngine ruleEngine;
    private final GraphStore store;
    private final InferenceProperties properties;
    private final Executor executor;

    private final RealtimeEventListener dataChangeListener = this::onRealtimeEvent;

    private final Map<String, List<GraphEdge>> inferredEdges = new ConcurrentHashMap<>();
    private final AtomicInteger activeTasks = new AtomicInteger();
    private final AtomicLong completedTasks = new AtomicLong();
    private final AtomicLong failedTasks = new AtomicLong();
    private final AtomicLong changeEventsProcessed = new AtomicLong();

    public RealTimeInferenceService(RealtimeQuerySystem realtime,
                                    CustomRuleEngine ruleEngine,
                                    GraphStore store,
                                    InferenceProperties properties,
                                    @Qualifier("autoInferenceExecutor") Executor executor) {
        this.realtime = realtime;
        this.ruleEngine = ruleEngine;
        this.store = store;
        this.properties = properties;
        this.executor = executor;
    }

    @PostConstruct
    public void start() {
        realtime.addListener(RealtimeEventType.DATA_CHANGE, dataChangeListener);
        log.info("🧠 Real-time inference listening for data changes (auto={}, rules={}, allowList={})",
                properties.isEnableAutoInference(), properties.isEnableCustomRules(), properties.getRuleIds());
    }

    @PreDestroy
    public void stop() {
        realtime.removeListener(RealtimeEventType.DATA_CHANGE, dataChangeListener);
    }

    private void onRealtimeEvent(RealtimeEvent event) {
        if (event.payload() instanceof DataChangeEvent change) {
            onDataChange(change);
        }
    }

    /**
     * Schedules rule evaluation for every address the change names.
     *
     * @return One future per scheduled address, empty when auto inference is off
     */
    public List<CompletableFuture<List<GraphEdge>>> onDataChange(DataChangeEvent change) {
        if (!properties.isEnableAutoInference() || !properties.isEnableCustomRules()
                || !ruleEngine.hasEnabledRules()) {
            return List.of();
        }
        changeEventsProcessed.incrementAndGet();
        Set<String> addresses = addressesOf(change);
        log.debug("Data change on '{}' schedules inference for {} nodes", change.table(), addresses.size());
        return addresses.stream().map(this::schedule).toList();
    }

    /**
     * Runs the enabled rules for one node on the auto-inference pool.
     */
    public CompletableFuture<List<GraphEdge>> schedule(String address) {
        try {
            return CompletableFuture.supplyAsync(() -> inferFor(address), executor);
        } catch (RejectedExecutionException e) {
            failedTasks.incrementAndGet();
            log.warn("Inference for {} rejected, pool saturated", address);
            return CompletableFuture.failedFuture(e);
        }
    }

    List<GraphEdge> inferFor(String address) {
        activeTasks.incrementAndGet();
        try {
            Optional<GraphNode> node = store.getNode(address);
            if (node.isEmpty()) {
                inferredEdges.remove(address);
                completedTasks.incrementAndGet();
                return List.of();
            }
            RuleApplication application = ruleEngine.apply(store, node.get(), properties.getRuleIds());
            inferredEdges.put(address, application.edges());
            if (!application.errors().isEmpty()) {
                log.warn("Inference for {} finished with {} rule errors: {}",
                        address, application.errors().size(), application.errors());
            }
            completedTasks.incrementAndGet();
            log.debug("Inferred {} edges for {} ({} duplicates discarded)",
                    application.edges().size(), address, application.discardedDuplicates());
            return application.edges();
        } catch (RuntimeException e) {
            failedTasks.incrementAndGet();
            log.error("Inference for {} failed", address, e);
            throw e;
        } finally {
            activeTasks.decrementAndGet();
        }
    }

    public List<GraphEdge> getInferredEdges(String address) {
        return inferredEdges.getOrDefault(address, List.of());
    }

    public Map<String, List<GraphEdge>> getAllInferredEdges() {
        return Collections.unmodifiableMap(new TreeMap<>(inferredEdges));
    }

    public InferenceTaskStats getStats() {
        return new InferenceTaskStats(activeTasks.get(), completedTasks.get(), failedTasks.get(),
                changeEventsProcessed.get(), inferredEdges.size());
    }

    private static Set<String> addressesOf(DataChangeEvent change) {
        Set<String> addresses = new LinkedHashSet<>();
        Object many = change.record().get(DataChangeEvent.ADDRESSES);
        if (many instanceof Collection<?> values) {
            values.stream().filter(v -> v != null).map(Object::toString).forEach(addresses::add);
        } else if (many != null) {
            addresses.add(many.toString());
        }
        Object one = change.record().get(ADDRESS);
        if (one != null) {
            addresses.add(one.toString());
        }
        return addresses;
    }
}
