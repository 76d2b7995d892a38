package com.purchasingpower.depgraph.inference.impl;

import com.google.common.base.Preconditions;
import com.purchasingpower.depgraph.inference.GraphValidationReport;
import com.purchasingpower.depgraph.inference.HierarchicalOptions;
import com.purchasingpower.depgraph.inference.InferenceEngine;
import com.purchasingpower.depgraph.inference.InferenceKind;
import com.purchasingpower.depgraph.inference.InferenceResult;
import com.purchasingpower.depgraph.inference.InferenceStatus;
import com.purchasingpower.depgraph.inference.InferenceSummary;
import com.purchasingpower.depgraph.inference.InheritableOptions;
import com.purchasingpower.depgraph.inference.TransitiveOptions;
import com.purchasingpower.depgraph.knowledge.GraphChangeEvent;
import com.purchasingpower.depgraph.knowledge.GraphChangeListener;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.util.Collection;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Supplier;

/**
 * Memoizing decorator over an {@link InferenceEngine}.
 *
 * <p>Results are keyed by (kind, root, edge type, options). Each result records
 * the addresses it read; a graph write touching any of them evicts it. Partial
 * results are never memoized. Register this engine as a
 * {@link GraphChangeListener} on the store the delegate reads.
 *
 * @since 2.0.0
 */
@Slf4j
public class CachingInferenceEngine implements InferenceEngine, GraphChangeListener {

    private final InferenceEngine delegate;
    private final InferenceMemoCache cache;
    private final AtomicLong graphVersion = new AtomicLong();

    public CachingInferenceEngine(InferenceEngine delegate, int maxEntries, Duration ttl) {
        this(delegate, maxEntries, ttl, Clock.systemUTC());
    }

    public CachingInferenceEngine(InferenceEngine delegate, int maxEntries, Duration ttl, Clock clock) {
        this.delegate = Preconditions.checkNotNull(delegate, "delegate");
        this.cache = new InferenceMemoCache(maxEntries, ttl, clock);
    }

    @Override
    public InferenceResult inferHierarchical(String rootId, String edgeType, HierarchicalOptions options) {
        HierarchicalOptions opts = options == null ? HierarchicalOptions.defaults() : options;
        HierarchicalOptions params = opts.toBuilder().timeout(null).build();
        return memoized(new InferenceMemoCache.Key(InferenceKind.HIERARCHICAL, rootId, edgeType, params),
                () -> delegate.inferHierarchical(rootId, edgeType, opts));
    }

    @Override
    public InferenceResult inferTransitive(String rootId, String edgeType, TransitiveOptions options) {
        TransitiveOptions opts = options == null ? TransitiveOptions.defaults() : options;
        TransitiveOptions params = opts.toBuilder().timeout(null).build();
        return memoized(new InferenceMemoCache.Key(InferenceKind.TRANSITIVE, rootId, edgeType, params),
                () -> delegate.inferTransitive(rootId, edgeType, opts));
    }

    @Override
    public InferenceResult inferInheritable(String rootId, String edgeType, InheritableOptions options) {
        InheritableOptions opts = options == null ? InheritableOptions.defaults() : options;
        InheritableOptions params = opts.toBuilder().timeout(null).build();
        return memoized(new InferenceMemoCache.Key(InferenceKind.INHERITABLE, rootId, edgeType, params),
                () -> delegate.inferInheritable(rootId, edgeType, opts));
    }

    @Override
    public InferenceResult applyRules(String rootId) {
        // Rule sets change at runtime without a graph write.
        return delegate.applyRules(rootId);
    }

    @Override
    public InferenceSummary inferAll(String rootId, Collection<String> edgeTypes) {
        return delegate.inferAll(rootId, edgeTypes);
    }

    @Override
    public GraphValidationReport validate() {
        return delegate.validate();
    }

    @Override
    public void onGraphChange(GraphChangeEvent event) {
        graphVersion.incrementAndGet();
        int removed = cache.invalidate(event.touchedAddresses());
        if (removed > 0) {
            log.debug("Graph {} {} invalidated {} memoized inference results",
                    event.type(), event.element(), removed);
        }
    }

    public void clear() {
        cache.clear();
    }

    public int size() {
        return cache.size();
    }

    public long hits() {
        return cache.hits();
    }

    public long misses() {
        return cache.misses();
    }

    private InferenceResult memoized(InferenceMemoCache.Key key, Supplier<InferenceResult> compute) {
        Optional<InferenceResult> cached = cache.get(key);
        if (cached.isPresent()) {
            return cached.get();
        }
        long versionBefore = graphVersion.get();
        InferenceResult result = compute.get();
        // A write during computation may already have been missed by the invalidation index.
        boolean stable = graphVersion.get() == versionBefore;
        if (stable && result.getStatus() == InferenceStatus.COMPLETED && !result.isPartial()) {
            cache.put(key, result);
            if (graphVersion.get() != versionBefore) {
                cache.remove(key);
            }
        }
        return result;
    }
}
