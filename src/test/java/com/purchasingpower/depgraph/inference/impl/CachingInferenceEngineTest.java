package com.purchasingpower.depgraph.inference.impl;

import com.purchasingpower.depgraph.core.Address;
import com.purchasingpower.depgraph.core.GraphEdge;
import com.purchasingpower.depgraph.inference.CustomRuleEngine;
import com.purchasingpower.depgraph.inference.HierarchicalOptions;
import com.purchasingpower.depgraph.inference.InferenceResult;
import com.purchasingpower.depgraph.knowledge.EdgeTypeRegistry;
import com.purchasingpower.depgraph.knowledge.ObservableGraphStore;
import com.purchasingpower.depgraph.knowledge.impl.InMemoryGraphStore;
import com.purchasingpower.depgraph.support.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static com.purchasingpower.depgraph.support.GraphFixtures.cls;
import static com.purchasingpower.depgraph.support.GraphFixtures.edge;
import static com.purchasingpower.depgraph.support.GraphFixtures.node;
import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("Caching inference engine")
class CachingInferenceEngineTest {

    private ObservableGraphStore store;
    private MutableClock clock;
    private CachingInferenceEngine engine;
    private Address a;
    private Address b;
    private Address unrelated;

    @BeforeEach
    void setUp() {
        store = new ObservableGraphStore(new InMemoryGraphStore());
        clock = MutableClock.startingAtEpoch();
        DefaultInferenceEngine delegate = new DefaultInferenceEngine(store, new EdgeTypeRegistry(),
                new CustomRuleEngine(), new SequentialFrontierExpander(), Duration.ofSeconds(5), false);
        engine = new CachingInferenceEngine(delegate, 2, Duration.ofMinutes(1), clock);
        store.addListener(engine);

        a = cls("A");
        b = cls("B");
        unrelated = cls("Unrelated");
        node(store, a);
        node(store, b);
        node(store, unrelated);
        edge(store, a, b, "calls");
    }

    @Test
    void repeatedCallIsServedFromCache() {
        InferenceResult first = engine.inferHierarchical(a.toCanonical(), "calls", null);
        InferenceResult second = engine.inferHierarchical(a.toCanonical(), "calls", HierarchicalOptions.defaults());

        assertThat(second).isSameAs(first);
        assertThat(engine.hits()).isEqualTo(1);
        assertThat(engine.misses()).isEqualTo(1);
    }

    @Test
    void timeoutDoesNotSplitCacheKeys() {
        InferenceResult first = engine.inferHierarchical(a.toCanonical(), "calls", null);
        InferenceResult second = engine.inferHierarchical(a.toCanonical(), "calls",
                HierarchicalOptions.builder().timeout(Duration.ofSeconds(2)).build());

        assertThat(second).isSameAs(first);
    }

    @Test
    @DisplayName("Writes touching a read address evict the entry")
    void writeOnTouchedAddressInvalidates() {
        engine.inferHierarchical(a.toCanonical(), "calls", null);
        Address c = cls("C");
        node(store, c);
        edge(store, b, c, "calls");

        InferenceResult result = engine.inferHierarchical(a.toCanonical(), "calls", null);

        assertThat(result.addresses()).containsExactly(b.toCanonical(), c.toCanonical());
    }

    @Test
    void unrelatedWriteKeepsEntry() {
        engine.inferHierarchical(a.toCanonical(), "calls", null);
        store.putEdge(GraphEdge.asserted(unrelated, cls("Elsewhere"), "calls"));

        engine.inferHierarchical(a.toCanonical(), "calls", null);

        assertThat(engine.hits()).isEqualTo(1);
    }

    @Test
    void entriesExpireAfterTtl() {
        engine.inferHierarchical(a.toCanonical(), "calls", null);
        clock.advance(Duration.ofMinutes(2));

        engine.inferHierarchical(a.toCanonical(), "calls", null);

        assertThat(engine.hits()).isZero();
        assertThat(engine.misses()).isEqualTo(2);
    }

    @Test
    void sizeBoundHoldsAfterEachCall() {
        engine.inferHierarchical(a.toCanonical(), "calls", null);
        engine.inferHierarchical(b.toCanonical(), "calls", null);
        engine.inferHierarchical(a.toCanonical(), "calls", null);
        engine.inferHierarchical(unrelated.toCanonical(), "calls", null);

        assertThat(engine.size()).isEqualTo(2);
        assertThat(engine.hits()).isEqualTo(1);
    }

    @Test
    @DisplayName("Options are compared by value, not by hash code")
    void optionsWithEqualHashCodesDoNotShareEntries() {
        // Lombok hashes these two to the same int.
        HierarchicalOptions withChildren = HierarchicalOptions.builder().includeChildren(true).maxDepth(3062).build();
        HierarchicalOptions withoutChildren = HierarchicalOptions.builder().includeChildren(false).maxDepth(2000).build();
        assertThat(withChildren.hashCode()).isEqualTo(withoutChildren.hashCode());

        InferenceResult first = engine.inferHierarchical(a.toCanonical(), "calls", withChildren);
        InferenceResult second = engine.inferHierarchical(a.toCanonical(), "calls", withoutChildren);

        assertThat(second).isNotSameAs(first);
        assertThat(engine.hits()).isZero();
        assertThat(engine.misses()).isEqualTo(2);
    }

    @Test
    void partialResultsAreNotMemoized() {
        engine.inferHierarchical(a.toCanonical(), "calls", HierarchicalOptions.builder().timeout(Duration.ZERO).build());

        assertThat(engine.size()).isZero();
    }

    @Test
    void clearEmptiesCache() {
        engine.inferHierarchical(a.toCanonical(), "calls", null);
        engine.clear();

        assertThat(engine.size()).isZero();
    }
}
