package com.purchasingpower.depgraph.inference.impl;

import com.purchasingpower.depgraph.core.Address;
import com.purchasingpower.depgraph.core.GraphEdge;
import com.purchasingpower.depgraph.exception.NodeNotFoundException;
import com.purchasingpower.depgraph.inference.CustomRuleEngine;
import com.purchasingpower.depgraph.inference.GraphValidationReport;
import com.purchasingpower.depgraph.inference.HierarchicalOptions;
import com.purchasingpower.depgraph.inference.InferenceKind;
import com.purchasingpower.depgraph.inference.InferenceResult;
import com.purchasingpower.depgraph.inference.InferenceRule;
import com.purchasingpower.depgraph.inference.InferenceStatus;
import com.purchasingpower.depgraph.inference.InferenceSummary;
import com.purchasingpower.depgraph.inference.InferredNode;
import com.purchasingpower.depgraph.inference.InheritableOptions;
import com.purchasingpower.depgraph.inference.TransitiveOptions;
import com.purchasingpower.depgraph.knowledge.EdgeTypeRegistry;
import com.purchasingpower.depgraph.knowledge.impl.InMemoryGraphStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import static com.purchasingpower.depgraph.support.GraphFixtures.cls;
import static com.purchasingpower.depgraph.support.GraphFixtures.edge;
import static com.purchasingpower.depgraph.support.GraphFixtures.node;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Inference over hand-built graphs. Classes are named after their role so the
 * expected paths read top to bottom.
 */
@DisplayName("Default inference engine")
class DefaultInferenceEngineTest {

    private InMemoryGraphStore store;
    private CustomRuleEngine rules;
    private DefaultInferenceEngine engine;

    @BeforeEach
    void setUp() {
        store = new InMemoryGraphStore();
        rules = new CustomRuleEngine();
        engine = newEngine(new SequentialFrontierExpander());
    }

    private DefaultInferenceEngine newEngine(FrontierExpander expander) {
        return new DefaultInferenceEngine(store, new EdgeTypeRegistry(), rules, expander, Duration.ofSeconds(30), true);
    }

    private Address add(String name) {
        Address address = cls(name);
        node(store, address);
        return address;
    }

    // =========================================================================
    // Hierarchical
    // =========================================================================

    @Nested
    @DisplayName("Hierarchical")
    class Hierarchical {

        @Test
        @DisplayName("Should reach each node once at its shallowest depth")
        void diamondReachesSharedNodeOnce() {
            // Given: A -> B -> D, A -> C -> D
            Address a = add("A");
            Address b = add("B");
            Address c = add("C");
            Address d = add("D");
            edge(store, a, b, "contains");
            edge(store, a, c, "contains");
            edge(store, b, d, "contains");
            edge(store, c, d, "contains");

            // When
            InferenceResult result = engine.inferHierarchical(a.toCanonical(), "contains", HierarchicalOptions.defaults());

            // Then
            assertThat(result.getStatus()).isEqualTo(InferenceStatus.COMPLETED);
            assertThat(result.addresses()).containsExactly(b.toCanonical(), c.toCanonical(), d.toCanonical());
            InferredNode shared = result.getNodes().get(2);
            assertThat(shared.depth()).isEqualTo(2);
            assertThat(shared.path()).containsExactly(a.toCanonical(), b.toCanonical(), d.toCanonical());
            assertThat(result.getEdges()).allSatisfy(e -> {
                assertThat(e.isInferred()).isTrue();
                assertThat(e.getProvenance().derivedBy()).isEqualTo("hierarchical");
                assertThat(e.getFromId()).isEqualTo(a.toCanonical());
            });
        }

        @Test
        void rootIsNeverInResultEvenOnCycle() {
            Address a = add("A");
            Address b = add("B");
            edge(store, a, b, "calls");
            edge(store, b, a, "calls");

            InferenceResult result = engine.inferHierarchical(a.toCanonical(), "calls", null);

            assertThat(result.addresses()).containsExactly(b.toCanonical());
            assertThat(result.getCyclesDetected()).isGreaterThanOrEqualTo(1);
        }

        @Test
        void respectsDepthBound() {
            Address a = add("A");
            Address b = add("B");
            Address c = add("C");
            edge(store, a, b, "contains");
            edge(store, b, c, "contains");

            InferenceResult result = engine.inferHierarchical(a.toCanonical(), "contains",
                    HierarchicalOptions.builder().maxDepth(1).build());

            assertThat(result.addresses()).containsExactly(b.toCanonical());
            assertThat(engine.inferHierarchical(a.toCanonical(), "contains",
                    HierarchicalOptions.builder().maxDepth(0).build()).getNodes()).isEmpty();
        }

        @Test
        @DisplayName("Parents direction walks edges backwards")
        void parentsDirection() {
            Address a = add("A");
            Address b = add("B");
            edge(store, a, b, "contains");

            InferenceResult result = engine.inferHierarchical(b.toCanonical(), "contains",
                    HierarchicalOptions.builder().includeChildren(false).build());

            assertThat(result.addresses()).containsExactly(a.toCanonical());
            GraphEdge inferred = result.getEdges().get(0);
            assertThat(inferred.getFromId()).isEqualTo(a.toCanonical());
            assertThat(inferred.getToId()).isEqualTo(b.toCanonical());
        }

        @Test
        void strictlyFollowsRequestedTypeUnlessSubtypesIncluded() {
            Address a = add("A");
            Address b = add("B");
            Address c = add("C");
            edge(store, a, b, "calls");
            edge(store, a, c, "imports");

            assertThat(engine.inferHierarchical(a.toCanonical(), "depends_on", null).getNodes()).isEmpty();
            assertThat(engine.inferHierarchical(a.toCanonical(), "depends_on",
                    HierarchicalOptions.builder().includeSubtypes(true).build()).addresses())
                    .containsExactly(b.toCanonical(), c.toCanonical());
        }

        @Test
        void danglingTargetsAreSkippedNotFatal() {
            Address a = add("A");
            Address ghost = cls("Ghost");
            edge(store, a, ghost, "calls");

            InferenceResult result = engine.inferHierarchical(a.toCanonical(), "calls", null);

            assertThat(result.getNodes()).isEmpty();
            assertThat(result.getSkippedEdges()).hasSize(1);
        }

        @Test
        void zeroTimeoutReturnsPartialResult() {
            Address a = add("A");
            Address b = add("B");
            edge(store, a, b, "calls");

            InferenceResult result = engine.inferHierarchical(a.toCanonical(), "calls",
                    HierarchicalOptions.builder().timeout(Duration.ZERO).build());

            assertThat(result.getStatus()).isEqualTo(InferenceStatus.TIMED_OUT);
            assertThat(result.isPartial()).isTrue();
        }
    }

    // =========================================================================
    // Transitive
    // =========================================================================

    @Nested
    @DisplayName("Transitive")
    class Transitive {

        private Address a;
        private Address b;
        private Address c;

        @BeforeEach
        void chain() {
            a = add("A");
            b = add("B");
            c = add("C");
            edge(store, a, b, "depends_on");
            edge(store, b, c, "depends_on");
        }

        @Test
        void closureRecordsShortestPaths() {
            InferenceResult result = engine.inferTransitive(a.toCanonical(), "depends_on", TransitiveOptions.defaults());

            assertThat(result.getKind()).isEqualTo(InferenceKind.TRANSITIVE);
            assertThat(result.addresses()).containsExactly(b.toCanonical(), c.toCanonical());
            assertThat(result.getEdges()).extracting(e -> e.getProvenance().derivedBy()).containsOnly("transitive");
            assertThat(result.getEdges().get(1).getProvenance().depth()).isEqualTo(2);
            assertThat(result.getEdges().get(1).getMetadata().get("path"))
                    .isEqualTo(a.toCanonical() + " -> " + b.toCanonical() + " -> " + c.toCanonical());
        }

        @Test
        void maxPathLengthBoundsDepth() {
            InferenceResult result = engine.inferTransitive(a.toCanonical(), "depends_on",
                    TransitiveOptions.builder().maxPathLength(1).build());

            assertThat(result.addresses()).containsExactly(b.toCanonical());
        }

        @Test
        void excludingIntermediateKeepsOnlyLeaves() {
            InferenceResult result = engine.inferTransitive(a.toCanonical(), "depends_on",
                    TransitiveOptions.builder().includeIntermediate(false).build());

            assertThat(result.addresses()).containsExactly(c.toCanonical());
        }

        @Test
        void cycleTerminates() {
            edge(store, c, a, "depends_on");

            InferenceResult result = engine.inferTransitive(a.toCanonical(), "depends_on", null);

            assertThat(result.addresses()).containsExactly(b.toCanonical(), c.toCanonical());
            assertThat(result.getCyclesDetected()).isEqualTo(1);
        }
    }

    // =========================================================================
    // Inheritable
    // =========================================================================

    @Test
    @DisplayName("Nearest ancestor claims an inherited target first")
    void inheritableWalksExtendsChain() {
        // Given: Child extends Parent extends Grand
        Address child = add("Child");
        Address parent = add("Parent");
        Address grand = add("Grand");
        Address x = add("X");
        Address y = add("Y");
        Address z = add("Z");
        edge(store, child, parent, "extends");
        edge(store, parent, grand, "extends");
        edge(store, child, z, "calls");
        edge(store, parent, x, "calls");
        edge(store, grand, x, "calls");
        edge(store, grand, y, "calls");
        edge(store, grand, z, "calls");

        // When
        InferenceResult result = engine.inferInheritable(child.toCanonical(), "calls", InheritableOptions.defaults());

        // Then
        assertThat(result.getEdges()).extracting(GraphEdge::getToId)
                .containsExactly(x.toCanonical(), y.toCanonical());
        GraphEdge fromParent = result.getEdges().get(0);
        assertThat(fromParent.getProvenance().derivedBy()).isEqualTo("inheritance");
        assertThat(fromParent.getMetadata())
                .containsEntry("source", parent.toCanonical())
                .containsEntry("inheritanceDepth", 1);
        assertThat(result.getEdges().get(1).getMetadata()).containsEntry("inheritanceDepth", 2);
    }

    @Test
    void inheritanceCanBeDisabledOrBounded() {
        Address child = add("Child");
        Address parent = add("Parent");
        Address grand = add("Grand");
        Address y = add("Y");
        edge(store, child, parent, "implements");
        edge(store, parent, grand, "extends");
        edge(store, grand, y, "uses");

        assertThat(engine.inferInheritable(child.toCanonical(), "uses",
                InheritableOptions.builder().includeInherited(false).build()).getEdges()).isEmpty();
        assertThat(engine.inferInheritable(child.toCanonical(), "uses",
                InheritableOptions.builder().maxInheritanceDepth(1).build()).getEdges()).isEmpty();
        assertThat(engine.inferInheritable(child.toCanonical(), "uses", null).getEdges()).hasSize(1);
    }

    // =========================================================================
    // Rules, aggregate, validation
    // =========================================================================

    @Test
    void applyRulesStampsRuleId() {
        Address a = add("A");
        Address b = add("B");
        edge(store, a, b, "calls");
        rules.register(InferenceRule.of("calls-imply-uses",
                (node, e) -> "calls".equals(e.getEdgeType()),
                (node, e) -> GraphEdge.asserted(e.getFrom(), e.getTo(), "uses")));

        InferenceResult result = engine.applyRules(a.toCanonical());

        assertThat(result.getEdges()).singleElement().satisfies(e -> {
            assertThat(e.getEdgeType()).isEqualTo("uses");
            assertThat(e.getProvenance().derivedBy()).isEqualTo("calls-imply-uses");
        });
        assertThat(result.addresses()).containsExactly(b.toCanonical());
    }

    @Test
    void inferAllRunsEveryApplicableKind() {
        // Given
        Address a = add("A");
        Address b = add("B");
        Address c = add("C");
        Address m = add("M");
        edge(store, a, b, "calls");
        edge(store, b, c, "calls");
        edge(store, a, m, "contains");

        // When
        InferenceSummary summary = engine.inferAll(a.toCanonical(), List.of("calls", "contains"));

        // Then
        assertThat(summary.results()).extracting(InferenceResult::getKind).containsExactly(
                InferenceKind.HIERARCHICAL,
                InferenceKind.HIERARCHICAL, InferenceKind.TRANSITIVE, InferenceKind.INHERITABLE);
        assertThat(summary.failures()).isEmpty();
        assertThat(summary.statistics().totalInferred()).isEqualTo(4);
        assertThat(summary.statistics().maxDepth()).isEqualTo(2);
        assertThat(summary.statistics().directRelationships()).isEqualTo(3);
        assertThat(summary.statistics().averageDepth()).isEqualTo(1.25);
        assertThat(summary.statistics().inferredByKind())
                .containsEntry(InferenceKind.HIERARCHICAL, 3)
                .containsEntry(InferenceKind.TRANSITIVE, 1);
    }

    @Test
    void unknownRootIsRejected() {
        assertThatThrownBy(() -> engine.inferTransitive("demo/x.ts#Class:X", "calls", null))
                .isInstanceOf(NodeNotFoundException.class)
                .hasMessage("Node not found: demo/x.ts#Class:X");
        assertThatThrownBy(() -> engine.inferAll("demo/x.ts#Class:X", null))
                .isInstanceOf(NodeNotFoundException.class);
    }

    @Test
    void validateReportsDanglingEdgesAndCycles() {
        Address a = add("A");
        Address b = add("B");
        edge(store, a, b, "depends_on");
        edge(store, b, a, "depends_on");
        edge(store, a, cls("Ghost"), "calls");

        GraphValidationReport report = engine.validate();

        assertThat(report.valid()).isFalse();
        assertThat(report.errors()).singleElement().asString().startsWith("Dangling edge ");
        assertThat(report.warnings()).contains("Found 1 cycle(s) in transitive edge type 'depends_on'");
    }

    @Test
    void validateAcceptsCleanGraph() {
        Address a = add("A");
        Address b = add("B");
        edge(store, a, b, "calls");

        GraphValidationReport report = engine.validate();

        assertThat(report.valid()).isTrue();
        assertThat(report.warnings()).isEmpty();
    }

    @Test
    @DisplayName("Parallel expansion yields the same nodes and paths as sequential")
    void parallelMatchesSequential() {
        // Given: a wide three-level tree with cross links
        Address root = add("Root");
        for (int i = 0; i < 8; i++) {
            Address mid = add("Mid" + i);
            edge(store, root, mid, "calls");
            for (int j = 0; j < 6; j++) {
                Address leaf = add("Leaf" + (i + j));
                edge(store, mid, leaf, "calls");
            }
        }
        ExecutorService pool = Executors.newFixedThreadPool(4);
        try {
            DefaultInferenceEngine parallel = newEngine(new ParallelFrontierExpander(pool, 4));

            // When
            InferenceResult expected = engine.inferHierarchical(root.toCanonical(), "calls", null);
            InferenceResult actual = parallel.inferHierarchical(root.toCanonical(), "calls", null);

            // Then
            assertThat(actual.getNodes()).isEqualTo(expected.getNodes());
            assertThat(actual.getNodes()).hasSize(8 + 13);
        } finally {
            pool.shutdownNow();
        }
    }

    @Test
    void nodeMetadataDoesNotAffectTraversal() {
        Address a = cls("A");
        node(store, a, Map.of("language", "typescript"));
        Address b = add("B");
        edge(store, a, b, "uses");

        assertThat(engine.inferHierarchical(a.toCanonical(), "uses", null).addresses())
                .containsExactly(b.toCanonical());
    }
}
