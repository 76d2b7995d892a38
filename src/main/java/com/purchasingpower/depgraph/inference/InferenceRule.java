package com.purchasingpower.depgraph.inference;

import com.purchasingpower.depgraph.core.GraphEdge;
import com.purchasingpower.depgraph.core.GraphNode;

import java.util.function.BiFunction;
import java.util.function.BiPredicate;

/**
 * A user-defined inference rule evaluated against one node and one of its
 * outgoing edges.
 *
 * <p>The edge returned by {@link #infer} is re-stamped with this rule's id as
 * provenance, so implementations may build it with
 * {@link GraphEdge#asserted}.
 *
 * @since 2.0.0
 */
public interface InferenceRule {

    String getId();

    default String getDescription() {
        return getId();
    }

    boolean matches(GraphNode node, GraphEdge edge);

    /**
     * @return The derived edge, or null when the rule decides not to produce one
     */
    GraphEdge infer(GraphNode node, GraphEdge edge);

    static InferenceRule of(String id,
                            BiPredicate<GraphNode, GraphEdge> predicate,
                            BiFunction<GraphNode, GraphEdge, GraphEdge> transform) {
        return new InferenceRule() {
            @Override
            public String getId() {
                return id;
            }

            @Override
            public boolean matches(GraphNode node, GraphEdge edge) {
                return predicate.test(node, edge);
            }

            @Override
            public GraphEdge infer(GraphNode node, GraphEdge edge) {
                return transform.apply(node, edge);
            }

            @Override
            public String toString() {
                return "InferenceRule[" + id + "]";
            }
        };
    }
}
