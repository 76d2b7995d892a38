package com.purchasingpower.depgraph.inference;

import java.util.Collection;

/**
 * Derives edges that are not stored explicitly in the graph.
 *
 * <p>All operations are read-only against the graph store. An unknown root
 * raises {@link com.purchasingpower.depgraph.exception.NodeNotFoundException};
 * an expired deadline is reported through {@link InferenceResult#getStatus()}
 * rather than thrown.
 *
 * @since 2.0.0
 */
public interface InferenceEngine {

    /**
     * Breadth-first walk strictly along {@code edgeType} edges.
     *
     * @param rootId   Canonical address of the root; never part of the result
     * @param edgeType Edge type to follow
     * @param options  Direction, depth bound and timeout
     * @return Reached nodes, each once, at its shallowest depth
     */
    InferenceResult inferHierarchical(String rootId, String edgeType, HierarchicalOptions options);

    /**
     * Transitive closure along outgoing {@code edgeType} edges, one shortest path per reached node.
     */
    InferenceResult inferTransitive(String rootId, String edgeType, TransitiveOptions options);

    /**
     * The root's own {@code edgeType} edges plus those of every ancestor on its
     * extends/implements chain, nearest ancestor first.
     */
    InferenceResult inferInheritable(String rootId, String edgeType, InheritableOptions options);

    /**
     * Applies enabled custom rules to the root's outgoing edges.
     */
    InferenceResult applyRules(String rootId);

    /**
     * Runs every applicable inference kind for each edge type, then the custom rules.
     *
     * @param edgeTypes Edge types to infer over; null or empty means every registered type
     */
    InferenceSummary inferAll(String rootId, Collection<String> edgeTypes);

    GraphValidationReport validate();
}
