package com.purchasingpower.depgraph.knowledge;

import com.purchasingpower.depgraph.core.EdgeDirection;
import com.purchasingpower.depgraph.core.GraphEdge;
import com.purchasingpower.depgraph.core.GraphNode;

import java.util.List;
import java.util.Optional;
import java.util.function.Predicate;

/**
 * Interface for symbolic graph storage.
 *
 * <p>The storage engine is an injected collaborator. Implementations guarantee
 * read-after-write visibility inside one process and nothing more.
 *
 * @since 2.0.0
 */
public interface GraphStore {

    // =========================================================================
    // Node Operations
    // =========================================================================

    /**
     * Get a node by its canonical address.
     *
     * @param address Canonical address string
     * @return Node if present
     */
    Optional<GraphNode> getNode(String address);

    /**
     * Store a node, replacing any node with the same address.
     *
     * @param node Node to store
     */
    void putNode(GraphNode node);

    /**
     * Delete a node together with its outgoing edges.
     *
     * @param address Canonical address string
     * @return true if a node was removed
     */
    boolean deleteNode(String address);

    /**
     * List nodes matching a filter.
     *
     * @param filter Node predicate, or null for all nodes
     * @return Matching nodes
     */
    List<GraphNode> allNodes(Predicate<GraphNode> filter);

    default List<GraphNode> allNodes() {
        return allNodes(null);
    }

    // =========================================================================
    // Edge Operations
    // =========================================================================

    /**
     * Get edges attached to an address.
     *
     * @param address   Canonical address string
     * @param edgeType  Edge type to match, or null for every type
     * @param direction Which side of the edge the address must be on
     * @return Matching edges in insertion order
     */
    List<GraphEdge> getEdges(String address, String edgeType, EdgeDirection direction);

    /**
     * Store an edge. An edge with the same (from, to, edgeType) is replaced.
     *
     * @param edge Edge to store
     */
    void putEdge(GraphEdge edge);

    /**
     * @return Every stored edge
     */
    List<GraphEdge> allEdges();
}
