package com.purchasingpower.depgraph.support;

import com.purchasingpower.depgraph.core.Address;
import com.purchasingpower.depgraph.core.GraphEdge;
import com.purchasingpower.depgraph.core.GraphNode;
import com.purchasingpower.depgraph.core.NodeType;
import com.purchasingpower.depgraph.knowledge.GraphStore;

import java.util.Map;

/**
 * Small graph builders shared by tests. Every address lives in project {@code demo}.
 */
public final class GraphFixtures {

    public static final String PROJECT = "demo";

    private GraphFixtures() {
    }

    public static Address cls(String name) {
        return Address.of(PROJECT, "src/" + name + ".ts", NodeType.CLASS, name);
    }

    public static Address fn(String file, String name) {
        return Address.of(PROJECT, file, NodeType.FUNCTION, name);
    }

    public static Address method(String owner, String name) {
        return Address.of(PROJECT, "src/" + owner + ".ts", NodeType.METHOD, owner + "." + name);
    }

    public static GraphNode node(GraphStore store, Address address) {
        GraphNode node = GraphNode.of(address);
        store.putNode(node);
        return node;
    }

    public static GraphNode node(GraphStore store, Address address, Map<String, Object> metadata) {
        GraphNode node = GraphNode.of(address, metadata);
        store.putNode(node);
        return node;
    }

    public static GraphEdge edge(GraphStore store, Address from, Address to, String edgeType) {
        GraphEdge edge = GraphEdge.asserted(from, to, edgeType);
        store.putEdge(edge);
        return edge;
    }
}
