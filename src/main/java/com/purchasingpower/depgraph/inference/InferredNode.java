package com.purchasingpower.depgraph.inference;

import java.util.List;

/**
 * A node reached by inference, with its hop count from the root and the
 * addresses along the discovering path (root first, this node last).
 */
public record InferredNode(String address, int depth, List<String> path) {

    public InferredNode {
        path = List.copyOf(path);
    }
}
