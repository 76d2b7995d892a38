package com.purchasingpower.depgraph.inference;

import com.purchasingpower.depgraph.core.GraphEdge;

import java.util.List;

/**
 * Edges produced by one pass of the custom rules over a node.
 *
 * @param edges               Winning edges, first registered rule first
 * @param errors              One entry per rule invocation that threw
 * @param discardedDuplicates Edges dropped because an earlier rule produced the same key
 */
public record RuleApplication(List<GraphEdge> edges, List<String> errors, int discardedDuplicates) {
}
