package com.purchasingpower.depgraph.inference;

import com.purchasingpower.depgraph.core.GraphEdge;
import lombok.Builder;
import lombok.Value;

import java.time.Duration;
import java.util.List;
import java.util.Set;

/**
 * Outcome of one inference call.
 *
 * <p>{@code nodes} are sorted by depth then address. {@code edges} are always
 * inferred edges (they carry provenance). When {@code status} is
 * {@link InferenceStatus#TIMED_OUT} the result is {@code partial} and holds
 * what had accumulated before the deadline.
 *
 * @since 2.0.0
 */
@Value
@Builder(toBuilder = true)
public class InferenceResult {

    InferenceKind kind;
    String rootId;
    String edgeType;
    InferenceStatus status;
    boolean partial;

    @Builder.Default
    List<InferredNode> nodes = List.of();

    @Builder.Default
    List<GraphEdge> edges = List.of();

    /** Branches cut because they led back to an already visited node. */
    int cyclesDetected;

    /** Edges whose target node is missing from the store. */
    @Builder.Default
    List<String> skippedEdges = List.of();

    @Builder.Default
    List<String> errors = List.of();

    /** Every address read while computing this result. */
    @Builder.Default
    Set<String> touchedAddresses = Set.of();

    Duration elapsed;

    public List<String> addresses() {
        return nodes.stream().map(InferredNode::address).toList();
    }

    public int maxDepth() {
        return nodes.stream().mapToInt(InferredNode::depth).max().orElse(0);
    }
}
