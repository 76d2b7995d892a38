package com.purchasingpower.depgraph.inference;

import lombok.Builder;
import lombok.Value;

import java.time.Duration;

/**
 * Options for hierarchical inference.
 *
 * <p>{@code includeChildren=true} walks outgoing edges (descendants),
 * {@code false} walks incoming edges (ancestors). {@code maxDepth} is inclusive.
 */
@Value
@Builder(toBuilder = true)
public class HierarchicalOptions {

    @Builder.Default
    boolean includeChildren = true;

    @Builder.Default
    int maxDepth = Integer.MAX_VALUE;

    /** Also follow registered child edge types of the requested type. */
    @Builder.Default
    boolean includeSubtypes = false;

    /** Null means the engine default. */
    Duration timeout;

    public static HierarchicalOptions defaults() {
        return builder().build();
    }
}
