package com.purchasingpower.depgraph.inference;

import lombok.Builder;
import lombok.Value;

import java.time.Duration;

/**
 * Options for transitive closure.
 *
 * <p>With {@code includeIntermediate=false} only terminal nodes are returned:
 * reached nodes that have no further outgoing edge of the traversed type.
 */
@Value
@Builder(toBuilder = true)
public class TransitiveOptions {

    @Builder.Default
    int maxPathLength = 10;

    @Builder.Default
    boolean includeIntermediate = true;

    Duration timeout;

    public static TransitiveOptions defaults() {
        return builder().build();
    }
}
