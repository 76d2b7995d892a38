package com.purchasingpower.depgraph.inference;

import lombok.Builder;
import lombok.Value;

import java.time.Duration;

@Value
@Builder(toBuilder = true)
public class InheritableOptions {

    /** When false only the root's own edges are returned. */
    @Builder.Default
    boolean includeInherited = true;

    @Builder.Default
    int maxInheritanceDepth = Integer.MAX_VALUE;

    Duration timeout;

    public static InheritableOptions defaults() {
        return builder().build();
    }
}
