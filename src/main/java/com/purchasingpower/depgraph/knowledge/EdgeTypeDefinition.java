package com.purchasingpower.depgraph.knowledge;

import lombok.Builder;
import lombok.Value;

/**
 * Schema entry for one edge type.
 *
 * <p>{@code transitive} types are eligible for closure, {@code inheritable}
 * types are propagated along extends/implements chains. {@code parentType}
 * places the type in the edge-type hierarchy (e.g. {@code calls} under
 * {@code depends_on}).
 */
@Value
@Builder
public class EdgeTypeDefinition {

    String type;
    String description;
    String parentType;
    boolean transitive;
    boolean inheritable;
    @Builder.Default
    boolean directed = true;
    int priority;
}
