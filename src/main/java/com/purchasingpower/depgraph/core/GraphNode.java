package com.purchasingpower.depgraph.core;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.Map;

/**
 * A node of the symbolic graph, identified by its canonical address.
 *
 * <p>Nodes are created once per analysis run and replaced wholesale when their
 * file is analysed again; metadata is never mutated in place.
 *
 * @since 2.0.0
 */
@Value
@Builder(toBuilder = true)
public class GraphNode {

    Address address;

    @Singular("metadataEntry")
    Map<String, Object> metadata;

    public static GraphNode of(Address address) {
        return GraphNode.builder().address(address).build();
    }

    public static GraphNode of(Address address, Map<String, Object> metadata) {
        return GraphNode.builder().address(address).metadata(metadata == null ? Map.of() : metadata).build();
    }

    public String getId() {
        return address.toCanonical();
    }
}
