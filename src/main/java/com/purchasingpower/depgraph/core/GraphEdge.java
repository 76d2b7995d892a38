package com.purchasingpower.depgraph.core;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Value;

import java.util.Map;

/**
 * A typed, directed relation between two addresses.
 *
 * <p>Edges asserted by extraction have no provenance. Edges produced by
 * inference always carry one; the only ways to build an edge are
 * {@link #asserted} and {@link #inferred}, which keeps the two apart.
 *
 * @since 2.0.0
 */
@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class GraphEdge {

    Address from;
    Address to;
    String edgeType;
    Map<String, Object> metadata;
    EdgeProvenance provenance;

    public static GraphEdge asserted(Address from, Address to, String edgeType) {
        return asserted(from, to, edgeType, Map.of());
    }

    public static GraphEdge asserted(Address from, Address to, String edgeType, Map<String, Object> metadata) {
        return new GraphEdge(from, to, edgeType, copy(metadata), null);
    }

    public static GraphEdge inferred(Address from, Address to, String edgeType,
                                     Map<String, Object> metadata, String derivedBy, int depth) {
        if (derivedBy == null || derivedBy.isBlank()) {
            throw new IllegalArgumentException("Inferred edge requires derivedBy");
        }
        return new GraphEdge(from, to, edgeType, copy(metadata), new EdgeProvenance(derivedBy, depth));
    }

    public boolean isInferred() {
        return provenance != null;
    }

    public String getFromId() {
        return from.toCanonical();
    }

    public String getToId() {
        return to.toCanonical();
    }

    public EdgeKey key() {
        return new EdgeKey(getFromId(), getToId(), edgeType);
    }

    /**
     * Returns a copy of this edge re-stamped with a different provenance.
     */
    public GraphEdge withProvenance(String derivedBy, int depth) {
        return inferred(from, to, edgeType, metadata, derivedBy, depth);
    }

    private static Map<String, Object> copy(Map<String, Object> metadata) {
        return metadata == null ? Map.of() : Map.copyOf(metadata);
    }

    /**
     * Identity of an edge regardless of metadata or provenance.
     */
    public record EdgeKey(String from, String to, String edgeType) {
    }
}
