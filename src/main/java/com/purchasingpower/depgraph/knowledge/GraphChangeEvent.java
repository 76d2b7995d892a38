package com.purchasingpower.depgraph.knowledge;

import com.purchasingpower.depgraph.core.GraphEdge;
import com.purchasingpower.depgraph.core.GraphNode;

import java.time.Instant;
import java.util.Set;

/**
 * A single write applied to a {@link GraphStore}.
 *
 * <p>For node deletions only {@code address} is set; {@code node} is the
 * removed node when it existed.
 */
public record GraphChangeEvent(ChangeType type, Element element, String address,
                               GraphNode node, GraphEdge edge, Instant timestamp) {

    public enum ChangeType { INSERT, UPDATE, DELETE }

    public enum Element { NODE, EDGE }

    public static GraphChangeEvent node(ChangeType type, String address, GraphNode node) {
        return new GraphChangeEvent(type, Element.NODE, address, node, null, Instant.now());
    }

    public static GraphChangeEvent edge(ChangeType type, GraphEdge edge) {
        return new GraphChangeEvent(type, Element.EDGE, edge.getFromId(), null, edge, Instant.now());
    }

    /**
     * Addresses touched by this change: the node, or both ends of the edge.
     */
    public Set<String> touchedAddresses() {
        if (element == Element.EDGE) {
            // self-loops touch a single address
            return edge.getFromId().equals(edge.getToId())
                    ? Set.of(edge.getFromId())
                    : Set.of(edge.getFromId(), edge.getToId());
        }
        return Set.of(address);
    }
}
