package com.purchasingpower.depgraph.core;

import java.util.Locale;

/**
 * Direction of edge traversal relative to the node being inspected.
 */
public enum EdgeDirection {
    /** Edges whose source is the node. */
    OUT,
    /** Edges whose target is the node. */
    IN,
    BOTH;

    public static EdgeDirection fromString(String value) {
        if (value == null || value.isBlank()) {
            return OUT;
        }
        return switch (value.trim().toUpperCase(Locale.ROOT)) {
            case "OUT", "OUTGOING", "DOWN" -> OUT;
            case "IN", "INCOMING", "UP" -> IN;
            case "BOTH", "ANY" -> BOTH;
            default -> throw new IllegalArgumentException("Unknown edge direction: " + value);
        };
    }
}
