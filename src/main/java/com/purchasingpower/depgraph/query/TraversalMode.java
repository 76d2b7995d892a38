package com.purchasingpower.depgraph.query;

import java.util.Locale;
import java.util.Optional;

public enum TraversalMode {
    HIERARCHICAL,
    TRANSITIVE,
    INHERITABLE;

    public static Optional<TraversalMode> fromString(String value) {
        if (value == null) {
            return Optional.empty();
        }
        for (TraversalMode mode : values()) {
            if (mode.name().equals(value.trim().toUpperCase(Locale.ROOT))) {
                return Optional.of(mode);
            }
        }
        return Optional.empty();
    }
}
