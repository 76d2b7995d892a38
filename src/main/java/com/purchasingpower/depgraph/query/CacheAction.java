package com.purchasingpower.depgraph.query;

import java.util.Locale;

public enum CacheAction {
    CLEAR,
    STATS,
    OPTIMIZE;

    public static CacheAction fromString(String value) {
        if (value == null) {
            throw new IllegalArgumentException("Cache action is required");
        }
        try {
            return valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown cache action: " + value, e);
        }
    }
}
