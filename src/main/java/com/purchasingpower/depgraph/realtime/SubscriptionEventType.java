package com.purchasingpower.depgraph.realtime;

import java.util.Locale;

/**
 * What a subscriber wants to hear about. Within one refresh cycle of a query
 * every DATA (or ERROR) subscriber is called before any COMPLETE subscriber.
 */
public enum SubscriptionEventType {
    DATA,
    ERROR,
    COMPLETE;

    public String getLabel() {
        return name().toLowerCase(Locale.ROOT);
    }

    /**
     * Accepts {@code data}, {@code error} or {@code complete} in any case; null means DATA.
     */
    public static SubscriptionEventType fromString(String value) {
        if (value == null || value.isBlank()) {
            return DATA;
        }
        try {
            return valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown subscription event type: " + value, e);
        }
    }
}
