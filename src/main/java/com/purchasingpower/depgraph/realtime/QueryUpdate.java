package com.purchasingpower.depgraph.realtime;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Payload delivered to a subscription callback. {@code data} is set for DATA
 * (and the final COMPLETE of a cycle), {@code error} for ERROR.
 */
public record QueryUpdate(String queryId,
                          SubscriptionEventType eventType,
                          List<Map<String, Object>> data,
                          String error,
                          Instant timestamp) {
}
