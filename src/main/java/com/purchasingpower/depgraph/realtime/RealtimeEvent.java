package com.purchasingpower.depgraph.realtime;

import java.time.Instant;

/**
 * Lifecycle event emitted to {@link RealtimeEventListener}s.
 * Fields that do not apply to the event type are null.
 */
public record RealtimeEvent(RealtimeEventType type,
                            String queryId,
                            String clientId,
                            String subscriptionId,
                            Object payload,
                            Instant timestamp) {
}
