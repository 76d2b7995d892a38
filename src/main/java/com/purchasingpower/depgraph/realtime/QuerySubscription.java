package com.purchasingpower.depgraph.realtime;

import java.time.Instant;

public record QuerySubscription(String id,
                                String queryId,
                                String clientId,
                                SubscriptionEventType eventType,
                                SubscriptionCallback callback,
                                Instant createdAt) {
}
