package com.purchasingpower.depgraph.realtime;

public enum RealtimeEventType {
    QUERY_REGISTERED,
    QUERY_ERROR,
    QUERY_DEACTIVATED,
    QUERY_TIMEOUT,
    SUBSCRIPTION_CREATED,
    SUBSCRIPTION_CANCELLED,
    DATA_CHANGE,
    CLIENT_CONNECTED,
    CLIENT_DISCONNECTED
}
