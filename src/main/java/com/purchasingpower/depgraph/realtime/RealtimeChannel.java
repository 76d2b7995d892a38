package com.purchasingpower.depgraph.realtime;

/**
 * Transport-agnostic connection to one client. Implementations wrap a
 * WebSocket, an SSE stream or, in tests, a list.
 */
public interface RealtimeChannel {

    String getClientId();

    /**
     * Sends one serialized message. Failures are reported as {@link IllegalStateException}.
     */
    void send(String message);

    boolean isOpen();

    void close();
}
