package com.purchasingpower.depgraph.realtime.impl;

import com.purchasingpower.depgraph.realtime.RealtimeChannel;
import lombok.extern.slf4j.Slf4j;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

import java.io.IOException;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * {@link RealtimeChannel} backed by a Server-Sent Events stream. Every message
 * goes out as one {@code realtime-update} event carrying the JSON envelope.
 *
 * @since 2.0.0
 */
@Slf4j
public class SseRealtimeChannel implements RealtimeChannel {

    static final String EVENT_NAME = "realtime-update";

    private final String clientId;
    private final SseEmitter emitter;
    private final AtomicBoolean open = new AtomicBoolean(true);

    public SseRealtimeChannel(String clientId, SseEmitter emitter) {
        this.clientId = clientId;
        this.emitter = emitter;
    }

    @Override
    public String getClientId() {
        return clientId;
    }

    @Override
    public void send(String message) {
        if (!open.get()) {
            throw new IllegalStateException("Channel of client " + clientId + " is closed");
        }
        try {
            // SseEmitter is not safe for concurrent sends
            synchronized (emitter) {
                emitter.send(SseEmitter.event().name(EVENT_NAME).data(message));
            }
            log.debug("📤 Sent realtime message to client {}", clientId);
        } catch (IOException | IllegalStateException e) {
            open.set(false);
            throw new IllegalStateException("Failed to send to client " + clientId + ": " + e.getMessage(), e);
        }
    }

    @Override
    public boolean isOpen() {
        return open.get();
    }

    /**
     * Marks the channel closed without completing the emitter, for use when
     * the servlet container already finished the stream.
     */
    public void markClosed() {
        open.set(false);
    }

    @Override
    public void close() {
        if (open.compareAndSet(true, false)) {
            emitter.complete();
        }
    }
}
