package com.purchasingpower.depgraph.api;

import com.purchasingpower.depgraph.config.RealtimeProperties;
import com.purchasingpower.depgraph.exception.ConnectionLimitExceededException;
import com.purchasingpower.depgraph.realtime.RealtimeQuerySystem;
import com.purchasingpower.depgraph.realtime.RealtimeStats;
import com.purchasingpower.depgraph.realtime.impl.RealtimeMessageHandler;
import com.purchasingpower.depgraph.realtime.impl.SseRealtimeChannel;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.CrossOrigin;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

/**
 * Realtime query subscriptions over Server-Sent Events.
 *
 * <p>A client opens the stream first, then posts envelope messages; query
 * updates arrive on the stream as {@code realtime-update} events.
 * <pre>
 * const events = new EventSource(`/api/v1/realtime/${clientId}/stream`);
 * events.addEventListener('realtime-update', e => render(JSON.parse(e.data)));
 *
 * fetch(`/api/v1/realtime/${clientId}/messages`, {
 *   method: 'POST',
 *   body: JSON.stringify({type: 'registerQuery', query: 'MATCH Class', queryType: 'SQL'})
 * });
 * </pre>
 *
 * @since 2.0.0
 */
@Slf4j
@RestController
@RequestMapping("/api/v1/realtime")
@RequiredArgsConstructor
@CrossOrigin(origins = "*")
public class RealtimeController {

    private final RealtimeQuerySystem realtime;
    private final RealtimeMessageHandler messageHandler;
    private final RealtimeProperties properties;

    /**
     * GET /api/v1/realtime/{clientId}/stream
     */
    @GetMapping(value = "/{clientId}/stream", produces = MediaType.TEXT_EVENT_STREAM_VALUE)
    public ResponseEntity<SseEmitter> stream(@PathVariable String clientId) {
        SseEmitter emitter = new SseEmitter(properties.getSseTimeout().toMillis());
        SseRealtimeChannel channel = new SseRealtimeChannel(clientId, emitter);

        emitter.onCompletion(() -> {
            log.info("✅ SSE stream completed for client: {}", clientId);
            release(clientId, channel);
        });
        emitter.onTimeout(() -> {
            log.warn("⏱️ SSE stream timed out for client: {}", clientId);
            release(clientId, channel);
        });
        emitter.onError(error -> {
            log.warn("❌ SSE stream error for client {}: {}", clientId, error.getMessage());
            release(clientId, channel);
        });

        try {
            realtime.connect(channel);
        } catch (ConnectionLimitExceededException e) {
            emitter.complete();
            return ResponseEntity.status(HttpStatus.TOO_MANY_REQUESTS).build();
        }
        log.info("📡 Client connected to realtime stream: {}", clientId);
        return ResponseEntity.ok(emitter);
    }

    /**
     * POST /api/v1/realtime/{clientId}/messages
     */
    @PostMapping(value = "/{clientId}/messages",
            consumes = MediaType.ALL_VALUE, produces = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<String> message(@PathVariable String clientId, @RequestBody String body) {
        return ResponseEntity.ok(messageHandler.handle(clientId, body));
    }

    /**
     * DELETE /api/v1/realtime/{clientId}
     */
    @DeleteMapping("/{clientId}")
    public ResponseEntity<Void> disconnect(@PathVariable String clientId) {
        realtime.disconnect(clientId);
        return ResponseEntity.noContent().build();
    }

    /**
     * GET /api/v1/realtime/stats
     */
    @GetMapping("/stats")
    public ResponseEntity<RealtimeStats> stats() {
        return ResponseEntity.ok(realtime.getStats());
    }

    private void release(String clientId, SseRealtimeChannel channel) {
        channel.markClosed();
        // A reconnect may already have replaced this channel.
        if (realtime.getChannel(clientId).filter(current -> current == channel).isPresent()) {
            realtime.disconnect(clientId);
        }
    }
}
