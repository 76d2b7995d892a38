package com.purchasingpower.depgraph.realtime.impl;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.purchasingpower.depgraph.exception.QueryNotFoundException;
import com.purchasingpower.depgraph.exception.SubscriptionNotFoundException;
import com.purchasingpower.depgraph.exception.UnsupportedDialectException;
import com.purchasingpower.depgraph.query.QueryDialect;
import com.purchasingpower.depgraph.realtime.QueryUpdate;
import com.purchasingpower.depgraph.realtime.RealtimeChannel;
import com.purchasingpower.depgraph.realtime.RealtimeMessage;
import com.purchasingpower.depgraph.realtime.RealtimeQuery;
import com.purchasingpower.depgraph.realtime.RealtimeQuerySystem;
import com.purchasingpower.depgraph.realtime.SubscriptionEventType;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Optional;

/**
 * Translates the JSON envelope of a client connection into
 * {@link RealtimeQuerySystem} calls.
 *
 * <p>{@link #handle(String, String)} never throws: every failure becomes an
 * {@code error} message. Subscription updates are pushed to the client's
 * registered {@link RealtimeChannel}.
 *
 * @since 2.0.0
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class RealtimeMessageHandler {

    private final RealtimeQuerySystem realtime;
    private final ObjectMapper objectMapper;

    /**
     * Handles one inbound message.
     *
     * @param clientId Sending client
     * @param json     Raw message text
     * @return Serialized response envelope
     */
    public String handle(String clientId, String json) {
        RealtimeMessage request;
        try {
            request = objectMapper.readValue(json, RealtimeMessage.class);
        } catch (JsonProcessingException | IllegalArgumentException e) {
            log.debug("Client {} sent unparseable message: {}", clientId, e.getMessage());
            return write(RealtimeMessage.error("Invalid JSON"));
        }
        return write(dispatch(clientId, request));
    }

    RealtimeMessage dispatch(String clientId, RealtimeMessage request) {
        String type = request.getType() == null ? "" : request.getType();
        try {
            return switch (type) {
                case RealtimeMessage.REGISTER_QUERY -> register(clientId, request);
                case RealtimeMessage.SUBSCRIBE -> subscribe(clientId, request);
                case RealtimeMessage.UNSUBSCRIBE -> {
                    realtime.unsubscribeFromQuery(request.getSubscriptionId());
                    yield RealtimeMessage.unsubscribed();
                }
                case RealtimeMessage.DEACTIVATE_QUERY -> {
                    realtime.deactivateQuery(request.getQueryId());
                    yield RealtimeMessage.queryDeactivated();
                }
                default -> RealtimeMessage.error("Unknown message type: " + type);
            };
        } catch (UnsupportedDialectException | QueryNotFoundException | SubscriptionNotFoundException e) {
            return RealtimeMessage.error(e.getMessage());
        } catch (IllegalArgumentException | IllegalStateException e) {
            return RealtimeMessage.error(e.getMessage());
        } catch (RuntimeException e) {
            log.error("Realtime message '{}' from client {} failed", type, clientId, e);
            return RealtimeMessage.error("Internal error: " + e.getMessage());
        }
    }

    private RealtimeMessage register(String clientId, RealtimeMessage request) {
        QueryDialect dialect = QueryDialect.fromString(request.getQueryType());
        String queryId = realtime.registerQuery(request.getQuery(), dialect, clientId, request.getDataSource());
        return RealtimeMessage.queryRegistered(queryId);
    }

    private RealtimeMessage subscribe(String clientId, RealtimeMessage request) {
        SubscriptionEventType eventType = SubscriptionEventType.fromString(request.getEventType());
        String queryId = request.getQueryId();
        String subscriptionId = realtime.subscribeToQuery(queryId, clientId, eventType, update -> push(clientId, update));

        if (eventType == SubscriptionEventType.DATA) {
            Optional<RealtimeQuery> query = realtime.getQuery(queryId);
            query.ifPresent(q -> push(clientId, new QueryUpdate(q.getId(), SubscriptionEventType.DATA,
                    q.getResults(), null, q.getLastExecuted())));
        }
        return RealtimeMessage.subscribed(subscriptionId);
    }

    private void push(String clientId, QueryUpdate update) {
        Optional<RealtimeChannel> channel = realtime.getChannel(clientId);
        if (channel.isEmpty() || !channel.get().isOpen()) {
            log.debug("No open channel for client {}, dropping {} update of query {}",
                    clientId, update.eventType(), update.queryId());
            return;
        }
        channel.get().send(write(RealtimeMessage.queryUpdate(update)));
    }

    private String write(RealtimeMessage message) {
        try {
            return objectMapper.writeValueAsString(message);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize realtime message: " + e.getMessage(), e);
        }
    }
}
