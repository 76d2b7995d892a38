package com.purchasingpower.depgraph.realtime;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * JSON envelope exchanged with realtime clients.
 *
 * <p>Requests:
 * <pre>
 * {"type": "registerQuery", "query": "...", "queryType": "SQL", "dataSource": "default"}
 * {"type": "subscribe", "queryId": "...", "eventType": "data"}
 * {"type": "unsubscribe", "subscriptionId": "..."}
 * {"type": "deactivateQuery", "queryId": "..."}
 * </pre>
 *
 * <p>Responses and pushes: {@code queryRegistered}, {@code subscribed},
 * {@code unsubscribed}, {@code queryDeactivated}, {@code queryUpdate} and
 * {@code error}.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class RealtimeMessage {

    public static final String REGISTER_QUERY = "registerQuery";
    public static final String SUBSCRIBE = "subscribe";
    public static final String UNSUBSCRIBE = "unsubscribe";
    public static final String DEACTIVATE_QUERY = "deactivateQuery";

    public static final String QUERY_REGISTERED = "queryRegistered";
    public static final String SUBSCRIBED = "subscribed";
    public static final String UNSUBSCRIBED = "unsubscribed";
    public static final String QUERY_DEACTIVATED = "queryDeactivated";
    public static final String QUERY_UPDATE = "queryUpdate";
    public static final String ERROR = "error";

    private String type;

    private String query;

    /**
     * Dialect label: SQL, GraphQL or NaturalLanguage.
     */
    private String queryType;

    private String dataSource;

    private String queryId;

    private String subscriptionId;

    private String eventType;

    private Object data;

    private String message;

    // ================================================================
    // Builder Helpers
    // ================================================================

    public static RealtimeMessage queryRegistered(String queryId) {
        return RealtimeMessage.builder().type(QUERY_REGISTERED).queryId(queryId).build();
    }

    public static RealtimeMessage subscribed(String subscriptionId) {
        return RealtimeMessage.builder().type(SUBSCRIBED).subscriptionId(subscriptionId).build();
    }

    public static RealtimeMessage unsubscribed() {
        return RealtimeMessage.builder().type(UNSUBSCRIBED).build();
    }

    public static RealtimeMessage queryDeactivated() {
        return RealtimeMessage.builder().type(QUERY_DEACTIVATED).build();
    }

    public static RealtimeMessage queryUpdate(QueryUpdate update) {
        return RealtimeMessage.builder()
                .type(QUERY_UPDATE)
                .queryId(update.queryId())
                .eventType(update.eventType().getLabel())
                .data(update.eventType() == SubscriptionEventType.ERROR ? update.error() : update.data())
                .build();
    }

    public static RealtimeMessage error(String message) {
        return RealtimeMessage.builder().type(ERROR).message(message).build();
    }
}
