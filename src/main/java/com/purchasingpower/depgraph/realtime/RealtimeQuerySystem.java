package com.purchasingpower.depgraph.realtime;

import com.purchasingpower.depgraph.query.QueryDialect;
import org.springframework.scheduling.TaskScheduler;

import java.util.Optional;

/**
 * Keeps registered queries fresh and pushes their results to subscribers.
 *
 * <p>Queries are re-evaluated when {@link #notifyDataChange} is called and on
 * the polling tick. Internal failures never escape to callers of the
 * notification paths; they surface as ERROR updates and
 * {@link RealtimeEventType#QUERY_ERROR} events.
 *
 * @since 2.0.0
 */
public interface RealtimeQuerySystem extends AutoCloseable {

    // =========================================================================
    // Queries and subscriptions
    // =========================================================================

    /**
     * Registers and immediately executes a query. A failing query is kept,
     * inactive, with its error recorded; the id is returned either way.
     *
     * @param dataSource Data source name, null for the default store
     * @throws IllegalArgumentException if the data source is unknown
     */
    String registerQuery(String query, QueryDialect dialect, String clientId, String dataSource);

    /**
     * @throws com.purchasingpower.depgraph.exception.QueryNotFoundException if the query is unknown
     * @throws IllegalStateException if the query is no longer active
     */
    String subscribeToQuery(String queryId, String clientId, SubscriptionEventType eventType,
                            SubscriptionCallback callback);

    /**
     * @throws com.purchasingpower.depgraph.exception.SubscriptionNotFoundException if the id is unknown
     */
    void unsubscribeFromQuery(String subscriptionId);

    /**
     * Deactivates a query, sends a final COMPLETE to its complete-subscribers
     * and removes all of its subscriptions.
     *
     * @return false if the query was already inactive
     * @throws com.purchasingpower.depgraph.exception.QueryNotFoundException if the query is unknown
     */
    boolean deactivateQuery(String queryId);

    Optional<RealtimeQuery> getQuery(String queryId);

    // =========================================================================
    // Refresh
    // =========================================================================

    void notifyDataChange(DataChangeEvent event);

    /**
     * One polling pass: time out stale queries, re-execute those older than
     * the polling interval and notify subscribers of changed results.
     */
    void tick();

    PollingHandle startPolling(TaskScheduler scheduler);

    // =========================================================================
    // Connections
    // =========================================================================

    /**
     * @throws com.purchasingpower.depgraph.exception.ConnectionLimitExceededException when at capacity
     */
    void connect(RealtimeChannel channel);

    /**
     * Deactivates every query of the client and removes all its subscriptions.
     */
    void disconnect(String clientId);

    Optional<RealtimeChannel> getChannel(String clientId);

    // =========================================================================
    // Listeners and statistics
    // =========================================================================

    void addListener(RealtimeEventType type, RealtimeEventListener listener);

    void removeListener(RealtimeEventType type, RealtimeEventListener listener);

    RealtimeStats getStats();

    /**
     * Cancels polling, closes every channel and drops all listeners and state.
     */
    @Override
    void close();
}
