package com.purchasingpower.depgraph.realtime.impl;

import com.google.common.base.Preconditions;
import com.purchasingpower.depgraph.config.RealtimeProperties;
import com.purchasingpower.depgraph.exception.ConnectionLimitExceededException;
import com.purchasingpower.depgraph.exception.QueryNotFoundException;
import com.purchasingpower.depgraph.exception.SubscriptionNotFoundException;
import com.purchasingpower.depgraph.knowledge.DataSourceRegistry;
import com.purchasingpower.depgraph.knowledge.GraphStore;
import com.purchasingpower.depgraph.query.QueryDialect;
import com.purchasingpower.depgraph.query.QueryEngine;
import com.purchasingpower.depgraph.query.QueryResult;
import com.purchasingpower.depgraph.realtime.DataChangeEvent;
import com.purchasingpower.depgraph.realtime.PollingHandle;
import com.purchasingpower.depgraph.realtime.QuerySubscription;
import com.purchasingpower.depgraph.realtime.QueryUpdate;
import com.purchasingpower.depgraph.realtime.RealtimeChannel;
import com.purchasingpower.depgraph.realtime.RealtimeEvent;
import com.purchasingpower.depgraph.realtime.RealtimeEventListener;
import com.purchasingpower.depgraph.realtime.RealtimeEventType;
import com.purchasingpower.depgraph.realtime.RealtimeQuery;
import com.purchasingpower.depgraph.realtime.RealtimeQuerySystem;
import com.purchasingpower.depgraph.realtime.RealtimeStats;
import com.purchasingpower.depgraph.realtime.SubscriptionCallback;
import com.purchasingpower.depgraph.realtime.SubscriptionEventType;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.TaskScheduler;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.Executor;
import java.util.concurrent.ScheduledFuture;
import java.util.function.Predicate;

/**
 * In-process {@link RealtimeQuerySystem}.
 *
 * <p>Registries are concurrent maps. Subscribe, deactivate and disconnect
 * take one short registry lock so that a subscription can never be added to a
 * query that is being torn down; callbacks and listeners always run outside
 * that lock on snapshots.
 *
 * <p>Polling is started explicitly with {@link #startPolling(TaskScheduler)};
 * {@link #tick()} can also be invoked directly.
 *
 * @since 2.0.0
 */
@Slf4j
public class DefaultRealtimeQuerySystem implements RealtimeQuerySystem {

    private final QueryEngine queryEngine;
    private final DataSourceRegistry dataSources;
    private final RealtimeProperties properties;
    private final Clock clock;
    private final Executor refreshExecutor;

    private final Map<String, RealtimeQuery> queries = new ConcurrentHashMap<>();
    private final Map<String, QuerySubscription> subscriptions = new ConcurrentHashMap<>();
    private final Map<String, RealtimeChannel> connections = new ConcurrentHashMap<>();
    private final Map<RealtimeEventType, List<RealtimeEventListener>> listeners = new ConcurrentHashMap<>();
    private final Object registryLock = new Object();

    private volatile PollingHandle pollingHandle;
    private volatile boolean closed;

    /**
     * @param refreshExecutor Pool for fanning out one polling tick, or null to refresh sequentially
     */
    public DefaultRealtimeQuerySystem(QueryEngine queryEngine, DataSourceRegistry dataSources,
                                      RealtimeProperties properties, Clock clock, Executor refreshExecutor) {
        this.queryEngine = Preconditions.checkNotNull(queryEngine, "queryEngine");
        this.dataSources = Preconditions.checkNotNull(dataSources, "dataSources");
        this.properties = Preconditions.checkNotNull(properties, "properties");
        this.clock = Preconditions.checkNotNull(clock, "clock");
        this.refreshExecutor = refreshExecutor;
    }

    // =========================================================================
    // Queries and subscriptions
    // =========================================================================

    @Override
    public String registerQuery(String query, QueryDialect dialect, String clientId, String dataSource) {
        Preconditions.checkArgument(query != null && !query.isBlank(), "Query text is required");
        Preconditions.checkNotNull(dialect, "dialect");
        checkOpen();
        GraphStore store = dataSources.resolve(dataSource);

        String id = UUID.randomUUID().toString();
        String sourceName = dataSource == null || dataSource.isBlank() ? DataSourceRegistry.DEFAULT : dataSource;
        RealtimeQuery registered = new RealtimeQuery(id, dialect, query, clientId, sourceName, store, clock.instant());
        registered.refreshLock().lock();
        try {
            queries.put(id, registered);
            QueryResult result = queryEngine.execute(query, dialect, store, properties.getQueryTimeout());
            registered.recordResults(result.getRows(), clock.instant());
            log.info("📝 Registered {} query {} for client {} ({} rows)", dialect, id, clientId, result.size());
            emit(RealtimeEventType.QUERY_REGISTERED, id, clientId, null, result.size());
        } catch (RuntimeException e) {
            registered.recordError(describe(e), clock.instant());
            registered.deactivate();
            log.warn("Registered {} query {} for client {} failed on first execution: {}",
                    dialect, id, clientId, describe(e));
            emit(RealtimeEventType.QUERY_REGISTERED, id, clientId, null, 0);
            emit(RealtimeEventType.QUERY_ERROR, id, clientId, null, describe(e));
        } finally {
            registered.refreshLock().unlock();
        }
        return id;
    }

    @Override
    public String subscribeToQuery(String queryId, String clientId, SubscriptionEventType eventType,
                                   SubscriptionCallback callback) {
        Preconditions.checkNotNull(eventType, "eventType");
        Preconditions.checkNotNull(callback, "callback");
        QuerySubscription subscription;
        synchronized (registryLock) {
            RealtimeQuery query = queries.get(queryId);
            if (query == null) {
                throw new QueryNotFoundException(queryId);
            }
            if (!query.isActive()) {
                throw new IllegalStateException("Query " + queryId + " is not active");
            }
            subscription = new QuerySubscription(UUID.randomUUID().toString(), queryId, clientId, eventType,
                    callback, clock.instant());
            subscriptions.put(subscription.id(), subscription);
        }
        log.debug("Client {} subscribed to {} events of query {}", clientId, eventType, queryId);
        emit(RealtimeEventType.SUBSCRIPTION_CREATED, queryId, clientId, subscription.id(), eventType);
        return subscription.id();
    }

    @Override
    public void unsubscribeFromQuery(String subscriptionId) {
        QuerySubscription removed = subscriptionId == null ? null : subscriptions.remove(subscriptionId);
        if (removed == null) {
            throw new SubscriptionNotFoundException(subscriptionId);
        }
        emit(RealtimeEventType.SUBSCRIPTION_CANCELLED, removed.queryId(), removed.clientId(), removed.id(), null);
    }

    @Override
    public boolean deactivateQuery(String queryId) {
        RealtimeQuery query = queries.get(queryId);
        if (query == null) {
            throw new QueryNotFoundException(queryId);
        }
        return deactivate(query, RealtimeEventType.QUERY_DEACTIVATED);
    }

    @Override
    public Optional<RealtimeQuery> getQuery(String queryId) {
        return Optional.ofNullable(queryId == null ? null : queries.get(queryId));
    }

    // =========================================================================
    // Refresh
    // =========================================================================

    @Override
    public void notifyDataChange(DataChangeEvent event) {
        Preconditions.checkNotNull(event, "event");
        if (closed) {
            return;
        }
        queryEngine.invalidateCache();
        emit(RealtimeEventType.DATA_CHANGE, null, null, null, event);

        List<RealtimeQuery> affected = activeQueries().stream()
                .filter(query -> isQueryAffectedByChange(query, event))
                .toList();
        log.debug("{} on '{}' re-evaluates {} active queries", event.type(), event.table(), affected.size());
        affected.forEach(query -> refresh(query, false));
    }

    // TODO: match the change's addresses against the node and edge types the compiled plan reads
    private boolean isQueryAffectedByChange(RealtimeQuery query, DataChangeEvent event) {
        return true;
    }

    @Override
    public void tick() {
        if (closed) {
            return;
        }
        Instant now = clock.instant();
        List<RealtimeQuery> due = new ArrayList<>();
        for (RealtimeQuery query : activeQueries()) {
            Duration age = Duration.between(query.getLastExecuted(), now);
            if (age.compareTo(properties.getQueryTimeout()) > 0) {
                log.info("⏱️ Query {} of client {} timed out after {} s", query.getId(), query.getClientId(),
                        age.toSeconds());
                deactivate(query, RealtimeEventType.QUERY_TIMEOUT);
            } else if (age.compareTo(properties.getPollingInterval()) >= 0) {
                due.add(query);
            }
        }

        if (due.size() > 1 && refreshExecutor != null && properties.getMaxConcurrency() > 1) {
            CompletableFuture<?>[] refreshes = due.stream()
                    .map(query -> CompletableFuture.runAsync(() -> refresh(query, true), refreshExecutor))
                    .toArray(CompletableFuture[]::new);
            CompletableFuture.allOf(refreshes).join();
        } else {
            due.forEach(query -> refresh(query, true));
        }
    }

    @Override
    public PollingHandle startPolling(TaskScheduler scheduler) {
        Preconditions.checkNotNull(scheduler, "scheduler");
        checkOpen();
        if (pollingHandle != null && !pollingHandle.isCancelled()) {
            return pollingHandle;
        }
        ScheduledFuture<?> future = scheduler.scheduleAtFixedRate(this::pollSafely, properties.getPollingInterval());
        pollingHandle = new ScheduledPollingHandle(future);
        log.info("🔄 Realtime polling started every {} ms", properties.getPollingInterval().toMillis());
        return pollingHandle;
    }

    private void pollSafely() {
        try {
            tick();
        } catch (RuntimeException e) {
            log.error("Realtime polling tick failed", e);
        }
    }

    /**
     * Re-executes one query and delivers the cycle: DATA (or ERROR) subscribers
     * first, then COMPLETE subscribers. A failure deactivates only this query.
     */
    private void refresh(RealtimeQuery query, boolean onlyIfChanged) {
        // A refresh that started later must not deliver before an earlier one.
        query.refreshLock().lock();
        try {
            refreshLocked(query, onlyIfChanged);
        } finally {
            query.refreshLock().unlock();
        }
    }

    private void refreshLocked(RealtimeQuery query, boolean onlyIfChanged) {
        if (!query.isActive()) {
            return;
        }
        List<QuerySubscription> subscribers = subscriptionsOf(query.getId());
        QueryResult result;
        try {
            result = queryEngine.execute(query.getText(), query.getDialect(), query.getStore(),
                    properties.getQueryTimeout());
        } catch (RuntimeException e) {
            String error = describe(e);
            query.recordError(error, clock.instant());
            log.warn("Query {} failed on refresh: {}", query.getId(), error);
            deliver(subscribers, SubscriptionEventType.ERROR,
                    new QueryUpdate(query.getId(), SubscriptionEventType.ERROR, null, error, clock.instant()));
            emit(RealtimeEventType.QUERY_ERROR, query.getId(), query.getClientId(), null, error);
            deactivate(query, RealtimeEventType.QUERY_DEACTIVATED);
            return;
        }

        boolean changed = query.recordResults(result.getRows(), clock.instant());
        if (onlyIfChanged && !changed) {
            return;
        }
        Instant now = clock.instant();
        deliver(subscribers, SubscriptionEventType.DATA,
                new QueryUpdate(query.getId(), SubscriptionEventType.DATA, result.getRows(), null, now));
        deliver(subscribers, SubscriptionEventType.COMPLETE,
                new QueryUpdate(query.getId(), SubscriptionEventType.COMPLETE, result.getRows(), null, now));
    }

    private boolean deactivate(RealtimeQuery query, RealtimeEventType reason) {
        if (!query.deactivate()) {
            return false;
        }
        List<QuerySubscription> removed;
        synchronized (registryLock) {
            removed = removeSubscriptions(s -> s.queryId().equals(query.getId()));
        }
        deliver(removed, SubscriptionEventType.COMPLETE, new QueryUpdate(query.getId(),
                SubscriptionEventType.COMPLETE, query.getResults(), query.getError(), clock.instant()));
        log.info("Query {} deactivated ({}), {} subscriptions removed", query.getId(), reason, removed.size());
        emit(reason, query.getId(), query.getClientId(), null, null);
        return true;
    }

    // =========================================================================
    // Connections
    // =========================================================================

    @Override
    public void connect(RealtimeChannel channel) {
        Preconditions.checkNotNull(channel, "channel");
        checkOpen();
        String clientId = channel.getClientId();
        RealtimeChannel previous;
        synchronized (registryLock) {
            previous = connections.get(clientId);
            if (previous == null && connections.size() >= properties.getMaxConnections()) {
                log.warn("Rejected client {}: {} connections open", clientId, connections.size());
                throw new ConnectionLimitExceededException(properties.getMaxConnections());
            }
            connections.put(clientId, channel);
        }
        if (previous != null && previous != channel) {
            closeQuietly(previous);
        }
        log.info("🔗 Client {} connected ({} active)", clientId, connections.size());
        emit(RealtimeEventType.CLIENT_CONNECTED, null, clientId, null, null);
    }

    @Override
    public void disconnect(String clientId) {
        RealtimeChannel channel;
        List<RealtimeQuery> deactivated = new ArrayList<>();
        List<QuerySubscription> removed;
        synchronized (registryLock) {
            channel = connections.remove(clientId);
            for (RealtimeQuery query : queries.values()) {
                if (clientId.equals(query.getClientId()) && query.deactivate()) {
                    deactivated.add(query);
                }
            }
            removed = removeSubscriptions(s -> clientId.equals(s.clientId())
                    || deactivated.stream().anyMatch(q -> q.getId().equals(s.queryId())));
        }

        // Other clients watching this client's queries get their final COMPLETE.
        for (RealtimeQuery query : deactivated) {
            List<QuerySubscription> watchers = removed.stream()
                    .filter(s -> s.queryId().equals(query.getId()) && !clientId.equals(s.clientId()))
                    .toList();
            deliver(watchers, SubscriptionEventType.COMPLETE, new QueryUpdate(query.getId(),
                    SubscriptionEventType.COMPLETE, query.getResults(), query.getError(), clock.instant()));
            emit(RealtimeEventType.QUERY_DEACTIVATED, query.getId(), clientId, null, null);
        }
        if (channel != null) {
            closeQuietly(channel);
        }
        log.info("👋 Client {} disconnected: {} queries deactivated, {} subscriptions removed",
                clientId, deactivated.size(), removed.size());
        emit(RealtimeEventType.CLIENT_DISCONNECTED, null, clientId, null, null);
    }

    @Override
    public Optional<RealtimeChannel> getChannel(String clientId) {
        return Optional.ofNullable(clientId == null ? null : connections.get(clientId));
    }

    // =========================================================================
    // Listeners and statistics
    // =========================================================================

    @Override
    public void addListener(RealtimeEventType type, RealtimeEventListener listener) {
        listeners.computeIfAbsent(type, t -> new CopyOnWriteArrayList<>()).add(listener);
    }

    @Override
    public void removeListener(RealtimeEventType type, RealtimeEventListener listener) {
        List<RealtimeEventListener> registered = listeners.get(type);
        if (registered != null) {
            registered.remove(listener);
        }
    }

    @Override
    public RealtimeStats getStats() {
        List<RealtimeQuery> active = activeQueries();
        Map<String, Integer> byType = new TreeMap<>();
        for (RealtimeQuery query : active) {
            byType.merge(query.getDialect().getLabel(), 1, Integer::sum);
        }
        return new RealtimeStats(active.size(), subscriptions.size(), connections.size(), byType);
    }

    @Override
    public void close() {
        if (closed) {
            return;
        }
        closed = true;
        if (pollingHandle != null) {
            pollingHandle.cancel();
        }
        List<RealtimeChannel> channels;
        synchronized (registryLock) {
            channels = new ArrayList<>(connections.values());
            connections.clear();
            subscriptions.clear();
            queries.values().forEach(RealtimeQuery::deactivate);
            queries.clear();
        }
        channels.forEach(this::closeQuietly);
        listeners.clear();
        log.info("Realtime query system closed ({} channels closed)", channels.size());
    }

    // =========================================================================
    // Helpers
    // =========================================================================

    private List<RealtimeQuery> activeQueries() {
        return queries.values().stream()
                .filter(RealtimeQuery::isActive)
                .sorted(Comparator.comparing(RealtimeQuery::getCreatedAt).thenComparing(RealtimeQuery::getId))
                .toList();
    }

    private List<QuerySubscription> subscriptionsOf(String queryId) {
        return subscriptions.values().stream()
                .filter(s -> s.queryId().equals(queryId))
                .sorted(Comparator.comparing(QuerySubscription::createdAt).thenComparing(QuerySubscription::id))
                .toList();
    }

    // Caller holds registryLock.
    private List<QuerySubscription> removeSubscriptions(Predicate<QuerySubscription> filter) {
        List<QuerySubscription> removed = new ArrayList<>();
        subscriptions.values().removeIf(subscription -> {
            if (filter.test(subscription)) {
                removed.add(subscription);
                return true;
            }
            return false;
        });
        removed.sort(Comparator.comparing(QuerySubscription::createdAt).thenComparing(QuerySubscription::id));
        return removed;
    }

    private void deliver(List<QuerySubscription> subscribers, SubscriptionEventType type, QueryUpdate update) {
        for (QuerySubscription subscription : subscribers) {
            if (subscription.eventType() != type) {
                continue;
            }
            try {
                subscription.callback().onUpdate(update);
            } catch (RuntimeException e) {
                log.warn("Subscriber {} of query {} failed on {} update: {}",
                        subscription.id(), subscription.queryId(), type, e.getMessage());
            }
        }
    }

    private void emit(RealtimeEventType type, String queryId, String clientId, String subscriptionId, Object payload) {
        List<RealtimeEventListener> registered = listeners.get(type);
        if (registered == null || registered.isEmpty()) {
            return;
        }
        RealtimeEvent event = new RealtimeEvent(type, queryId, clientId, subscriptionId, payload, clock.instant());
        for (RealtimeEventListener listener : registered) {
            try {
                listener.onEvent(event);
            } catch (RuntimeException e) {
                log.warn("Realtime listener failed on {}: {}", type, e.getMessage());
            }
        }
    }

    private void closeQuietly(RealtimeChannel channel) {
        try {
            channel.close();
        } catch (RuntimeException e) {
            log.debug("Closing channel of client {} failed: {}", channel.getClientId(), e.getMessage());
        }
    }

    private void checkOpen() {
        if (closed) {
            throw new IllegalStateException("Realtime query system is closed");
        }
    }

    private static String describe(RuntimeException e) {
        return e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
    }

    private record ScheduledPollingHandle(ScheduledFuture<?> future) implements PollingHandle {

        @Override
        public void cancel() {
            future.cancel(false);
        }

        @Override
        public boolean isCancelled() {
            return future.isCancelled();
        }
    }
}
