package com.purchasingpower.depgraph.realtime;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.purchasingpower.depgraph.knowledge.GraphStore;
import com.purchasingpower.depgraph.query.QueryDialect;
import lombok.AccessLevel;
import lombok.Getter;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.locks.ReentrantLock;

/**
 * A registered query and its latest evaluation.
 *
 * <p>Deactivation is one-way: {@link #deactivate()} flips {@code active} with a
 * compare-and-set and nothing sets it back. Refreshes of one query are
 * serialized on {@link #refreshLock()} so deliveries follow execution order.
 *
 * @since 2.0.0
 */
@Getter
public class RealtimeQuery {

    private final String id;
    private final QueryDialect dialect;
    private final String text;
    private final String clientId;
    private final String dataSource;
    private final Instant createdAt;

    @Getter(AccessLevel.NONE)
    private final GraphStore store;

    @Getter(AccessLevel.NONE)
    private final AtomicBoolean active = new AtomicBoolean(true);

    @Getter(AccessLevel.NONE)
    private final ReentrantLock refreshLock = new ReentrantLock();

    private volatile Instant lastExecuted;
    private volatile List<Map<String, Object>> results = List.of();
    private volatile String error;

    public RealtimeQuery(String id, QueryDialect dialect, String text, String clientId,
                         String dataSource, GraphStore store, Instant createdAt) {
        this.id = id;
        this.dialect = dialect;
        this.text = text;
        this.clientId = clientId;
        this.dataSource = dataSource;
        this.store = store;
        this.createdAt = createdAt;
        this.lastExecuted = createdAt;
    }

    public boolean isActive() {
        return active.get();
    }

    /**
     * @return true if this call performed the deactivation
     */
    public boolean deactivate() {
        return active.compareAndSet(true, false);
    }

    @JsonIgnore
    public GraphStore getStore() {
        return store;
    }

    public ReentrantLock refreshLock() {
        return refreshLock;
    }

    /**
     * Records a successful execution.
     *
     * @return true if the rows differ from the previous execution
     */
    public boolean recordResults(List<Map<String, Object>> rows, Instant executedAt) {
        boolean changed = !rows.equals(results);
        this.results = rows;
        this.error = null;
        this.lastExecuted = executedAt;
        return changed;
    }

    public void recordError(String message, Instant executedAt) {
        this.error = message;
        this.lastExecuted = executedAt;
    }
}
