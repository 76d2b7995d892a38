package com.purchasingpower.depgraph.knowledge;

import com.google.common.base.Preconditions;
import com.purchasingpower.depgraph.core.EdgeDirection;
import com.purchasingpower.depgraph.core.GraphEdge;
import com.purchasingpower.depgraph.core.GraphNode;
import lombok.extern.slf4j.Slf4j;

import java.util.List;
import java.util.Optional;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Predicate;

/**
 * {@link GraphStore} decorator that publishes every write to registered
 * listeners once the delegate has applied it.
 *
 * <p>A listener that throws is logged; the write itself has already succeeded.
 *
 * @since 2.0.0
 */
@Slf4j
public class ObservableGraphStore implements GraphStore {

    private final GraphStore delegate;
    private final CopyOnWriteArrayList<GraphChangeListener> listeners = new CopyOnWriteArrayList<>();

    public ObservableGraphStore(GraphStore delegate) {
        this.delegate = Preconditions.checkNotNull(delegate, "delegate");
    }

    public void addListener(GraphChangeListener listener) {
        listeners.addIfAbsent(Preconditions.checkNotNull(listener, "listener"));
    }

    public void removeListener(GraphChangeListener listener) {
        listeners.remove(listener);
    }

    @Override
    public Optional<GraphNode> getNode(String address) {
        return delegate.getNode(address);
    }

    @Override
    public void putNode(GraphNode node) {
        boolean existed = delegate.getNode(node.getId()).isPresent();
        delegate.putNode(node);
        publish(GraphChangeEvent.node(
                existed ? GraphChangeEvent.ChangeType.UPDATE : GraphChangeEvent.ChangeType.INSERT,
                node.getId(), node));
    }

    @Override
    public boolean deleteNode(String address) {
        Optional<GraphNode> existing = delegate.getNode(address);
        boolean removed = delegate.deleteNode(address);
        if (removed) {
            publish(GraphChangeEvent.node(GraphChangeEvent.ChangeType.DELETE, address, existing.orElse(null)));
        }
        return removed;
    }

    @Override
    public List<GraphNode> allNodes(Predicate<GraphNode> filter) {
        return delegate.allNodes(filter);
    }

    @Override
    public List<GraphEdge> getEdges(String address, String edgeType, EdgeDirection direction) {
        return delegate.getEdges(address, edgeType, direction);
    }

    @Override
    public void putEdge(GraphEdge edge) {
        boolean existed = delegate.getEdges(edge.getFromId(), edge.getEdgeType(), EdgeDirection.OUT).stream()
                .anyMatch(e -> e.key().equals(edge.key()));
        delegate.putEdge(edge);
        publish(GraphChangeEvent.edge(
                existed ? GraphChangeEvent.ChangeType.UPDATE : GraphChangeEvent.ChangeType.INSERT, edge));
    }

    @Override
    public List<GraphEdge> allEdges() {
        return delegate.allEdges();
    }

    private void publish(GraphChangeEvent event) {
        for (GraphChangeListener listener : listeners) {
            try {
                listener.onGraphChange(event);
            } catch (RuntimeException e) {
                log.warn("Graph change listener {} failed for {} {}: {}",
                        listener.getClass().getSimpleName(), event.type(), event.address(), e.getMessage());
            }
        }
    }
}
