package com.purchasingpower.depgraph.knowledge.impl;

import com.purchasingpower.depgraph.core.EdgeDirection;
import com.purchasingpower.depgraph.core.GraphEdge;
import com.purchasingpower.depgraph.core.GraphEdge.EdgeKey;
import com.purchasingpower.depgraph.core.GraphNode;
import com.purchasingpower.depgraph.knowledge.GraphStore;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.function.Predicate;

/**
 * Process-local {@link GraphStore}.
 *
 * <p>Nodes live in a concurrent map. Edges are kept in insertion order and
 * indexed by both endpoints under a read/write lock, so readers never observe
 * an edge in one index but not the other.
 *
 * @since 2.0.0
 */
@Slf4j
public class InMemoryGraphStore implements GraphStore {

    private final Map<String, GraphNode> nodes = new ConcurrentHashMap<>();
    private final Map<EdgeKey, GraphEdge> edges = new LinkedHashMap<>();
    private final Map<String, Set<EdgeKey>> outgoing = new LinkedHashMap<>();
    private final Map<String, Set<EdgeKey>> incoming = new LinkedHashMap<>();
    private final ReadWriteLock edgeLock = new ReentrantReadWriteLock();

    @Override
    public Optional<GraphNode> getNode(String address) {
        return address == null ? Optional.empty() : Optional.ofNullable(nodes.get(address));
    }

    @Override
    public void putNode(GraphNode node) {
        nodes.put(node.getId(), node);
    }

    @Override
    public boolean deleteNode(String address) {
        GraphNode removed = nodes.remove(address);
        edgeLock.writeLock().lock();
        try {
            Set<EdgeKey> owned = outgoing.remove(address);
            if (owned != null) {
                for (EdgeKey key : owned) {
                    edges.remove(key);
                    Set<EdgeKey> targetIndex = incoming.get(key.to());
                    if (targetIndex != null) {
                        targetIndex.remove(key);
                    }
                }
                log.debug("Removed {} outgoing edges of {}", owned.size(), address);
            }
        } finally {
            edgeLock.writeLock().unlock();
        }
        return removed != null;
    }

    @Override
    public List<GraphNode> allNodes(Predicate<GraphNode> filter) {
        return nodes.values().stream()
                .filter(node -> filter == null || filter.test(node))
                .sorted(Comparator.comparing(GraphNode::getId))
                .toList();
    }

    @Override
    public List<GraphEdge> getEdges(String address, String edgeType, EdgeDirection direction) {
        edgeLock.readLock().lock();
        try {
            Set<EdgeKey> keys = new LinkedHashSet<>();
            if (direction != EdgeDirection.IN) {
                keys.addAll(outgoing.getOrDefault(address, Set.of()));
            }
            if (direction != EdgeDirection.OUT) {
                keys.addAll(incoming.getOrDefault(address, Set.of()));
            }
            List<GraphEdge> result = new ArrayList<>(keys.size());
            for (EdgeKey key : keys) {
                if (edgeType == null || edgeType.equals(key.edgeType())) {
                    result.add(edges.get(key));
                }
            }
            return result;
        } finally {
            edgeLock.readLock().unlock();
        }
    }

    @Override
    public void putEdge(GraphEdge edge) {
        EdgeKey key = edge.key();
        edgeLock.writeLock().lock();
        try {
            edges.put(key, edge);
            outgoing.computeIfAbsent(key.from(), k -> new LinkedHashSet<>()).add(key);
            incoming.computeIfAbsent(key.to(), k -> new LinkedHashSet<>()).add(key);
        } finally {
            edgeLock.writeLock().unlock();
        }
    }

    @Override
    public List<GraphEdge> allEdges() {
        edgeLock.readLock().lock();
        try {
            return List.copyOf(edges.values());
        } finally {
            edgeLock.readLock().unlock();
        }
    }
}
