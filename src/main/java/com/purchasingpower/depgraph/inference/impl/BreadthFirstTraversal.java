package com.purchasingpower.depgraph.inference.impl;

import com.purchasingpower.depgraph.core.Deadline;
import com.purchasingpower.depgraph.core.EdgeDirection;
import com.purchasingpower.depgraph.core.GraphEdge;
import com.purchasingpower.depgraph.inference.InferredNode;
import com.purchasingpower.depgraph.knowledge.GraphStore;
import lombok.Builder;
import lombok.Value;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Level-synchronous breadth-first walk shared by every inference kind.
 *
 * <p>Each node is reached once, at its shallowest depth. When several parents
 * reach the same node on one level the smallest parent address wins, so the
 * recorded paths do not depend on expansion order. An edge leading back onto
 * the current path counts as a cycle and ends that branch.
 *
 * @since 2.0.0
 */
class BreadthFirstTraversal {

    private final GraphStore store;
    private final FrontierExpander expander;

    BreadthFirstTraversal(GraphStore store, FrontierExpander expander) {
        this.store = store;
        this.expander = expander;
    }

    Outcome run(String rootId, Collection<String> edgeTypes, EdgeDirection direction,
                int maxDepth, Deadline deadline) {
        Set<String> visited = ConcurrentHashMap.newKeySet();
        Set<String> touched = ConcurrentHashMap.newKeySet();
        List<String> skipped = Collections.synchronizedList(new ArrayList<>());
        Map<String, Integer> outDegree = new ConcurrentHashMap<>();
        AtomicInteger cycles = new AtomicInteger();

        Map<String, Discovery> byAddress = new ConcurrentHashMap<>();
        List<InferredNode> reached = new ArrayList<>();
        visited.add(rootId);
        touched.add(rootId);
        byAddress.put(rootId, new Discovery(rootId, null, null, List.of(rootId)));

        List<String> frontier = List.of(rootId);
        boolean timedOut = false;

        for (int depth = 1; depth <= maxDepth && !frontier.isEmpty(); depth++) {
            if (deadline.isExpired()) {
                timedOut = true;
                break;
            }
            Map<String, Discovery> level = new ConcurrentHashMap<>();
            Map<String, Discovery> parents = Collections.unmodifiableMap(byAddress);

            expander.expand(frontier, parent -> {
                List<String> parentPath = parents.get(parent).path();
                List<GraphEdge> edges = new ArrayList<>();
                for (String edgeType : edgeTypes) {
                    edges.addAll(store.getEdges(parent, edgeType, direction));
                }
                touched.add(parent);
                outDegree.put(parent, edges.size());

                for (GraphEdge edge : edges) {
                    String neighbour = otherEnd(edge, parent, direction);
                    touched.add(neighbour);
                    if (parentPath.contains(neighbour)) {
                        cycles.incrementAndGet();
                        continue;
                    }
                    if (visited.contains(neighbour)) {
                        continue;
                    }
                    if (store.getNode(neighbour).isEmpty()) {
                        skipped.add(edge.getFromId() + " -[" + edge.getEdgeType() + "]-> " + edge.getToId());
                        continue;
                    }
                    List<String> path = new ArrayList<>(parentPath);
                    path.add(neighbour);
                    level.merge(neighbour, new Discovery(neighbour, parent, edge, path), Discovery::preferred);
                }
            }, deadline);

            if (deadline.isExpired()) {
                timedOut = true;
            }

            List<String> next = new ArrayList<>(level.keySet());
            Collections.sort(next);
            for (String address : next) {
                Discovery discovery = level.get(address);
                visited.add(address);
                byAddress.put(address, discovery);
                reached.add(new InferredNode(address, depth, discovery.path()));
            }
            frontier = next;
            if (timedOut) {
                break;
            }
        }

        reached.sort(Comparator.comparingInt(InferredNode::depth).thenComparing(InferredNode::address));
        Map<String, GraphEdge> discoveringEdges = new HashMap<>();
        byAddress.values().stream()
                .filter(d -> d.edge() != null)
                .forEach(d -> discoveringEdges.put(d.address(), d.edge()));

        List<String> sortedSkipped;
        synchronized (skipped) {
            sortedSkipped = skipped.stream().distinct().sorted().toList();
        }
        return Outcome.builder()
                .nodes(List.copyOf(reached))
                .discoveringEdges(Map.copyOf(discoveringEdges))
                .outDegree(Map.copyOf(outDegree))
                .cycles(cycles.get())
                .skippedEdges(sortedSkipped)
                .touched(Set.copyOf(touched))
                .timedOut(timedOut)
                .build();
    }

    private static String otherEnd(GraphEdge edge, String current, EdgeDirection direction) {
        return switch (direction) {
            case OUT -> edge.getToId();
            case IN -> edge.getFromId();
            case BOTH -> current.equals(edge.getFromId()) ? edge.getToId() : edge.getFromId();
        };
    }

    private record Discovery(String address, String parent, GraphEdge edge, List<String> path) {

        static Discovery preferred(Discovery a, Discovery b) {
            int byParent = a.parent().compareTo(b.parent());
            if (byParent != 0) {
                return byParent < 0 ? a : b;
            }
            return a.edge().getEdgeType().compareTo(b.edge().getEdgeType()) <= 0 ? a : b;
        }
    }

    @Value
    @Builder
    static class Outcome {
        List<InferredNode> nodes;
        Map<String, GraphEdge> discoveringEdges;
        /** Number of traversed edges leaving each expanded node. */
        Map<String, Integer> outDegree;
        int cycles;
        List<String> skippedEdges;
        Set<String> touched;
        boolean timedOut;
    }
}
