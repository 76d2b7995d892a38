package com.purchasingpower.depgraph.inference.impl;

import com.purchasingpower.depgraph.core.GraphEdge;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Finds cycles among the edges of one type with an iterative three-colour DFS.
 * Each back edge yields one cycle, reported as the address path that closes it.
 */
final class CycleFinder {

    private enum Colour { WHITE, GREY, BLACK }

    private CycleFinder() {
    }

    static List<List<String>> find(List<GraphEdge> edges, String edgeType) {
        Map<String, TreeSet<String>> adjacency = new TreeMap<>();
        for (GraphEdge edge : edges) {
            if (edgeType.equals(edge.getEdgeType())) {
                adjacency.computeIfAbsent(edge.getFromId(), k -> new TreeSet<>()).add(edge.getToId());
                adjacency.computeIfAbsent(edge.getToId(), k -> new TreeSet<>());
            }
        }

        Map<String, Colour> colours = new HashMap<>();
        List<List<String>> cycles = new ArrayList<>();

        for (String start : adjacency.keySet()) {
            if (colours.getOrDefault(start, Colour.WHITE) != Colour.WHITE) {
                continue;
            }
            Deque<String> path = new ArrayDeque<>();
            Deque<Iterator<String>> iterators = new ArrayDeque<>();
            path.addLast(start);
            iterators.push(adjacency.get(start).iterator());
            colours.put(start, Colour.GREY);

            while (!iterators.isEmpty()) {
                Iterator<String> it = iterators.peek();
                if (!it.hasNext()) {
                    iterators.pop();
                    colours.put(path.removeLast(), Colour.BLACK);
                    continue;
                }
                String next = it.next();
                Colour colour = colours.getOrDefault(next, Colour.WHITE);
                if (colour == Colour.GREY) {
                    cycles.add(closeCycle(path, next));
                } else if (colour == Colour.WHITE) {
                    colours.put(next, Colour.GREY);
                    path.addLast(next);
                    iterators.push(adjacency.get(next).iterator());
                }
            }
        }
        return cycles;
    }

    private static List<String> closeCycle(Deque<String> path, String target) {
        List<String> cycle = new ArrayList<>();
        boolean inCycle = false;
        for (String address : path) {
            if (address.equals(target)) {
                inCycle = true;
            }
            if (inCycle) {
                cycle.add(address);
            }
        }
        cycle.add(target);
        return cycle;
    }
}
