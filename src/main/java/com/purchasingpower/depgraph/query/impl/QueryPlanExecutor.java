package com.purchasingpower.depgraph.query.impl;

import com.purchasingpower.depgraph.core.AddressCodec;
import com.purchasingpower.depgraph.core.Deadline;
import com.purchasingpower.depgraph.core.EdgeDirection;
import com.purchasingpower.depgraph.core.GraphEdge;
import com.purchasingpower.depgraph.core.GraphNode;
import com.purchasingpower.depgraph.exception.NodeNotFoundException;
import com.purchasingpower.depgraph.exception.QueryTimeoutException;
import com.purchasingpower.depgraph.inference.HierarchicalOptions;
import com.purchasingpower.depgraph.inference.InferenceEngine;
import com.purchasingpower.depgraph.inference.InferenceResult;
import com.purchasingpower.depgraph.inference.InferenceStatus;
import com.purchasingpower.depgraph.inference.InferredNode;
import com.purchasingpower.depgraph.inference.InheritableOptions;
import com.purchasingpower.depgraph.inference.TransitiveOptions;
import com.purchasingpower.depgraph.knowledge.GraphStore;
import com.purchasingpower.depgraph.query.AttributeFilter;
import com.purchasingpower.depgraph.query.QueryField;
import com.purchasingpower.depgraph.query.QueryPlan;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;

/**
 * Runs a {@link QueryPlan} against one store. Read-only.
 *
 * <p>Traversal plans produce their candidates through the inference engine;
 * all other plans scan the store. Candidates are then filtered, ordered,
 * paged and projected.
 *
 * @since 2.0.0
 */
@Slf4j
class QueryPlanExecutor {

    static final String INHERITED_FROM = "inheritedFrom";

    private static final int DEFAULT_HIERARCHICAL_DEPTH = 1;
    private static final int DEADLINE_CHECK_INTERVAL = 64;

    private final int defaultLimit;

    QueryPlanExecutor(int defaultLimit) {
        this.defaultLimit = defaultLimit;
    }

    Outcome execute(QueryPlan plan, GraphStore store, InferenceEngine inference, Deadline deadline) {
        boolean traversal = plan.getTraversal() != null;
        Candidates candidates = traversal
                ? traverse(plan.getTraversal(), store, inference, deadline)
                : new Candidates(scan(store), false);

        List<Candidate> matched = new ArrayList<>();
        int checked = 0;
        for (Candidate candidate : candidates.items()) {
            if (++checked % DEADLINE_CHECK_INTERVAL == 0 && deadline.isExpired()) {
                throw timeout(plan, matched, traversal);
            }
            if (matches(plan, candidate)) {
                matched.add(candidate);
            }
        }
        if (candidates.partial()) {
            throw timeout(plan, matched, traversal);
        }

        matched.sort(ordering(plan.getOrderBy()));
        int offset = plan.getOffset() == null ? 0 : plan.getOffset();
        int limit = plan.getLimit() == null ? defaultLimit : plan.getLimit();
        List<Map<String, Object>> rows = matched.stream()
                .skip(offset)
                .limit(limit)
                .map(candidate -> project(plan, candidate, traversal))
                .toList();
        return new Outcome(rows, matched.size());
    }

    record Outcome(List<Map<String, Object>> rows, int totalMatched) {
    }

    // =========================================================================
    // Candidate production
    // =========================================================================

    private List<Candidate> scan(GraphStore store) {
        return store.allNodes(null).stream()
                .map(node -> new Candidate(node, null, Map.of()))
                .toList();
    }

    private Candidates traverse(QueryPlan.Traversal traversal, GraphStore store, InferenceEngine inference,
                                Deadline deadline) {
        String root = resolveRoot(traversal.getRootReference(), store);
        Duration timeout = deadline.remaining();
        Integer depth = traversal.getDepth();

        return switch (traversal.getMode()) {
            case HIERARCHICAL -> {
                int maxDepth = depth == null ? DEFAULT_HIERARCHICAL_DEPTH : depth;
                if (traversal.getDirection() == EdgeDirection.BOTH) {
                    InferenceResult down = hierarchical(inference, root, traversal.getEdgeType(), true, maxDepth, timeout);
                    InferenceResult up = hierarchical(inference, root, traversal.getEdgeType(), false, maxDepth, timeout);
                    yield merge(store, down, up);
                }
                yield fromNodes(store, hierarchical(inference, root, traversal.getEdgeType(),
                        traversal.getDirection() == EdgeDirection.OUT, maxDepth, timeout));
            }
            case TRANSITIVE -> {
                TransitiveOptions.TransitiveOptionsBuilder options = TransitiveOptions.builder().timeout(timeout);
                if (depth != null) {
                    options.maxPathLength(depth);
                }
                yield fromNodes(store, inference.inferTransitive(root, traversal.getEdgeType(), options.build()));
            }
            case INHERITABLE -> {
                InheritableOptions.InheritableOptionsBuilder options = InheritableOptions.builder().timeout(timeout);
                if (depth != null) {
                    options.maxInheritanceDepth(depth);
                }
                yield fromInheritedEdges(store, inference.inferInheritable(root, traversal.getEdgeType(), options.build()));
            }
        };
    }

    private static InferenceResult hierarchical(InferenceEngine inference, String root, String edgeType,
                                                boolean children, int maxDepth, Duration timeout) {
        return inference.inferHierarchical(root, edgeType, HierarchicalOptions.builder()
                .includeChildren(children)
                .maxDepth(maxDepth)
                .timeout(timeout)
                .build());
    }

    private static Candidates fromNodes(GraphStore store, InferenceResult result) {
        List<Candidate> items = new ArrayList<>();
        for (InferredNode node : result.getNodes()) {
            store.getNode(node.address()).ifPresent(n -> items.add(new Candidate(n, node.depth(), Map.of())));
        }
        return new Candidates(items, result.getStatus() == InferenceStatus.TIMED_OUT);
    }

    private static Candidates merge(GraphStore store, InferenceResult first, InferenceResult second) {
        Map<String, Integer> depths = new TreeMap<>();
        for (InferenceResult result : List.of(first, second)) {
            result.getNodes().forEach(n -> depths.merge(n.address(), n.depth(), Math::min));
        }
        List<Candidate> items = new ArrayList<>();
        depths.forEach((address, depth) ->
                store.getNode(address).ifPresent(n -> items.add(new Candidate(n, depth, Map.of()))));
        boolean partial = first.getStatus() == InferenceStatus.TIMED_OUT || second.getStatus() == InferenceStatus.TIMED_OUT;
        return new Candidates(items, partial);
    }

    private static Candidates fromInheritedEdges(GraphStore store, InferenceResult result) {
        List<Candidate> items = new ArrayList<>();
        for (GraphEdge edge : result.getEdges()) {
            Object source = edge.getMetadata().get("source");
            store.getNode(edge.getToId()).ifPresent(n -> items.add(new Candidate(n, edge.getProvenance().depth(),
                    source == null ? Map.of() : Map.of(INHERITED_FROM, source))));
        }
        return new Candidates(items, result.getStatus() == InferenceStatus.TIMED_OUT);
    }

    /**
     * A full address must exist; a bare symbol name resolves to the smallest
     * matching address.
     */
    static String resolveRoot(String reference, GraphStore store) {
        if (AddressCodec.validate(reference).valid()) {
            String address = AddressCodec.normalize(reference);
            return store.getNode(address).map(GraphNode::getId)
                    .orElseThrow(() -> new NodeNotFoundException(reference));
        }
        Optional<String> exact = store.allNodes(n -> n.getAddress().getSymbolName().equals(reference)).stream()
                .map(GraphNode::getId)
                .min(Comparator.naturalOrder());
        if (exact.isPresent()) {
            return exact.get();
        }
        return store.allNodes(n -> n.getAddress().getSymbolName().equalsIgnoreCase(reference)).stream()
                .map(GraphNode::getId)
                .min(Comparator.naturalOrder())
                .orElseThrow(() -> new NodeNotFoundException(reference));
    }

    // =========================================================================
    // Filtering, ordering, projection
    // =========================================================================

    private static boolean matches(QueryPlan plan, Candidate candidate) {
        if (!plan.getNodeTypes().isEmpty()
                && !plan.getNodeTypes().contains(candidate.node().getAddress().getNodeType())) {
            return false;
        }
        if (plan.getFilterGroups().isEmpty()) {
            return true;
        }
        for (List<AttributeFilter> group : plan.getFilterGroups()) {
            if (group.stream().allMatch(f -> f.matches(candidate.node(), candidate.depth()))) {
                return true;
            }
        }
        return false;
    }

    private static Comparator<Candidate> ordering(QueryPlan.OrderBy orderBy) {
        Comparator<Candidate> byAddress = Comparator.comparing(c -> c.node().getId());
        if (orderBy == null) {
            return byAddress;
        }
        Comparator<Candidate> byField = (a, b) -> compareValues(
                value(orderBy.field(), a), value(orderBy.field(), b), orderBy.descending());
        return byField.thenComparing(byAddress);
    }

    // Nulls sort last in both directions.
    private static int compareValues(Object a, Object b, boolean descending) {
        if (a == null || b == null) {
            return a == null ? (b == null ? 0 : 1) : -1;
        }
        int result;
        if (a instanceof Number x && b instanceof Number y) {
            result = Double.compare(x.doubleValue(), y.doubleValue());
        } else {
            result = String.valueOf(a).compareTo(String.valueOf(b));
        }
        return descending ? -result : result;
    }

    private static Object value(String field, Candidate candidate) {
        if (candidate.extras().containsKey(field)) {
            return candidate.extras().get(field);
        }
        return QueryField.resolve(field, candidate.node(), candidate.depth());
    }

    private static Map<String, Object> project(QueryPlan plan, Candidate candidate, boolean traversal) {
        Map<String, Object> row = new LinkedHashMap<>();
        if (!plan.getProjection().isEmpty()) {
            for (QueryPlan.Projection projection : plan.getProjection()) {
                row.put(projection.alias(), value(projection.field(), candidate));
            }
            return Collections.unmodifiableMap(row);
        }

        GraphNode node = candidate.node();
        row.put(QueryField.ADDRESS, node.getId());
        row.put(QueryField.PROJECT_NAME, node.getAddress().getProjectName());
        row.put(QueryField.FILE_PATH, node.getAddress().getFilePath());
        row.put(QueryField.NODE_TYPE, node.getAddress().getNodeType().getLabel());
        row.put(QueryField.SYMBOL_NAME, node.getAddress().getSymbolName());
        if (traversal) {
            row.put(QueryField.DEPTH, candidate.depth());
        }
        new TreeMap<>(candidate.extras()).forEach(row::put);
        new TreeMap<>(node.getMetadata()).forEach((key, value) ->
                row.put(row.containsKey(key) ? "metadata." + key : key, value));
        // Rows are shared with cached results; null values rule out Map.copyOf.
        return Collections.unmodifiableMap(row);
    }

    private static QueryTimeoutException timeout(QueryPlan plan, List<Candidate> matched, boolean traversal) {
        List<Candidate> sorted = new ArrayList<>(matched);
        sorted.sort(ordering(plan.getOrderBy()));
        List<Map<String, Object>> partial = sorted.stream().map(c -> project(plan, c, traversal)).toList();
        log.warn("Query deadline expired with {} partial rows", partial.size());
        return new QueryTimeoutException("Query timed out", partial);
    }

    private record Candidate(GraphNode node, Integer depth, Map<String, Object> extras) {
    }

    private record Candidates(List<Candidate> items, boolean partial) {
    }
}
