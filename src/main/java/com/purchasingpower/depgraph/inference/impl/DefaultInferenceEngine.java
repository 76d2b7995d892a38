package com.purchasingpower.depgraph.inference.impl;

import com.google.common.base.Preconditions;
import com.purchasingpower.depgraph.core.Address;
import com.purchasingpower.depgraph.core.Deadline;
import com.purchasingpower.depgraph.core.EdgeDirection;
import com.purchasingpower.depgraph.core.GraphEdge;
import com.purchasingpower.depgraph.core.GraphNode;
import com.purchasingpower.depgraph.exception.InferenceException;
import com.purchasingpower.depgraph.exception.NodeNotFoundException;
import com.purchasingpower.depgraph.inference.CustomRuleEngine;
import com.purchasingpower.depgraph.inference.GraphValidationReport;
import com.purchasingpower.depgraph.inference.HierarchicalOptions;
import com.purchasingpower.depgraph.inference.InferenceEngine;
import com.purchasingpower.depgraph.inference.InferenceKind;
import com.purchasingpower.depgraph.inference.InferenceResult;
import com.purchasingpower.depgraph.inference.InferenceStatistics;
import com.purchasingpower.depgraph.inference.InferenceStatus;
import com.purchasingpower.depgraph.inference.InferenceSummary;
import com.purchasingpower.depgraph.inference.InferredNode;
import com.purchasingpower.depgraph.inference.InheritableOptions;
import com.purchasingpower.depgraph.inference.RuleApplication;
import com.purchasingpower.depgraph.inference.TransitiveOptions;
import com.purchasingpower.depgraph.knowledge.EdgeTypeDefinition;
import com.purchasingpower.depgraph.knowledge.EdgeTypeRegistry;
import com.purchasingpower.depgraph.knowledge.GraphStore;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collection;
import java.util.EnumMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Supplier;

/**
 * Inference over a single {@link GraphStore}.
 *
 * <p>Every kind runs on {@link BreadthFirstTraversal}; whether frontiers are
 * expanded sequentially or on a worker pool is decided by the injected
 * {@link FrontierExpander}. No state survives between calls.
 *
 * @since 2.0.0
 */
@Slf4j
public class DefaultInferenceEngine implements InferenceEngine {

    static final String DERIVED_HIERARCHICAL = "hierarchical";
    static final String DERIVED_TRANSITIVE = "transitive";
    static final String DERIVED_INHERITANCE = "inheritance";

    private static final int MAX_LISTED_CYCLES = 5;

    private final GraphStore store;
    private final EdgeTypeRegistry edgeTypes;
    private final CustomRuleEngine ruleEngine;
    private final BreadthFirstTraversal traversal;
    private final Duration defaultTimeout;
    private final boolean customRulesEnabled;

    public DefaultInferenceEngine(GraphStore store, EdgeTypeRegistry edgeTypes, CustomRuleEngine ruleEngine,
                                  FrontierExpander expander, Duration defaultTimeout, boolean customRulesEnabled) {
        this.store = Preconditions.checkNotNull(store, "store");
        this.edgeTypes = Preconditions.checkNotNull(edgeTypes, "edgeTypes");
        this.ruleEngine = Preconditions.checkNotNull(ruleEngine, "ruleEngine");
        this.traversal = new BreadthFirstTraversal(store, Preconditions.checkNotNull(expander, "expander"));
        this.defaultTimeout = defaultTimeout;
        this.customRulesEnabled = customRulesEnabled;
    }

    // =========================================================================
    // Hierarchical
    // =========================================================================

    @Override
    public InferenceResult inferHierarchical(String rootId, String edgeType, HierarchicalOptions options) {
        HierarchicalOptions opts = options == null ? HierarchicalOptions.defaults() : options;
        requireNode(rootId);
        Preconditions.checkArgument(opts.getMaxDepth() >= 0, "maxDepth must be >= 0");

        Collection<String> types = opts.isIncludeSubtypes() ? edgeTypes.withSubtypes(edgeType) : List.of(edgeType);
        EdgeDirection direction = opts.isIncludeChildren() ? EdgeDirection.OUT : EdgeDirection.IN;

        return timed(InferenceKind.HIERARCHICAL, rootId, edgeType, () -> {
            BreadthFirstTraversal.Outcome outcome = traversal.run(
                    rootId, types, direction, opts.getMaxDepth(), deadline(opts.getTimeout()));

            List<GraphEdge> edges = new ArrayList<>();
            for (InferredNode node : outcome.getNodes()) {
                Map<String, Object> metadata = Map.of("path", String.join(" -> ", node.path()));
                edges.add(opts.isIncludeChildren()
                        ? inferredEdge(rootId, node.address(), edgeType, metadata, DERIVED_HIERARCHICAL, node.depth())
                        : inferredEdge(node.address(), rootId, edgeType, metadata, DERIVED_HIERARCHICAL, node.depth()));
            }
            return fromOutcome(InferenceKind.HIERARCHICAL, rootId, edgeType, outcome, outcome.getNodes(), edges);
        });
    }

    // =========================================================================
    // Transitive
    // =========================================================================

    @Override
    public InferenceResult inferTransitive(String rootId, String edgeType, TransitiveOptions options) {
        TransitiveOptions opts = options == null ? TransitiveOptions.defaults() : options;
        requireNode(rootId);
        Preconditions.checkArgument(opts.getMaxPathLength() >= 0, "maxPathLength must be >= 0");

        return timed(InferenceKind.TRANSITIVE, rootId, edgeType, () -> {
            BreadthFirstTraversal.Outcome outcome = traversal.run(
                    rootId, List.of(edgeType), EdgeDirection.OUT, opts.getMaxPathLength(), deadline(opts.getTimeout()));

            List<InferredNode> selected = opts.isIncludeIntermediate()
                    ? outcome.getNodes()
                    : outcome.getNodes().stream().filter(n -> isTerminal(n.address(), edgeType, outcome)).toList();

            List<GraphEdge> edges = selected.stream()
                    .map(n -> inferredEdge(rootId, n.address(), edgeType,
                            Map.of("path", String.join(" -> ", n.path())), DERIVED_TRANSITIVE, n.depth()))
                    .toList();
            return fromOutcome(InferenceKind.TRANSITIVE, rootId, edgeType, outcome, selected, edges);
        });
    }

    private boolean isTerminal(String address, String edgeType, BreadthFirstTraversal.Outcome outcome) {
        Integer degree = outcome.getOutDegree().get(address);
        if (degree != null) {
            return degree == 0;
        }
        // Not expanded because it sits at the path-length bound.
        return store.getEdges(address, edgeType, EdgeDirection.OUT).isEmpty();
    }

    // =========================================================================
    // Inheritable
    // =========================================================================

    @Override
    public InferenceResult inferInheritable(String rootId, String edgeType, InheritableOptions options) {
        InheritableOptions opts = options == null ? InheritableOptions.defaults() : options;
        requireNode(rootId);

        return timed(InferenceKind.INHERITABLE, rootId, edgeType, () -> {
            if (!opts.isIncludeInherited() || opts.getMaxInheritanceDepth() == 0) {
                return InferenceResult.builder()
                        .kind(InferenceKind.INHERITABLE)
                        .rootId(rootId)
                        .edgeType(edgeType)
                        .status(InferenceStatus.COMPLETED)
                        .touchedAddresses(Set.of(rootId))
                        .build();
            }

            BreadthFirstTraversal.Outcome chain = traversal.run(rootId,
                    List.of(EdgeTypeRegistry.EXTENDS, EdgeTypeRegistry.IMPLEMENTS), EdgeDirection.OUT,
                    opts.getMaxInheritanceDepth(), deadline(opts.getTimeout()));

            Set<String> touched = new HashSet<>(chain.getTouched());
            Set<String> claimed = new HashSet<>();
            for (GraphEdge own : store.getEdges(rootId, edgeType, EdgeDirection.OUT)) {
                claimed.add(own.getToId());
            }

            // Ancestors are ordered by depth then address, so the nearest source claims a target first.
            List<GraphEdge> inherited = new ArrayList<>();
            for (InferredNode ancestor : chain.getNodes()) {
                for (GraphEdge edge : store.getEdges(ancestor.address(), edgeType, EdgeDirection.OUT)) {
                    touched.add(edge.getToId());
                    if (edge.getToId().equals(rootId) || !claimed.add(edge.getToId())) {
                        continue;
                    }
                    Map<String, Object> metadata = new LinkedHashMap<>(edge.getMetadata());
                    metadata.put("source", ancestor.address());
                    metadata.put("inheritanceDepth", ancestor.depth());
                    inherited.add(inferredEdge(rootId, edge.getToId(), edgeType, metadata,
                            DERIVED_INHERITANCE, ancestor.depth()));
                }
            }

            return fromOutcome(InferenceKind.INHERITABLE, rootId, edgeType, chain, chain.getNodes(), inherited)
                    .toBuilder()
                    .touchedAddresses(Set.copyOf(touched))
                    .build();
        });
    }

    // =========================================================================
    // Custom rules
    // =========================================================================

    @Override
    public InferenceResult applyRules(String rootId) {
        GraphNode root = requireNode(rootId);
        return timed(InferenceKind.RULES, rootId, null, () -> {
            RuleApplication application = ruleEngine.apply(store, root, null);
            Set<String> touched = new HashSet<>();
            touched.add(rootId);
            List<InferredNode> nodes = new ArrayList<>();
            for (GraphEdge edge : application.edges()) {
                touched.add(edge.getToId());
                nodes.add(new InferredNode(edge.getToId(), 1, List.of(rootId, edge.getToId())));
            }
            store.getEdges(rootId, null, EdgeDirection.OUT).forEach(e -> touched.add(e.getToId()));
            return InferenceResult.builder()
                    .kind(InferenceKind.RULES)
                    .rootId(rootId)
                    .status(InferenceStatus.COMPLETED)
                    .nodes(nodes.stream().distinct().toList())
                    .edges(application.edges())
                    .errors(application.errors())
                    .touchedAddresses(Set.copyOf(touched))
                    .build();
        });
    }

    // =========================================================================
    // Aggregate operations
    // =========================================================================

    @Override
    public InferenceSummary inferAll(String rootId, Collection<String> requestedTypes) {
        requireNode(rootId);
        Collection<String> types = requestedTypes == null || requestedTypes.isEmpty()
                ? edgeTypes.getAll().stream().map(EdgeTypeDefinition::getType).toList()
                : requestedTypes;

        List<InferenceResult> results = new ArrayList<>();
        List<String> failures = new ArrayList<>();
        for (String type : types) {
            try {
                results.add(inferHierarchical(rootId, type, HierarchicalOptions.defaults()));
                if (edgeTypes.isTransitive(type)) {
                    results.add(inferTransitive(rootId, type, TransitiveOptions.defaults()));
                }
                if (edgeTypes.isInheritable(type)) {
                    results.add(inferInheritable(rootId, type, InheritableOptions.defaults()));
                }
            } catch (RuntimeException e) {
                log.warn("Inference for edge type '{}' from {} failed: {}", type, rootId, e.getMessage());
                failures.add(type + ": " + e.getMessage());
            }
        }
        if (customRulesEnabled && ruleEngine.hasEnabledRules()) {
            results.add(applyRules(rootId));
        }

        InferenceStatistics statistics = statistics(results);
        log.info("Inferred {} relationships from {} across {} edge types",
                statistics.totalInferred(), rootId, types.size());
        return new InferenceSummary(rootId, List.copyOf(results), statistics, List.copyOf(failures));
    }

    @Override
    public GraphValidationReport validate() {
        List<String> errors = new ArrayList<>(edgeTypes.validateHierarchy());
        List<String> warnings = new ArrayList<>();

        List<GraphEdge> allEdges = store.allEdges();
        for (GraphEdge edge : allEdges) {
            if (store.getNode(edge.getFromId()).isEmpty() || store.getNode(edge.getToId()).isEmpty()) {
                errors.add("Dangling edge " + edge.getFromId() + " -[" + edge.getEdgeType() + "]-> " + edge.getToId());
            }
        }

        for (EdgeTypeDefinition definition : edgeTypes.getAll()) {
            if (!definition.isTransitive()) {
                continue;
            }
            List<List<String>> cycles = CycleFinder.find(allEdges, definition.getType());
            if (cycles.isEmpty()) {
                continue;
            }
            warnings.add("Found " + cycles.size() + " cycle(s) in transitive edge type '" + definition.getType() + "'");
            cycles.stream()
                    .limit(MAX_LISTED_CYCLES)
                    .forEach(cycle -> warnings.add("  " + String.join(" -> ", cycle)));
            if (cycles.size() > MAX_LISTED_CYCLES) {
                warnings.add("  ... and " + (cycles.size() - MAX_LISTED_CYCLES) + " more");
            }
        }
        return new GraphValidationReport(errors.isEmpty(), List.copyOf(errors), List.copyOf(warnings));
    }

    // =========================================================================
    // Helpers
    // =========================================================================

    private GraphNode requireNode(String rootId) {
        Preconditions.checkArgument(rootId != null && !rootId.isBlank(), "rootId is required");
        return store.getNode(rootId).orElseThrow(() -> new NodeNotFoundException(rootId));
    }

    private Deadline deadline(Duration timeout) {
        return Deadline.after(timeout != null ? timeout : defaultTimeout);
    }

    private InferenceResult timed(InferenceKind kind, String rootId, String edgeType, Supplier<InferenceResult> body) {
        long start = System.nanoTime();
        try {
            InferenceResult result = body.get();
            Duration elapsed = Duration.ofNanos(System.nanoTime() - start);
            log.debug("{} inference from {} over '{}' finished {} with {} nodes in {} ms",
                    kind, rootId, edgeType, result.getStatus(), result.getNodes().size(), elapsed.toMillis());
            return result.toBuilder().elapsed(elapsed).build();
        } catch (NodeNotFoundException | IllegalArgumentException | InferenceException e) {
            throw e;
        } catch (RuntimeException e) {
            log.error("{} inference from {} failed: {}", kind, rootId, e.getMessage(), e);
            throw new InferenceException(kind + " inference from " + rootId + " failed", e);
        }
    }

    private static InferenceResult fromOutcome(InferenceKind kind, String rootId, String edgeType,
                                               BreadthFirstTraversal.Outcome outcome,
                                               List<InferredNode> nodes, List<GraphEdge> edges) {
        return InferenceResult.builder()
                .kind(kind)
                .rootId(rootId)
                .edgeType(edgeType)
                .status(outcome.isTimedOut() ? InferenceStatus.TIMED_OUT : InferenceStatus.COMPLETED)
                .partial(outcome.isTimedOut())
                .nodes(List.copyOf(nodes))
                .edges(List.copyOf(edges))
                .cyclesDetected(outcome.getCycles())
                .skippedEdges(outcome.getSkippedEdges())
                .touchedAddresses(outcome.getTouched())
                .build();
    }

    private GraphEdge inferredEdge(String from, String to, String edgeType, Map<String, Object> metadata,
                                   String derivedBy, int depth) {
        return GraphEdge.inferred(addressOf(from), addressOf(to), edgeType, metadata, derivedBy, depth);
    }

    private Address addressOf(String id) {
        return store.getNode(id)
                .map(GraphNode::getAddress)
                .orElseThrow(() -> new NodeNotFoundException(id));
    }

    private static InferenceStatistics statistics(List<InferenceResult> results) {
        Map<InferenceKind, Integer> byKind = new EnumMap<>(InferenceKind.class);
        int total = 0;
        int depthSum = 0;
        int maxDepth = 0;
        int direct = 0;
        for (InferenceResult result : results) {
            byKind.merge(result.getKind(), result.getEdges().size(), Integer::sum);
            for (GraphEdge edge : result.getEdges()) {
                int depth = edge.getProvenance().depth();
                total++;
                depthSum += depth;
                maxDepth = Math.max(maxDepth, depth);
                if (depth == 1) {
                    direct++;
                }
            }
        }
        double average = total == 0 ? 0.0 : (double) depthSum / total;
        return new InferenceStatistics(total, Map.copyOf(byKind), average, maxDepth, direct);
    }
}
