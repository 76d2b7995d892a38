package com.purchasingpower.depgraph.inference;

import com.google.common.base.Preconditions;
import com.purchasingpower.depgraph.core.EdgeDirection;
import com.purchasingpower.depgraph.core.GraphEdge;
import com.purchasingpower.depgraph.core.GraphEdge.EdgeKey;
import com.purchasingpower.depgraph.core.GraphNode;
import com.purchasingpower.depgraph.knowledge.GraphStore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Registry and evaluator of {@link InferenceRule}s.
 *
 * <p>Rules are evaluated in registration order. When two rules derive an edge
 * with the same (from, to, edgeType) the first registered rule wins and later
 * duplicates are discarded. A rule that throws is skipped for that edge.
 *
 * @since 2.0.0
 */
@Slf4j
@Component
public class CustomRuleEngine {

    private final Map<String, Registration> rules = new LinkedHashMap<>();

    public synchronized void register(InferenceRule rule) {
        Preconditions.checkNotNull(rule, "rule");
        Preconditions.checkArgument(rule.getId() != null && !rule.getId().isBlank(), "Rule id is required");
        if (rules.containsKey(rule.getId())) {
            throw new IllegalArgumentException("Rule already registered: " + rule.getId());
        }
        rules.put(rule.getId(), new Registration(rule, true));
        log.info("Registered inference rule '{}'", rule.getId());
    }

    public synchronized boolean unregister(String ruleId) {
        boolean removed = rules.remove(ruleId) != null;
        if (removed) {
            log.info("Unregistered inference rule '{}'", ruleId);
        }
        return removed;
    }

    public synchronized void setEnabled(String ruleId, boolean enabled) {
        Registration registration = rules.get(ruleId);
        if (registration == null) {
            throw new IllegalArgumentException("Unknown rule: " + ruleId);
        }
        rules.put(ruleId, new Registration(registration.rule(), enabled));
    }

    public synchronized boolean isEnabled(String ruleId) {
        Registration registration = rules.get(ruleId);
        return registration != null && registration.enabled();
    }

    public synchronized List<String> getRuleIds() {
        return List.copyOf(rules.keySet());
    }

    public synchronized boolean hasEnabledRules() {
        return rules.values().stream().anyMatch(Registration::enabled);
    }

    /**
     * Evaluates enabled rules against every outgoing edge of {@code node}.
     *
     * @param allowList Rule ids to run; null or empty means every enabled rule
     */
    public RuleApplication apply(GraphStore store, GraphNode node, Collection<String> allowList) {
        List<InferenceRule> active = snapshot(allowList);
        List<GraphEdge> outgoing = store.getEdges(node.getId(), null, EdgeDirection.OUT);

        Map<EdgeKey, GraphEdge> winners = new LinkedHashMap<>();
        List<String> errors = new ArrayList<>();
        int discarded = 0;

        for (InferenceRule rule : active) {
            for (GraphEdge edge : outgoing) {
                GraphEdge derived;
                try {
                    if (!rule.matches(node, edge)) {
                        continue;
                    }
                    derived = rule.infer(node, edge);
                } catch (RuntimeException e) {
                    log.warn("Rule '{}' failed on {} -[{}]-> {}: {}",
                            rule.getId(), edge.getFromId(), edge.getEdgeType(), edge.getToId(), e.getMessage());
                    errors.add(rule.getId() + ": " + e.getMessage());
                    continue;
                }
                if (derived == null) {
                    continue;
                }
                GraphEdge stamped = derived.withProvenance(rule.getId(), 1);
                if (winners.putIfAbsent(stamped.key(), stamped) != null) {
                    discarded++;
                    log.debug("Rule '{}' lost conflict on {}", rule.getId(), stamped.key());
                }
            }
        }
        return new RuleApplication(List.copyOf(winners.values()), List.copyOf(errors), discarded);
    }

    private synchronized List<InferenceRule> snapshot(Collection<String> allowList) {
        boolean restricted = allowList != null && !allowList.isEmpty();
        return rules.values().stream()
                .filter(Registration::enabled)
                .filter(r -> !restricted || allowList.contains(r.rule().getId()))
                .map(Registration::rule)
                .toList();
    }

    private record Registration(InferenceRule rule, boolean enabled) {
    }
}
