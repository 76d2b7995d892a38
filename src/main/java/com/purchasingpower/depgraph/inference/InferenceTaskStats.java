package com.purchasingpower.depgraph.inference;

/**
 * Counters of the change-driven inference service.
 *
 * @param materializedNodes Nodes whose latest rule output is currently held
 */
public record InferenceTaskStats(int activeTasks,
                                 long completedTasks,
                                 long failedTasks,
                                 long changeEventsProcessed,
                                 int materializedNodes) {
}
