package com.purchasingpower.depgraph.inference;

import java.util.Map;

/**
 * Aggregates over the results of {@link InferenceEngine#inferAll}.
 */
public record InferenceStatistics(int totalInferred,
                                  Map<InferenceKind, Integer> inferredByKind,
                                  double averageDepth,
                                  int maxDepth,
                                  int directRelationships) {
}
