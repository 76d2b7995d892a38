package com.purchasingpower.depgraph.inference;

import java.util.List;

/**
 * Every inference run for one root, plus their aggregate statistics.
 * Edge types whose inference failed are listed in {@code failures}.
 */
public record InferenceSummary(String rootId,
                               List<InferenceResult> results,
                               InferenceStatistics statistics,
                               List<String> failures) {
}
