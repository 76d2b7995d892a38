package com.purchasingpower.depgraph.inference;

import java.util.List;

/**
 * Result of {@link InferenceEngine#validate()}. Cycles in transitive edge types
 * are warnings; broken edge-type hierarchy and dangling edges are errors.
 */
public record GraphValidationReport(boolean valid, List<String> errors, List<String> warnings) {
}
