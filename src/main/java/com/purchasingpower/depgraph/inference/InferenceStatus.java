package com.purchasingpower.depgraph.inference;

/**
 * Lifecycle of a single inference call.
 *
 * <pre>
 * PENDING -> TRAVERSING -> COMPLETED | TIMED_OUT | FAILED
 * </pre>
 */
public enum InferenceStatus {
    PENDING,
    TRAVERSING,
    COMPLETED,
    TIMED_OUT,
    FAILED;

    public boolean isTerminal() {
        return this == COMPLETED || this == TIMED_OUT || this == FAILED;
    }
}
