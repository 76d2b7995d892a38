package com.purchasingpower.depgraph.inference;

public enum InferenceKind {
    HIERARCHICAL,
    TRANSITIVE,
    INHERITABLE,
    RULES
}
