package com.purchasingpower.depgraph.core;

/**
 * Origin of an inferred edge: the rule (or built-in inference kind) that derived
 * it and how many hops from the inference root it was found.
 */
public record EdgeProvenance(String derivedBy, int depth) {
}
