package com.purchasingpower.depgraph.knowledge;

/**
 * Receives writes applied through an {@link ObservableGraphStore}.
 */
@FunctionalInterface
public interface GraphChangeListener {

    void onGraphChange(GraphChangeEvent event);
}
