package com.purchasingpower.depgraph.realtime;

/**
 * Handle on the recurring polling tick.
 */
public interface PollingHandle {

    void cancel();

    boolean isCancelled();
}
