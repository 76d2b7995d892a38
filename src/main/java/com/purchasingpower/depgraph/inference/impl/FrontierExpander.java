package com.purchasingpower.depgraph.inference.impl;

import com.purchasingpower.depgraph.core.Deadline;

import java.util.List;
import java.util.function.Consumer;

/**
 * Strategy for expanding one BFS level.
 *
 * <p>{@code expandOne} is thread-safe; implementations may call it concurrently
 * but must return only once every frontier node has been expanded or the
 * deadline has passed.
 */
public interface FrontierExpander {

    void expand(List<String> frontier, Consumer<String> expandOne, Deadline deadline);
}
