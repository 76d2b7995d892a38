package com.purchasingpower.depgraph.inference;

import com.purchasingpower.depgraph.knowledge.GraphStore;

/**
 * Supplies the inference engine that reads a given store. The primary store
 * gets the shared, memoizing engine; other data sources get a plain one.
 */
@FunctionalInterface
public interface InferenceEngineProvider {

    InferenceEngine forStore(GraphStore store);
}
