package com.purchasingpower.depgraph.knowledge;

import com.google.common.base.Preconditions;
import lombok.extern.slf4j.Slf4j;

import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Named graph stores that queries may target.
 *
 * <p>Transport messages name their data source by string; this registry turns
 * that name into a {@link GraphStore}. A blank or missing name resolves to
 * {@link #DEFAULT}.
 *
 * @since 2.0.0
 */
@Slf4j
public class DataSourceRegistry {

    public static final String DEFAULT = "default";

    private final Map<String, GraphStore> stores = new ConcurrentHashMap<>();

    public DataSourceRegistry(GraphStore primary) {
        stores.put(DEFAULT, Preconditions.checkNotNull(primary, "primary"));
    }

    public void register(String name, GraphStore store) {
        Preconditions.checkArgument(name != null && !name.isBlank(), "Data source name is required");
        stores.put(name, Preconditions.checkNotNull(store, "store"));
        log.info("Registered data source '{}'", name);
    }

    /**
     * @throws IllegalArgumentException if no store is registered under the name
     */
    public GraphStore resolve(String name) {
        String key = name == null || name.isBlank() ? DEFAULT : name;
        GraphStore store = stores.get(key);
        if (store == null) {
            throw new IllegalArgumentException("Unknown data source: " + name);
        }
        return store;
    }

    public GraphStore primary() {
        return stores.get(DEFAULT);
    }

    public Set<String> names() {
        return new TreeSet<>(stores.keySet());
    }
}
