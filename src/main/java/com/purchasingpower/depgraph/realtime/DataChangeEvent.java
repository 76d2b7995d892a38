package com.purchasingpower.depgraph.realtime;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Notification that the data behind registered queries changed.
 *
 * @param table  Logical collection that changed, e.g. {@code files}
 * @param record Change details; ingestion puts the affected node addresses under {@code addresses}
 */
public record DataChangeEvent(ChangeType type, String table, Map<String, Object> record, Instant timestamp) {

    public static final String ADDRESSES = "addresses";

    public enum ChangeType { INSERT, UPDATE, DELETE }

    public DataChangeEvent {
        record = record == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(record));
        timestamp = timestamp == null ? Instant.now() : timestamp;
    }
}
