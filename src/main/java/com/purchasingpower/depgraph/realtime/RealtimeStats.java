package com.purchasingpower.depgraph.realtime;

import java.util.Map;

/**
 * @param queriesByType Active query count keyed by dialect label (SQL, GraphQL, NaturalLanguage)
 */
public record RealtimeStats(int activeQueries,
                            int activeSubscriptions,
                            int activeConnections,
                            Map<String, Integer> queriesByType) {
}
