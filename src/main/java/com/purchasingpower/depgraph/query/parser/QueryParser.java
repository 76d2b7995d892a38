package com.purchasingpower.depgraph.query.parser;

import com.purchasingpower.depgraph.query.QueryDialect;
import com.purchasingpower.depgraph.query.QueryPlan;

/**
 * Compiles query text of one dialect into a {@link QueryPlan}.
 * Implementations are stateless and never touch a graph store.
 */
public interface QueryParser {

    QueryDialect dialect();

    /**
     * @throws com.purchasingpower.depgraph.exception.QuerySyntaxException on malformed input
     */
    QueryPlan parse(String query);
}
