package com.purchasingpower.depgraph.query;

import com.purchasingpower.depgraph.core.EdgeDirection;
import com.purchasingpower.depgraph.core.NodeType;
import lombok.Builder;
import lombok.Value;

import java.util.List;
import java.util.Set;

/**
 * Dialect-independent form of a query.
 *
 * <p>Every dialect compiles to this plan; the executor never sees query text.
 * {@code filterGroups} is in disjunctive normal form: a node matches when every
 * filter of at least one group matches. An empty list matches everything, as
 * does an empty {@code nodeTypes} set.
 *
 * @since 2.0.0
 */
@Value
@Builder(toBuilder = true)
public class QueryPlan {

    QueryDialect dialect;

    @Builder.Default
    Set<NodeType> nodeTypes = Set.of();

    Traversal traversal;

    @Builder.Default
    List<List<AttributeFilter>> filterGroups = List.of();

    /** Empty means the default projection. */
    @Builder.Default
    List<Projection> projection = List.of();

    OrderBy orderBy;

    Integer limit;

    Integer offset;

    /**
     * Graph walk that produces the candidate nodes instead of a full scan.
     * A null {@code depth} means the mode's default.
     */
    @Value
    @Builder
    public static class Traversal {
        /** Canonical address, or a bare symbol name resolved at execution. */
        String rootReference;
        String edgeType;
        @Builder.Default
        EdgeDirection direction = EdgeDirection.OUT;
        Integer depth;
        @Builder.Default
        TraversalMode mode = TraversalMode.HIERARCHICAL;
    }

    public record Projection(String field, String alias) {

        public Projection {
            field = QueryField.canonical(field);
            alias = alias == null ? field : alias;
        }

        public static Projection of(String field) {
            return new Projection(field, null);
        }
    }

    public record OrderBy(String field, boolean descending) {

        public OrderBy {
            field = QueryField.canonical(field);
        }
    }
}
