package com.purchasingpower.depgraph.query.parser;

import com.purchasingpower.depgraph.core.EdgeDirection;
import com.purchasingpower.depgraph.core.NodeType;
import com.purchasingpower.depgraph.exception.QuerySyntaxException;
import com.purchasingpower.depgraph.query.AttributeFilter;
import com.purchasingpower.depgraph.query.FilterOperator;
import com.purchasingpower.depgraph.query.QueryDialect;
import com.purchasingpower.depgraph.query.QueryPlan;
import com.purchasingpower.depgraph.query.TraversalMode;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * SQL-like dialect.
 *
 * <pre>
 * SELECT fields FROM types | MATCH types
 *   [TRAVERSE edgeType [IN|OUT|BOTH] FROM 'root' [DEPTH n] [USING HIERARCHICAL|TRANSITIVE|INHERITABLE]]
 *   [WHERE condition {AND|OR condition}]
 *   [ORDER BY field [ASC|DESC]]
 *   [LIMIT n] [OFFSET n]
 * </pre>
 *
 * <p>Conditions support {@code = != <> < <= > >= LIKE IN (..) NOT IN (..) IS [NOT] NULL}
 * and parentheses; AND binds tighter than OR. {@code *} or {@code nodes} in the
 * FROM clause means every node type. A WHERE clause whose normal form exceeds
 * {@value #MAX_FILTER_GROUPS} AND-groups is rejected.
 *
 * @since 2.0.0
 */
public class SqlQueryParser implements QueryParser {

    static final int MAX_FILTER_GROUPS = 256;

    @Override
    public QueryDialect dialect() {
        return QueryDialect.SQL;
    }

    @Override
    public QueryPlan parse(String query) {
        if (query == null || query.isBlank()) {
            throw new QuerySyntaxException("Query is empty", query);
        }
        TokenCursor cursor = new TokenCursor(query);
        QueryPlan.QueryPlanBuilder plan = QueryPlan.builder().dialect(QueryDialect.SQL);

        if (cursor.acceptKeyword("SELECT")) {
            plan.projection(parseProjection(cursor));
            cursor.expectKeyword("FROM");
            plan.nodeTypes(parseNodeTypes(cursor));
        } else if (cursor.acceptKeyword("MATCH")) {
            plan.nodeTypes(parseNodeTypes(cursor));
        } else {
            throw cursor.error("Expected SELECT or MATCH but found " + cursor.peek().describe());
        }

        if (cursor.acceptKeyword("TRAVERSE")) {
            plan.traversal(parseTraversal(cursor));
        }
        if (cursor.acceptKeyword("WHERE")) {
            plan.filterGroups(parseOr(cursor));
        }
        if (cursor.acceptKeyword("ORDER")) {
            cursor.expectKeyword("BY");
            String field = cursor.expect(Token.Type.IDENTIFIER, "ORDER BY field").text();
            boolean descending = false;
            if (cursor.acceptKeyword("DESC")) {
                descending = true;
            } else {
                cursor.acceptKeyword("ASC");
            }
            plan.orderBy(new QueryPlan.OrderBy(field, descending));
        }
        if (cursor.acceptKeyword("LIMIT")) {
            plan.limit(cursor.expectInteger("LIMIT"));
        }
        if (cursor.acceptKeyword("OFFSET")) {
            plan.offset(cursor.expectInteger("OFFSET"));
        }
        cursor.acceptSymbol(";");
        if (!cursor.atEnd()) {
            throw cursor.error("Unexpected " + cursor.peek().describe());
        }
        return plan.build();
    }

    private List<QueryPlan.Projection> parseProjection(TokenCursor cursor) {
        if (cursor.acceptSymbol("*")) {
            return List.of();
        }
        List<QueryPlan.Projection> projection = new ArrayList<>();
        do {
            String field = cursor.expect(Token.Type.IDENTIFIER, "column name").text();
            String alias = null;
            if (cursor.acceptKeyword("AS")) {
                alias = cursor.expect(Token.Type.IDENTIFIER, "column alias").text();
            }
            projection.add(new QueryPlan.Projection(field, alias));
        } while (cursor.acceptSymbol(","));
        return projection;
    }

    private Set<NodeType> parseNodeTypes(TokenCursor cursor) {
        if (cursor.acceptSymbol("*") || cursor.acceptKeyword("nodes")) {
            return Set.of();
        }
        Set<NodeType> types = new LinkedHashSet<>();
        do {
            Token token = cursor.peek();
            if (!token.is(Token.Type.IDENTIFIER) && !token.is(Token.Type.STRING)) {
                throw cursor.error("Expected node type but found " + token.describe());
            }
            cursor.next();
            NodeType type = NodeType.fromLenient(token.text())
                    .orElseThrow(() -> new QuerySyntaxException("Unknown node type '" + token.text() + "'",
                            cursor.query(), token.position()));
            types.add(type);
        } while (cursor.acceptSymbol(","));
        return types;
    }

    private QueryPlan.Traversal parseTraversal(TokenCursor cursor) {
        Token edge = cursor.peek();
        if (!edge.is(Token.Type.IDENTIFIER) && !edge.is(Token.Type.STRING)) {
            throw cursor.error("Expected edge type after TRAVERSE but found " + edge.describe());
        }
        cursor.next();

        EdgeDirection direction = EdgeDirection.OUT;
        if (cursor.acceptKeyword("IN")) {
            direction = EdgeDirection.IN;
        } else if (cursor.acceptKeyword("OUT")) {
            direction = EdgeDirection.OUT;
        } else if (cursor.acceptKeyword("BOTH")) {
            direction = EdgeDirection.BOTH;
        }

        cursor.expectKeyword("FROM");
        Token root = cursor.peek();
        if (!root.is(Token.Type.STRING) && !root.is(Token.Type.IDENTIFIER)) {
            throw cursor.error("Expected traversal root but found " + root.describe());
        }
        cursor.next();

        Integer depth = null;
        if (cursor.acceptKeyword("DEPTH")) {
            depth = cursor.expectInteger("DEPTH");
        }
        TraversalMode mode = TraversalMode.HIERARCHICAL;
        if (cursor.acceptKeyword("USING")) {
            Token modeToken = cursor.expect(Token.Type.IDENTIFIER, "traversal mode");
            mode = TraversalMode.fromString(modeToken.text())
                    .orElseThrow(() -> new QuerySyntaxException("Unknown traversal mode '" + modeToken.text() + "'",
                            cursor.query(), modeToken.position()));
        }
        if (mode != TraversalMode.HIERARCHICAL && direction != EdgeDirection.OUT) {
            throw new QuerySyntaxException(mode + " traversal only supports OUT direction", cursor.query(),
                    edge.position());
        }
        return QueryPlan.Traversal.builder()
                .rootReference(root.text())
                .edgeType(edge.text())
                .direction(direction)
                .depth(depth)
                .mode(mode)
                .build();
    }

    // Conditions are returned in disjunctive normal form: OR of AND-groups.

    private List<List<AttributeFilter>> parseOr(TokenCursor cursor) {
        List<List<AttributeFilter>> groups = new ArrayList<>(parseAnd(cursor));
        while (cursor.acceptKeyword("OR")) {
            groups.addAll(parseAnd(cursor));
            checkGroupCount(cursor, groups.size());
        }
        return groups;
    }

    private List<List<AttributeFilter>> parseAnd(TokenCursor cursor) {
        List<List<AttributeFilter>> groups = parsePrimary(cursor);
        while (cursor.acceptKeyword("AND")) {
            List<List<AttributeFilter>> right = parsePrimary(cursor);
            checkGroupCount(cursor, (long) groups.size() * right.size());
            List<List<AttributeFilter>> combined = new ArrayList<>();
            for (List<AttributeFilter> left : groups) {
                for (List<AttributeFilter> other : right) {
                    List<AttributeFilter> merged = new ArrayList<>(left);
                    merged.addAll(other);
                    combined.add(List.copyOf(merged));
                }
            }
            groups = combined;
        }
        return groups;
    }

    // Distributing AND over OR multiplies group counts.
    private static void checkGroupCount(TokenCursor cursor, long groups) {
        if (groups > MAX_FILTER_GROUPS) {
            throw cursor.error("WHERE clause expands to more than " + MAX_FILTER_GROUPS + " condition groups");
        }
    }

    private List<List<AttributeFilter>> parsePrimary(TokenCursor cursor) {
        if (cursor.acceptSymbol("(")) {
            List<List<AttributeFilter>> inner = parseOr(cursor);
            cursor.expectSymbol(")");
            return inner;
        }
        return List.of(List.of(parseCondition(cursor)));
    }

    private AttributeFilter parseCondition(TokenCursor cursor) {
        String field = cursor.expect(Token.Type.IDENTIFIER, "field name").text();

        if (cursor.acceptKeyword("IS")) {
            boolean negated = cursor.acceptKeyword("NOT");
            cursor.expectKeyword("NULL");
            return new AttributeFilter(field, negated ? FilterOperator.IS_NOT_NULL : FilterOperator.IS_NULL, null);
        }
        if (cursor.acceptKeyword("NOT")) {
            if (cursor.acceptKeyword("IN")) {
                return new AttributeFilter(field, FilterOperator.NOT_IN, parseValueList(cursor));
            }
            cursor.expectKeyword("LIKE");
            throw cursor.error("NOT LIKE is not supported");
        }
        if (cursor.acceptKeyword("IN")) {
            return new AttributeFilter(field, FilterOperator.IN, parseValueList(cursor));
        }
        if (cursor.acceptKeyword("LIKE")) {
            return new AttributeFilter(field, FilterOperator.LIKE, parseValue(cursor));
        }

        Token op = cursor.peek();
        FilterOperator operator;
        if (op.isSymbol("=")) {
            operator = FilterOperator.EQ;
        } else if (op.isSymbol("!=") || op.isSymbol("<>")) {
            operator = FilterOperator.NE;
        } else if (op.isSymbol("<")) {
            operator = FilterOperator.LT;
        } else if (op.isSymbol("<=")) {
            operator = FilterOperator.LE;
        } else if (op.isSymbol(">")) {
            operator = FilterOperator.GT;
        } else if (op.isSymbol(">=")) {
            operator = FilterOperator.GE;
        } else {
            throw cursor.error("Expected comparison operator after '" + field + "' but found " + op.describe());
        }
        cursor.next();
        return new AttributeFilter(field, operator, parseValue(cursor));
    }

    private List<Object> parseValueList(TokenCursor cursor) {
        cursor.expectSymbol("(");
        List<Object> values = new ArrayList<>();
        if (!cursor.peek().isSymbol(")")) {
            do {
                values.add(parseValue(cursor));
            } while (cursor.acceptSymbol(","));
        }
        cursor.expectSymbol(")");
        return values;
    }

    private Object parseValue(TokenCursor cursor) {
        Token token = cursor.peek();
        return switch (token.type()) {
            case STRING -> cursor.next().text();
            case NUMBER -> LiteralValues.number(cursor.next().text());
            case IDENTIFIER -> LiteralValues.identifier(cursor.next().text());
            default -> throw cursor.error("Expected a value but found " + token.describe());
        };
    }
}
