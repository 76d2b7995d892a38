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
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * GraphQL-like dialect with two root fields.
 *
 * <pre>
 * { nodes(type: "Class", filePath_like: "service") { address symbolName metadata { lines } } }
 * query Callers { traverse(from: "app/src/a.ts#Function:run", edge: "calls", direction: IN, depth: 2) { address depth } }
 * </pre>
 *
 * <p>Recognised arguments are {@code type}, {@code limit}, {@code offset},
 * {@code orderBy} ({@code "field"} or {@code "field DESC"}) and, on
 * {@code traverse}, {@code from}, {@code edge}, {@code direction}, {@code depth}
 * and {@code mode}. Any other argument is a filter on the field of that name;
 * the suffixes {@code _like}, {@code _contains}, {@code _in}, {@code _not_in},
 * {@code _ne}, {@code _gt}, {@code _gte}, {@code _lt} and {@code _lte} select
 * the operator, equality otherwise.
 *
 * @since 2.0.0
 */
public class GraphQlQueryParser implements QueryParser {

    private static final String NODES = "nodes";
    private static final String TRAVERSE = "traverse";

    private static final Map<String, FilterOperator> SUFFIXES = new LinkedHashMap<>();

    static {
        // longest first so "_not_in" wins over "_in"
        SUFFIXES.put("_not_in", FilterOperator.NOT_IN);
        SUFFIXES.put("_contains", FilterOperator.LIKE);
        SUFFIXES.put("_like", FilterOperator.LIKE);
        SUFFIXES.put("_gte", FilterOperator.GE);
        SUFFIXES.put("_lte", FilterOperator.LE);
        SUFFIXES.put("_ne", FilterOperator.NE);
        SUFFIXES.put("_gt", FilterOperator.GT);
        SUFFIXES.put("_lt", FilterOperator.LT);
        SUFFIXES.put("_in", FilterOperator.IN);
    }

    @Override
    public QueryDialect dialect() {
        return QueryDialect.GRAPHQL;
    }

    @Override
    public QueryPlan parse(String query) {
        if (query == null || query.isBlank()) {
            throw new QuerySyntaxException("Query is empty", query);
        }
        TokenCursor cursor = new TokenCursor(query);
        if (cursor.acceptKeyword("query")) {
            if (cursor.peek().is(Token.Type.IDENTIFIER)) {
                cursor.next();
            }
        }
        cursor.expectSymbol("{");

        if (cursor.peek(1).isSymbol(":")) {
            cursor.expect(Token.Type.IDENTIFIER, "alias");
            cursor.next();
        }
        Token rootField = cursor.expect(Token.Type.IDENTIFIER, "root field");
        String root = rootField.text();
        if (!NODES.equals(root) && !TRAVERSE.equals(root)) {
            throw new QuerySyntaxException("Unknown root field '" + root + "', expected nodes or traverse",
                    query, rootField.position());
        }

        Map<String, Argument> arguments = cursor.peek().isSymbol("(") ? parseArguments(cursor) : Map.of();
        List<QueryPlan.Projection> projection = cursor.peek().isSymbol("{") ? parseSelectionSet(cursor) : List.of();

        if (cursor.peek().is(Token.Type.IDENTIFIER)) {
            throw cursor.error("Only one root field is supported");
        }
        cursor.expectSymbol("}");
        if (!cursor.atEnd()) {
            throw cursor.error("Unexpected " + cursor.peek().describe());
        }

        return buildPlan(query, root, rootField, arguments, projection);
    }

    private QueryPlan buildPlan(String query, String root, Token rootField,
                                Map<String, Argument> arguments, List<QueryPlan.Projection> projection) {
        QueryPlan.QueryPlanBuilder plan = QueryPlan.builder()
                .dialect(QueryDialect.GRAPHQL)
                .projection(projection);
        Map<String, Argument> remaining = new LinkedHashMap<>(arguments);

        Argument type = remaining.remove("type");
        if (type != null) {
            plan.nodeTypes(nodeTypes(query, type));
        }
        Argument limit = remaining.remove("limit");
        if (limit != null) {
            plan.limit(integer(query, "limit", limit));
        }
        Argument offset = remaining.remove("offset");
        if (offset != null) {
            plan.offset(integer(query, "offset", offset));
        }
        Argument orderBy = remaining.remove("orderBy");
        if (orderBy != null) {
            String[] parts = String.valueOf(orderBy.value()).trim().split("\\s+");
            boolean descending = parts.length > 1 && parts[1].equalsIgnoreCase("DESC");
            plan.orderBy(new QueryPlan.OrderBy(parts[0], descending));
        }

        if (TRAVERSE.equals(root)) {
            plan.traversal(traversal(query, rootField, remaining));
        }

        List<AttributeFilter> filters = new ArrayList<>();
        remaining.forEach((name, argument) -> filters.add(filter(name, argument.value())));
        if (!filters.isEmpty()) {
            plan.filterGroups(List.of(List.copyOf(filters)));
        }
        return plan.build();
    }

    private QueryPlan.Traversal traversal(String query, Token rootField, Map<String, Argument> remaining) {
        Argument from = remaining.remove("from");
        Argument edge = remaining.remove("edge");
        if (from == null || edge == null) {
            throw new QuerySyntaxException("traverse requires 'from' and 'edge' arguments", query, rootField.position());
        }
        Argument directionArg = remaining.remove("direction");
        Argument depthArg = remaining.remove("depth");
        Argument modeArg = remaining.remove("mode");

        EdgeDirection direction;
        try {
            direction = directionArg == null ? EdgeDirection.OUT : EdgeDirection.fromString(String.valueOf(directionArg.value()));
        } catch (IllegalArgumentException e) {
            throw new QuerySyntaxException(e.getMessage(), query, directionArg.position());
        }
        TraversalMode mode = TraversalMode.HIERARCHICAL;
        if (modeArg != null) {
            mode = TraversalMode.fromString(String.valueOf(modeArg.value()))
                    .orElseThrow(() -> new QuerySyntaxException("Unknown traversal mode '" + modeArg.value() + "'",
                            query, modeArg.position()));
        }
        if (mode != TraversalMode.HIERARCHICAL && direction != EdgeDirection.OUT) {
            throw new QuerySyntaxException(mode + " traversal only supports OUT direction", query, rootField.position());
        }
        return QueryPlan.Traversal.builder()
                .rootReference(String.valueOf(from.value()))
                .edgeType(String.valueOf(edge.value()))
                .direction(direction)
                .depth(depthArg == null ? null : integer(query, "depth", depthArg))
                .mode(mode)
                .build();
    }

    private static AttributeFilter filter(String name, Object value) {
        for (Map.Entry<String, FilterOperator> suffix : SUFFIXES.entrySet()) {
            if (name.endsWith(suffix.getKey()) && name.length() > suffix.getKey().length()) {
                String field = name.substring(0, name.length() - suffix.getKey().length());
                return new AttributeFilter(field, suffix.getValue(), value);
            }
        }
        return new AttributeFilter(name, FilterOperator.EQ, value);
    }

    private static Set<NodeType> nodeTypes(String query, Argument argument) {
        Collection<?> values = argument.value() instanceof Collection<?> list ? list : List.of(argument.value());
        Set<NodeType> types = new LinkedHashSet<>();
        for (Object value : values) {
            types.add(NodeType.fromLenient(String.valueOf(value))
                    .orElseThrow(() -> new QuerySyntaxException("Unknown node type '" + value + "'",
                            query, argument.position())));
        }
        return types;
    }

    private static int integer(String query, String name, Argument argument) {
        if (argument.value() instanceof Long number && number >= 0 && number <= Integer.MAX_VALUE) {
            return number.intValue();
        }
        throw new QuerySyntaxException("Argument '" + name + "' must be a non-negative integer", query, argument.position());
    }

    // =========================================================================
    // Grammar
    // =========================================================================

    private Map<String, Argument> parseArguments(TokenCursor cursor) {
        cursor.expectSymbol("(");
        Map<String, Argument> arguments = new LinkedHashMap<>();
        while (!cursor.acceptSymbol(")")) {
            Token name = cursor.expect(Token.Type.IDENTIFIER, "argument name");
            cursor.expectSymbol(":");
            int position = cursor.peek().position();
            Object value = parseValue(cursor);
            if (arguments.put(name.text(), new Argument(value, position)) != null) {
                throw new QuerySyntaxException("Duplicate argument '" + name.text() + "'", cursor.query(), name.position());
            }
            cursor.acceptSymbol(",");
        }
        return arguments;
    }

    private Object parseValue(TokenCursor cursor) {
        Token token = cursor.peek();
        if (token.isSymbol("[")) {
            cursor.next();
            List<Object> values = new ArrayList<>();
            while (!cursor.acceptSymbol("]")) {
                values.add(parseValue(cursor));
                cursor.acceptSymbol(",");
            }
            return values;
        }
        return switch (token.type()) {
            case STRING -> cursor.next().text();
            case NUMBER -> LiteralValues.number(cursor.next().text());
            case IDENTIFIER -> LiteralValues.identifier(cursor.next().text());
            default -> throw cursor.error("Expected a value but found " + token.describe());
        };
    }

    private List<QueryPlan.Projection> parseSelectionSet(TokenCursor cursor) {
        cursor.expectSymbol("{");
        List<QueryPlan.Projection> projection = new ArrayList<>();
        while (!cursor.acceptSymbol("}")) {
            String alias = null;
            if (cursor.peek(1).isSymbol(":")) {
                alias = cursor.expect(Token.Type.IDENTIFIER, "alias").text();
                cursor.next();
            }
            Token field = cursor.expect(Token.Type.IDENTIFIER, "field name");
            if (cursor.peek().isSymbol("{")) {
                if (!"metadata".equals(field.text())) {
                    throw new QuerySyntaxException("Only metadata supports a nested selection", cursor.query(),
                            field.position());
                }
                cursor.next();
                while (!cursor.acceptSymbol("}")) {
                    String key = cursor.expect(Token.Type.IDENTIFIER, "metadata key").text();
                    projection.add(new QueryPlan.Projection("metadata." + key, key));
                }
            } else {
                projection.add(new QueryPlan.Projection(field.text(), alias));
            }
        }
        if (projection.isEmpty()) {
            throw cursor.error("Selection set must not be empty");
        }
        return projection;
    }

    private record Argument(Object value, int position) {
    }
}
