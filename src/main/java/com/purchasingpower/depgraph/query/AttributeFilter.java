package com.purchasingpower.depgraph.query;

import com.purchasingpower.depgraph.core.GraphNode;
import com.purchasingpower.depgraph.core.NodeType;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * One {@code field operator value} condition of a query plan.
 *
 * <p>Numbers compare numerically, everything else by string form. Node type
 * values are matched leniently ({@code class}, {@code classes} and
 * {@code Class} are the same).
 */
public record AttributeFilter(String field, FilterOperator operator, Object value) {

    public AttributeFilter {
        field = QueryField.canonical(field);
    }

    public static AttributeFilter eq(String field, Object value) {
        return new AttributeFilter(field, FilterOperator.EQ, value);
    }

    public static AttributeFilter like(String field, String value) {
        return new AttributeFilter(field, FilterOperator.LIKE, value);
    }

    public boolean matches(GraphNode node, Integer depth) {
        Object actual = QueryField.resolve(field, node, depth);
        return switch (operator) {
            case IS_NULL -> actual == null;
            case IS_NOT_NULL -> actual != null;
            case EQ -> actual != null && valueEquals(actual, value);
            case NE -> actual == null || !valueEquals(actual, value);
            case LT -> compare(actual, value).map(c -> c < 0).orElse(false);
            case LE -> compare(actual, value).map(c -> c <= 0).orElse(false);
            case GT -> compare(actual, value).map(c -> c > 0).orElse(false);
            case GE -> compare(actual, value).map(c -> c >= 0).orElse(false);
            case LIKE -> actual != null && likeMatch(String.valueOf(actual), String.valueOf(value));
            case IN -> actual != null && values().stream().anyMatch(v -> valueEquals(actual, v));
            case NOT_IN -> actual == null || values().stream().noneMatch(v -> valueEquals(actual, v));
        };
    }

    private List<?> values() {
        if (value instanceof Collection<?> collection) {
            return new ArrayList<>(collection);
        }
        return value == null ? List.of() : List.of(value);
    }

    private boolean valueEquals(Object actual, Object expected) {
        if (expected == null) {
            return false;
        }
        if (QueryField.NODE_TYPE.equals(field)) {
            Optional<NodeType> a = NodeType.fromLenient(String.valueOf(actual));
            Optional<NodeType> b = NodeType.fromLenient(String.valueOf(expected));
            return a.isPresent() && a.equals(b);
        }
        Optional<BigDecimal> a = number(actual);
        Optional<BigDecimal> b = number(expected);
        if (a.isPresent() && b.isPresent()) {
            return a.get().compareTo(b.get()) == 0;
        }
        return Objects.equals(String.valueOf(actual), String.valueOf(expected));
    }

    private static Optional<Integer> compare(Object actual, Object expected) {
        if (actual == null || expected == null) {
            return Optional.empty();
        }
        Optional<BigDecimal> a = number(actual);
        Optional<BigDecimal> b = number(expected);
        if (a.isPresent() && b.isPresent()) {
            return Optional.of(a.get().compareTo(b.get()));
        }
        return Optional.of(String.valueOf(actual).compareTo(String.valueOf(expected)));
    }

    private static boolean likeMatch(String actual, String pattern) {
        String haystack = actual.toLowerCase(Locale.ROOT);
        String needle = pattern.toLowerCase(Locale.ROOT);
        if (!needle.contains("%")) {
            return haystack.contains(needle);
        }
        String regex = Arrays.stream(needle.split("%", -1))
                .map(Pattern::quote)
                .collect(Collectors.joining(".*"));
        return Pattern.compile(regex, Pattern.DOTALL).matcher(haystack).matches();
    }

    private static Optional<BigDecimal> number(Object value) {
        String text;
        if (value instanceof Number number) {
            text = number.toString();
        } else if (value instanceof String string && !string.isBlank()) {
            text = string.trim();
        } else {
            return Optional.empty();
        }
        try {
            return Optional.of(new BigDecimal(text));
        } catch (NumberFormatException e) {
            return Optional.empty();
        }
    }

    @Override
    public String toString() {
        return field + " " + operator.getSymbol() + (value == null ? "" : " " + value);
    }
}
