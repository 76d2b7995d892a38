package com.purchasingpower.depgraph.query;

import com.purchasingpower.depgraph.exception.UnsupportedDialectException;

import java.util.Locale;

/**
 * Query languages accepted by the {@link QueryEngine}.
 *
 * @since 2.0.0
 */
public enum QueryDialect {
    SQL("SQL"),
    GRAPHQL("GraphQL"),
    NATURAL_LANGUAGE("NaturalLanguage");

    private final String label;

    QueryDialect(String label) {
        this.label = label;
    }

    public String getLabel() {
        return label;
    }

    /**
     * Accepts the wire label ({@code SQL}, {@code GraphQL}, {@code NaturalLanguage})
     * or the enum name, ignoring case.
     *
     * @throws UnsupportedDialectException for anything else
     */
    public static QueryDialect fromString(String value) {
        if (value == null) {
            throw new UnsupportedDialectException(null);
        }
        String normalized = value.trim().replace("_", "").replace("-", "").replace(" ", "").toLowerCase(Locale.ROOT);
        return switch (normalized) {
            case "sql" -> SQL;
            case "graphql" -> GRAPHQL;
            case "naturallanguage", "nl" -> NATURAL_LANGUAGE;
            default -> throw new UnsupportedDialectException(value);
        };
    }

    @Override
    public String toString() {
        return label;
    }
}
