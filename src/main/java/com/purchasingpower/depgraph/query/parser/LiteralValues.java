package com.purchasingpower.depgraph.query.parser;

import java.util.Locale;

final class LiteralValues {

    private LiteralValues() {
    }

    /** Integral text becomes a Long, decimal text a Double; malformed text stays a string. */
    static Object number(String text) {
        try {
            if (text.contains(".")) {
                return Double.valueOf(text);
            }
            return Long.valueOf(text);
        } catch (NumberFormatException e) {
            return text;
        }
    }

    /** Bare words: booleans and null are literals, anything else is a string. */
    static Object identifier(String text) {
        return switch (text.toLowerCase(Locale.ROOT)) {
            case "true" -> Boolean.TRUE;
            case "false" -> Boolean.FALSE;
            case "null" -> null;
            default -> text;
        };
    }
}
