package com.purchasingpower.depgraph.query.parser;

import java.util.Locale;

record Token(Type type, String text, int position) {

    enum Type {
        IDENTIFIER,
        STRING,
        NUMBER,
        SYMBOL,
        EOF
    }

    boolean is(Type expected) {
        return type == expected;
    }

    boolean isSymbol(String symbol) {
        return type == Type.SYMBOL && text.equals(symbol);
    }

    /** Case-insensitive keyword test; keywords are identifiers. */
    boolean isKeyword(String keyword) {
        return type == Type.IDENTIFIER && text.equalsIgnoreCase(keyword);
    }

    String upper() {
        return text.toUpperCase(Locale.ROOT);
    }

    String describe() {
        return type == Type.EOF ? "end of query" : "'" + text + "'";
    }
}
