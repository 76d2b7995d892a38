package com.purchasingpower.depgraph.query.parser;

import com.purchasingpower.depgraph.exception.QuerySyntaxException;

import java.util.ArrayList;
import java.util.List;

/**
 * Lexer shared by the SQL and GraphQL parsers.
 *
 * <p>Identifiers may contain letters, digits, {@code _}, {@code $}, {@code .}
 * and inner dashes (so {@code parsed-by} and {@code metadata.lines} are single
 * tokens). Strings use single or double quotes with backslash escapes.
 */
final class QueryTokenizer {

    private static final String SINGLE_CHAR_SYMBOLS = "(){}[],:*=<>;";

    private QueryTokenizer() {
    }

    static List<Token> tokenize(String query) {
        List<Token> tokens = new ArrayList<>();
        int i = 0;
        int length = query.length();
        while (i < length) {
            char c = query.charAt(i);
            if (Character.isWhitespace(c)) {
                i++;
            } else if (c == '#' && isLineCommentStart(query, i)) {
                while (i < length && query.charAt(i) != '\n') {
                    i++;
                }
            } else if (c == '\'' || c == '"') {
                i = readString(query, i, tokens);
            } else if (Character.isDigit(c) || (c == '-' && i + 1 < length && Character.isDigit(query.charAt(i + 1)))) {
                int start = i++;
                while (i < length && (Character.isDigit(query.charAt(i)) || query.charAt(i) == '.')) {
                    i++;
                }
                tokens.add(new Token(Token.Type.NUMBER, query.substring(start, i), start));
            } else if (Character.isLetter(c) || c == '_' || c == '$') {
                int start = i++;
                while (i < length && isIdentifierPart(query, i)) {
                    i++;
                }
                tokens.add(new Token(Token.Type.IDENTIFIER, query.substring(start, i), start));
            } else if (i + 1 < length && isTwoCharSymbol(query.substring(i, i + 2))) {
                tokens.add(new Token(Token.Type.SYMBOL, query.substring(i, i + 2), i));
                i += 2;
            } else if (SINGLE_CHAR_SYMBOLS.indexOf(c) >= 0) {
                tokens.add(new Token(Token.Type.SYMBOL, String.valueOf(c), i));
                i++;
            } else {
                throw new QuerySyntaxException("Unexpected character '" + c + "'", query, i);
            }
        }
        tokens.add(new Token(Token.Type.EOF, "", length));
        return tokens;
    }

    private static boolean isLineCommentStart(String query, int i) {
        return i == 0 || query.charAt(i - 1) == '\n' || Character.isWhitespace(query.charAt(i - 1));
    }

    private static boolean isTwoCharSymbol(String candidate) {
        return candidate.equals("!=") || candidate.equals("<=") || candidate.equals(">=") || candidate.equals("<>");
    }

    private static boolean isIdentifierPart(String query, int i) {
        char c = query.charAt(i);
        if (Character.isLetterOrDigit(c) || c == '_' || c == '$' || c == '.') {
            return true;
        }
        // inner dash: "parsed-by", but not a trailing or doubled one
        return c == '-' && i + 1 < query.length() && Character.isLetterOrDigit(query.charAt(i + 1));
    }

    private static int readString(String query, int start, List<Token> tokens) {
        char quote = query.charAt(start);
        StringBuilder value = new StringBuilder();
        int i = start + 1;
        while (i < query.length()) {
            char c = query.charAt(i);
            if (c == '\\' && i + 1 < query.length()) {
                value.append(query.charAt(i + 1));
                i += 2;
            } else if (c == quote) {
                tokens.add(new Token(Token.Type.STRING, value.toString(), start));
                return i + 1;
            } else {
                value.append(c);
                i++;
            }
        }
        throw new QuerySyntaxException("Unterminated string literal", query, start);
    }
}
