package com.purchasingpower.depgraph.query.parser;

import com.purchasingpower.depgraph.exception.QuerySyntaxException;

import java.util.List;

/**
 * Position in a token stream with the accept/expect helpers both recursive
 * descent parsers use.
 */
final class TokenCursor {

    private final String query;
    private final List<Token> tokens;
    private int index;

    TokenCursor(String query) {
        this.query = query;
        this.tokens = QueryTokenizer.tokenize(query);
    }

    Token peek() {
        return tokens.get(index);
    }

    Token peek(int ahead) {
        return tokens.get(Math.min(index + ahead, tokens.size() - 1));
    }

    Token next() {
        Token token = tokens.get(index);
        if (!token.is(Token.Type.EOF)) {
            index++;
        }
        return token;
    }

    boolean atEnd() {
        return peek().is(Token.Type.EOF);
    }

    boolean acceptKeyword(String keyword) {
        if (peek().isKeyword(keyword)) {
            index++;
            return true;
        }
        return false;
    }

    boolean acceptSymbol(String symbol) {
        if (peek().isSymbol(symbol)) {
            index++;
            return true;
        }
        return false;
    }

    void expectKeyword(String keyword) {
        if (!acceptKeyword(keyword)) {
            throw error("Expected " + keyword + " but found " + peek().describe());
        }
    }

    void expectSymbol(String symbol) {
        if (!acceptSymbol(symbol)) {
            throw error("Expected '" + symbol + "' but found " + peek().describe());
        }
    }

    Token expect(Token.Type type, String what) {
        if (!peek().is(type)) {
            throw error("Expected " + what + " but found " + peek().describe());
        }
        return next();
    }

    int expectInteger(String what) {
        Token token = expect(Token.Type.NUMBER, what);
        try {
            int value = Integer.parseInt(token.text());
            if (value < 0) {
                throw new QuerySyntaxException(what + " must not be negative", query, token.position());
            }
            return value;
        } catch (NumberFormatException e) {
            throw new QuerySyntaxException("Expected an integer " + what + " but found '" + token.text() + "'",
                    query, token.position());
        }
    }

    QuerySyntaxException error(String message) {
        return new QuerySyntaxException(message, query, peek().position());
    }

    String query() {
        return query;
    }
}
