package com.purchasingpower.depgraph.exception;

import lombok.Getter;

/**
 * Raised by the query parsers before any store access.
 */
@Getter
public class QuerySyntaxException extends RuntimeException {

    private final String query;
    private final int position;

    public QuerySyntaxException(String message, String query, int position) {
        super(position >= 0 ? message + " at position " + position : message);
        this.query = query;
        this.position = position;
    }

    public QuerySyntaxException(String message, String query) {
        this(message, query, -1);
    }
}
