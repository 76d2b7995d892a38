package com.purchasingpower.depgraph.exception;

public class QueryNotFoundException extends RuntimeException {

    public QueryNotFoundException(String queryId) {
        super("Query not found: " + queryId);
    }
}
