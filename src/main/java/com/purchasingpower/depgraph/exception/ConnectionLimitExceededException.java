package com.purchasingpower.depgraph.exception;

import lombok.Getter;

@Getter
public class ConnectionLimitExceededException extends RuntimeException {

    private final int maxConnections;

    public ConnectionLimitExceededException(int maxConnections) {
        super("Maximum connections reached (" + maxConnections + ")");
        this.maxConnections = maxConnections;
    }
}
