package com.purchasingpower.depgraph.exception;

import lombok.Getter;

@Getter
public class UnsupportedDialectException extends RuntimeException {

    private final String dialect;

    public UnsupportedDialectException(String dialect) {
        super("Unsupported query dialect: " + dialect);
        this.dialect = dialect;
    }
}
