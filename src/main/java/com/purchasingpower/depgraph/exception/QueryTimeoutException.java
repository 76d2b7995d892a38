package com.purchasingpower.depgraph.exception;

import lombok.Getter;

import java.util.List;
import java.util.Map;

/**
 * Query deadline expired. Carries whatever rows had been produced.
 */
@Getter
public class QueryTimeoutException extends RuntimeException {

    private final transient List<Map<String, Object>> partialRows;

    public QueryTimeoutException(String message, List<Map<String, Object>> partialRows) {
        super(message);
        this.partialRows = partialRows == null ? List.of() : List.copyOf(partialRows);
    }
}
