package com.purchasingpower.depgraph.api;

/**
 * Body returned by the inference and realtime endpoints on failure.
 */
public record ErrorResponse(boolean success, String error) {

    public static ErrorResponse of(String error) {
        return new ErrorResponse(false, error);
    }
}
