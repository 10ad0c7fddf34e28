package com.kgagent.exception;

/**
 * Raised when a {@code {{stepId.field}}} placeholder cannot be substituted from the upstream
 * step's result, including the case where the upstream step returned no data.
 */
public class PlaceholderResolutionException extends KgAgentException {

    public PlaceholderResolutionException(String message) {
        super(message);
    }
}
