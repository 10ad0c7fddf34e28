package com.kgagent.exception;

/**
 * Raised for a structurally invalid plan (duplicate ids, unknown or cyclic dependencies).
 */
public class PlanValidationException extends KgAgentException {

    public PlanValidationException(String message) {
        super(message);
    }
}
