package com.kgagent.exception;

/**
 * Raised when an intent cannot be compiled to a query: a required slot is missing, or a slot
 * still carries an unresolved step placeholder.
 */
public class TemplateCompilationException extends KgAgentException {

    public TemplateCompilationException(String message) {
        super(message);
    }
}
