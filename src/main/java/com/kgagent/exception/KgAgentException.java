package com.kgagent.exception;

/**
 * Root of the agent's unchecked exceptions.
 * <p>
 * Thrown for failures in the agent's own logic (classification, compilation, planning,
 * execution, configuration). Library exceptions are wrapped into this type, or one of its
 * subclasses, together with the context in which they occurred.
 */
public class KgAgentException extends RuntimeException {

    public KgAgentException(String message) {
        super(message);
    }

    public KgAgentException(String message, Throwable cause) {
        super(message, cause);
    }
}
