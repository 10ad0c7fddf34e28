package com.kgagent.exception;

import com.kgagent.model.ExecutionErrorKind;
import lombok.Getter;

/**
 * A SPARQL query failed at the endpoint. Carries the failure kind and the endpoint that was
 * called so that the failing step can be reported with its endpoint identity.
 */
@Getter
public class QueryExecutionException extends KgAgentException {

    private final ExecutionErrorKind kind;
    private final String endpoint;

    public QueryExecutionException(ExecutionErrorKind kind, String endpoint, String message) {
        super(message);
        this.kind = kind;
        this.endpoint = endpoint;
    }

    public QueryExecutionException(ExecutionErrorKind kind, String endpoint, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
        this.endpoint = endpoint;
    }

    public boolean isRepairable() {
        return kind == ExecutionErrorKind.QUERY_ERROR;
    }
}
