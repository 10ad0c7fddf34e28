package com.kgagent.model;

/**
 * Distinguishes how a query execution failed, so callers can give different guidance.
 */
public enum ExecutionErrorKind {
    /** The endpoint rejected the query (syntax or semantic error). */
    QUERY_ERROR,
    /** The endpoint could not be reached or answered with a server error. */
    TRANSPORT,
    /** The endpoint did not answer within the configured timeout. */
    TIMEOUT,
    /** The caller cancelled the run before the endpoint answered. */
    CANCELLED
}
