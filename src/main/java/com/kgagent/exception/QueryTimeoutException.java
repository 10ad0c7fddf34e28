package com.kgagent.exception;

import com.kgagent.model.ExecutionErrorKind;
import java.time.Duration;

/**
 * The endpoint did not answer within the configured timeout.
 */
public class QueryTimeoutException extends QueryExecutionException {

    public QueryTimeoutException(String endpoint, Duration timeout, Throwable cause) {
        super(ExecutionErrorKind.TIMEOUT, endpoint,
                "Query to " + endpoint + " timed out after " + timeout.toSeconds()
                        + "s. Try narrowing the query: lower the limit, add filters or target a single graph.",
                cause);
    }
}
