package com.kgagent.dto.response;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.kgagent.model.ExecutionErrorKind;
import com.kgagent.model.SparqlResult;
import lombok.Builder;
import lombok.Value;

/**
 * Response of the execute operation. {@code executedQuery} and {@code endpointUsed} are only
 * populated for debug requests; {@code error} and {@code errorKind} only on failure.
 */
@Value
@Builder(toBuilder = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ExecutionResponse {

    SparqlResult result;

    String executedQuery;

    String endpointUsed;

    String error;

    ExecutionErrorKind errorKind;

    /**
     * True when the result came from a repaired query.
     */
    boolean repaired;

    long elapsedMs;

    public boolean isSuccess() {
        return error == null;
    }
}
