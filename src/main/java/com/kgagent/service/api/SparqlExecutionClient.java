package com.kgagent.service.api;

import com.kgagent.dto.request.ExecutionRequest;
import com.kgagent.dto.response.ExecutionResponse;
import com.kgagent.model.ContextPack;
import reactor.core.publisher.Mono;

/**
 * Sends compiled queries to a single graph endpoint or to the federation endpoint.
 */
public interface SparqlExecutionClient {

    /**
     * Executes the query with the configured timeout.
     * <p>
     * The returned {@link Mono} errors with a {@link com.kgagent.exception.QueryExecutionException}
     * (a {@link com.kgagent.exception.QueryTimeoutException} on timeout). Cancelling the
     * subscription aborts the HTTP call.
     */
    Mono<ExecutionResponse> execute(ExecutionRequest request, ContextPack pack);
}
