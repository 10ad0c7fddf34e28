package com.kgagent.dto.request;

import com.kgagent.model.GraphMode;
import java.util.List;

/**
 * A compiled query ready to be sent to the knowledge-graph endpoints.
 *
 * @param query  SPARQL text.
 * @param mode   single-endpoint or federated routing.
 * @param graphs target graph shortnames; the first one is used in single mode.
 * @param debug  return the executed query text and endpoint in the response.
 * @param repair allow one repair attempt when the endpoint rejects the query.
 */
public record ExecutionRequest(String query, GraphMode mode, List<String> graphs, boolean debug, boolean repair) {

    public ExecutionRequest withQuery(String newQuery) {
        return new ExecutionRequest(newQuery, mode, graphs, debug, repair);
    }
}
