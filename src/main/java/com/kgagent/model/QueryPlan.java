package com.kgagent.model;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import lombok.Data;

/**
 * A DAG of {@link QueryStep}s created for one user request and discarded after execution.
 */
@Data
public class QueryPlan {

    private String id;

    private List<QueryStep> steps = new ArrayList<>();

    /**
     * The natural-language question the plan answers.
     */
    private String originalQuery;

    private Instant createdAt = Instant.now();

    /**
     * Why each step was routed to its graph.
     */
    private String graphRoutingRationale;

    public Optional<QueryStep> findStep(String stepId) {
        return steps.stream().filter(s -> s.getId().equals(stepId)).findFirst();
    }
}
