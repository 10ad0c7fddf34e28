package com.kgagent.model;

import java.util.List;
import java.util.Map;

/**
 * What a plan run produced.
 *
 * @param planId          the executed plan.
 * @param outcome         aggregate terminal state.
 * @param results         SPARQL results of the steps that reached done, keyed by step id.
 * @param failures        failure reason per failed step id.
 * @param skippedStepIds  steps left pending because an upstream step did not complete.
 * @param executedQueries the exact query text sent for each dispatched step (debug runs only).
 */
public record PlanExecutionResult(String planId,
                                  PlanOutcome outcome,
                                  Map<String, SparqlResult> results,
                                  Map<String, String> failures,
                                  List<String> skippedStepIds,
                                  Map<String, String> executedQueries) {

    public static PlanExecutionResult cancelled(String planId) {
        return new PlanExecutionResult(planId, PlanOutcome.CANCELLED, Map.of(), Map.of(), List.of(), Map.of());
    }
}
