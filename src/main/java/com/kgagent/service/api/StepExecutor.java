package com.kgagent.service.api;

import com.kgagent.dto.request.PlanRunOptions;
import com.kgagent.model.CancellationToken;
import com.kgagent.model.PlanExecutionResult;
import com.kgagent.model.QueryPlan;

/**
 * Runs a plan in dependency order, feeding each step's bindings into its dependents.
 */
public interface StepExecutor {

    /**
     * Executes the plan and blocks until every runnable step finished or the run was cancelled.
     * Step failures are recorded on the steps and in the result, never thrown.
     *
     * @throws com.kgagent.exception.PlanValidationException if the plan is structurally invalid.
     */
    PlanExecutionResult execute(QueryPlan plan, PlanRunOptions options, CancellationToken cancellation);
}
