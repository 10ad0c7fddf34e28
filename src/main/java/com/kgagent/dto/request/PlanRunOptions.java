package com.kgagent.dto.request;

/**
 * Options for one plan run.
 *
 * @param packId context pack supplying endpoints and the task catalog; null for the default pack.
 * @param debug  capture the executed query text of every dispatched step.
 * @param repair allow each step's query one repair attempt.
 */
public record PlanRunOptions(String packId, boolean debug, boolean repair) {

    public static PlanRunOptions defaults() {
        return new PlanRunOptions(null, false, true);
    }
}
