package com.kgagent.model;

/**
 * Aggregate terminal state of a plan run.
 */
public enum PlanOutcome {
    /** Every step reached done. */
    DONE,
    /** At least one step is done and at least one failed or was skipped. */
    PARTIALLY_FAILED,
    /** No step reached done. */
    FAILED,
    /** The run was cancelled; step results were discarded. */
    CANCELLED
}
