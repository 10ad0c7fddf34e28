package com.kgagent.model;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Lifecycle of a {@link QueryStep}: {@code PENDING -> RUNNING -> DONE | FAILED}, each transition
 * happening at most once.
 */
public enum StepStatus {
    PENDING,
    RUNNING,
    DONE,
    FAILED;

    @JsonValue
    public String wireValue() {
        return name().toLowerCase();
    }

    boolean canTransitionTo(StepStatus next) {
        return switch (this) {
            case PENDING -> next == RUNNING;
            case RUNNING -> next == DONE || next == FAILED;
            case DONE, FAILED -> false;
        };
    }
}
