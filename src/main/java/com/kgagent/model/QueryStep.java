package com.kgagent.model;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import lombok.AccessLevel;
import lombok.Data;
import lombok.EqualsAndHashCode;
import lombok.Setter;

/**
 * A single node of a {@link QueryPlan}. Each step compiles to exactly one SPARQL query.
 * <p>
 * Slot values of the step's {@link Intent} and the literal {@link #sparql} may carry
 * {@code {{stepId.field}}} placeholders that are resolved by the executor once the referenced
 * step is done. The status is only ever moved forward through {@link #markRunning()},
 * {@link #markDone()} and {@link #markFailed(String)}. Equality covers the step definition only,
 * so a step keeps its identity in hashed collections while it runs.
 */
@Data
public class QueryStep {

    /**
     * Unique identifier of the step within its plan (e.g. "step1").
     */
    private String id;

    private String description;

    private Intent intent;

    /**
     * Optional literal query. When present it is used instead of the task template.
     */
    private String sparql;

    /**
     * Ids of the steps that must be {@link StepStatus#DONE} before this step may run.
     */
    private Set<String> dependsOn = new LinkedHashSet<>();

    /**
     * The upstream step whose bindings are available for placeholder interpolation.
     */
    private String usesResultsFrom;

    private List<String> targetGraphs = new ArrayList<>();

    /**
     * Placeholder field name to result variable, e.g. {@code drug_iris -> drug}.
     */
    private Map<String, String> exports = new LinkedHashMap<>();

    @Setter(AccessLevel.NONE)
    @EqualsAndHashCode.Exclude
    private volatile StepStatus status = StepStatus.PENDING;

    @Setter(AccessLevel.NONE)
    @EqualsAndHashCode.Exclude
    private volatile String error;

    public synchronized void markRunning() {
        transitionTo(StepStatus.RUNNING);
    }

    public synchronized void markDone() {
        transitionTo(StepStatus.DONE);
    }

    public synchronized void markFailed(String reason) {
        transitionTo(StepStatus.FAILED);
        this.error = reason;
    }

    private void transitionTo(StepStatus next) {
        if (!status.canTransitionTo(next)) {
            throw new IllegalStateException("Step " + id + " cannot move from " + status + " to " + next);
        }
        this.status = next;
    }
}
