package com.kgagent.service.impl;

import com.kgagent.config.KgAgentProperties;
import com.kgagent.dto.request.ExecutionRequest;
import com.kgagent.dto.request.PlanRunOptions;
import com.kgagent.dto.response.ExecutionResponse;
import com.kgagent.model.CancellationToken;
import com.kgagent.model.ContextPack;
import com.kgagent.model.GraphMode;
import com.kgagent.model.Intent;
import com.kgagent.model.PlanExecutionResult;
import com.kgagent.model.PlanOutcome;
import com.kgagent.model.QueryPlan;
import com.kgagent.model.QueryStep;
import com.kgagent.model.SparqlResult;
import com.kgagent.model.StepStatus;
import com.kgagent.service.api.ContextPackService;
import com.kgagent.service.api.PlanBuilder;
import com.kgagent.service.api.SparqlExecutionClient;
import com.kgagent.service.api.StepExecutor;
import com.kgagent.service.api.TemplateCompiler;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Function;
import java.util.stream.Collectors;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;
import reactor.core.publisher.Sinks;
import reactor.core.scheduler.Schedulers;

/**
 * Executes plans as a dependency graph: a step is dispatched as soon as all of its dependencies are
 * done, independently of any sibling that is still running, with at most
 * {@code kgagent.execution.max-concurrency} queries in flight. A failed step leaves its dependents
 * pending; they are reported as skipped.
 */
@Service
@Slf4j
public class StepExecutorImpl implements StepExecutor {

    private final PlanBuilder planBuilder;
    private final TemplateCompiler templateCompiler;
    private final PlaceholderInterpolator interpolator;
    private final SparqlExecutionClient client;
    private final ContextPackService contextPackService;
    private final KgAgentProperties properties;

    public StepExecutorImpl(PlanBuilder planBuilder, TemplateCompiler templateCompiler, PlaceholderInterpolator interpolator,
                            SparqlExecutionClient client, ContextPackService contextPackService, KgAgentProperties properties) {
        this.planBuilder = planBuilder;
        this.templateCompiler = templateCompiler;
        this.interpolator = interpolator;
        this.client = client;
        this.contextPackService = contextPackService;
        this.properties = properties;
    }

    @Override
    public PlanExecutionResult execute(QueryPlan plan, PlanRunOptions options, CancellationToken cancellation) {
        planBuilder.validate(plan);
        ContextPack pack = contextPackService.getPack(packIdFor(plan, options));
        Run run = new Run(plan, pack, options, cancellation);
        log.info("Executing plan {} ({} steps)", plan.getId(), plan.getSteps().size());

        Sinks.Many<QueryStep> ready = Sinks.many().unicast().onBackpressureBuffer();
        run.release(ready, null);
        ready.asFlux()
                .flatMap(step -> runStep(step, run)
                                .subscribeOn(Schedulers.boundedElastic())
                                .doFinally(signal -> run.release(ready, step)),
                        Math.max(1, properties.getExecution().getMaxConcurrency()))
                .takeUntilOther(cancellation.whenCancelled())
                .blockLast();

        if (cancellation.isCancelled()) {
            log.info("Plan {} cancelled; discarding step results", plan.getId());
            return PlanExecutionResult.cancelled(plan.getId());
        }
        return run.toResult();
    }

    private Mono<ExecutionResponse> runStep(QueryStep step, Run run) {
        return Mono.defer(() -> {
                    if (run.cancellation.isCancelled()) {
                        return Mono.<ExecutionResponse>empty();
                    }
                    step.markRunning();
                    log.info("Step {} running: {}", step.getId(), step.getDescription());

                    Intent intent = step.getIntent() == null
                            ? null
                            : interpolator.resolveSlots(step.getIntent(), run.stepsById, run.results);
                    String query = step.getSparql() != null
                            ? interpolator.resolveQuery(step.getSparql(), run.stepsById, run.results)
                            : templateCompiler.compile(intent, run.pack);
                    if (run.options.debug()) {
                        run.executedQueries.put(step.getId(), query);
                    }

                    List<String> graphs = !step.getTargetGraphs().isEmpty()
                            ? step.getTargetGraphs()
                            : intent == null ? List.of() : intent.getGraphs();
                    GraphMode mode = intent == null ? GraphMode.FEDERATED : intent.getGraphMode();
                    return client.execute(new ExecutionRequest(query, mode, graphs, run.options.debug(), run.options.repair()), run.pack);
                })
                .doOnNext(response -> {
                    run.results.put(step.getId(), response.getResult() == null ? new SparqlResult() : response.getResult());
                    if (response.getExecutedQuery() != null) {
                        run.executedQueries.put(step.getId(), response.getExecutedQuery());
                    }
                    step.markDone();
                    log.info("Step {} done: {} row(s){}", step.getId(), run.results.get(step.getId()).size(),
                            response.isRepaired() ? " (after repair)" : "");
                })
                .onErrorResume(e -> {
                    String reason = e.getMessage() == null ? e.getClass().getSimpleName() : e.getMessage();
                    if (step.getStatus() == StepStatus.RUNNING) {
                        step.markFailed(reason);
                    }
                    run.failures.put(step.getId(), reason);
                    log.warn("Step {} failed: {}", step.getId(), reason);
                    return Mono.empty();
                });
    }

    private static String packIdFor(QueryPlan plan, PlanRunOptions options) {
        if (options.packId() != null) {
            return options.packId();
        }
        return plan.getSteps().stream()
                .map(QueryStep::getIntent)
                .filter(intent -> intent != null && intent.getPackId() != null)
                .map(Intent::getPackId)
                .findFirst()
                .orElse(null);
    }

    /**
     * Mutable state of one plan run. Maps are written from reactor threads.
     */
    private static final class Run {
        final QueryPlan plan;
        final ContextPack pack;
        final PlanRunOptions options;
        final CancellationToken cancellation;
        final Map<String, QueryStep> stepsById;
        final Map<String, SparqlResult> results = new ConcurrentHashMap<>();
        final Map<String, String> failures = new ConcurrentHashMap<>();
        final Map<String, String> executedQueries = new ConcurrentHashMap<>();
        private final Set<String> dispatched = new HashSet<>();
        private int inFlight;

        Run(QueryPlan plan, ContextPack pack, PlanRunOptions options, CancellationToken cancellation) {
            this.plan = plan;
            this.pack = pack;
            this.options = options;
            this.cancellation = cancellation;
            this.stepsById = plan.getSteps().stream().collect(Collectors.toMap(QueryStep::getId, Function.identity()));
        }

        boolean isDone(String stepId) {
            return stepsById.get(stepId).getStatus() == StepStatus.DONE;
        }

        /**
         * Called once at start and once per settled step. Emits every step that has just become
         * ready and completes the queue when nothing is in flight any more.
         */
        synchronized void release(Sinks.Many<QueryStep> ready, QueryStep settled) {
            if (settled != null) {
                inFlight--;
            }
            if (!cancellation.isCancelled()) {
                for (QueryStep step : plan.getSteps()) {
                    if (step.getStatus() == StepStatus.PENDING && !dispatched.contains(step.getId())
                            && step.getDependsOn().stream().allMatch(this::isDone)) {
                        dispatched.add(step.getId());
                        inFlight++;
                        log.debug("Step {} ready", step.getId());
                        Sinks.EmitResult result = ready.tryEmitNext(step);
                        if (result.isFailure()) {
                            log.warn("Step {} could not be dispatched: {}", step.getId(), result);
                            inFlight--;
                        }
                    }
                }
            }
            if (inFlight == 0) {
                ready.tryEmitComplete();
            }
        }

        PlanExecutionResult toResult() {
            Map<String, SparqlResult> orderedResults = new LinkedHashMap<>();
            Map<String, String> orderedFailures = new LinkedHashMap<>();
            Map<String, String> orderedQueries = new LinkedHashMap<>();
            for (QueryStep step : plan.getSteps()) {
                String id = step.getId();
                if (results.containsKey(id)) {
                    orderedResults.put(id, results.get(id));
                }
                if (failures.containsKey(id)) {
                    orderedFailures.put(id, failures.get(id));
                }
                if (executedQueries.containsKey(id)) {
                    orderedQueries.put(id, executedQueries.get(id));
                }
            }
            List<String> skipped = plan.getSteps().stream()
                    .filter(step -> step.getStatus() == StepStatus.PENDING)
                    .map(QueryStep::getId)
                    .toList();

            long done = plan.getSteps().stream().filter(step -> step.getStatus() == StepStatus.DONE).count();
            PlanOutcome outcome = done == plan.getSteps().size()
                    ? PlanOutcome.DONE
                    : done == 0 ? PlanOutcome.FAILED : PlanOutcome.PARTIALLY_FAILED;
            return new PlanExecutionResult(plan.getId(), outcome, orderedResults, orderedFailures, skipped, orderedQueries);
        }
    }
}
