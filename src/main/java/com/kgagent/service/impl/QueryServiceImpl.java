package com.kgagent.service.impl;

import com.kgagent.config.KgAgentProperties;
import com.kgagent.dto.request.ExecutionRequest;
import com.kgagent.dto.response.AskResponse;
import com.kgagent.dto.response.ExecutionResponse;
import com.kgagent.exception.KgAgentException;
import com.kgagent.exception.QueryExecutionException;
import com.kgagent.model.CancellationToken;
import com.kgagent.model.Classification;
import com.kgagent.model.ContextPack;
import com.kgagent.model.ExecutionErrorKind;
import com.kgagent.model.Intent;
import com.kgagent.model.RefinementResult;
import com.kgagent.model.SlotValue;
import com.kgagent.model.TaskDefinition;
import com.kgagent.model.TaskType;
import com.kgagent.service.api.ContextPackService;
import com.kgagent.service.api.GxaBridgeService;
import com.kgagent.service.api.IntentClassifier;
import com.kgagent.service.api.QueryService;
import com.kgagent.service.api.SlotExtractor;
import com.kgagent.service.api.SlotRefiner;
import com.kgagent.service.api.SparqlExecutionClient;
import com.kgagent.service.api.TemplateCompiler;
import java.util.Map;
import java.util.Set;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;
import reactor.util.function.Tuple2;

@Service
@Slf4j
public class QueryServiceImpl implements QueryService {

    private static final Set<TaskType> BRIDGEABLE = Set.of(TaskType.DATASET_SEARCH, TaskType.GEO_DATASET_SEARCH);

    private final ContextPackService contextPackService;
    private final IntentClassifier classifier;
    private final SlotExtractor extractor;
    private final DeterministicSlotRefiner deterministicRefiner;
    private final LlmSlotRefiner llmRefiner;
    private final TemplateCompiler templateCompiler;
    private final SparqlExecutionClient client;
    private final GxaBridgeService gxaBridge;
    private final KgAgentProperties properties;

    public QueryServiceImpl(ContextPackService contextPackService, IntentClassifier classifier, SlotExtractor extractor,
                            DeterministicSlotRefiner deterministicRefiner, LlmSlotRefiner llmRefiner,
                            TemplateCompiler templateCompiler, SparqlExecutionClient client,
                            GxaBridgeService gxaBridge, KgAgentProperties properties) {
        this.contextPackService = contextPackService;
        this.classifier = classifier;
        this.extractor = extractor;
        this.deterministicRefiner = deterministicRefiner;
        this.llmRefiner = llmRefiner;
        this.templateCompiler = templateCompiler;
        this.client = client;
        this.gxaBridge = gxaBridge;
        this.properties = properties;
    }

    @Override
    public Intent interpret(String text, String packId, Map<String, SlotValue> presetSlots) {
        if (text == null || text.isBlank()) {
            throw new KgAgentException("The question must not be empty.");
        }
        ContextPack pack = contextPackService.getPack(packId);
        Intent baseline = Intent.builder()
                .packId(pack.getId())
                .slots(presetSlots == null ? Map.of() : presetSlots)
                .build();

        // Classification and extraction do not depend on each other.
        Tuple2<Classification, Intent> both = Mono.zip(
                        Mono.fromCallable(() -> classifier.classify(text, pack)).subscribeOn(Schedulers.boundedElastic()),
                        Mono.fromCallable(() -> extractor.extract(text, baseline)).subscribeOn(Schedulers.boundedElastic()))
                .block();
        Classification classification = both.getT1();
        Intent extracted = both.getT2();

        TaskDefinition def = pack.requireTask(classification.task());
        Set<String> accepted = def.acceptedSlots();
        Intent.IntentBuilder builder = Intent.builder()
                .task(classification.task())
                .packId(pack.getId())
                .graphMode(def.getGraphMode())
                .graphs(def.getDefaultGraphs().isEmpty() ? pack.getDefaultGraphs() : def.getDefaultGraphs())
                .confidence(classification.confidence())
                .notes(classification.note() == null ? "" : classification.note());
        extracted.getSlots().forEach((name, value) -> {
            boolean preset = presetSlots != null && presetSlots.containsKey(name);
            if (preset || accepted.contains(name)) {
                builder.slot(name, value);
            }
        });
        Intent intent = builder.build();
        if (classification.lowConfidence()) {
            intent = intent.withNote("low confidence");
        }

        SlotRefiner refiner = def.isLlmAssistable() && properties.getRefiner().isEnabled() ? llmRefiner : deterministicRefiner;
        RefinementResult refinement = refiner.refine(text, intent, def);
        if (refinement.error() != null) {
            log.warn("Slot refinement degraded: {}", refinement.error());
        }
        Intent refined = refinement.intent();
        log.info("Interpreted question as {} (confidence {}), slots {}", refined.getTask().getId(), refined.getConfidence(),
                refined.getSlots().keySet());
        return refined;
    }

    @Override
    public String compile(Intent intent) {
        return templateCompiler.compile(intent, contextPackService.getPack(intent.getPackId()));
    }

    @Override
    public ExecutionResponse execute(ExecutionRequest request, String packId, CancellationToken cancellation) {
        if (cancellation.isCancelled()) {
            return cancelled(request);
        }
        ContextPack pack = contextPackService.getPack(packId);
        try {
            ExecutionResponse response = client.execute(request, pack)
                    .takeUntilOther(cancellation.whenCancelled())
                    .block();
            if (response == null && cancellation.isCancelled()) {
                log.info("Query cancelled before the endpoint answered");
                return cancelled(request);
            }
            return response == null ? ExecutionResponse.builder().build() : response;
        } catch (QueryExecutionException e) {
            log.warn("Query execution failed: {}", e.getMessage());
            return ExecutionResponse.builder()
                    .error(e.getMessage())
                    .errorKind(e.getKind())
                    .executedQuery(request.debug() ? request.query() : null)
                    .build();
        } catch (KgAgentException e) {
            log.warn("Query could not be dispatched: {}", e.getMessage());
            return ExecutionResponse.builder().error(e.getMessage()).build();
        }
    }

    private static ExecutionResponse cancelled(ExecutionRequest request) {
        return ExecutionResponse.builder()
                .error("Query cancelled.")
                .errorKind(ExecutionErrorKind.CANCELLED)
                .executedQuery(request.debug() ? request.query() : null)
                .build();
    }

    @Override
    public ExecutionResponse run(Intent intent, String query, boolean debug, boolean repair,
                                 CancellationToken cancellation) {
        ExecutionRequest request = new ExecutionRequest(query, intent.getGraphMode(), intent.getGraphs(), debug, repair);
        ExecutionResponse response = execute(request, intent.getPackId(), cancellation);

        if (response.isSuccess() && !cancellation.isCancelled() && BRIDGEABLE.contains(intent.getTask())
                && "true".equalsIgnoreCase(intent.slotAsString("include_gxa_bridge"))) {
            ContextPack pack = contextPackService.getPack(intent.getPackId());
            try {
                response = response.toBuilder().result(gxaBridge.annotate(response.getResult(), pack)).build();
            } catch (KgAgentException e) {
                log.warn("Expression Atlas annotation skipped: {}", e.getMessage());
            }
        }
        return response;
    }

    @Override
    public AskResponse ask(String text, String packId, boolean debug, boolean repair, CancellationToken cancellation) {
        Intent intent = interpret(text, packId, Map.of());
        String query = compile(intent);
        return new AskResponse(intent, query, run(intent, query, debug, repair, cancellation));
    }
}
