package com.kgagent.service.impl;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.timeout;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.kgagent.TestPacks;
import com.kgagent.config.KgAgentProperties;
import com.kgagent.dto.request.ExecutionRequest;
import com.kgagent.dto.response.AskResponse;
import com.kgagent.dto.response.ExecutionResponse;
import com.kgagent.exception.KgAgentException;
import com.kgagent.exception.QueryExecutionException;
import com.kgagent.model.CancellationToken;
import com.kgagent.model.ContextPack;
import com.kgagent.model.ExecutionErrorKind;
import com.kgagent.model.Intent;
import com.kgagent.model.RdfTerm;
import com.kgagent.model.SlotValue;
import com.kgagent.model.SparqlResult;
import com.kgagent.model.TaskType;
import com.kgagent.service.api.ContextPackService;
import com.kgagent.service.api.GxaBridgeService;
import com.kgagent.service.api.LlmClient;
import com.kgagent.service.api.SparqlExecutionClient;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import reactor.core.publisher.Mono;

@ExtendWith(MockitoExtension.class)
class QueryServiceImplTest {

    @Mock
    private ContextPackService contextPackService;
    @Mock
    private SparqlExecutionClient client;
    @Mock
    private GxaBridgeService gxaBridge;
    @Mock
    private LlmClient llmClient;

    private QueryServiceImpl queryService;
    private ContextPack pack;

    @BeforeEach
    void setUp() {
        pack = TestPacks.wobd();
        lenient().when(contextPackService.getPack(any())).thenReturn(pack);
        lenient().when(llmClient.isConfigured()).thenReturn(false);
        KgAgentProperties properties = new KgAgentProperties();
        DeterministicSlotRefiner deterministic = new DeterministicSlotRefiner();
        queryService = new QueryServiceImpl(contextPackService, new RuleBasedIntentClassifier(), new RegexSlotExtractor(),
                deterministic, new LlmSlotRefiner(deterministic, llmClient, properties), new TemplateCompilerImpl(),
                client, gxaBridge, properties);
    }

    @Test
    void interpret_genesInExperiment_bindsAccession() {
        Intent intent = queryService.interpret("Which genes are differentially expressed in E-GEOD-76?", null, Map.of());

        assertThat(intent.getTask()).isEqualTo(TaskType.GENES_IN_EXPERIMENT);
        assertThat(intent.getPackId()).isEqualTo("wobd");
        assertThat(intent.slotAsString("experiment_id")).isEqualTo("E-GEOD-76");
        assertThat(intent.getNotes()).contains("Classified as");

        String query = queryService.compile(intent);
        assertThat(query).contains("\"E-GEOD-76\"").contains("FROM <https://purl.org/okn/frink/kg/gene-expression-atlas-okn>");
    }

    @Test
    void interpret_upregulatedAcrossExperiments_compilesAgreementQuery() {
        Intent intent = queryService.interpret("Find genes upregulated in multiple experiments", null, Map.of());

        assertThat(intent.getTask()).isEqualTo(TaskType.GENES_AGREEMENT);
        assertThat(intent.slotAsString("direction")).isEqualTo("up");
        assertThat(queryService.compile(intent)).contains("?log2fc > 0");
    }

    @Test
    void interpret_presetSlotsWinOverExtraction() {
        Intent intent = queryService.interpret("Which genes are differentially expressed in E-GEOD-76?", null,
                Map.of("experiment_id", SlotValue.of("E-MTAB-5")));

        assertThat(intent.slotAsString("experiment_id")).isEqualTo("E-MTAB-5");
    }

    @Test
    void interpret_blankQuestion_isRejected() {
        assertThatThrownBy(() -> queryService.interpret("  ", null, Map.of()))
                .isInstanceOf(KgAgentException.class)
                .hasMessage("The question must not be empty.");
    }

    @Test
    void ask_runsCompiledQueryOnTheIntentGraphs() {
        SparqlResult rows = SparqlResult.of(List.of("gene"), List.of(Map.of("gene", RdfTerm.literal("TP53"))));
        when(client.execute(any(), eq(pack))).thenReturn(Mono.just(ExecutionResponse.builder().result(rows).build()));

        AskResponse response = queryService.ask("Which genes are differentially expressed in E-GEOD-76?", null, false, true,
                CancellationToken.create());

        assertThat(response.execution().isSuccess()).isTrue();
        assertThat(response.execution().getResult().size()).isEqualTo(1);
        ArgumentCaptor<ExecutionRequest> request = ArgumentCaptor.forClass(ExecutionRequest.class);
        verify(client).execute(request.capture(), eq(pack));
        assertThat(request.getValue().query()).isEqualTo(response.compiledQuery());
        assertThat(request.getValue().graphs()).isEqualTo(response.intent().getGraphs());
        assertThat(request.getValue().repair()).isTrue();
        verify(gxaBridge, never()).annotate(any(), any());
    }

    @Test
    void execute_endpointFailure_isReportedInTheResponse() {
        when(client.execute(any(), any())).thenReturn(Mono.error(
                new QueryExecutionException(ExecutionErrorKind.QUERY_ERROR, "http://endpoint", "Endpoint rejected the query")));

        ExecutionResponse response = queryService.execute(
                new ExecutionRequest("SELECT * WHERE { ?s ?p ?o }", null, List.of("nde"), true, false), "wobd",
                CancellationToken.create());

        assertThat(response.isSuccess()).isFalse();
        assertThat(response.getErrorKind()).isEqualTo(ExecutionErrorKind.QUERY_ERROR);
        assertThat(response.getError()).isEqualTo("Endpoint rejected the query");
        assertThat(response.getExecutedQuery()).isEqualTo("SELECT * WHERE { ?s ?p ?o }");
    }

    @Test
    void run_datasetSearchWithBridge_annotatesRows() {
        SparqlResult datasets = SparqlResult.of(List.of("identifier"), List.of(Map.of("identifier", RdfTerm.literal("GSE76"))));
        SparqlResult annotated = SparqlResult.of(List.of("identifier", "hasGeneExpression"), List.of(
                Map.of("identifier", RdfTerm.literal("GSE76"), "hasGeneExpression", RdfTerm.literal("true"))));
        when(client.execute(any(), any())).thenReturn(Mono.just(ExecutionResponse.builder().result(datasets).build()));
        when(gxaBridge.annotate(datasets, pack)).thenReturn(annotated);

        Intent intent = queryService.interpret("Show me datasets about influenza", null,
                Map.of("include_gxa_bridge", SlotValue.of("true")));
        ExecutionResponse response = queryService.run(intent, queryService.compile(intent), false, true, CancellationToken.create());

        assertThat(intent.getTask()).isEqualTo(TaskType.DATASET_SEARCH);
        assertThat(response.getResult()).isSameAs(annotated);
    }

    @Test
    void run_bridgeFailure_keepsUnannotatedRows() {
        SparqlResult datasets = SparqlResult.of(List.of("identifier"), List.of(Map.of("identifier", RdfTerm.literal("GSE76"))));
        when(client.execute(any(), any())).thenReturn(Mono.just(ExecutionResponse.builder().result(datasets).build()));
        when(gxaBridge.annotate(any(), any())).thenThrow(new KgAgentException("atlas unavailable"));

        Intent intent = queryService.interpret("Show me datasets about influenza", null,
                Map.of("include_gxa_bridge", SlotValue.of("true")));
        ExecutionResponse response = queryService.run(intent, queryService.compile(intent), false, true, CancellationToken.create());

        assertThat(response.isSuccess()).isTrue();
        assertThat(response.getResult()).isSameAs(datasets);
    }

    @Test
    void ask_cancelledWhileTheEndpointIsBusy_abortsTheRequest() throws Exception {
        AtomicBoolean disposed = new AtomicBoolean();
        when(client.execute(any(), any())).thenReturn(Mono.<ExecutionResponse>never().doOnCancel(() -> disposed.set(true)));
        CancellationToken cancellation = CancellationToken.create();

        CompletableFuture<AskResponse> pending = CompletableFuture.supplyAsync(() -> queryService.ask(
                "Which genes are differentially expressed in E-GEOD-76?", null, true, true, cancellation));
        verify(client, timeout(2000)).execute(any(), eq(pack));
        cancellation.cancel();
        AskResponse response = pending.get(2, TimeUnit.SECONDS);

        assertThat(response.execution().isSuccess()).isFalse();
        assertThat(response.execution().getErrorKind()).isEqualTo(ExecutionErrorKind.CANCELLED);
        assertThat(response.execution().getError()).isEqualTo("Query cancelled.");
        assertThat(response.execution().getExecutedQuery()).isEqualTo(response.compiledQuery());
        assertThat(disposed).isTrue();
    }

    @Test
    void run_alreadyCancelled_neverReachesTheEndpoint() {
        CancellationToken cancellation = CancellationToken.create();
        cancellation.cancel();
        Intent intent = queryService.interpret("Show me datasets about influenza", null,
                Map.of("include_gxa_bridge", SlotValue.of("true")));

        ExecutionResponse response = queryService.run(intent, queryService.compile(intent), false, true, cancellation);

        assertThat(response.getErrorKind()).isEqualTo(ExecutionErrorKind.CANCELLED);
        assertThat(response.getExecutedQuery()).isNull();
        verify(client, never()).execute(any(), any());
        verify(gxaBridge, never()).annotate(any(), any());
    }
}
