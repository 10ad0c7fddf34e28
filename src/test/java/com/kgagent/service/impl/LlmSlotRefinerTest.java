package com.kgagent.service.impl;

import static org.assertj.core.api.Assertions.assertThat;

import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.kgagent.TestPacks;
import com.kgagent.config.KgAgentProperties;
import com.kgagent.model.ContextPack;
import com.kgagent.model.Intent;
import com.kgagent.model.RefinementResult;
import com.kgagent.model.SlotValue;
import com.kgagent.model.TaskDefinition;
import com.kgagent.model.TaskType;
import com.kgagent.service.api.CredentialService;
import java.io.IOException;
import java.util.List;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import okhttp3.mockwebserver.RecordedRequest;
import org.junit.jupiter.api.AfterAll;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.test.util.ReflectionTestUtils;
import org.springframework.web.reactive.function.client.WebClient;

@ExtendWith(MockitoExtension.class)
class LlmSlotRefinerTest {

    public static MockWebServer mockLlmServer;

    @Mock
    private CredentialService credentialService;

    private LlmClientImpl llmClient;
    private LlmSlotRefiner refiner;
    private ContextPack pack;

    @BeforeAll
    static void setUpAll() throws IOException {
        mockLlmServer = new MockWebServer();
        mockLlmServer.start();
    }

    @AfterAll
    static void tearDownAll() throws IOException {
        mockLlmServer.shutdown();
    }

    @BeforeEach
    void setUp() {
        llmClient = new LlmClientImpl(WebClient.builder().build(), credentialService);
        ReflectionTestUtils.setField(llmClient, "llmApiEndpoint", String.format("http://localhost:%s", mockLlmServer.getPort()));
        ReflectionTestUtils.setField(llmClient, "llmApiKey", "test-key");
        ReflectionTestUtils.setField(llmClient, "llmModel", "test-model");
        refiner = new LlmSlotRefiner(new DeterministicSlotRefiner(), llmClient, new KgAgentProperties());
        pack = TestPacks.wobd();
    }

    @Test
    void refine_addsOnlyUnboundSlotsOfTheDeclaredType() throws Exception {
        enqueueLlmAnswer("{\\\"experiment_id\\\":\\\"E-GEOD-99\\\",\\\"direction\\\":\\\"down\\\",\\\"limit\\\":\\\"ten\\\"}");
        TaskDefinition task = pack.requireTask(TaskType.GENES_IN_EXPERIMENT);
        Intent intent = Intent.builder()
                .task(TaskType.GENES_IN_EXPERIMENT)
                .slot("experiment_id", SlotValue.of("E-GEOD-76"))
                .build();

        RefinementResult result = refiner.refine("Which genes go down in E-GEOD-76?", intent, task);

        assertThat(result.refined()).isTrue();
        assertThat(result.error()).isNull();
        assertThat(result.intent().slotAsString("experiment_id")).isEqualTo("E-GEOD-76");
        assertThat(result.intent().slotAsString("direction")).isEqualTo("down");
        assertThat(result.intent().hasSlot("limit")).isFalse();
        assertThat(result.intent().getNotes()).contains("slots refined by LLM");

        RecordedRequest request = mockLlmServer.takeRequest();
        String body = request.getBody().readUtf8();
        assertThat(request.getHeader("Authorization")).isEqualTo("Bearer test-key");
        assertThat(body).contains("\"model\":\"test-model\"");
        assertThat(body).contains("gene_expression_genes_in_experiment");
        assertThat(body).contains("Slots already bound (do not repeat them): experiment_id");
    }

    @Test
    void refine_llmFailure_keepsDeterministicSlotsAndReportsError() throws Exception {
        mockLlmServer.enqueue(new MockResponse().setResponseCode(500).setBody("boom"));
        TaskDefinition task = pack.requireTask(TaskType.EXPERIMENTS_FOR_GENE);
        Intent intent = Intent.builder()
                .task(TaskType.EXPERIMENTS_FOR_GENE)
                .slot("gene_symbol", SlotValue.of("DUSP2"))
                .build();

        RefinementResult result = refiner.refine("Where is DUSP2 upregulated?", intent, task);

        assertThat(result.refined()).isFalse();
        assertThat(result.error()).contains("communicating with the LLM");
        assertThat(result.intent().slotAsList("gene_symbols")).containsExactly("DUSP2");
        assertThat(result.intent().getNotes()).contains("LLM refinement skipped");
        mockLlmServer.takeRequest();
    }

    @Test
    void refine_answerIsNotJson_keepsDeterministicSlotsAndReportsError() throws Exception {
        enqueueLlmAnswer("Sure! The gene is DUSP2.");

        RefinementResult result = refineDusp2Question();

        assertUnrefined(result, "not valid JSON");
        mockLlmServer.takeRequest();
    }

    @Test
    void refine_answerIsJsonArray_keepsDeterministicSlotsAndReportsError() throws Exception {
        enqueueLlmAnswer("[\\\"DUSP2\\\", 2]");

        RefinementResult result = refineDusp2Question();

        assertUnrefined(result, "not a JSON object");
        mockLlmServer.takeRequest();
    }

    @Test
    void refine_answerIsJsonScalar_keepsDeterministicSlotsAndReportsError() throws Exception {
        enqueueLlmAnswer("42");

        RefinementResult result = refineDusp2Question();

        assertUnrefined(result, "not a JSON object");
        mockLlmServer.takeRequest();
    }

    @Test
    void refine_withoutApiKey_doesNotCallTheLlm() {
        ReflectionTestUtils.setField(llmClient, "llmApiKey", "");
        int before = mockLlmServer.getRequestCount();
        TaskDefinition task = pack.requireTask(TaskType.GENES_AGREEMENT);
        Intent intent = Intent.builder().task(TaskType.GENES_AGREEMENT).build();

        RefinementResult result = refiner.refine("Find genes upregulated in multiple experiments", intent, task);

        assertThat(result.refined()).isFalse();
        assertThat(result.error()).isNull();
        assertThat(mockLlmServer.getRequestCount()).isEqualTo(before);
    }

    @Test
    void deterministicRefiner_fillsListFromScalarWhenAccepted() {
        TaskDefinition task = pack.requireTask(TaskType.EXPERIMENTS_FOR_GENE);
        Intent intent = Intent.builder().slot("gene_symbol", SlotValue.of("TP53")).build();

        RefinementResult result = new DeterministicSlotRefiner().refine("", intent, task);

        assertThat(result.refined()).isTrue();
        assertThat(result.intent().slotAsList("gene_symbols")).isEqualTo(List.of("TP53"));
    }

    @Test
    void convert_rejectsMismatchedTypes() {
        JsonNodeFactory nodes = JsonNodeFactory.instance;

        assertThat(LlmSlotRefiner.convert(nodes.numberNode(5), "integer")).isEqualTo(SlotValue.of(5));
        assertThat(LlmSlotRefiner.convert(nodes.textNode("5"), "integer")).isNull();
        assertThat(LlmSlotRefiner.convert(nodes.arrayNode(), "string[]")).isNull();
        assertThat(LlmSlotRefiner.convert(nodes.textNode("  "), "string")).isNull();
    }

    private RefinementResult refineDusp2Question() {
        TaskDefinition task = pack.requireTask(TaskType.EXPERIMENTS_FOR_GENE);
        Intent intent = Intent.builder()
                .task(TaskType.EXPERIMENTS_FOR_GENE)
                .slot("gene_symbol", SlotValue.of("DUSP2"))
                .build();
        return refiner.refine("Where is DUSP2 upregulated?", intent, task);
    }

    private static void assertUnrefined(RefinementResult result, String expectedError) {
        assertThat(result.refined()).isFalse();
        assertThat(result.error()).contains(expectedError);
        assertThat(result.intent().getTask()).isEqualTo(TaskType.EXPERIMENTS_FOR_GENE);
        assertThat(result.intent().slotAsList("gene_symbols")).containsExactly("DUSP2");
        assertThat(result.intent().getNotes()).contains("LLM refinement skipped");
    }

    private static void enqueueLlmAnswer(String escapedJsonContent) {
        String llmResponseJson = "{ \"choices\": [ { \"message\": { \"role\": \"assistant\", \"content\": \""
                + escapedJsonContent + "\" } } ] }";
        mockLlmServer.enqueue(new MockResponse()
                .setBody(llmResponseJson)
                .addHeader("Content-Type", "application/json"));
    }
}
