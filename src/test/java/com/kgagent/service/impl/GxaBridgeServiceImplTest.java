package com.kgagent.service.impl;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.kgagent.TestPacks;
import com.kgagent.dto.request.ExecutionRequest;
import com.kgagent.dto.response.ExecutionResponse;
import com.kgagent.exception.KgAgentException;
import com.kgagent.model.ContextPack;
import com.kgagent.model.GraphMode;
import com.kgagent.model.RdfTerm;
import com.kgagent.model.SparqlResult;
import com.kgagent.service.api.SparqlExecutionClient;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import reactor.core.publisher.Mono;

@ExtendWith(MockitoExtension.class)
class GxaBridgeServiceImplTest {

    @Mock
    private SparqlExecutionClient client;

    private GxaBridgeServiceImpl bridge;
    private ContextPack pack;

    @BeforeEach
    void setUp() {
        bridge = new GxaBridgeServiceImpl(client);
        pack = TestPacks.wobd();
    }

    @Test
    void annotate_flagsGeoDatasetsKnownToTheAtlas() {
        SparqlResult datasets = SparqlResult.of(List.of("dataset", "identifier"), List.of(
                Map.of("dataset", RdfTerm.uri("https://www.ncbi.nlm.nih.gov/geo/query/acc.cgi?acc=GSE76"),
                        "identifier", RdfTerm.literal("GSE76")),
                Map.of("dataset", RdfTerm.uri("https://example.org/ds/GSE999"), "identifier", RdfTerm.literal("GSE999")),
                Map.of("dataset", RdfTerm.uri("https://example.org/ds/other"))));
        when(client.execute(any(), any())).thenReturn(Mono.just(ExecutionResponse.builder()
                .result(SparqlResult.of(List.of("experimentId"),
                        List.of(Map.of("experimentId", RdfTerm.literal("E-GEOD-76")))))
                .build()));

        SparqlResult annotated = bridge.annotate(datasets, pack);

        assertThat(annotated.getVars()).containsExactly("dataset", "identifier", "hasGeneExpression", "gxaExperimentId");
        assertThat(annotated.getBindings().get(0).get("hasGeneExpression").getValue()).isEqualTo("true");
        assertThat(annotated.getBindings().get(0).get("gxaExperimentId").getValue()).isEqualTo("E-GEOD-76");
        assertThat(annotated.getBindings().get(1).get("hasGeneExpression").getValue()).isEqualTo("false");
        assertThat(annotated.getBindings().get(1)).doesNotContainKey("gxaExperimentId");
        assertThat(annotated.getBindings().get(2).get("hasGeneExpression").getDatatype())
                .isEqualTo("http://www.w3.org/2001/XMLSchema#boolean");

        ArgumentCaptor<ExecutionRequest> request = ArgumentCaptor.forClass(ExecutionRequest.class);
        verify(client).execute(request.capture(), any());
        assertThat(request.getValue().mode()).isEqualTo(GraphMode.SINGLE);
        assertThat(request.getValue().graphs()).containsExactly("gene-expression-atlas-okn");
        assertThat(request.getValue().query()).contains("VALUES ?experimentId { \"E-GEOD-76\" \"E-GEOD-999\" }");
    }

    @Test
    void annotate_doesNotModifyInput() {
        SparqlResult datasets = SparqlResult.of(List.of("identifier"), List.of(Map.of("identifier", RdfTerm.literal("GSE5"))));
        when(client.execute(any(), any())).thenReturn(Mono.just(ExecutionResponse.builder()
                .result(SparqlResult.empty(List.of("experimentId"))).build()));

        bridge.annotate(datasets, pack);

        assertThat(datasets.getVars()).containsExactly("identifier");
        assertThat(datasets.getBindings().get(0)).containsOnlyKeys("identifier");
    }

    @Test
    void annotate_noGeoAccessions_skipsTheAtlasQuery() {
        SparqlResult datasets = SparqlResult.of(List.of("dataset"), List.of(Map.of("dataset", RdfTerm.uri("https://example.org/ds/1"))));

        SparqlResult annotated = bridge.annotate(datasets, pack);

        assertThat(annotated.getBindings().get(0).get("hasGeneExpression").getValue()).isEqualTo("false");
        verify(client, never()).execute(any(), any());
    }

    @Test
    void toGxaAccession_mapsGeoSeries() {
        assertThat(GxaBridgeServiceImpl.toGxaAccession("GSE76")).isEqualTo("E-GEOD-76");
        assertThat(GxaBridgeServiceImpl.toGxaAccession("gse12345")).isEqualTo("E-GEOD-12345");
        assertThatThrownBy(() -> GxaBridgeServiceImpl.toGxaAccession("E-MTAB-1"))
                .isInstanceOf(KgAgentException.class);
    }
}
