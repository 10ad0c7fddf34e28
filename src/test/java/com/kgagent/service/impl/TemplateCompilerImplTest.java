package com.kgagent.service.impl;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.kgagent.TestPacks;
import com.kgagent.exception.TemplateCompilationException;
import com.kgagent.model.ContextPack;
import com.kgagent.model.Intent;
import com.kgagent.model.SlotValue;
import com.kgagent.model.TaskType;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

class TemplateCompilerImplTest {

    private TemplateCompilerImpl compiler;
    private ContextPack pack;

    @BeforeEach
    void setUp() {
        compiler = new TemplateCompilerImpl();
        pack = TestPacks.wobd();
    }

    @Test
    void compile_genesInExperiment_filtersOnLiteralAccession() {
        Intent intent = Intent.builder()
                .task(TaskType.GENES_IN_EXPERIMENT)
                .slot("experiment_id", SlotValue.of("E-GEOD-76"))
                .build();

        String query = compiler.compile(intent, pack);

        assertThat(query).contains("FILTER(CONTAINS(STR(?contrast), \"E-GEOD-76\"))");
        assertThat(query).contains("?geneSymbol");
        assertThat(query).contains("FROM <https://purl.org/okn/frink/kg/gene-expression-atlas-okn>");
    }

    @Test
    void compile_missingRequiredSlot_throws() {
        Intent intent = Intent.builder().task(TaskType.GENES_IN_EXPERIMENT).build();

        assertThatThrownBy(() -> compiler.compile(intent, pack))
                .isInstanceOf(TemplateCompilationException.class)
                .hasMessage("Missing required slot 'experiment_id' for template 'gene_expression_genes_in_experiment'");
    }

    @Test
    void compile_alternativeSlotSatisfiesRequirement() {
        Intent intent = Intent.builder()
                .task(TaskType.DATASET_SEARCH)
                .slot("health_conditions", SlotValue.of(List.of("MONDO:0005148")))
                .build();

        String query = compiler.compile(intent, pack);

        assertThat(query).contains("<http://purl.obolibrary.org/obo/MONDO_0005148>");
        assertThat(query).contains("rdfs:subClassOf*");
    }

    @Test
    void compile_unresolvedPlaceholder_throws() {
        Intent intent = Intent.builder()
                .task(TaskType.DATASET_SEARCH)
                .slot("health_conditions", SlotValue.of("{{step2.disease_iris}}"))
                .build();

        assertThatThrownBy(() -> compiler.compile(intent, pack))
                .isInstanceOf(TemplateCompilationException.class)
                .hasMessageContaining("unresolved step placeholder");
    }

    @Test
    void compile_limitIsCappedByGuardrails() {
        Intent intent = Intent.builder()
                .task(TaskType.DATASET_SEARCH)
                .slot("keywords", SlotValue.of("asthma"))
                .slot("limit", SlotValue.of(100000))
                .build();

        assertThat(compiler.compile(intent, pack)).endsWith("LIMIT 500");
    }

    @Test
    void compile_genesAgreement_usesDirectionFilter() {
        Intent intent = Intent.builder()
                .task(TaskType.GENES_AGREEMENT)
                .slot("direction", SlotValue.of("up"))
                .build();

        String query = compiler.compile(intent, pack);

        assertThat(query).contains("?log2fc > 0");
        assertThat(query).doesNotContain("E-GEOD");
    }

    @Test
    void compile_rawSparqlWithoutQuery_throws() {
        Intent intent = Intent.builder().task(TaskType.RAW_SPARQL).build();

        assertThatThrownBy(() -> compiler.compile(intent, pack))
                .isInstanceOf(TemplateCompilationException.class)
                .hasMessageContaining("needs a literal query");
    }

    @ParameterizedTest
    @EnumSource(TaskType.class)
    void templateFor_coversEveryTask(TaskType task) {
        assertThat(compiler.templateFor(task)).isNotNull();
    }
}
