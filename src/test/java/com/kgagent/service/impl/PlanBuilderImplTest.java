package com.kgagent.service.impl;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.kgagent.exception.PlanValidationException;
import com.kgagent.model.Intent;
import com.kgagent.model.QueryPlan;
import com.kgagent.model.QueryStep;
import com.kgagent.model.SlotValue;
import com.kgagent.model.TaskType;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class PlanBuilderImplTest {

    private PlanBuilderImpl planBuilder;

    @BeforeEach
    void setUp() {
        planBuilder = new PlanBuilderImpl();
    }

    @Test
    void buildDrugDatasetsPlan_chainsThreeSteps() {
        QueryPlan plan = planBuilder.buildDrugDatasetsPlan(List.of("methotrexate"), 1000, false);

        assertThat(plan.getId()).startsWith("drug-datasets-");
        assertThat(plan.getSteps()).extracting(QueryStep::getId).containsExactly("step1", "step2", "step3");

        QueryStep step1 = plan.getSteps().get(0);
        assertThat(step1.getIntent().getTask()).isEqualTo(TaskType.ENTITY_RESOLUTION);
        assertThat(step1.getIntent().slotAsList("entity_names")).containsExactly("methotrexate");
        assertThat(step1.getDependsOn()).isEmpty();

        QueryStep step2 = plan.getSteps().get(1);
        assertThat(step2.getSparql()).contains("VALUES ?drug { {{step1.drug_iris}} }");
        assertThat(step2.getDependsOn()).containsExactly("step1");

        QueryStep step3 = plan.getSteps().get(2);
        assertThat(step3.getIntent().getTask()).isEqualTo(TaskType.DATASET_SEARCH);
        assertThat(step3.getIntent().slotAsString("health_conditions")).isEqualTo("{{step2.disease_iris}}");
        assertThat(step3.getIntent().slotAsString("limit")).isEqualTo("500");
        assertThat(step3.getTargetGraphs()).containsExactly("nde");
    }

    @Test
    void buildDrugDatasetsPlan_geoOnly_usesGeoTask() {
        QueryPlan plan = planBuilder.buildDrugDatasetsPlan(List.of("aspirin", " "), null, true);

        QueryStep step3 = plan.getSteps().get(2);
        assertThat(step3.getIntent().getTask()).isEqualTo(TaskType.GEO_DATASET_SEARCH);
        assertThat(step3.getIntent().hasSlot("limit")).isFalse();
    }

    @Test
    void buildDrugDatasetsPlan_withoutNames_throws() {
        assertThatThrownBy(() -> planBuilder.buildDrugDatasetsPlan(List.of(" "), null, false))
                .isInstanceOf(PlanValidationException.class);
    }

    @Test
    void validate_rejectsCycles() {
        QueryStep a = step("a", "b");
        QueryStep b = step("b", "a");

        assertThatThrownBy(() -> planBuilder.validate(plan(a, b)))
                .isInstanceOf(PlanValidationException.class)
                .hasMessageContaining("cycle");
    }

    @Test
    void validate_rejectsPlaceholderInRootStep() {
        QueryStep root = step("root");
        root.setIntent(root.getIntent().toBuilder().slot("health_conditions", SlotValue.of("{{other.iris}}")).build());
        QueryStep other = step("other");

        assertThatThrownBy(() -> planBuilder.validate(plan(root, other)))
                .isInstanceOf(PlanValidationException.class)
                .hasMessageContaining("does not depend on it");
    }

    @Test
    void validate_rejectsUnknownDependencyAndDuplicateIds() {
        assertThatThrownBy(() -> planBuilder.validate(plan(step("a", "missing"))))
                .hasMessageContaining("unknown step 'missing'");
        assertThatThrownBy(() -> planBuilder.validate(plan(step("a"), step("a"))))
                .hasMessageContaining("Duplicate step id 'a'");
    }

    @Test
    void validate_rejectsUsesResultsFromOutsideDependencies() {
        QueryStep a = step("a");
        QueryStep b = step("b");
        b.setUsesResultsFrom("a");

        assertThatThrownBy(() -> planBuilder.validate(plan(a, b)))
                .isInstanceOf(PlanValidationException.class);
    }

    @Test
    void singleStep_wrapsIntent() {
        Intent intent = Intent.builder().task(TaskType.ENTITY_LOOKUP).graph("wikidata").slot("q", SlotValue.of("aspirin")).build();

        QueryPlan plan = planBuilder.singleStep(intent, "/entity aspirin");

        assertThat(plan.getSteps()).hasSize(1);
        assertThat(plan.getSteps().get(0).getTargetGraphs()).containsExactly("wikidata");
        assertThat(plan.getOriginalQuery()).isEqualTo("/entity aspirin");
    }

    static QueryStep step(String id, String... dependsOn) {
        QueryStep step = new QueryStep();
        step.setId(id);
        step.setIntent(Intent.builder().task(TaskType.ENTITY_LOOKUP).slot("q", SlotValue.of(id)).build());
        step.getDependsOn().addAll(List.of(dependsOn));
        return step;
    }

    static QueryPlan plan(QueryStep... steps) {
        QueryPlan plan = new QueryPlan();
        plan.setId("test-plan");
        plan.setSteps(new ArrayList<>(List.of(steps)));
        return plan;
    }
}
