package com.kgagent.service.impl;

import com.kgagent.exception.PlanValidationException;
import com.kgagent.model.GraphMode;
import com.kgagent.model.Intent;
import com.kgagent.model.QueryPlan;
import com.kgagent.model.QueryStep;
import com.kgagent.model.SlotValue;
import com.kgagent.model.TaskType;
import com.kgagent.service.api.PlanBuilder;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

/**
 * Assembles fixed-shape plans and checks plan structure before execution.
 */
@Service
@Slf4j
public class PlanBuilderImpl implements PlanBuilder {

    static final int MAX_DATASET_RESULTS = 500;

    /**
     * Diseases treated by the resolved drugs, with their MONDO mapping (P5270).
     */
    static final String WIKIDATA_DRUG_TO_DISEASES = """
            PREFIX wd: <http://www.wikidata.org/entity/>
            PREFIX wdt: <http://www.wikidata.org/prop/direct/>
            PREFIX wdtn: <http://www.wikidata.org/prop/direct-normalized/>
            PREFIX rdfs: <http://www.w3.org/2000/01/rdf-schema#>

            SELECT DISTINCT ?disease ?diseaseLabel ?mondo_id ?mondoIRI
            FROM <https://purl.org/okn/frink/kg/wikidata>
            WHERE {
              VALUES ?drug { {{step1.drug_iris}} }
              ?drug wdt:P2175 ?disease .
              ?disease rdfs:label ?diseaseLabel .
              FILTER(LANG(?diseaseLabel) = "en")
              OPTIONAL { ?disease wdt:P5270 ?mondo_id . }
              OPTIONAL { ?disease wdtn:P5270 ?mondoIRI . }
            }
            LIMIT 50""";

    @Value("${kgagent.packs.default-pack:wobd}")
    private String packId = "wobd";

    @Override
    public QueryPlan buildDrugDatasetsPlan(List<String> drugNames, Integer maxResults, boolean geoOnly) {
        List<String> names = drugNames == null ? List.of() : drugNames.stream()
                .map(String::trim)
                .filter(name -> !name.isEmpty())
                .distinct()
                .toList();
        if (names.isEmpty()) {
            throw new PlanValidationException("At least one drug name is required.");
        }

        QueryStep resolve = new QueryStep();
        resolve.setId("step1");
        resolve.setDescription(names.size() == 1
                ? "Resolve drug \"" + names.get(0) + "\" to Wikidata IRI"
                : "Resolve " + names.size() + " drugs to Wikidata IRIs");
        resolve.setTargetGraphs(List.of("wikidata"));
        resolve.setIntent(stepIntent(TaskType.ENTITY_RESOLUTION, "wikidata")
                .slot("entity_type", SlotValue.of("drug"))
                .slot("entity_name", SlotValue.of(names.get(0)))
                .slot("entity_names", SlotValue.of(names))
                .slot("target_ontology", SlotValue.of("Wikidata"))
                .build());
        resolve.getExports().put("drug_iris", "drug");

        QueryStep diseases = new QueryStep();
        diseases.setId("step2");
        diseases.setDescription("Find diseases treated by the drug in Wikidata with MONDO IDs");
        diseases.setTargetGraphs(List.of("wikidata"));
        diseases.setIntent(stepIntent(TaskType.RAW_SPARQL, "wikidata").build());
        diseases.setSparql(WIKIDATA_DRUG_TO_DISEASES);
        diseases.getDependsOn().add("step1");
        diseases.setUsesResultsFrom("step1");
        diseases.getExports().put("disease_iris", "mondoIRI");

        QueryStep datasets = new QueryStep();
        datasets.setId("step3");
        datasets.setDescription(geoOnly
                ? "Query NDE GEO datasets for diseases from step 2"
                : "Query NDE datasets for diseases from step 2");
        datasets.setTargetGraphs(List.of("nde"));
        Intent.IntentBuilder datasetIntent = stepIntent(geoOnly ? TaskType.GEO_DATASET_SEARCH : TaskType.DATASET_SEARCH, "nde")
                .slot("health_conditions", SlotValue.of("{{step2.disease_iris}}"));
        if (maxResults != null && maxResults > 0) {
            datasetIntent.slot("limit", SlotValue.of(Math.min(maxResults, MAX_DATASET_RESULTS)));
        }
        datasets.setIntent(datasetIntent.build());
        datasets.getDependsOn().add("step2");
        datasets.setUsesResultsFrom("step2");

        QueryPlan plan = new QueryPlan();
        plan.setId("drug-datasets-" + System.currentTimeMillis());
        plan.setSteps(new ArrayList<>(List.of(resolve, diseases, datasets)));
        plan.setOriginalQuery("Find datasets about diseases treated by " + String.join(", ", names));
        plan.setGraphRoutingRationale("Fixed drug→disease→datasets pipeline: Wikidata resolves drugs and "
                + "their indications, NDE holds the datasets.");

        validate(plan);
        log.info("Built plan {} with {} steps", plan.getId(), plan.getSteps().size());
        return plan;
    }

    @Override
    public QueryPlan singleStep(Intent intent, String originalQuery) {
        QueryStep step = new QueryStep();
        step.setId("step1");
        step.setDescription("Answer with task " + intent.getTask());
        step.setIntent(intent);
        step.setTargetGraphs(new ArrayList<>(intent.getGraphs()));

        QueryPlan plan = new QueryPlan();
        plan.setId(intent.getTask() + "-" + System.currentTimeMillis());
        plan.setSteps(new ArrayList<>(List.of(step)));
        plan.setOriginalQuery(originalQuery);
        plan.setGraphRoutingRationale("Single " + intent.getGraphMode().name().toLowerCase()
                + " query against " + String.join(", ", intent.getGraphs()));
        validate(plan);
        return plan;
    }

    @Override
    public void validate(QueryPlan plan) {
        if (plan.getSteps() == null || plan.getSteps().isEmpty()) {
            throw new PlanValidationException("Plan " + plan.getId() + " has no steps.");
        }

        Map<String, QueryStep> byId = new HashMap<>();
        for (QueryStep step : plan.getSteps()) {
            if (step.getId() == null || step.getId().isBlank()) {
                throw new PlanValidationException("Plan " + plan.getId() + " has a step without an id.");
            }
            if (byId.put(step.getId(), step) != null) {
                throw new PlanValidationException("Duplicate step id '" + step.getId() + "'.");
            }
            if (step.getIntent() == null && step.getSparql() == null) {
                throw new PlanValidationException("Step '" + step.getId() + "' has neither an intent nor a query.");
            }
        }

        for (QueryStep step : plan.getSteps()) {
            for (String dependency : step.getDependsOn()) {
                if (!byId.containsKey(dependency)) {
                    throw new PlanValidationException("Step '" + step.getId() + "' depends on unknown step '" + dependency + "'.");
                }
            }
            String upstream = step.getUsesResultsFrom();
            if (upstream != null && !step.getDependsOn().contains(upstream)) {
                throw new PlanValidationException("Step '" + step.getId() + "' uses results from '" + upstream
                        + "' but does not depend on it.");
            }
            for (String referenced : referencedSteps(step)) {
                if (!step.getDependsOn().contains(referenced)) {
                    throw new PlanValidationException("Step '" + step.getId() + "' has a placeholder for '" + referenced
                            + "' but does not depend on it.");
                }
            }
        }

        checkAcyclic(plan, byId);
    }

    /**
     * Kahn's algorithm: a plan is acyclic iff every step can be removed in dependency order.
     */
    private static void checkAcyclic(QueryPlan plan, Map<String, QueryStep> byId) {
        Map<String, Integer> inDegree = new HashMap<>();
        Map<String, List<String>> dependents = new HashMap<>();
        for (QueryStep step : plan.getSteps()) {
            inDegree.put(step.getId(), step.getDependsOn().size());
            for (String dependency : step.getDependsOn()) {
                dependents.computeIfAbsent(dependency, k -> new ArrayList<>()).add(step.getId());
            }
        }

        Deque<String> ready = new ArrayDeque<>();
        inDegree.forEach((id, degree) -> {
            if (degree == 0) {
                ready.add(id);
            }
        });
        Set<String> visited = new HashSet<>();
        while (!ready.isEmpty()) {
            String id = ready.poll();
            visited.add(id);
            for (String dependent : dependents.getOrDefault(id, List.of())) {
                if (inDegree.merge(dependent, -1, Integer::sum) == 0) {
                    ready.add(dependent);
                }
            }
        }
        if (visited.size() != byId.size()) {
            Set<String> cyclic = new LinkedHashSet<>(byId.keySet());
            cyclic.removeAll(visited);
            throw new PlanValidationException("Plan " + plan.getId() + " has a dependency cycle among steps " + cyclic + ".");
        }
    }

    private static Set<String> referencedSteps(QueryStep step) {
        Set<String> referenced = new LinkedHashSet<>(PlaceholderInterpolator.referencedSteps(step.getSparql()));
        if (step.getIntent() != null) {
            step.getIntent().getSlots().values().stream()
                    .flatMap(value -> value.asList().stream())
                    .forEach(value -> referenced.addAll(PlaceholderInterpolator.referencedSteps(value)));
        }
        return referenced;
    }

    private Intent.IntentBuilder stepIntent(TaskType task, String graph) {
        return Intent.builder()
                .task(task)
                .packId(packId)
                .graphMode(GraphMode.FEDERATED)
                .graph(graph)
                .confidence(1.0);
    }
}
