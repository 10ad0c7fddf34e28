package com.kgagent.service.api;

import com.kgagent.model.Intent;
import com.kgagent.model.QueryPlan;
import java.util.List;

/**
 * Builds query plans. Plans are only assembled here; nothing is executed.
 */
public interface PlanBuilder {

    /**
     * Builds the drug to disease to dataset plan: resolve drug names in Wikidata, find the
     * diseases they treat, then search NDE for datasets about those diseases.
     *
     * @param drugNames  one or more drug names.
     * @param maxResults row limit of the dataset step, capped; null for the default.
     * @param geoOnly    restrict the dataset step to NCBI GEO datasets.
     */
    QueryPlan buildDrugDatasetsPlan(List<String> drugNames, Integer maxResults, boolean geoOnly);

    /**
     * Wraps a single intent into a one-step plan.
     */
    QueryPlan singleStep(Intent intent, String originalQuery);

    /**
     * Checks the plan's structural invariants: unique step ids, known and acyclic dependencies,
     * {@code usesResultsFrom} among the dependencies, and no placeholders in root steps.
     *
     * @throws com.kgagent.exception.PlanValidationException if an invariant is violated.
     */
    void validate(QueryPlan plan);
}
