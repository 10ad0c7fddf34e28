package com.kgagent.service.impl;

import com.kgagent.exception.TemplateCompilationException;
import com.kgagent.model.ContextPack;
import com.kgagent.model.Intent;
import com.kgagent.model.SlotValue;
import com.kgagent.model.TaskDefinition;
import com.kgagent.model.TaskType;
import com.kgagent.service.api.TemplateCompiler;
import com.kgagent.template.DatasetSearchTemplate;
import com.kgagent.template.EntityLookupTemplate;
import com.kgagent.template.EntityResolutionTemplate;
import com.kgagent.template.ExperimentsForGenesTemplate;
import com.kgagent.template.GeneCrossDatasetSummaryTemplate;
import com.kgagent.template.GenesAgreementTemplate;
import com.kgagent.template.GenesDiscordanceTemplate;
import com.kgagent.template.GenesInExperimentTemplate;
import com.kgagent.template.GxaCoverageTemplate;
import com.kgagent.template.SparqlTemplate;
import java.util.List;
import java.util.Map;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Compiles intents with the template registered for their task.
 * <p>
 * The task set is closed: {@link #templateFor(TaskType)} switches over every {@link TaskType}, so
 * adding a task without a template does not compile.
 */
@Service
@Slf4j
public class TemplateCompilerImpl implements TemplateCompiler {

    /**
     * Slot carrying the literal query of a {@code raw_sparql} intent.
     */
    public static final String RAW_QUERY_SLOT = "query";

    private final SparqlTemplate datasetSearch = new DatasetSearchTemplate(false);
    private final SparqlTemplate geoDatasetSearch = new DatasetSearchTemplate(true);
    private final SparqlTemplate entityLookup = new EntityLookupTemplate();
    private final SparqlTemplate entityResolution = new EntityResolutionTemplate();
    private final SparqlTemplate rawSparql = (intent, pack) -> intent.slotAsString(RAW_QUERY_SLOT);
    private final SparqlTemplate gxaCoverage = new GxaCoverageTemplate();
    private final SparqlTemplate genesInExperiment = new GenesInExperimentTemplate();
    private final SparqlTemplate experimentsForGenes = new ExperimentsForGenesTemplate();
    private final SparqlTemplate geneCrossDatasetSummary = new GeneCrossDatasetSummaryTemplate();
    private final SparqlTemplate genesAgreement = new GenesAgreementTemplate();
    private final SparqlTemplate genesDiscordance = new GenesDiscordanceTemplate();

    @Override
    public String compile(Intent intent, ContextPack pack) {
        TaskType task = intent.getTask();
        if (task == null) {
            throw new TemplateCompilationException("Intent has no task.");
        }
        TaskDefinition definition = pack.requireTask(task);

        List<String> missing = definition.missingRequiredSlots(intent);
        if (!missing.isEmpty()) {
            throw new TemplateCompilationException(
                    "Missing required slot '" + missing.get(0) + "' for template '" + task + "'");
        }
        if (task == TaskType.RAW_SPARQL && !intent.hasSlot(RAW_QUERY_SLOT)) {
            throw new TemplateCompilationException("Template '" + task + "' needs a literal query.");
        }
        rejectPlaceholders(intent);

        Intent scoped = intent.getGraphs().isEmpty() ? withDefaultGraphs(intent, definition, pack) : intent;
        String query = templateFor(task).render(scoped, pack);
        log.debug("Compiled {} query:\n{}", task, query);
        return query;
    }

    SparqlTemplate templateFor(TaskType task) {
        return switch (task) {
            case DATASET_SEARCH -> datasetSearch;
            case GEO_DATASET_SEARCH -> geoDatasetSearch;
            case ENTITY_LOOKUP -> entityLookup;
            case ENTITY_RESOLUTION -> entityResolution;
            case RAW_SPARQL -> rawSparql;
            case GENE_EXPRESSION_DATASET_SEARCH -> gxaCoverage;
            case GENES_IN_EXPERIMENT -> genesInExperiment;
            case EXPERIMENTS_FOR_GENE -> experimentsForGenes;
            case GENE_CROSS_DATASET_SUMMARY -> geneCrossDatasetSummary;
            case GENES_AGREEMENT -> genesAgreement;
            case GENES_DISCORDANCE -> genesDiscordance;
        };
    }

    private static void rejectPlaceholders(Intent intent) {
        for (Map.Entry<String, SlotValue> slot : intent.getSlots().entrySet()) {
            boolean unresolved = slot.getValue().asList().stream()
                    .anyMatch(value -> value != null && PlaceholderInterpolator.containsPlaceholder(value));
            if (unresolved) {
                throw new TemplateCompilationException("Slot '" + slot.getKey()
                        + "' still contains an unresolved step placeholder: " + slot.getValue());
            }
        }
    }

    private static Intent withDefaultGraphs(Intent intent, TaskDefinition definition, ContextPack pack) {
        List<String> graphs = definition.getDefaultGraphs().isEmpty() ? pack.getDefaultGraphs() : definition.getDefaultGraphs();
        return intent.toBuilder().graphs(graphs).build();
    }
}
