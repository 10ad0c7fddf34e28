package com.kgagent.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Arrays;

/**
 * The closed catalog of query tasks the planner knows how to compile.
 * <p>
 * Context packs refer to tasks by their wire id (e.g. {@code "dataset_search"}); everywhere
 * else in the code base the enum constant is used so that dispatch over tasks is checked
 * by the compiler.
 */
public enum TaskType {

    DATASET_SEARCH("dataset_search"),
    GEO_DATASET_SEARCH("geo_dataset_search"),
    ENTITY_LOOKUP("entity_lookup"),
    ENTITY_RESOLUTION("entity_resolution"),
    RAW_SPARQL("raw_sparql"),
    GENE_EXPRESSION_DATASET_SEARCH("gene_expression_dataset_search"),
    GENES_IN_EXPERIMENT("gene_expression_genes_in_experiment"),
    EXPERIMENTS_FOR_GENE("gene_expression_experiments_for_gene"),
    GENE_CROSS_DATASET_SUMMARY("gene_expression_gene_cross_dataset_summary"),
    GENES_AGREEMENT("gene_expression_genes_agreement"),
    GENES_DISCORDANCE("gene_expression_genes_discordance");

    private final String id;

    TaskType(String id) {
        this.id = id;
    }

    @JsonValue
    public String getId() {
        return id;
    }

    /**
     * @return true for the Gene Expression Atlas family of tasks.
     */
    public boolean isGeneExpression() {
        return id.startsWith("gene_expression_");
    }

    @JsonCreator
    public static TaskType fromId(String id) {
        return Arrays.stream(values())
                .filter(t -> t.id.equalsIgnoreCase(id) || t.name().equalsIgnoreCase(id))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Unknown task: " + id));
    }

    @Override
    public String toString() {
        return id;
    }
}
