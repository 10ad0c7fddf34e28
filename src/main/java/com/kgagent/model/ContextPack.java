package com.kgagent.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import com.kgagent.exception.KgAgentException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import lombok.Data;

/**
 * Read-only configuration for one knowledge-graph context: the graphs and endpoints it can
 * reach, the guardrails applied to generated queries, and the task catalog.
 */
@Data
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
@JsonIgnoreProperties(ignoreUnknown = true)
public class ContextPack {

    private String id;

    private String label;

    private String federationEndpoint;

    private Map<String, GraphEndpoint> graphs = new LinkedHashMap<>();

    private List<String> defaultGraphs = new ArrayList<>();

    private Guardrails guardrails = new Guardrails();

    private List<TaskDefinition> tasks = new ArrayList<>();

    public Optional<TaskDefinition> findTask(TaskType task) {
        return tasks.stream().filter(t -> t.getId() == task).findFirst();
    }

    public TaskDefinition requireTask(TaskType task) {
        return findTask(task).orElseThrow(() ->
                new KgAgentException("Task '" + task + "' is not declared by context pack '" + id + "'."));
    }

    public boolean declares(TaskType task) {
        return findTask(task).isPresent();
    }

    public GraphEndpoint requireGraph(String shortname) {
        GraphEndpoint graph = graphs.get(shortname);
        if (graph == null) {
            throw new KgAgentException("Graph '" + shortname + "' is not known to context pack '" + id + "'.");
        }
        return graph;
    }

    /**
     * Caps a requested row limit by the pack's guardrails, falling back to the default limit.
     */
    public int capLimit(Integer requested) {
        int limit = requested == null || requested <= 0 ? guardrails.getDefaultLimit() : requested;
        return Math.min(limit, guardrails.getMaxLimit());
    }

    @Data
    @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class GraphEndpoint {
        private String iri;
        private String endpoint;
    }

    @Data
    @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Guardrails {
        private int defaultLimit = 100;
        private int maxLimit = 500;
    }
}
