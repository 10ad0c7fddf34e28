package com.kgagent.service.impl;

import com.fasterxml.jackson.databind.JsonNode;
import com.kgagent.config.KgAgentProperties;
import com.kgagent.dto.llm.LlmMessage;
import com.kgagent.exception.KgAgentException;
import com.kgagent.model.Intent;
import com.kgagent.model.RefinementResult;
import com.kgagent.model.SlotValue;
import com.kgagent.model.TaskDefinition;
import com.kgagent.service.api.LlmClient;
import com.kgagent.service.api.SlotRefiner;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Asks the LLM for the task's schema fields after the deterministic refiner ran.
 * <p>
 * Answers are validated field by field against the task's {@code llm_schema}; values of the
 * wrong type are dropped. Only unbound slots are filled. Any failure degrades to the
 * deterministic result with an error annotation.
 */
@Component
@Slf4j
public class LlmSlotRefiner implements SlotRefiner {

    private final DeterministicSlotRefiner deterministic;
    private final LlmClient llmClient;
    private final KgAgentProperties properties;

    public LlmSlotRefiner(DeterministicSlotRefiner deterministic, LlmClient llmClient, KgAgentProperties properties) {
        this.deterministic = deterministic;
        this.llmClient = llmClient;
        this.properties = properties;
    }

    @Override
    public RefinementResult refine(String text, Intent intent, TaskDefinition task) {
        RefinementResult base = deterministic.refine(text, intent, task);
        Intent current = base.intent();

        if (task.getLlmSchema().isEmpty()) {
            return base;
        }
        if (!llmClient.isConfigured()) {
            log.debug("LLM not configured; keeping deterministic slots for {}", task.getId());
            return base;
        }

        JsonNode answer;
        try {
            answer = llmClient.completeJson(buildMessages(text, current, task), properties.getRefiner().getMaxTokens());
        } catch (KgAgentException e) {
            log.warn("LLM slot refinement failed for {}: {}", task.getId(), e.getMessage());
            return RefinementResult.failed(current.withNote("LLM refinement skipped"), e.getMessage());
        }

        Intent refined = current;
        for (Map.Entry<String, String> field : task.getLlmSchema().entrySet()) {
            String slot = field.getKey();
            if (refined.hasSlot(slot) || !answer.has(slot)) {
                continue;
            }
            SlotValue value = convert(answer.get(slot), field.getValue());
            if (value == null) {
                log.debug("Discarding LLM value for '{}': expected {}", slot, field.getValue());
                continue;
            }
            refined = refined.withSlotIfAbsent(slot, value);
        }

        if (refined == current) {
            return base;
        }
        log.info("LLM filled slots for {}", task.getId());
        return new RefinementResult(refined.withNote("slots refined by LLM"), true, null);
    }

    /**
     * @return the value in slot form, or null when the JSON node does not match the declared type.
     */
    static SlotValue convert(JsonNode node, String type) {
        if (node == null || node.isNull()) {
            return null;
        }
        switch (type) {
            case "string":
                return node.isTextual() && !node.asText().isBlank() ? SlotValue.of(node.asText().trim()) : null;
            case "integer":
                if (node.isIntegralNumber() && node.canConvertToInt()) {
                    return SlotValue.of(node.asInt());
                }
                return null;
            case "string[]":
                if (!node.isArray() || node.isEmpty()) {
                    return null;
                }
                List<String> values = new ArrayList<>();
                for (JsonNode element : node) {
                    if (!element.isTextual()) {
                        return null;
                    }
                    if (!element.asText().isBlank()) {
                        values.add(element.asText().trim());
                    }
                }
                return values.isEmpty() ? null : SlotValue.of(values);
            default:
                return null;
        }
    }

    private static List<LlmMessage> buildMessages(String text, Intent intent, TaskDefinition task) {
        String schema = task.getLlmSchema().entrySet().stream()
                .map(e -> "  \"" + e.getKey() + "\": " + e.getValue())
                .collect(Collectors.joining(",\n", "{\n", "\n}"));
        String bound = intent.getSlots().keySet().isEmpty() ? "(none)" : String.join(", ", intent.getSlots().keySet());

        String system = "You extract structured parameters for a SPARQL query template.\n"
                + "Task: " + task.getId() + " (" + task.getDescription() + ")\n\n"
                + "Return ONLY a JSON object. Include only the fields you can determine from the question; omit the rest.\n"
                + "Field types (string, string[] or integer):\n" + schema + "\n\n"
                + "Rules:\n"
                + "- experiment_id: Expression Atlas accession such as E-GEOD-76.\n"
                + "- gene_symbol / gene_symbols: official gene symbols such as DUSP2 or TP53.\n"
                + "- keywords / factor_terms: 1-5 short topic terms, without generic words like 'show' or 'datasets'.\n"
                + "- direction: \"up\" or \"down\".\n"
                + "- limit: integer.\n"
                + "Slots already bound (do not repeat them): " + bound;
        return List.of(LlmMessage.system(system), LlmMessage.user(text));
    }
}
