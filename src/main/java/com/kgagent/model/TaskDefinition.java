package com.kgagent.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import lombok.Data;

/**
 * A task as declared by a context pack: which slots it accepts, where it runs by default, and
 * whether the LLM refiner may fill its slots.
 */
@Data
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
@JsonIgnoreProperties(ignoreUnknown = true)
public class TaskDefinition {

    private TaskType id;

    private String description;

    private List<String> requiredSlots = new ArrayList<>();

    private List<String> optionalSlots = new ArrayList<>();

    /**
     * Required slot name to slots that satisfy the requirement in its place,
     * e.g. {@code keywords -> [health_conditions]}.
     */
    private Map<String, List<String>> slotAlternatives = new LinkedHashMap<>();

    private List<String> defaultGraphs = new ArrayList<>();

    private GraphMode graphMode = GraphMode.FEDERATED;

    private boolean llmAssistable;

    /**
     * Output schema offered to the LLM refiner: slot name to {@code string}, {@code string[]} or {@code integer}.
     */
    private Map<String, String> llmSchema = new LinkedHashMap<>();

    /**
     * @return the required slots that are neither bound nor covered by a bound alternative.
     */
    public List<String> missingRequiredSlots(Intent intent) {
        return requiredSlots.stream()
                .filter(slot -> !intent.hasSlot(slot)
                        && slotAlternatives.getOrDefault(slot, List.of()).stream().noneMatch(intent::hasSlot))
                .toList();
    }

    public Set<String> acceptedSlots() {
        Set<String> accepted = new LinkedHashSet<>(requiredSlots);
        accepted.addAll(optionalSlots);
        return accepted;
    }
}
