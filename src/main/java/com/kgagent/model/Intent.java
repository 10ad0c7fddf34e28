package com.kgagent.model;

import java.util.List;
import java.util.Map;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

/**
 * The classified task of one query operation together with its resolved parameters.
 * <p>
 * An Intent is immutable: extraction, refinement and placeholder resolution each produce a new
 * value through {@link #toBuilder()} or the {@code with*} helpers. The slot map keeps insertion
 * order so that compiled queries are deterministic.
 */
@Value
@Builder(toBuilder = true)
public class Intent {

    TaskType task;

    String packId;

    @Builder.Default
    GraphMode graphMode = GraphMode.FEDERATED;

    @Singular
    List<String> graphs;

    @Singular
    Map<String, SlotValue> slots;

    double confidence;

    @Builder.Default
    String notes = "";

    public SlotValue getSlot(String name) {
        return slots.get(name);
    }

    /**
     * @return true if the slot is bound to a non-blank value.
     */
    public boolean hasSlot(String name) {
        SlotValue value = slots.get(name);
        return value != null && !value.isBlank();
    }

    public String slotAsString(String name) {
        SlotValue value = slots.get(name);
        return value == null ? null : value.asString();
    }

    public List<String> slotAsList(String name) {
        SlotValue value = slots.get(name);
        return value == null ? List.of() : value.asList();
    }

    /**
     * Returns a copy with the slot bound, unless the slot already holds a non-blank value.
     */
    public Intent withSlotIfAbsent(String name, SlotValue value) {
        if (hasSlot(name)) {
            return this;
        }
        return toBuilder().slot(name, value).build();
    }

    /**
     * Returns a copy with {@code note} appended to the provenance notes.
     */
    public Intent withNote(String note) {
        String combined = notes == null || notes.isBlank() ? note : notes + " | " + note;
        return toBuilder().notes(combined).build();
    }
}
