package com.kgagent.service.impl;

import com.kgagent.model.Intent;
import com.kgagent.model.RefinementResult;
import com.kgagent.model.SlotValue;
import com.kgagent.model.TaskDefinition;
import com.kgagent.service.api.SlotRefiner;
import java.util.List;
import java.util.Map;
import java.util.Set;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Refinement without external calls. Fills a scalar slot from its list counterpart (and the other
 * way round) when the task accepts both, e.g. {@code gene_symbol} from {@code gene_symbols}.
 */
@Component
@Slf4j
public class DeterministicSlotRefiner implements SlotRefiner {

    private static final Map<String, String> SCALAR_TO_LIST = Map.of(
            "gene_symbol", "gene_symbols",
            "entity_name", "entity_names");

    @Override
    public RefinementResult refine(String text, Intent intent, TaskDefinition task) {
        Set<String> accepted = task.acceptedSlots();
        Intent refined = intent;

        for (Map.Entry<String, String> pair : SCALAR_TO_LIST.entrySet()) {
            String scalar = pair.getKey();
            String list = pair.getValue();
            if (accepted.contains(scalar) && !refined.hasSlot(scalar) && refined.hasSlot(list)) {
                refined = refined.withSlotIfAbsent(scalar, SlotValue.of(refined.slotAsList(list).get(0)));
            }
            if (accepted.contains(list) && !refined.hasSlot(list) && refined.hasSlot(scalar)) {
                refined = refined.withSlotIfAbsent(list, SlotValue.of(List.of(refined.slotAsString(scalar))));
            }
        }

        if (refined == intent) {
            return RefinementResult.unchanged(intent);
        }
        log.debug("Derived slots for {}: {}", task.getId(), refined.getSlots().keySet());
        return new RefinementResult(refined, true, null);
    }
}
