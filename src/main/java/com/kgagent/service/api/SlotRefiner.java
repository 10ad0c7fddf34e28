package com.kgagent.service.api;

import com.kgagent.model.Intent;
import com.kgagent.model.RefinementResult;
import com.kgagent.model.TaskDefinition;

/**
 * A slot-filling strategy applied after deterministic extraction.
 * <p>
 * Refiners only add slots that are still unbound and never fail the pipeline: on error they
 * return the input intent with an error annotation.
 */
public interface SlotRefiner {

    RefinementResult refine(String text, Intent intent, TaskDefinition task);
}
