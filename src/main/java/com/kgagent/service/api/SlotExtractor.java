package com.kgagent.service.api;

import com.kgagent.model.Intent;

/**
 * Deterministically extracts slot values from free text.
 */
public interface SlotExtractor {

    /**
     * Returns a copy of {@code intent} with every slot recognized in {@code text} bound, except
     * slots the intent already holds: existing values always win.
     */
    Intent extract(String text, Intent intent);
}
