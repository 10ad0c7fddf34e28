package com.kgagent.service.api;

import com.kgagent.model.Classification;
import com.kgagent.model.ContextPack;

/**
 * Selects the task a question asks for.
 * <p>
 * Implementations must be pure: the same text and pack always give the same classification.
 */
public interface IntentClassifier {

    /**
     * @param text the user's question.
     * @param pack the active context pack; only tasks it declares may be selected.
     * @return the selected task with its confidence. Never null: an unmatched question yields the
     *         fallback task flagged as low confidence.
     */
    Classification classify(String text, ContextPack pack);
}
