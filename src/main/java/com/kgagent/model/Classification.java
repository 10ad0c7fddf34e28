package com.kgagent.model;

/**
 * Result of intent classification.
 *
 * @param task          the selected task.
 * @param confidence    confidence in [0, 1].
 * @param note          provenance of the decision, e.g. which rule matched.
 * @param lowConfidence true when no rule matched and the fallback task was used.
 */
public record Classification(TaskType task, double confidence, String note, boolean lowConfidence) {
}
