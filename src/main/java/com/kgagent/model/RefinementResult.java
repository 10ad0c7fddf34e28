package com.kgagent.model;

/**
 * Outcome of a slot refinement pass.
 *
 * @param intent  the (possibly) refined intent; the input intent when nothing changed.
 * @param refined true if at least one slot was added.
 * @param error   why refinement degraded to the deterministic slots, or null.
 */
public record RefinementResult(Intent intent, boolean refined, String error) {

    public static RefinementResult unchanged(Intent intent) {
        return new RefinementResult(intent, false, null);
    }

    public static RefinementResult failed(Intent intent, String error) {
        return new RefinementResult(intent, false, error);
    }
}
