package com.example.shadowlands.model;

/**
 * Outcome of adding progress to an objective. The two flags are true only on the
 * call that caused the transition.
 */
public record AdvanceResult(String questId, String objectiveId,
                            boolean objectiveCompleted, boolean questCompleted,
                            int currentProgress, int targetCount) {
}
