package com.example.shadowlands.model;

/**
 * Snapshot of one objective's progress inside a quest instance.
 * {@code completed} holds exactly when {@code currentProgress == targetCount}.
 */
public record QuestObjective(String objectiveId, ObjectiveType type, String description,
                             int targetCount, int currentProgress) {

    public QuestObjective {
        currentProgress = Math.max(0, Math.min(currentProgress, targetCount));
    }

    public static QuestObjective from(ObjectiveDef def) {
        return new QuestObjective(def.objectiveId(), def.type(), def.description(), def.targetCount(), 0);
    }

    public boolean completed() {
        return currentProgress == targetCount;
    }

    /**
     * Progress after adding an increment, clamped at the target.
     */
    public QuestObjective advance(int increment) {
        long next = (long) currentProgress + increment;
        return new QuestObjective(objectiveId, type, description, targetCount, (int) Math.min(next, targetCount));
    }

    public double progressPercentage() {
        return currentProgress * 100.0 / targetCount;
    }
}
