package com.example.shadowlands.model;

/**
 * Template-side definition of a countable quest objective.
 */
public record ObjectiveDef(String objectiveId, ObjectiveType type, String description, int targetCount) {

    public ObjectiveDef {
        if (objectiveId == null || objectiveId.isEmpty()) {
            throw new IllegalArgumentException("objective id is required");
        }
        if (targetCount < 1) {
            throw new IllegalArgumentException("target count must be at least 1 for objective " + objectiveId);
        }
        type = type != null ? type : ObjectiveType.INTERACT_NPC;
        description = description != null ? description : "";
    }
}
