package com.example.shadowlands.model;

/**
 * Snapshot of a choice inside a quest instance.
 */
public record QuestChoice(String choiceId, String description, boolean made, boolean consequencesApplied) {

    public static QuestChoice from(ChoiceDef def) {
        return new QuestChoice(def.choiceId(), def.description(), false, false);
    }

    public QuestChoice markMade() {
        return new QuestChoice(choiceId, description, true, true);
    }
}
