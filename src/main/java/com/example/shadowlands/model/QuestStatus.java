package com.example.shadowlands.model;

public enum QuestStatus {
    ACTIVE,
    COMPLETED,
    /** Failed or abandoned */
    FAILED;

    public boolean isTerminal() {
        return this != ACTIVE;
    }

    public String key() {
        return name().toLowerCase();
    }
}
