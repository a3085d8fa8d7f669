package com.example.shadowlands.model;

public enum QuestComplexity {
    /** Multi-session, complex narrative */
    EPIC,
    STANDARD,
    /** Short, immediate payoff */
    QUICK;

    public String key() {
        return name().toLowerCase();
    }

    public static QuestComplexity fromString(String s) {
        if (s == null || s.isEmpty()) return STANDARD;
        try {
            return valueOf(s.toUpperCase().replace("-", "_").replace(" ", "_"));
        } catch (IllegalArgumentException e) {
            return STANDARD;
        }
    }
}
