package com.example.shadowlands.model;

/**
 * Quest classification.
 */
public enum QuestType {
    MAIN_CAMPAIGN,
    CHARACTER_PERSONAL,
    FACTION_POLITICAL,
    EXPLORATION_DISCOVERY,
    DYNAMIC_GENERATED;

    public String key() {
        return name().toLowerCase();
    }

    public static QuestType fromString(String s) {
        if (s == null || s.isEmpty()) return MAIN_CAMPAIGN;
        try {
            return valueOf(s.toUpperCase().replace("-", "_").replace(" ", "_"));
        } catch (IllegalArgumentException e) {
            return MAIN_CAMPAIGN;
        }
    }
}
