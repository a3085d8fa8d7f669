package com.example.shadowlands.model;

/**
 * How far a choice consequence reaches.
 */
public enum ConsequenceType {
    /** Changes the quest the choice was made in */
    IMMEDIATE,
    /** Faction and relationship changes */
    INTERMEDIATE,
    /** Major story developments */
    LONG_TERM;

    public String key() {
        return name().toLowerCase();
    }

    public static ConsequenceType fromString(String s) {
        if (s == null || s.isEmpty()) return IMMEDIATE;
        try {
            return valueOf(s.toUpperCase().replace("-", "_").replace(" ", "_"));
        } catch (IllegalArgumentException e) {
            return IMMEDIATE;
        }
    }
}
