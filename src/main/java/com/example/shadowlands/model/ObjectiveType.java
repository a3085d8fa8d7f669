package com.example.shadowlands.model;

public enum ObjectiveType {
    KILL_TARGET,
    COLLECT_ITEM,
    REACH_LOCATION,
    INTERACT_NPC,
    SOLVE_PUZZLE,
    MAKE_CHOICE,
    CRAFT_ITEM,
    SURVIVE_TIME;

    public String key() {
        return name().toLowerCase();
    }

    public static ObjectiveType fromString(String s) {
        if (s == null || s.isEmpty()) return INTERACT_NPC;
        try {
            return valueOf(s.toUpperCase().replace("-", "_").replace(" ", "_"));
        } catch (IllegalArgumentException e) {
            return INTERACT_NPC;
        }
    }
}
