package com.example.shadowlands.model;

public enum RewardType {
    EXPERIENCE,
    ITEM,
    SKILL,
    REPUTATION;

    public String key() {
        return name().toLowerCase();
    }

    public static RewardType fromString(String s) {
        if (s == null || s.isEmpty()) return ITEM;
        try {
            return valueOf(s.toUpperCase().replace("-", "_").replace(" ", "_"));
        } catch (IllegalArgumentException e) {
            return ITEM;
        }
    }
}
