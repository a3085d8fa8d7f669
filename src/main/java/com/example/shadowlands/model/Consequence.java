package com.example.shadowlands.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * One effect of a quest choice: a type, an action name and the action's parameters.
 */
public record Consequence(ConsequenceType type, String action, Map<String, Object> params) {

    public static final String ADD_OBJECTIVE = "add_objective";
    public static final String REPUTATION_CHANGE = "reputation_change";

    public Consequence {
        type = type != null ? type : ConsequenceType.IMMEDIATE;
        action = action != null ? action : "";
        params = params != null
            ? Collections.unmodifiableMap(new LinkedHashMap<>(params))
            : Collections.emptyMap();
    }

    public String getString(String key, String defaultVal) {
        Object val = params.get(key);
        return val != null ? val.toString() : defaultVal;
    }

    public int getInt(String key, int defaultVal) {
        Object val = params.get(key);
        if (val instanceof Number) return ((Number) val).intValue();
        if (val instanceof String) {
            try { return Integer.parseInt((String) val); } catch (NumberFormatException e) { return defaultVal; }
        }
        return defaultVal;
    }
}
