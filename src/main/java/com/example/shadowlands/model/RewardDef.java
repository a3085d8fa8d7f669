package com.example.shadowlands.model;

/**
 * A reward granted when a completed quest is claimed.
 * For EXPERIENCE the value is an amount; for REPUTATION it is {@code faction:amount};
 * for ITEM and SKILL it is the granted key.
 */
public record RewardDef(RewardType type, String value, String description) {

    public RewardDef {
        type = type != null ? type : RewardType.ITEM;
        value = value != null ? value.trim() : "";
        description = description != null ? description : "";
        switch (type) {
            case EXPERIENCE:
                if (parseAmount(value) < 0) {
                    throw new IllegalArgumentException("experience reward must be a non-negative integer: " + value);
                }
                break;
            case REPUTATION:
                int sep = value.lastIndexOf(':');
                if (sep <= 0) {
                    throw new IllegalArgumentException("reputation reward must look like faction:amount: " + value);
                }
                parseSigned(value.substring(sep + 1));
                break;
            default:
                if (value.isEmpty()) {
                    throw new IllegalArgumentException(type.key() + " reward needs a value");
                }
        }
    }

    public int experienceAmount() {
        return type == RewardType.EXPERIENCE ? parseAmount(value) : 0;
    }

    public String reputationFaction() {
        return type == RewardType.REPUTATION ? value.substring(0, value.lastIndexOf(':')) : "";
    }

    public int reputationAmount() {
        return type == RewardType.REPUTATION ? parseSigned(value.substring(value.lastIndexOf(':') + 1)) : 0;
    }

    private static int parseAmount(String s) {
        try {
            return Integer.parseInt(s);
        } catch (NumberFormatException e) {
            return -1;
        }
    }

    private static int parseSigned(String s) {
        try {
            return Integer.parseInt(s.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("not an amount: " + s, e);
        }
    }
}
