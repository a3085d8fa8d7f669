package com.example.shadowlands.model;

import java.util.List;

/**
 * What claiming a quest's rewards changed on the character.
 */
public record RewardResult(String questId, List<RewardDef> rewards, int experienceGained,
                           int previousLevel, int newLevel) {

    public RewardResult {
        rewards = List.copyOf(rewards);
    }

    public boolean leveledUp() {
        return newLevel > previousLevel;
    }
}
