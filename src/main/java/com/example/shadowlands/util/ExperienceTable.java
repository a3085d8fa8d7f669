package com.example.shadowlands.util;

import com.example.shadowlands.error.EngineException;
import com.example.shadowlands.error.ErrorKind;

/**
 * Cumulative experience needed for each level, 1 through {@link #MAX_LEVEL}.
 */
public final class ExperienceTable {

    public static final int MAX_LEVEL = 20;

    // Index 0 = level 1
    private static final int[] THRESHOLDS = {
        0, 100, 250, 450, 700, 1000, 1350, 1750, 2200, 2700,
        3250, 3850, 4500, 5200, 5950, 6750, 7600, 8500, 9450, 10450
    };

    private ExperienceTable() {}

    /**
     * Highest level whose threshold the given experience has reached.
     */
    public static int levelFor(int experience) {
        if (experience < 0) {
            throw EngineException.of(ErrorKind.INVALID_EXPERIENCE, "Experience must be non-negative, got %d", experience);
        }
        for (int level = MAX_LEVEL; level > 1; level--) {
            if (experience >= THRESHOLDS[level - 1]) return level;
        }
        return 1;
    }

    /**
     * Total experience required to reach a level (capped at MAX_LEVEL).
     */
    public static int experienceFor(int level) {
        if (level < 1) {
            throw EngineException.of(ErrorKind.INVALID_LEVEL, "Level must be at least 1, got %d", level);
        }
        return THRESHOLDS[Math.min(level, MAX_LEVEL) - 1];
    }

    /**
     * Experience still missing for the next level, or 0 at the cap.
     */
    public static int experienceToNextLevel(int experience) {
        int level = levelFor(experience);
        if (level >= MAX_LEVEL) return 0;
        return experienceFor(level + 1) - experience;
    }
}
