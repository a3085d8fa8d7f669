package com.example.shadowlands.config;

import com.example.shadowlands.model.Attributes;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.Yaml;

import java.io.IOException;
import java.io.InputStream;
import java.util.Collections;
import java.util.Map;

/**
 * Engine tuning loaded from a YAML resource (default {@code /engine.yaml}).
 *
 * Layout:
 * <pre>
 * derivation:
 *   health_base: 100
 *   health_per_might: 5
 *   ...
 * combat:
 *   base_hit_chance: 0.85
 *   hit_chance_floor: 0.05
 *   ...
 * character:
 *   might: 12
 *   level: 1
 * quests:
 *   resource: /data/quests.yaml
 * </pre>
 * Absent keys keep their defaults. Out-of-range values fail start-up.
 */
public class EngineConfig {

    private static final Logger logger = LoggerFactory.getLogger(EngineConfig.class);

    public static final String DEFAULT_RESOURCE = "/engine.yaml";
    public static final String DEFAULT_QUEST_RESOURCE = "/data/quests.yaml";

    private final Derivation derivation;
    private final Combat combat;
    private final Attributes defaultAttributes;
    private final int defaultLevel;
    private final String questResource;

    public EngineConfig(Derivation derivation, Combat combat, Attributes defaultAttributes,
                        int defaultLevel, String questResource) {
        this.derivation = derivation;
        this.combat = combat;
        this.defaultAttributes = defaultAttributes;
        this.defaultLevel = defaultLevel;
        this.questResource = questResource;
        validate();
    }

    public static EngineConfig defaults() {
        return new EngineConfig(Derivation.defaults(), Combat.defaults(),
            new Attributes(12, 12, 12, 0), 1, DEFAULT_QUEST_RESOURCE);
    }

    public static EngineConfig load() {
        return load(DEFAULT_RESOURCE);
    }

    /**
     * Load from a classpath resource. A missing resource yields the defaults.
     */
    @SuppressWarnings("unchecked")
    public static EngineConfig load(String resourcePath) {
        try (InputStream in = EngineConfig.class.getResourceAsStream(resourcePath)) {
            if (in == null) {
                logger.warn("Engine config {} not found, using defaults", resourcePath);
                return defaults();
            }
            Map<String, Object> root = new Yaml().load(in);
            if (root == null) root = Collections.emptyMap();

            Map<String, Object> d = section(root, "derivation");
            Derivation dd = Derivation.defaults();
            Derivation derivation = new Derivation(
                getInt(d, "health_base", dd.healthBase),
                getInt(d, "health_per_might", dd.healthPerMight),
                getInt(d, "health_per_will", dd.healthPerWill),
                getInt(d, "health_per_level", dd.healthPerLevel),
                getInt(d, "mana_base", dd.manaBase),
                getInt(d, "mana_per_intellect", dd.manaPerIntellect),
                getInt(d, "mana_per_level", dd.manaPerLevel),
                getInt(d, "accuracy_per_might", dd.accuracyPerMight),
                getInt(d, "accuracy_per_shadow", dd.accuracyPerShadow),
                getInt(d, "accuracy_per_level", dd.accuracyPerLevel),
                getInt(d, "evasion_per_shadow", dd.evasionPerShadow),
                getInt(d, "evasion_per_will", dd.evasionPerWill),
                getInt(d, "evasion_per_level", dd.evasionPerLevel),
                getInt(d, "attack_power_per_might", dd.attackPowerPerMight),
                getInt(d, "attack_power_per_shadow", dd.attackPowerPerShadow),
                getInt(d, "corruption_resistance_per_will", dd.corruptionResistancePerWill),
                getInt(d, "base_action_points", dd.baseActionPoints),
                getInt(d, "action_point_threshold", dd.actionPointThreshold));

            Map<String, Object> c = section(root, "combat");
            Combat cd = Combat.defaults();
            Combat combat = new Combat(
                getDouble(c, "base_hit_chance", cd.baseHitChance),
                getDouble(c, "accuracy_step", cd.accuracyStep),
                getDouble(c, "hit_chance_floor", cd.hitChanceFloor),
                getDouble(c, "hit_chance_ceiling", cd.hitChanceCeiling));

            Map<String, Object> ch = section(root, "character");
            Attributes attrs = new Attributes(
                getInt(ch, "might", 12),
                getInt(ch, "intellect", 12),
                getInt(ch, "will", 12),
                getInt(ch, "shadow", 0));
            int level = getInt(ch, "level", 1);

            Map<String, Object> q = section(root, "quests");
            String questResource = getString(q, "resource", DEFAULT_QUEST_RESOURCE);

            EngineConfig config = new EngineConfig(derivation, combat, attrs, level, questResource);
            logger.info("Loaded engine config from {}", resourcePath);
            return config;
        } catch (IOException e) {
            throw new IllegalStateException("Failed to read engine config " + resourcePath, e);
        }
    }

    private void validate() {
        if (defaultLevel < 1) {
            throw new IllegalStateException("Default character level must be at least 1, got " + defaultLevel);
        }
        if (defaultAttributes.hasNegative()) {
            throw new IllegalStateException("Default attributes must be non-negative: " + defaultAttributes);
        }
        derivation.validate();
        combat.validate();
    }

    public Derivation getDerivation() { return derivation; }
    public Combat getCombat() { return combat; }
    public Attributes getDefaultAttributes() { return defaultAttributes; }
    public int getDefaultLevel() { return defaultLevel; }
    public String getQuestResource() { return questResource; }

    // YAML helper methods
    @SuppressWarnings("unchecked")
    private static Map<String, Object> section(Map<String, Object> root, String key) {
        Object val = root.get(key);
        return val instanceof Map ? (Map<String, Object>) val : Collections.emptyMap();
    }

    private static String getString(Map<String, Object> map, String key, String defaultVal) {
        Object val = map.get(key);
        return val != null ? val.toString() : defaultVal;
    }

    private static int getInt(Map<String, Object> map, String key, int defaultVal) {
        Object val = map.get(key);
        if (val instanceof Number) return ((Number) val).intValue();
        if (val instanceof String) {
            try { return Integer.parseInt((String) val); } catch (NumberFormatException e) {
                throw new IllegalStateException("Config key " + key + " is not an integer: " + val, e);
            }
        }
        return defaultVal;
    }

    private static double getDouble(Map<String, Object> map, String key, double defaultVal) {
        Object val = map.get(key);
        if (val instanceof Number) return ((Number) val).doubleValue();
        if (val instanceof String) {
            try { return Double.parseDouble((String) val); } catch (NumberFormatException e) {
                throw new IllegalStateException("Config key " + key + " is not a number: " + val, e);
            }
        }
        return defaultVal;
    }

    /**
     * Coefficients for deriving combat statistics. All non-negative, which keeps every
     * derived value monotonic in its contributing attributes and level.
     */
    public static class Derivation {
        public final int healthBase;
        public final int healthPerMight;
        public final int healthPerWill;
        public final int healthPerLevel;
        public final int manaBase;
        public final int manaPerIntellect;
        public final int manaPerLevel;
        public final int accuracyPerMight;
        public final int accuracyPerShadow;
        public final int accuracyPerLevel;
        public final int evasionPerShadow;
        public final int evasionPerWill;
        public final int evasionPerLevel;
        public final int attackPowerPerMight;
        public final int attackPowerPerShadow;
        public final int corruptionResistancePerWill;
        public final int baseActionPoints;
        /** Might or intellect at or above this grants one extra action point each */
        public final int actionPointThreshold;

        public Derivation(int healthBase, int healthPerMight, int healthPerWill, int healthPerLevel,
                          int manaBase, int manaPerIntellect, int manaPerLevel,
                          int accuracyPerMight, int accuracyPerShadow, int accuracyPerLevel,
                          int evasionPerShadow, int evasionPerWill, int evasionPerLevel,
                          int attackPowerPerMight, int attackPowerPerShadow,
                          int corruptionResistancePerWill, int baseActionPoints, int actionPointThreshold) {
            this.healthBase = healthBase;
            this.healthPerMight = healthPerMight;
            this.healthPerWill = healthPerWill;
            this.healthPerLevel = healthPerLevel;
            this.manaBase = manaBase;
            this.manaPerIntellect = manaPerIntellect;
            this.manaPerLevel = manaPerLevel;
            this.accuracyPerMight = accuracyPerMight;
            this.accuracyPerShadow = accuracyPerShadow;
            this.accuracyPerLevel = accuracyPerLevel;
            this.evasionPerShadow = evasionPerShadow;
            this.evasionPerWill = evasionPerWill;
            this.evasionPerLevel = evasionPerLevel;
            this.attackPowerPerMight = attackPowerPerMight;
            this.attackPowerPerShadow = attackPowerPerShadow;
            this.corruptionResistancePerWill = corruptionResistancePerWill;
            this.baseActionPoints = baseActionPoints;
            this.actionPointThreshold = actionPointThreshold;
        }

        public static Derivation defaults() {
            return new Derivation(100, 5, 2, 10,
                50, 3, 5,
                2, 1, 2,
                2, 1, 2,
                2, 1,
                2, 3, 15);
        }

        void validate() {
            int[] values = {
                healthBase, healthPerMight, healthPerWill, healthPerLevel,
                manaBase, manaPerIntellect, manaPerLevel,
                accuracyPerMight, accuracyPerShadow, accuracyPerLevel,
                evasionPerShadow, evasionPerWill, evasionPerLevel,
                attackPowerPerMight, attackPowerPerShadow,
                corruptionResistancePerWill, baseActionPoints, actionPointThreshold
            };
            for (int v : values) {
                if (v < 0) {
                    throw new IllegalStateException("Derivation coefficients must be non-negative, found " + v);
                }
            }
        }
    }

    /**
     * Hit chance tuning. The chance is always clamped into [floor, ceiling].
     */
    public static class Combat {
        public final double baseHitChance;
        /** Hit chance gained per point of accuracy over evasion */
        public final double accuracyStep;
        public final double hitChanceFloor;
        public final double hitChanceCeiling;

        public Combat(double baseHitChance, double accuracyStep, double hitChanceFloor, double hitChanceCeiling) {
            this.baseHitChance = baseHitChance;
            this.accuracyStep = accuracyStep;
            this.hitChanceFloor = hitChanceFloor;
            this.hitChanceCeiling = hitChanceCeiling;
        }

        public static Combat defaults() {
            return new Combat(0.85, 0.01, 0.05, 0.95);
        }

        void validate() {
            if (hitChanceFloor < 0.0 || hitChanceCeiling > 1.0 || hitChanceFloor > hitChanceCeiling) {
                throw new IllegalStateException(String.format(
                    "Hit chance bounds must satisfy 0 <= floor <= ceiling <= 1, got [%.2f, %.2f]",
                    hitChanceFloor, hitChanceCeiling));
            }
            if (accuracyStep < 0.0) {
                throw new IllegalStateException("accuracy_step must be non-negative, got " + accuracyStep);
            }
        }
    }
}
