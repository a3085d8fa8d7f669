package com.example.shadowlands.util;

import com.example.shadowlands.config.EngineConfig;
import com.example.shadowlands.error.EngineException;
import com.example.shadowlands.error.ErrorKind;
import com.example.shadowlands.model.Attributes;
import com.example.shadowlands.model.DerivedAttributes;

/**
 * Derives combat statistics from base attributes and level.
 *
 * Formulas (default coefficients):
 *   health     = 100 + might * 5 + will * 2 + level * 10
 *   mana       = 50 + intellect * 3 + level * 5
 *   accuracy   = might * 2 + shadow + level * 2
 *   evasion    = shadow * 2 + will + level * 2
 *   mitigation = (might + will) / 2
 *   attack     = might * 2 + shadow
 *   corruption resistance = will * 2 + level
 *   action points = 3, +1 at might >= 15, +1 at intellect >= 15
 *
 * Pure and deterministic. Coefficients are non-negative, so raising an attribute or the
 * level never lowers a value it feeds into. Values saturate at Integer.MAX_VALUE.
 */
public class AttributeDeriver {

    private static final int MITIGATION_DIVISOR = 2;

    private final EngineConfig.Derivation coefficients;

    public AttributeDeriver() {
        this(EngineConfig.Derivation.defaults());
    }

    public AttributeDeriver(EngineConfig.Derivation coefficients) {
        this.coefficients = coefficients;
    }

    /**
     * @param attributes base attributes, all non-negative
     * @param level character level, at least 1
     * @return the derived statistics
     * @throws EngineException INVALID_ATTRIBUTES or INVALID_LEVEL
     */
    public DerivedAttributes derive(Attributes attributes, int level) {
        if (attributes == null) {
            throw EngineException.of(ErrorKind.INVALID_ATTRIBUTES, "Attributes are required");
        }
        if (attributes.hasNegative()) {
            throw EngineException.of(ErrorKind.INVALID_ATTRIBUTES, "Attributes must be non-negative: %s", attributes);
        }
        if (level < 1) {
            throw EngineException.of(ErrorKind.INVALID_LEVEL, "Level must be at least 1, got %d", level);
        }
        EngineConfig.Derivation c = coefficients;
        int might = attributes.might();
        int intellect = attributes.intellect();
        int will = attributes.will();
        int shadow = attributes.shadow();

        int health = sum(c.healthBase, term(might, c.healthPerMight), term(will, c.healthPerWill),
            term(level, c.healthPerLevel));
        int mana = sum(c.manaBase, term(intellect, c.manaPerIntellect), term(level, c.manaPerLevel));
        int accuracy = sum(term(might, c.accuracyPerMight), term(shadow, c.accuracyPerShadow),
            term(level, c.accuracyPerLevel));
        int evasion = sum(term(shadow, c.evasionPerShadow), term(will, c.evasionPerWill),
            term(level, c.evasionPerLevel));
        int mitigation = (int) (((long) might + will) / MITIGATION_DIVISOR);
        int attackPower = sum(term(might, c.attackPowerPerMight), term(shadow, c.attackPowerPerShadow));
        int corruptionResistance = sum(term(will, c.corruptionResistancePerWill), level);

        int actionPoints = c.baseActionPoints;
        if (might >= c.actionPointThreshold) actionPoints++;
        if (intellect >= c.actionPointThreshold) actionPoints++;

        return new DerivedAttributes(health, mana, accuracy, evasion, mitigation, attackPower,
            corruptionResistance, actionPoints);
    }

    private static int term(int value, int coefficient) {
        return saturate((long) value * coefficient);
    }

    private static int sum(int... terms) {
        long total = 0;
        for (int t : terms) total += t;
        return saturate(total);
    }

    private static int saturate(long value) {
        return (int) Math.max(Integer.MIN_VALUE, Math.min(Integer.MAX_VALUE, value));
    }
}
