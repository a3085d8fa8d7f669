package com.example.shadowlands.combat;

import com.example.shadowlands.config.EngineConfig;

/**
 * Combat calculator for hit chance and damage.
 *
 * Hit chance: base + (attacker_accuracy - defender_evasion) * step,
 *             clamped to [floor, ceiling] (default 5%..95%).
 *
 * Damage:     raw       = weapon_damage + attacker_attack_power
 *             reduction = armor_value + defender_mitigation
 *             damage    = max(0, raw - reduction)
 *
 * Sums saturate at Integer.MAX_VALUE instead of wrapping.
 */
public class CombatCalculator {

    private final EngineConfig.Combat settings;

    public CombatCalculator() {
        this(EngineConfig.Combat.defaults());
    }

    public CombatCalculator(EngineConfig.Combat settings) {
        this.settings = settings;
    }

    /**
     * Calculate the chance for an attack to land.
     *
     * @param attackerAccuracy Attacker's accuracy
     * @param defenderEvasion Defender's evasion
     * @return hit chance as a decimal, never outside [floor, ceiling]
     */
    public double calculateHitChance(int attackerAccuracy, int defenderEvasion) {
        double chance = settings.baseHitChance + ((double) attackerAccuracy - defenderEvasion) * settings.accuracyStep;
        return Math.max(settings.hitChanceFloor, Math.min(settings.hitChanceCeiling, chance));
    }

    /**
     * Damage before mitigation.
     */
    public int calculateRawDamage(int weaponDamage, int attackPower) {
        return saturate((long) weaponDamage + attackPower);
    }

    /**
     * Flat reduction from armor plus the defender's own mitigation.
     */
    public int calculateReduction(int armorValue, int defenderMitigation) {
        return saturate((long) armorValue + defenderMitigation);
    }

    /**
     * Damage after mitigation, floored at 0.
     */
    public int calculateDamage(int rawDamage, int reduction) {
        return saturate(Math.max(0L, (long) rawDamage - reduction));
    }

    private static int saturate(long value) {
        return (int) Math.max(Integer.MIN_VALUE, Math.min(Integer.MAX_VALUE, value));
    }
}
