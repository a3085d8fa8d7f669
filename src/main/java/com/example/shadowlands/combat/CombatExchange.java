package com.example.shadowlands.combat;

/**
 * Result of a single attack. Both fields of the core outcome are always present;
 * {@code damageDealt} is 0 on a miss and never negative.
 *
 * The remaining fields record how the outcome was reached.
 */
public record CombatExchange(
    boolean hitSuccess,
    int damageDealt,
    double hitChance,
    double roll,
    int rawDamage,
    int reduction
) {

    public static CombatExchange hit(int damage, double hitChance, double roll, int rawDamage, int reduction) {
        return new CombatExchange(true, damage, hitChance, roll, rawDamage, reduction);
    }

    public static CombatExchange miss(double hitChance, double roll, int rawDamage, int reduction) {
        return new CombatExchange(false, 0, hitChance, roll, rawDamage, reduction);
    }
}
