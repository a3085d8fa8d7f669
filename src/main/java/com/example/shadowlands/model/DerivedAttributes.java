package com.example.shadowlands.model;

/**
 * Combat statistics computed from attributes and level. Never set directly.
 */
public record DerivedAttributes(
    int health,
    int mana,
    int accuracy,
    int evasion,
    int mitigation,
    int attackPower,
    int corruptionResistance,
    int actionPoints
) {
}
