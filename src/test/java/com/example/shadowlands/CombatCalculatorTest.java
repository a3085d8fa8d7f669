package com.example.shadowlands;

import com.example.shadowlands.combat.CombatCalculator;
import com.example.shadowlands.config.EngineConfig;
import org.junit.jupiter.api.Test;
import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for CombatCalculator hit chance and damage formulas.
 */
public class CombatCalculatorTest {

    private static final double DELTA = 0.0001;

    private final CombatCalculator calculator = new CombatCalculator();

    // === Hit Chance Tests ===

    @Test
    void testHitChance_equalAccuracyAndEvasion() {
        // No difference = base 85%
        assertEquals(0.85, calculator.calculateHitChance(20, 20), DELTA);
        assertEquals(0.85, calculator.calculateHitChance(0, 0), DELTA);
    }

    @Test
    void testHitChance_scalesWithDifference() {
        // +5 accuracy over evasion = 85% + 5% = 90%
        assertEquals(0.90, calculator.calculateHitChance(25, 20), DELTA);
        // -5 = 80%
        assertEquals(0.80, calculator.calculateHitChance(10, 15), DELTA);
        // -50 = 35%
        assertEquals(0.35, calculator.calculateHitChance(0, 50), DELTA);
    }

    @Test
    void testHitChance_clampedToCeiling() {
        // 85% + 20% would be 105%, capped at 95%
        assertEquals(0.95, calculator.calculateHitChance(40, 20), DELTA);
        assertEquals(0.95, calculator.calculateHitChance(1000, 0), DELTA);
    }

    @Test
    void testHitChance_clampedToFloor() {
        // 85% - 100% would be -15%, floored at 5%
        assertEquals(0.05, calculator.calculateHitChance(0, 100), DELTA);
        assertEquals(0.05, calculator.calculateHitChance(0, 10000), DELTA);
    }

    @Test
    void testHitChance_alwaysWithinBounds() {
        for (int acc = 0; acc <= 200; acc += 7) {
            for (int eva = 0; eva <= 200; eva += 11) {
                double chance = calculator.calculateHitChance(acc, eva);
                assertTrue(chance >= 0.05 && chance <= 0.95, "acc=" + acc + " eva=" + eva + " -> " + chance);
            }
        }
    }

    @Test
    void testHitChance_customBounds() {
        CombatCalculator tight = new CombatCalculator(new EngineConfig.Combat(0.5, 0.02, 0.25, 0.75));
        assertEquals(0.5, tight.calculateHitChance(10, 10), DELTA);
        assertEquals(0.6, tight.calculateHitChance(15, 10), DELTA);
        assertEquals(0.75, tight.calculateHitChance(100, 0), DELTA);
        assertEquals(0.25, tight.calculateHitChance(0, 100), DELTA);
    }

    // === Damage Tests ===

    @Test
    void testRawDamage_weaponPlusAttackPower() {
        assertEquals(45, calculator.calculateRawDamage(15, 30));
        assertEquals(0, calculator.calculateRawDamage(0, 0));
    }

    @Test
    void testReduction_armorPlusMitigation() {
        assertEquals(20, calculator.calculateReduction(8, 12));
    }

    @Test
    void testDamage_subtractsReduction() {
        assertEquals(25, calculator.calculateDamage(45, 20));
        assertEquals(1, calculator.calculateDamage(21, 20));
    }

    @Test
    void testDamage_neverNegative() {
        // Reduction larger than raw damage = 0, not negative
        assertEquals(0, calculator.calculateDamage(20, 20));
        assertEquals(0, calculator.calculateDamage(5, 100));
        assertEquals(0, calculator.calculateDamage(0, 0));
    }

    // === Large Value Tests ===

    @Test
    void testRawDamage_saturatesInsteadOfWrapping() {
        // MAX + 30 would wrap negative; it stays at MAX
        assertEquals(Integer.MAX_VALUE, calculator.calculateRawDamage(Integer.MAX_VALUE, 30));
        assertEquals(Integer.MAX_VALUE, calculator.calculateRawDamage(Integer.MAX_VALUE, Integer.MAX_VALUE));
    }

    @Test
    void testReduction_saturatesInsteadOfWrapping() {
        assertEquals(Integer.MAX_VALUE, calculator.calculateReduction(Integer.MAX_VALUE, 12));
    }

    @Test
    void testDamage_hugeWeaponStillHits() {
        int raw = calculator.calculateRawDamage(Integer.MAX_VALUE, 30);
        int reduction = calculator.calculateReduction(8, 12);
        assertEquals(Integer.MAX_VALUE - 20, calculator.calculateDamage(raw, reduction));
        assertEquals(0, calculator.calculateDamage(raw, calculator.calculateReduction(Integer.MAX_VALUE, 12)));
    }

    @Test
    void testHitChance_extremeValuesStayClamped() {
        assertEquals(0.95, calculator.calculateHitChance(Integer.MAX_VALUE, 0), DELTA);
        assertEquals(0.05, calculator.calculateHitChance(0, Integer.MAX_VALUE), DELTA);
    }
}
