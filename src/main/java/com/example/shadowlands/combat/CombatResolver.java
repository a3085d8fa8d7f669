package com.example.shadowlands.combat;

import com.example.shadowlands.error.EngineException;
import com.example.shadowlands.error.ErrorKind;
import com.example.shadowlands.model.DerivedAttributes;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Random;

/**
 * Resolves one attack between two derived-attribute sets.
 *
 * The random source is always supplied by the caller: a fixed seed reproduces the
 * outcome, and independent exchanges never share state.
 */
public class CombatResolver {

    private static final Logger logger = LoggerFactory.getLogger(CombatResolver.class);

    private final CombatCalculator calculator;

    public CombatResolver(CombatCalculator calculator) {
        this.calculator = calculator;
    }

    public CombatCalculator getCalculator() { return calculator; }

    /**
     * Draws exactly one uniform sample from {@code rng} to decide the hit.
     *
     * @throws EngineException INVALID_COMBAT_INPUT on null sides or rng, or negative weapon/armor values
     */
    public CombatExchange resolve(DerivedAttributes attacker, DerivedAttributes defender,
                                  int weaponDamage, int armorValue, Random rng) {
        if (attacker == null || defender == null) {
            throw EngineException.of(ErrorKind.INVALID_COMBAT_INPUT, "Attacker and defender are required");
        }
        if (weaponDamage < 0) {
            throw EngineException.of(ErrorKind.INVALID_COMBAT_INPUT, "Weapon damage must be non-negative, got %d", weaponDamage);
        }
        if (armorValue < 0) {
            throw EngineException.of(ErrorKind.INVALID_COMBAT_INPUT, "Armor value must be non-negative, got %d", armorValue);
        }
        if (rng == null) {
            throw EngineException.of(ErrorKind.INVALID_COMBAT_INPUT, "A random source is required");
        }

        double hitChance = calculator.calculateHitChance(attacker.accuracy(), defender.evasion());
        double roll = rng.nextDouble();
        int rawDamage = calculator.calculateRawDamage(weaponDamage, attacker.attackPower());
        int reduction = calculator.calculateReduction(armorValue, defender.mitigation());

        CombatExchange exchange;
        if (roll < hitChance) {
            exchange = CombatExchange.hit(calculator.calculateDamage(rawDamage, reduction),
                hitChance, roll, rawDamage, reduction);
        } else {
            exchange = CombatExchange.miss(hitChance, roll, rawDamage, reduction);
        }
        logger.debug("Combat exchange: chance={} roll={} raw={} reduction={} -> hit={} damage={}",
            String.format("%.2f", hitChance), String.format("%.3f", roll), rawDamage, reduction,
            exchange.hitSuccess(), exchange.damageDealt());
        return exchange;
    }
}
