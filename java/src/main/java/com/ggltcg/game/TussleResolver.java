package com.ggltcg.game;

import com.ggltcg.card.Card;
import com.ggltcg.card.Stat;
import com.ggltcg.effect.ContinuousEffect;
import com.ggltcg.effect.EffectRegistry;

/**
 * Computes tussle outcomes.
 * <p>
 * The faster Toy strikes first; the attacker gets a speed bonus on its controller's turn.
 * A Toy defeated by the first strike does not strike back, so only a speed tie can sleep
 * both Toys. An auto-win effect skips the strike order entirely unless the defender is
 * protected from it. Combat damage itself is not an effect and ignores immunity.
 * <p>
 * This class never mutates the game; the engine applies the returned result.
 */
public class TussleResolver {
    private final EffectRegistry registry;
    private final StatResolver stats;
    private final GameRules rules;

    public TussleResolver(EffectRegistry registry, StatResolver stats, GameRules rules) {
        this.registry = registry;
        this.stats = stats;
        this.rules = rules;
    }

    /**
     * Predict the outcome of the attacker tussling the defender in the current state.
     */
    public TussleResult predict(Card attacker, Card defender, GameState state) {
        int attackerSpeed = stats.getEffectiveStat(attacker, Stat.SPEED, state);
        if (attacker.getController().equals(state.getActivePlayerId())) {
            attackerSpeed += rules.getAttackerSpeedBonus();
        }
        int defenderSpeed = stats.getEffectiveStat(defender, Stat.SPEED, state);

        if (hasAutoWin(attacker, defender, state)) {
            return new TussleResult(attacker, defender, true, attackerSpeed, defenderSpeed,
                    0, 0, false, true);
        }

        int attackerStrength = stats.getEffectiveStat(attacker, Stat.STRENGTH, state);
        int defenderStrength = stats.getEffectiveStat(defender, Stat.STRENGTH, state);
        int attackerStamina = stats.getRemainingStamina(attacker, state);
        int defenderStamina = stats.getRemainingStamina(defender, state);

        int damageToDefender;
        int damageToAttacker;
        if (attackerSpeed > defenderSpeed) {
            damageToDefender = attackerStrength;
            damageToAttacker = defenderStamina - damageToDefender <= 0 ? 0 : defenderStrength;
        } else if (defenderSpeed > attackerSpeed) {
            damageToAttacker = defenderStrength;
            damageToDefender = attackerStamina - damageToAttacker <= 0 ? 0 : attackerStrength;
        } else {
            damageToDefender = attackerStrength;
            damageToAttacker = defenderStrength;
        }

        return new TussleResult(attacker, defender, false, attackerSpeed, defenderSpeed,
                damageToAttacker, damageToDefender,
                attackerStamina - damageToAttacker <= 0,
                defenderStamina - damageToDefender <= 0);
    }

    private boolean hasAutoWin(Card attacker, Card defender, GameState state) {
        for (Card source : state.getAllCardsInPlay()) {
            for (ContinuousEffect effect : registry.getContinuousEffects(source)) {
                if (effect.winsTussle(attacker, state) && !stats.isProtected(defender, effect, state)) {
                    return true;
                }
            }
        }
        return false;
    }
}
