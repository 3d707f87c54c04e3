package com.ggltcg.game;

import com.ggltcg.card.Card;

/**
 * Outcome of a tussle, computed from the stats before any damage lands.
 *
 * @param attacker          the attacking Toy
 * @param defender          the defending Toy
 * @param autoWin           the attacker won through an auto-win effect; no damage was dealt
 * @param attackerSpeed     attacker speed including the own-turn bonus
 * @param defenderSpeed     defender speed
 * @param damageToAttacker  damage the attacker takes
 * @param damageToDefender  damage the defender takes
 * @param attackerDefeated  whether the attacker is sleeped
 * @param defenderDefeated  whether the defender is sleeped
 */
public record TussleResult(Card attacker,
                           Card defender,
                           boolean autoWin,
                           int attackerSpeed,
                           int defenderSpeed,
                           int damageToAttacker,
                           int damageToDefender,
                           boolean attackerDefeated,
                           boolean defenderDefeated) {

    /**
     * The attacker is sleeped and the defender survives.
     */
    public boolean isAttackerLoss() {
        return attackerDefeated && !defenderDefeated;
    }

    public String describe() {
        String a = attacker.getName();
        String d = defender.getName();
        if (autoWin) {
            return a + " wins the tussle against " + d + " automatically";
        }
        StringBuilder sb = new StringBuilder();
        sb.append(a).append(" (speed ").append(attackerSpeed).append(") tussles ")
                .append(d).append(" (speed ").append(defenderSpeed).append(")");
        if (damageToDefender > 0) {
            sb.append(", ").append(d).append(" takes ").append(damageToDefender);
        }
        if (damageToAttacker > 0) {
            sb.append(", ").append(a).append(" takes ").append(damageToAttacker);
        }
        if (defenderDefeated) {
            sb.append(", ").append(d).append(" is sleeped");
        }
        if (attackerDefeated) {
            sb.append(", ").append(a).append(" is sleeped");
        }
        return sb.toString();
    }
}
