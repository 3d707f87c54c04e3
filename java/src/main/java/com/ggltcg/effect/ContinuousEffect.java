package com.ggltcg.effect;

import com.ggltcg.card.Card;
import com.ggltcg.card.Stat;
import com.ggltcg.game.GameState;

import java.util.OptionalInt;

/**
 * Always-on effect of an in-play card.
 * Each hook defaults to "no influence"; an effect overrides only what it changes.
 * Cost hooks are also consulted for the card being played, so an effect may act from hand.
 */
public non-sealed interface ContinuousEffect extends Effect {

    @Override
    default EffectKind getKind() {
        return EffectKind.CONTINUOUS;
    }

    /**
     * Delta this effect contributes to a target's stat.
     */
    default int statModifier(Card target, Stat stat, GameState state) {
        return 0;
    }

    /**
     * Tussle cost this effect imposes on the attacker, if any. The lowest override wins.
     */
    default OptionalInt tussleCost(Card attacker, GameState state) {
        return OptionalInt.empty();
    }

    /**
     * Whether the attacker is forbidden from tussling and direct attacking.
     */
    default boolean forbidsTussle(Card attacker, GameState state) {
        return false;
    }

    /**
     * Signed adjustment to the CC cost of a card being played by a player.
     */
    default int cardCostModifier(Card card, String playerId, GameState state) {
        return 0;
    }

    /**
     * Whether the card may be paid for by sleeping another of its player's cards.
     */
    default boolean allowsAlternativeCost(Card card) {
        return false;
    }

    /**
     * Whether the attacker may direct attack while the opponent still has Toys in play.
     */
    default boolean allowsDirectAttack(Card attacker) {
        return false;
    }

    /**
     * Whether the attacker wins a tussle outright, skipping strike resolution.
     */
    default boolean winsTussle(Card attacker, GameState state) {
        return false;
    }

    /**
     * Whether this effect shields the target from an incoming effect.
     */
    default boolean protects(Card target, Effect incoming, GameState state) {
        return false;
    }
}
