package com.ggltcg.effect;

import com.ggltcg.card.Card;

import java.util.List;
import java.util.Optional;
import java.util.OptionalInt;

/**
 * One-shot effect resolved when its Action card is played.
 */
public non-sealed interface PlayEffect extends Effect {

    @Override
    default EffectKind getKind() {
        return EffectKind.PLAY;
    }

    /**
     * Reason the card cannot be played right now, or empty if it can.
     */
    default Optional<String> playRestriction(GameView view, String playerId) {
        return Optional.empty();
    }

    default boolean requiresTargets() {
        return getMaxTargets() > 0;
    }

    default int getMinTargets() {
        return 0;
    }

    default int getMaxTargets() {
        return 0;
    }

    default List<Card> getValidTargets(GameView view, String playerId) {
        return List.of();
    }

    /**
     * Cost derived from the chosen targets, for cards printed without a cost.
     */
    default OptionalInt costForTargets(List<Card> targets) {
        return OptionalInt.empty();
    }

    void resolve(List<Card> targets, String playerId, EffectContext context);
}
