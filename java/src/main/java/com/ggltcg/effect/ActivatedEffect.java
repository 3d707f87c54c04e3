package com.ggltcg.effect;

import com.ggltcg.card.Card;

import java.util.List;

/**
 * Ability the controller pays CC to use while the source is in play.
 */
public non-sealed interface ActivatedEffect extends Effect {

    @Override
    default EffectKind getKind() {
        return EffectKind.ACTIVATED;
    }

    int getCostCc();

    default int getMinTargets() {
        return 1;
    }

    default int getMaxTargets() {
        return 1;
    }

    List<Card> getValidTargets(GameView view, String playerId);

    void activate(List<Card> targets, String playerId, EffectContext context);
}
