package com.ggltcg.effect;

import com.ggltcg.card.Card;

/**
 * An effect bound to one source card.
 * Every effect is exactly one of the four kinds; call sites switch on {@link #getKind()}.
 */
public sealed interface Effect permits ContinuousEffect, TriggeredEffect, ActivatedEffect, PlayEffect {

    /**
     * The card this effect belongs to.
     */
    Card getSource();

    /**
     * Grammar keyword the effect was parsed from (e.g. "stat_boost").
     * Named immunities match on this value.
     */
    String getKeyword();

    EffectKind getKind();

    /**
     * Controller of the source card; the player this effect acts for.
     */
    default String getController() {
        return getSource().getController();
    }
}
