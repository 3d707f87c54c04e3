package com.ggltcg.effect;

import com.ggltcg.card.Card;

/**
 * alternative_cost_sleep_card - the source may be played by sleeping another of your cards
 * instead of paying its CC cost.
 */
public class AlternativeCostEffect extends AbstractEffect implements ContinuousEffect {
    public static final String KEYWORD = "alternative_cost_sleep_card";

    public AlternativeCostEffect(Card source) {
        super(source, KEYWORD);
    }

    @Override
    public boolean allowsAlternativeCost(Card card) {
        return card.equals(getSource());
    }
}
