package com.ggltcg.effect;

import com.ggltcg.card.Card;

/**
 * direct_attack_any_time - the source may direct attack even while the opponent has Toys in play.
 * Older card tables spell it {@code direct_attack}.
 */
public class DirectAttackAnyTimeEffect extends AbstractEffect implements ContinuousEffect {
    public static final String KEYWORD = "direct_attack_any_time";
    public static final String SHORT_KEYWORD = "direct_attack";

    public DirectAttackAnyTimeEffect(Card source) {
        super(source, KEYWORD);
    }

    @Override
    public boolean allowsDirectAttack(Card attacker) {
        return attacker.equals(getSource());
    }
}
