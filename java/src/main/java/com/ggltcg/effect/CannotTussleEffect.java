package com.ggltcg.effect;

import com.ggltcg.card.Card;
import com.ggltcg.game.GameState;

/**
 * cannot_tussle - the source never attacks.
 */
public class CannotTussleEffect extends AbstractEffect implements ContinuousEffect {
    public static final String KEYWORD = "cannot_tussle";

    public CannotTussleEffect(Card source) {
        super(source, KEYWORD);
    }

    @Override
    public boolean forbidsTussle(Card attacker, GameState state) {
        return attacker.equals(getSource());
    }
}
