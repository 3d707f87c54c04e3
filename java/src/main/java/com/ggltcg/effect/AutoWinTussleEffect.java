package com.ggltcg.effect;

import com.ggltcg.card.Card;
import com.ggltcg.game.GameState;

/**
 * auto_win_tussle_on_own_turn - the source wins any tussle it starts on its controller's turn.
 */
public class AutoWinTussleEffect extends AbstractEffect implements ContinuousEffect {
    public static final String KEYWORD = "auto_win_tussle_on_own_turn";

    public AutoWinTussleEffect(Card source) {
        super(source, KEYWORD);
    }

    @Override
    public boolean winsTussle(Card attacker, GameState state) {
        return attacker.equals(getSource())
                && getSource().getController().equals(state.getActivePlayerId());
    }
}
