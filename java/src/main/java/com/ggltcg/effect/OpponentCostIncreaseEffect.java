package com.ggltcg.effect;

import com.ggltcg.card.Card;
import com.ggltcg.game.GameState;

/**
 * opponent_cost_increase:&lt;n&gt; - cards played by the source's opponent cost n more.
 */
public class OpponentCostIncreaseEffect extends AbstractEffect implements ContinuousEffect {
    public static final String KEYWORD = "opponent_cost_increase";

    private final int amount;

    public OpponentCostIncreaseEffect(Card source, int amount) {
        super(source, KEYWORD);
        this.amount = amount;
    }

    @Override
    public int cardCostModifier(Card card, String playerId, GameState state) {
        if (getSource().isInPlay() && !playerId.equals(getSource().getController())) {
            return amount;
        }
        return 0;
    }
}
