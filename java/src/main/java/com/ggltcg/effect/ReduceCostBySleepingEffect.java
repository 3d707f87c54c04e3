package com.ggltcg.effect;

import com.ggltcg.card.Card;
import com.ggltcg.game.GameState;

/**
 * reduce_cost_by_sleeping - the source costs 1 less for each card in its player's sleep zone.
 */
public class ReduceCostBySleepingEffect extends AbstractEffect implements ContinuousEffect {
    public static final String KEYWORD = "reduce_cost_by_sleeping";

    public ReduceCostBySleepingEffect(Card source) {
        super(source, KEYWORD);
    }

    @Override
    public int cardCostModifier(Card card, String playerId, GameState state) {
        if (!card.equals(getSource()) || !playerId.equals(getSource().getOwner())) {
            return 0;
        }
        return -state.getPlayer(playerId).getSleepZone().size();
    }
}
