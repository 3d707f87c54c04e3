package com.ggltcg.effect;

import com.ggltcg.card.Card;
import com.ggltcg.game.GameState;

import java.util.OptionalInt;

/**
 * set_tussle_cost:&lt;n&gt; - tussles by the controller's Toys cost n.
 */
public class SetTussleCostEffect extends AbstractEffect implements ContinuousEffect {
    public static final String KEYWORD = "set_tussle_cost";

    private final int cost;

    public SetTussleCostEffect(Card source, int cost) {
        super(source, KEYWORD);
        this.cost = cost;
    }

    @Override
    public OptionalInt tussleCost(Card attacker, GameState state) {
        if (getSource().isInPlay() && attacker.getController().equals(getSource().getController())) {
            return OptionalInt.of(cost);
        }
        return OptionalInt.empty();
    }
}
