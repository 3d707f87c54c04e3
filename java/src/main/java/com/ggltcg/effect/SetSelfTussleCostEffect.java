package com.ggltcg.effect;

import com.ggltcg.card.Card;
import com.ggltcg.game.GameState;

import java.util.OptionalInt;

/**
 * set_self_tussle_cost:&lt;n&gt;[:not_turn_1] - the source's own tussles cost n.
 * With not_turn_1 the source may not tussle on the game's first turn.
 */
public class SetSelfTussleCostEffect extends AbstractEffect implements ContinuousEffect {
    public static final String KEYWORD = "set_self_tussle_cost";

    private final int cost;
    private final boolean notTurn1;

    public SetSelfTussleCostEffect(Card source, int cost, boolean notTurn1) {
        super(source, KEYWORD);
        this.cost = cost;
        this.notTurn1 = notTurn1;
    }

    @Override
    public OptionalInt tussleCost(Card attacker, GameState state) {
        return attacker.equals(getSource()) ? OptionalInt.of(cost) : OptionalInt.empty();
    }

    @Override
    public boolean forbidsTussle(Card attacker, GameState state) {
        return notTurn1 && attacker.equals(getSource()) && state.getTurnNumber() == 1;
    }
}
