package com.ggltcg.effect;

import com.ggltcg.card.Card;
import com.ggltcg.card.Stat;
import com.ggltcg.card.StatModification;

import java.util.List;

/**
 * turn_stat_boost:&lt;stat|all&gt;:&lt;n&gt; - your Toys in play get +n until the end of this turn.
 */
public class TurnStatBoostEffect extends AbstractEffect implements PlayEffect {
    public static final String KEYWORD = "turn_stat_boost";

    private final List<Stat> stats;
    private final int amount;

    public TurnStatBoostEffect(Card source, List<Stat> stats, int amount) {
        super(source, KEYWORD);
        this.stats = List.copyOf(stats);
        this.amount = amount;
    }

    @Override
    public void resolve(List<Card> targets, String playerId, EffectContext context) {
        int turn = context.getState().getTurnNumber();
        for (Card card : context.getState().getCardsInPlay(playerId)) {
            if (!card.isToy()) {
                continue;
            }
            for (Stat stat : stats) {
                context.addModification(card, StatModification.untilEndOfTurn(stat, amount, turn, getSource().getId()));
            }
        }
    }
}
