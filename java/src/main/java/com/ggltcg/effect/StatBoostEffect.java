package com.ggltcg.effect;

import com.ggltcg.card.Card;
import com.ggltcg.card.Stat;
import com.ggltcg.game.GameState;

import java.util.List;

/**
 * stat_boost:&lt;stat|all&gt;:&lt;n&gt; - the controller's Toys in play get +n, the source included.
 */
public class StatBoostEffect extends AbstractEffect implements ContinuousEffect {
    public static final String KEYWORD = "stat_boost";

    private final List<Stat> stats;
    private final int amount;

    public StatBoostEffect(Card source, List<Stat> stats, int amount) {
        super(source, KEYWORD);
        this.stats = List.copyOf(stats);
        this.amount = amount;
    }

    @Override
    public int statModifier(Card target, Stat stat, GameState state) {
        Card source = getSource();
        if (!source.isInPlay() || !target.isInPlay() || !target.isToy()) {
            return 0;
        }
        if (!target.getController().equals(source.getController())) {
            return 0;
        }
        return stats.contains(stat) ? amount : 0;
    }

    public List<Stat> getStats() {
        return stats;
    }

    public int getAmount() {
        return amount;
    }
}
