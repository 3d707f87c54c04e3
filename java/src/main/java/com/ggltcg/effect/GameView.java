package com.ggltcg.effect;

import com.ggltcg.card.Card;
import com.ggltcg.card.Stat;
import com.ggltcg.game.GameRules;
import com.ggltcg.game.GameState;

/**
 * Read-only rules queries available to effects while choosing targets or checking restrictions.
 */
public interface GameView {

    GameState getState();

    GameRules getRules();

    int getEffectiveStat(Card card, Stat stat);

    /**
     * Effective stamina minus damage taken.
     */
    int getRemainingStamina(Card card);

    /**
     * Whether an in-play continuous effect shields the target from the incoming effect.
     */
    boolean isProtected(Card target, Effect incoming);
}
