package com.ggltcg.game;

import com.ggltcg.card.Card;
import com.ggltcg.card.Stat;
import com.ggltcg.effect.ContinuousEffect;
import com.ggltcg.effect.Effect;
import com.ggltcg.effect.EffectRegistry;

/**
 * Effective stats and protection.
 * Everything is computed from the current state on each call; nothing is cached.
 */
public class StatResolver {
    private final EffectRegistry registry;

    public StatResolver(EffectRegistry registry) {
        this.registry = registry;
    }

    /**
     * Base stat plus stored modifications plus continuous effects of every card in play,
     * floored at zero. The attacker's speed bonus is not included; only tussles apply it.
     */
    public int getEffectiveStat(Card card, Stat stat, GameState state) {
        int value = card.getBaseStat(stat) + card.getModificationTotal(stat);
        for (Card source : state.getAllCardsInPlay()) {
            for (ContinuousEffect effect : registry.getContinuousEffects(source)) {
                int delta = effect.statModifier(card, stat, state);
                if (delta != 0 && !isProtected(card, effect, state)) {
                    value += delta;
                }
            }
        }
        return Math.max(0, value);
    }

    /**
     * Effective stamina minus damage taken, floored at zero.
     */
    public int getRemainingStamina(Card card, GameState state) {
        return Math.max(0, getEffectiveStat(card, Stat.STAMINA, state) - card.getDamage());
    }

    public boolean isDefeated(Card card, GameState state) {
        return getRemainingStamina(card, state) <= 0;
    }

    /**
     * Whether any continuous effect in play shields the target from the incoming effect.
     */
    public boolean isProtected(Card target, Effect incoming, GameState state) {
        for (Card source : state.getAllCardsInPlay()) {
            for (ContinuousEffect effect : registry.getContinuousEffects(source)) {
                if (effect != incoming && effect.protects(target, incoming, state)) {
                    return true;
                }
            }
        }
        return false;
    }
}
