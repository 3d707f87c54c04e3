package com.ggltcg.game;

import com.ggltcg.card.Card;
import com.ggltcg.effect.ContinuousEffect;
import com.ggltcg.effect.EffectRegistry;
import com.ggltcg.effect.PlayEffect;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.OptionalInt;

/**
 * Card and tussle costs, and the continuous restrictions around attacking.
 */
public class CostCalculator {
    private final EffectRegistry registry;
    private final GameRules rules;

    public CostCalculator(EffectRegistry registry, GameRules rules) {
        this.registry = registry;
        this.rules = rules;
    }

    /**
     * CC cost for a player to play a card with the given targets.
     * Empty when the card's cost depends on a target that has not been chosen.
     */
    public OptionalInt getCardCost(Card card, String playerId, List<Card> targets, GameState state) {
        Integer printed = card.getActiveDefinition().getCost();
        int cost;
        if (printed != null) {
            cost = printed;
        } else {
            OptionalInt derived = OptionalInt.empty();
            for (PlayEffect effect : registry.getPlayEffects(card)) {
                derived = effect.costForTargets(targets);
                if (derived.isPresent()) {
                    break;
                }
            }
            if (derived.isEmpty()) {
                return OptionalInt.empty();
            }
            cost = derived.getAsInt();
        }
        for (ContinuousEffect effect : costEffects(card, state)) {
            cost += effect.cardCostModifier(card, playerId, state);
        }
        return OptionalInt.of(Math.max(0, cost));
    }

    /**
     * The card's own effects plus those of every card in play.
     */
    private List<ContinuousEffect> costEffects(Card card, GameState state) {
        List<ContinuousEffect> effects = new ArrayList<>();
        if (!card.isInPlay()) {
            effects.addAll(registry.getContinuousEffects(card));
        }
        for (Card source : state.getAllCardsInPlay()) {
            effects.addAll(registry.getContinuousEffects(source));
        }
        return effects;
    }

    public boolean allowsAlternativeCost(Card card) {
        for (ContinuousEffect effect : registry.getContinuousEffects(card)) {
            if (effect.allowsAlternativeCost(card)) {
                return true;
            }
        }
        return false;
    }

    /**
     * Lowest of the base tussle cost and every override that applies to the attacker.
     */
    public int getTussleCost(Card attacker, GameState state) {
        int cost = rules.getTussleCost();
        for (Card source : state.getAllCardsInPlay()) {
            for (ContinuousEffect effect : registry.getContinuousEffects(source)) {
                OptionalInt override = effect.tussleCost(attacker, state);
                if (override.isPresent()) {
                    cost = Math.min(cost, override.getAsInt());
                }
            }
        }
        return Math.max(0, cost);
    }

    /**
     * Reason the attacker may not tussle or direct attack, if a continuous effect forbids it.
     */
    public Optional<String> getTussleRestriction(Card attacker, GameState state) {
        for (Card source : state.getAllCardsInPlay()) {
            for (ContinuousEffect effect : registry.getContinuousEffects(source)) {
                if (effect.forbidsTussle(attacker, state)) {
                    return Optional.of(attacker.getName() + " cannot tussle (" + effect.getKeyword() + ")");
                }
            }
        }
        return Optional.empty();
    }

    public boolean allowsDirectAttackPastToys(Card attacker) {
        for (ContinuousEffect effect : registry.getContinuousEffects(attacker)) {
            if (effect.allowsDirectAttack(attacker)) {
                return true;
            }
        }
        return false;
    }
}
