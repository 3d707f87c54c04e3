package com.ggltcg.game;

import com.ggltcg.card.Card;
import com.ggltcg.card.Stat;
import com.ggltcg.effect.ActivatedEffect;
import com.ggltcg.effect.EffectRegistry;
import com.ggltcg.effect.GameView;
import com.ggltcg.effect.PlayEffect;
import com.ggltcg.game.action.ActionType;
import com.ggltcg.game.action.ActivateAbilityAction;
import com.ggltcg.game.action.DirectAttackAction;
import com.ggltcg.game.action.EndTurnAction;
import com.ggltcg.game.action.InvalidActionException;
import com.ggltcg.game.action.PlayCardAction;
import com.ggltcg.game.action.TussleAction;
import com.ggltcg.game.action.ValidAction;
import com.ggltcg.game.zones.Zone;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.OptionalInt;
import java.util.Set;

/**
 * Decides whether actions are legal.
 * <p>
 * The valid-action listing is built from the same checks the engine runs before executing
 * an action, so what is listed and what is accepted never disagree. Nothing here mutates
 * the game.
 */
public class ActionValidator {
    private static final Logger log = LoggerFactory.getLogger(ActionValidator.class);

    /** A validated card play. */
    record PlayPlan(Card card, String playerId, List<Card> targets, int cost, Card alternativeCostCard,
                    List<PlayEffect> effects) {}

    /** A validated tussle. */
    record TusslePlan(Card attacker, Card defender, String playerId, int cost) {}

    /** A validated direct attack. */
    record DirectAttackPlan(Card attacker, String playerId, int cost) {}

    /** A validated ability activation. */
    record ActivatePlan(Card card, ActivatedEffect ability, String playerId, List<Card> targets) {}

    /** What a player may still choose when playing a card. */
    record PlayOptions(Card card, Integer cost, List<Card> targets, int minTargets, int maxTargets,
                       List<Card> alternativeCostCards) {}

    private final GameView view;
    private final EffectRegistry registry;
    private final CostCalculator costs;
    private final TussleResolver tussles;

    public ActionValidator(GameView view, EffectRegistry registry, CostCalculator costs, TussleResolver tussles) {
        this.view = view;
        this.registry = registry;
        this.costs = costs;
        this.tussles = tussles;
    }

    private GameState state() {
        return view.getState();
    }

    // ---- Play card ----

    /**
     * Checks that do not depend on the player's choices of target and payment.
     */
    PlayOptions playOptions(Card card, String playerId) throws InvalidActionException {
        requireActive(playerId);
        Player player = state().getPlayer(playerId);
        if (card.getZone() != Zone.HAND || !player.getHand().contains(card)) {
            throw new InvalidActionException(card.getName() + " is not in your hand");
        }

        List<PlayEffect> effects = registry.getPlayEffects(card);
        for (PlayEffect effect : effects) {
            Optional<String> restriction = effect.playRestriction(view, playerId);
            if (restriction.isPresent()) {
                throw new InvalidActionException(restriction.get());
            }
        }

        PlayEffect targeting = targetingEffect(effects);
        List<Card> targets = targeting != null ? targeting.getValidTargets(view, playerId) : List.of();
        int minTargets = targeting != null ? targeting.getMinTargets() : 0;
        int maxTargets = targeting != null ? targeting.getMaxTargets() : 0;
        if (targets.size() < minTargets) {
            throw new InvalidActionException(card.getName() + " has no valid targets");
        }

        List<Card> alternatives = costs.allowsAlternativeCost(card)
                ? alternativeCostCards(card, player)
                : List.of();

        Integer cost;
        if (card.getActiveDefinition().hasVariableCost()) {
            List<Card> affordable = new ArrayList<>();
            Integer cheapest = null;
            for (Card target : targets) {
                OptionalInt targetCost = costs.getCardCost(card, playerId, List.of(target), state());
                if (targetCost.isEmpty()) {
                    continue;
                }
                int c = targetCost.getAsInt();
                if (c <= player.getCc() || !alternatives.isEmpty()) {
                    affordable.add(target);
                    cheapest = cheapest == null ? c : Math.min(cheapest, c);
                }
            }
            if (affordable.isEmpty()) {
                throw new InvalidActionException("Not enough CC to play " + card.getName());
            }
            targets = affordable;
            cost = cheapest;
        } else {
            cost = costs.getCardCost(card, playerId, List.of(), state()).orElse(0);
            if (cost > player.getCc() && alternatives.isEmpty()) {
                throw new InvalidActionException("Not enough CC to play " + card.getName()
                        + ": need " + cost + ", have " + player.getCc());
            }
        }
        return new PlayOptions(card, cost, targets, minTargets, maxTargets, alternatives);
    }

    PlayPlan validatePlay(PlayCardAction action) throws InvalidActionException {
        String playerId = action.playerId();
        Card card = requireCard(action.cardId());
        PlayOptions options = playOptions(card, playerId);
        Player player = state().getPlayer(playerId);

        List<PlayEffect> effects = registry.getPlayEffects(card);
        PlayEffect targeting = targetingEffect(effects);
        List<Card> targets = resolveTargets(action.targetIds());
        if (targeting == null) {
            if (!targets.isEmpty()) {
                throw new InvalidActionException(card.getName() + " does not take targets");
            }
        } else {
            List<Card> valid = targeting.getValidTargets(view, playerId);
            checkTargets(card, targets, valid, options.minTargets(), options.maxTargets());
        }

        int cost = costs.getCardCost(card, playerId, targets, state())
                .orElseThrow(() -> new InvalidActionException("Choose a target for " + card.getName()));

        Card alternative = null;
        if (action.alternativeCostCardId() != null) {
            alternative = requireCard(action.alternativeCostCardId());
            if (!options.alternativeCostCards().contains(alternative)) {
                throw new InvalidActionException(alternative.getName()
                        + " cannot be sleeped to pay for " + card.getName());
            }
        } else if (cost > player.getCc()) {
            throw new InvalidActionException("Not enough CC to play " + card.getName()
                    + ": need " + cost + ", have " + player.getCc());
        }
        return new PlayPlan(card, playerId, targets, cost, alternative, effects);
    }

    private PlayEffect targetingEffect(List<PlayEffect> effects) {
        for (PlayEffect effect : effects) {
            if (effect.requiresTargets()) {
                return effect;
            }
        }
        return null;
    }

    /**
     * Other cards the player could sleep: their hand and the cards they control in play.
     */
    private List<Card> alternativeCostCards(Card card, Player player) {
        List<Card> cards = new ArrayList<>();
        for (Card c : player.getHand().getCards()) {
            if (!c.equals(card)) {
                cards.add(c);
            }
        }
        cards.addAll(player.getInPlay().getCards());
        return cards;
    }

    // ---- Tussle / direct attack ----

    TusslePlan validateTussle(TussleAction action) throws InvalidActionException {
        String playerId = action.playerId();
        requireActive(playerId);
        Card attacker = requireCard(action.attackerId());
        checkAttacker(attacker, playerId);

        Card defender = requireCard(action.defenderId());
        if (!defender.isInPlay() || !defender.isToy() || defender.getController().equals(playerId)) {
            throw new InvalidActionException(defender.getName() + " is not an opposing Toy in play");
        }

        int cost = costs.getTussleCost(attacker, state());
        requireCc(playerId, cost, "tussle");
        return new TusslePlan(attacker, defender, playerId, cost);
    }

    DirectAttackPlan validateDirectAttack(DirectAttackAction action) throws InvalidActionException {
        String playerId = action.playerId();
        requireActive(playerId);
        Card attacker = requireCard(action.attackerId());
        checkAttacker(attacker, playerId);

        Player opponent = state().getOpponent(playerId);
        if (opponent.hasToysInPlay() && !costs.allowsDirectAttackPastToys(attacker)) {
            throw new InvalidActionException("Cannot direct attack: opponent has toys in play");
        }
        if (state().getDirectAttacksThisTurn() >= view.getRules().getMaxDirectAttacks()) {
            throw new InvalidActionException("Cannot direct attack: limit of "
                    + view.getRules().getMaxDirectAttacks() + " direct attacks per turn reached");
        }
        if (opponent.getHand().isEmpty()) {
            throw new InvalidActionException("Cannot direct attack: opponent has no cards in hand");
        }

        int cost = costs.getTussleCost(attacker, state());
        requireCc(playerId, cost, "direct attack");
        return new DirectAttackPlan(attacker, playerId, cost);
    }

    private void checkAttacker(Card attacker, String playerId) throws InvalidActionException {
        if (!attacker.isInPlay() || !attacker.getController().equals(playerId)) {
            throw new InvalidActionException(attacker.getName() + " is not one of your cards in play");
        }
        if (!attacker.isToy()) {
            throw new InvalidActionException(attacker.getName() + " is not a Toy");
        }
        Optional<String> restriction = costs.getTussleRestriction(attacker, state());
        if (restriction.isPresent()) {
            throw new InvalidActionException(restriction.get());
        }
        if (view.getEffectiveStat(attacker, Stat.STRENGTH) <= 0) {
            throw new InvalidActionException(attacker.getName() + " has no strength to attack with");
        }
    }

    // ---- Activated abilities ----

    private ActivatedEffect requireAbility(Card card, String playerId) throws InvalidActionException {
        requireActive(playerId);
        if (!card.isInPlay() || !card.getController().equals(playerId)) {
            throw new InvalidActionException(card.getName() + " is not one of your cards in play");
        }
        List<ActivatedEffect> abilities = registry.getActivatedEffects(card);
        if (abilities.isEmpty()) {
            throw new InvalidActionException(card.getName() + " has no activated ability");
        }
        ActivatedEffect ability = abilities.get(0);
        requireCc(playerId, ability.getCostCc(), "use " + card.getName());
        if (ability.getValidTargets(view, playerId).size() < ability.getMinTargets()) {
            throw new InvalidActionException(card.getName() + " has no valid targets");
        }
        return ability;
    }

    ActivatePlan validateActivate(ActivateAbilityAction action) throws InvalidActionException {
        Card card = requireCard(action.cardId());
        ActivatedEffect ability = requireAbility(card, action.playerId());
        List<Card> targets = resolveTargets(action.targetIds());
        checkTargets(card, targets, ability.getValidTargets(view, action.playerId()),
                ability.getMinTargets(), ability.getMaxTargets());
        return new ActivatePlan(card, ability, action.playerId(), targets);
    }

    // ---- End turn ----

    void validateEndTurn(EndTurnAction action) throws InvalidActionException {
        requireActive(action.playerId());
    }

    // ---- Valid action listing ----

    /**
     * Every action the player may take now. With the AI filter, tussles the attacker is
     * certain to lose are left out.
     */
    public List<ValidAction> getValidActions(String playerId, boolean filterForAi) {
        List<ValidAction> actions = new ArrayList<>();
        try {
            requireActive(playerId);
        } catch (InvalidActionException e) {
            log.trace("No actions for {}: {}", playerId, e.getMessage());
            return actions;
        }
        Player player = state().getPlayer(playerId);
        Player opponent = state().getOpponent(playerId);

        for (Card card : player.getHand().getCards()) {
            try {
                PlayOptions options = playOptions(card, playerId);
                actions.add(new ValidAction(ActionType.PLAY_CARD, card.getId(), options.cost(),
                        ids(options.targets()), options.minTargets(), options.maxTargets(),
                        ids(options.alternativeCostCards()),
                        "Play " + card.getName() + costLabel(options.cost())));
            } catch (InvalidActionException e) {
                log.trace("{} not playable: {}", card, e.getMessage());
            }
        }

        for (Card attacker : player.getInPlay().getToys()) {
            for (Card defender : opponent.getInPlay().getToys()) {
                try {
                    TusslePlan plan = validateTussle(new TussleAction(playerId, attacker.getId(), defender.getId()));
                    if (filterForAi && tussles.predict(attacker, defender, state()).isAttackerLoss()) {
                        continue;
                    }
                    actions.add(new ValidAction(ActionType.TUSSLE, attacker.getId(), plan.cost(),
                            List.of(defender.getId()), 1, 1, List.of(),
                            attacker.getName() + " tussles " + defender.getName() + costLabel(plan.cost())));
                } catch (InvalidActionException e) {
                    log.trace("{} cannot tussle {}: {}", attacker, defender, e.getMessage());
                }
            }
            try {
                DirectAttackPlan plan = validateDirectAttack(new DirectAttackAction(playerId, attacker.getId()));
                actions.add(new ValidAction(ActionType.DIRECT_ATTACK, attacker.getId(), plan.cost(),
                        List.of(), 0, 0, List.of(),
                        attacker.getName() + " attacks directly" + costLabel(plan.cost())));
            } catch (InvalidActionException e) {
                log.trace("{} cannot direct attack: {}", attacker, e.getMessage());
            }
        }

        for (Card card : player.getInPlay().getCards()) {
            if (registry.getActivatedEffects(card).isEmpty()) {
                continue;
            }
            try {
                ActivatedEffect ability = requireAbility(card, playerId);
                actions.add(new ValidAction(ActionType.ACTIVATE_ABILITY, card.getId(), ability.getCostCc(),
                        ids(ability.getValidTargets(view, playerId)), ability.getMinTargets(),
                        ability.getMaxTargets(), List.of(),
                        "Use " + card.getName() + costLabel(ability.getCostCc())));
            } catch (InvalidActionException e) {
                log.trace("{} cannot activate: {}", card, e.getMessage());
            }
        }

        actions.add(ValidAction.endTurn());
        return actions;
    }

    // ---- Shared checks ----

    private void requireActive(String playerId) throws InvalidActionException {
        if (state().isGameOver()) {
            throw new InvalidActionException("The game is over");
        }
        if (!state().hasPlayer(playerId)) {
            throw new InvalidActionException("Unknown player: " + playerId);
        }
        if (!playerId.equals(state().getActivePlayerId())) {
            throw new InvalidActionException("It is not your turn");
        }
        if (!state().getPhase().isMainPhase()) {
            throw new InvalidActionException("Actions are only allowed in the main phase");
        }
    }

    private void requireCc(String playerId, int cost, String what) throws InvalidActionException {
        int cc = state().getPlayer(playerId).getCc();
        if (cost > cc) {
            throw new InvalidActionException("Not enough CC to " + what + ": need " + cost + ", have " + cc);
        }
    }

    private Card requireCard(String cardId) throws InvalidActionException {
        if (cardId == null) {
            throw new InvalidActionException("No card given");
        }
        return state().findCard(cardId)
                .orElseThrow(() -> new InvalidActionException("Card not found: " + cardId));
    }

    private List<Card> resolveTargets(List<String> targetIds) throws InvalidActionException {
        List<Card> targets = new ArrayList<>();
        Set<String> seen = new HashSet<>();
        for (String id : targetIds) {
            if (!seen.add(id)) {
                throw new InvalidActionException("Duplicate target: " + id);
            }
            targets.add(requireCard(id));
        }
        return targets;
    }

    /**
     * Caller-supplied targets must all be members of the effect's own valid-target set.
     */
    private void checkTargets(Card card, List<Card> targets, List<Card> valid, int min, int max)
            throws InvalidActionException {
        for (Card target : targets) {
            if (!valid.contains(target)) {
                throw new InvalidActionException(target.getName() + " is not a valid target for " + card.getName());
            }
        }
        int required = Math.min(min, valid.size());
        if (targets.size() < required) {
            throw new InvalidActionException(card.getName() + " needs at least " + required + " target(s)");
        }
        if (targets.size() > max) {
            throw new InvalidActionException(card.getName() + " takes at most " + max + " target(s)");
        }
    }

    private static List<String> ids(List<Card> cards) {
        List<String> ids = new ArrayList<>(cards.size());
        for (Card card : cards) {
            ids.add(card.getId());
        }
        return ids;
    }

    private static String costLabel(Integer cost) {
        return cost != null ? " (" + cost + " CC)" : "";
    }
}
