package com.ggltcg.game;

import com.ggltcg.card.Card;
import com.ggltcg.card.Stat;
import com.ggltcg.card.StatModification;
import com.ggltcg.effect.Effect;
import com.ggltcg.effect.EffectContext;
import com.ggltcg.effect.EffectRegistry;
import com.ggltcg.effect.PlayEffect;
import com.ggltcg.effect.TriggerEvent;
import com.ggltcg.effect.TriggerTiming;
import com.ggltcg.effect.TriggeredEffect;
import com.ggltcg.game.action.ActionResult;
import com.ggltcg.game.action.ActivateAbilityAction;
import com.ggltcg.game.action.DirectAttackAction;
import com.ggltcg.game.action.EndTurnAction;
import com.ggltcg.game.action.GameAction;
import com.ggltcg.game.action.InvalidActionException;
import com.ggltcg.game.action.PlayCardAction;
import com.ggltcg.game.action.TussleAction;
import com.ggltcg.game.action.ValidAction;
import com.ggltcg.game.zones.Zone;
import com.ggltcg.rng.GameRng;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

/**
 * Runs one game: validates and applies actions, moves cards between zones, fires
 * triggers and checks for victory.
 * <p>
 * Each action is validated in full before anything changes. Triggers fired while an
 * action resolves are queued and drained breadth-first before the action returns.
 * The engine is the only thing that mutates its {@link GameState}; it is not thread-safe
 * and callers must serialize actions per game.
 */
public class GameEngine implements EffectContext {
    private static final Logger logger = LoggerFactory.getLogger(GameEngine.class);

    private record PendingTrigger(TriggeredEffect effect, TriggerEvent event) {}

    private final GameState state;
    private final GameRules rules;
    private final EffectRegistry registry;
    private final StatResolver stats;
    private final CostCalculator costs;
    private final TussleResolver tussles;
    private final ActionValidator validator;
    private final HandCardSelector handSelector;
    private final Deque<PendingTrigger> triggerQueue = new ArrayDeque<>();

    public GameEngine(GameState state, EffectRegistry registry, GameRules rules) {
        this(state, registry, rules, HandCardSelector.random(new GameRng()));
    }

    public GameEngine(GameState state, EffectRegistry registry, GameRules rules, HandCardSelector handSelector) {
        this.state = state;
        this.rules = rules;
        this.registry = registry;
        this.stats = new StatResolver(registry);
        this.costs = new CostCalculator(registry, rules);
        this.tussles = new TussleResolver(registry, stats, rules);
        this.validator = new ActionValidator(this, registry, costs, tussles);
        this.handSelector = handSelector;
    }

    /**
     * Begin the first turn of a freshly set up game. Does nothing once a turn has begun.
     */
    public void startGame() {
        if (state.getPhase() == Phase.START && state.getCcHistory().isEmpty()) {
            logger.info("Game {} starts, {} goes first", state.getGameId(), state.getActivePlayerId());
            beginTurn();
        }
    }

    // ---- Actions ----

    /**
     * Validate and apply an action, including every trigger it sets off.
     *
     * @throws InvalidActionException if the action is illegal; the state is left untouched
     */
    public ActionResult execute(GameAction action) throws InvalidActionException {
        String description;
        try {
            description = switch (action.getType()) {
                case PLAY_CARD -> applyPlay(validator.validatePlay((PlayCardAction) action));
                case TUSSLE -> applyTussle(validator.validateTussle((TussleAction) action));
                case DIRECT_ATTACK -> applyDirectAttack(validator.validateDirectAttack((DirectAttackAction) action));
                case ACTIVATE_ABILITY -> applyActivate(validator.validateActivate((ActivateAbilityAction) action));
                case END_TURN -> {
                    validator.validateEndTurn((EndTurnAction) action);
                    yield applyEndTurn();
                }
            };
        } catch (InvalidActionException e) {
            logger.debug("Rejected {}: {}", action, e.getMessage());
            throw e;
        }
        drainTriggers();
        sleepDefeatedToys();
        checkVictory(action.playerId());
        if (rules.isCheckInvariants()) {
            InvariantChecker.check(state);
        }
        logger.info("{}", description);
        return new ActionResult(description, state.getWinnerId());
    }

    public ActionResult playCard(String playerId, String cardId, List<String> targetIds, String alternativeCostCardId)
            throws InvalidActionException {
        return execute(new PlayCardAction(playerId, cardId, targetIds, alternativeCostCardId));
    }

    public ActionResult initiateTussle(String attackerId, String defenderId, String playerId)
            throws InvalidActionException {
        return execute(new TussleAction(playerId, attackerId, defenderId));
    }

    public ActionResult directAttack(String attackerId, String playerId) throws InvalidActionException {
        return execute(new DirectAttackAction(playerId, attackerId));
    }

    public ActionResult activateAbility(String playerId, String cardId, List<String> targetIds)
            throws InvalidActionException {
        return execute(new ActivateAbilityAction(playerId, cardId, targetIds));
    }

    public ActionResult endTurn(String playerId) throws InvalidActionException {
        return execute(new EndTurnAction(playerId));
    }

    /**
     * Actions the player may take now; the same checks {@link #execute} applies.
     */
    public List<ValidAction> getValidActions(String playerId, boolean filterForAi) {
        return validator.getValidActions(playerId, filterForAi);
    }

    private String applyPlay(ActionValidator.PlayPlan plan) {
        Card card = plan.card();
        String playerId = plan.playerId();
        Player player = state.getPlayer(playerId);
        String name = card.getName();

        if (plan.alternativeCostCard() != null) {
            log(playerId + " sleeps " + plan.alternativeCostCard().getName() + " to pay for " + name);
            sleep(plan.alternativeCostCard());
        } else {
            spendCc(player, plan.cost());
        }

        String description = playerId + " plays " + name + describeTargets(plan.targets());
        log(description);
        if (card.isToy()) {
            moveTo(card, Zone.IN_PLAY, playerId);
        } else {
            for (PlayEffect effect : plan.effects()) {
                effect.resolve(plan.targets(), playerId, this);
            }
            if (card.getZone() == Zone.HAND) {
                sleep(card);
            }
        }

        if (card.isInPlay()) {
            enqueueTriggers(List.of(card), TriggerTiming.WHEN_PLAYED, TriggerEvent.played(card, playerId));
        }
        enqueueTriggers(state.getCardsInPlay(playerId), TriggerTiming.WHEN_OTHER_CARD_PLAYED,
                TriggerEvent.cardPlayed(card, playerId));
        return description;
    }

    private String applyTussle(ActionValidator.TusslePlan plan) {
        spendCc(state.getPlayer(plan.playerId()), plan.cost());
        TussleResult result = tussles.predict(plan.attacker(), plan.defender(), state);
        if (!result.autoWin()) {
            plan.attacker().applyDamage(result.damageToAttacker());
            plan.defender().applyDamage(result.damageToDefender());
        }
        String description = result.describe();
        log(description);
        if (result.defenderDefeated()) {
            sleep(plan.defender());
        }
        if (result.attackerDefeated()) {
            sleep(plan.attacker());
        }
        return description;
    }

    private String applyDirectAttack(ActionValidator.DirectAttackPlan plan) {
        spendCc(state.getPlayer(plan.playerId()), plan.cost());
        Player opponent = state.getOpponent(plan.playerId());
        Card target = handSelector.select(opponent.getHand().getCards());
        state.incrementDirectAttacks();
        String description = plan.attacker().getName() + " attacks directly, sleeping "
                + target.getName() + " from " + opponent.getPlayerId() + "'s hand";
        log(description);
        sleep(target);
        return description;
    }

    private String applyActivate(ActionValidator.ActivatePlan plan) {
        spendCc(state.getPlayer(plan.playerId()), plan.ability().getCostCc());
        String description = plan.playerId() + " uses " + plan.card().getName() + describeTargets(plan.targets());
        log(description);
        plan.ability().activate(plan.targets(), plan.playerId(), this);
        return description;
    }

    // ---- Turn structure ----

    private String applyEndTurn() {
        Player ending = state.getActivePlayer();
        state.setPhase(Phase.END);
        int removed = 0;
        for (Card card : state.getAllCards()) {
            removed += card.expireModifications(state.getTurnNumber());
        }
        state.getCurrentCcRecord().ifPresent(r -> r.close(ending.getCc()));
        String description = ending.getPlayerId() + " ends turn " + state.getTurnNumber();
        log(description);
        logger.debug("Expired {} turn-scoped modifications", removed);

        state.setActivePlayerId(state.getOpponentId(ending.getPlayerId()));
        state.incrementTurn();
        state.setDirectAttacksThisTurn(0);
        beginTurn();
        return description;
    }

    private void beginTurn() {
        state.setPhase(Phase.START);
        Player player = state.getActivePlayer();
        String playerId = player.getPlayerId();
        state.addCcRecord(new TurnCcRecord(state.getTurnNumber(), playerId, player.getCc()));

        boolean openingTurn = state.getTurnNumber() == 1 && playerId.equals(state.getFirstPlayerId());
        int grant = openingTurn ? rules.getFirstTurnCc() : rules.getTurnCc();
        int gained = gainCc(playerId, grant);
        log("Turn " + state.getTurnNumber() + ": " + playerId + " gains " + gained + " CC (" + player.getCc() + ")");

        enqueueTriggers(state.getCardsInPlay(playerId), TriggerTiming.START_OF_TURN, TriggerEvent.startOfTurn(playerId));
        drainTriggers();
        sleepDefeatedToys();
        state.setPhase(Phase.MAIN);
        checkVictory(playerId);
    }

    // ---- Triggers ----

    private void enqueueTriggers(List<Card> sources, TriggerTiming timing, TriggerEvent event) {
        for (Card source : sources) {
            for (TriggeredEffect effect : registry.getTriggeredEffects(source, timing)) {
                if (effect.shouldTrigger(event, this)) {
                    triggerQueue.addLast(new PendingTrigger(effect, event));
                }
            }
        }
    }

    private void drainTriggers() {
        while (!triggerQueue.isEmpty()) {
            PendingTrigger pending = triggerQueue.pollFirst();
            logger.debug("Resolving trigger {} for {}", pending.effect(), pending.event().timing());
            pending.effect().apply(pending.event(), this);
        }
    }

    /**
     * Sleep every in-play Toy left with no remaining stamina, for example after the
     * stamina boost keeping it alive has left play, until no such Toy is left.
     */
    private void sleepDefeatedToys() {
        List<Card> defeated = defeatedToys();
        while (!defeated.isEmpty()) {
            for (Card card : defeated) {
                if (card.isInPlay()) {
                    log(card.getName() + " has no stamina left");
                    sleep(card);
                }
            }
            drainTriggers();
            defeated = defeatedToys();
        }
    }

    private List<Card> defeatedToys() {
        List<Card> defeated = new ArrayList<>();
        for (Card card : state.getAllCardsInPlay()) {
            if (card.isToy() && stats.isDefeated(card, state)) {
                defeated.add(card);
            }
        }
        return defeated;
    }

    // ---- Victory ----

    /**
     * A player loses once every card they own is in their sleep zone. If both players
     * lose at once, the acting player wins.
     */
    private void checkVictory(String actingPlayerId) {
        if (state.isGameOver()) {
            return;
        }
        List<String> losers = new ArrayList<>();
        for (Player player : state.getPlayers()) {
            List<Card> owned = state.getCardsOwnedBy(player.getPlayerId());
            if (!owned.isEmpty() && owned.stream().allMatch(c -> c.getZone() == Zone.SLEEP)) {
                losers.add(player.getPlayerId());
            }
        }
        if (losers.isEmpty()) {
            return;
        }
        String winner = losers.size() == 1 ? state.getOpponentId(losers.get(0)) : actingPlayerId;
        state.setWinnerId(winner);
        log(winner + " wins: every card of " + String.join(" and ", losers) + " is sleeping");
        logger.info("Game {} won by {} on turn {}", state.getGameId(), winner, state.getTurnNumber());
    }

    // ---- Zone transitions ----

    /**
     * Take a card out of the zone list it currently occupies.
     */
    private void detach(Card card) {
        Zone zone = card.getZone();
        String holder = zone == Zone.IN_PLAY ? card.getController() : card.getOwner();
        if (!state.getPlayer(holder).getZone(zone).remove(card)) {
            String message = card + " is not in " + holder + "'s " + zone.getJsonValue();
            logger.error("Invariant violation: {}", message);
            throw new InvariantViolationException(message);
        }
    }

    /**
     * Move a card to a zone under a holder: the controller for play, the owner otherwise.
     */
    private void moveTo(Card card, Zone zone, String controllerId) {
        detach(card);
        card.setController(zone == Zone.IN_PLAY ? controllerId : card.getOwner());
        card.setZone(zone);
        String holder = zone == Zone.IN_PLAY ? controllerId : card.getOwner();
        state.getPlayer(holder).getZone(zone).add(card);
    }

    @Override
    public void sleep(Card card) {
        if (card.getZone() == Zone.SLEEP) {
            return;
        }
        boolean wasInPlay = card.isInPlay();
        List<TriggeredEffect> onSleep = wasInPlay
                ? registry.getTriggeredEffects(card, TriggerTiming.WHEN_SLEEPED)
                : List.of();
        String name = card.getName();

        card.clearModifications();
        card.revertCopy();
        moveTo(card, Zone.SLEEP, card.getOwner());
        log(name + " is sleeped" + (wasInPlay ? "" : " from hand"));

        TriggerEvent event = TriggerEvent.sleeped(card);
        for (TriggeredEffect effect : onSleep) {
            if (effect.shouldTrigger(event, this)) {
                triggerQueue.addLast(new PendingTrigger(effect, event));
            }
        }
    }

    @Override
    public void wake(Card card) {
        if (card.getZone() != Zone.SLEEP) {
            throw new IllegalArgumentException(card + " is not sleeping");
        }
        card.clearModifications();
        card.revertCopy();
        card.resetStamina();
        moveTo(card, Zone.HAND, card.getOwner());
        log(card.getName() + " is unsleeped to " + card.getOwner() + "'s hand");
    }

    @Override
    public void returnToHand(Card card) {
        if (!card.isInPlay()) {
            throw new IllegalArgumentException(card + " is not in play");
        }
        String name = card.getName();
        card.clearModifications();
        card.revertCopy();
        card.resetStamina();
        moveTo(card, Zone.HAND, card.getOwner());
        log(name + " returns to " + card.getOwner() + "'s hand");
    }

    @Override
    public void changeController(Card card, String newControllerId) {
        if (!card.isInPlay()) {
            throw new IllegalArgumentException(card + " is not in play");
        }
        String previous = card.getController();
        detach(card);
        card.setController(newControllerId);
        state.getPlayer(newControllerId).getInPlay().add(card);
        log(newControllerId + " takes control of " + card.getName() + " from " + previous);
    }

    @Override
    public void becomeCopy(Card card, Card original, String playerId) {
        card.becomeCopyOf(original.getActiveDefinition());
        moveTo(card, Zone.IN_PLAY, playerId);
        log(card.getId() + " becomes a copy of " + original.getName());
    }

    // ---- Resources and stats ----

    @Override
    public int gainCc(String playerId, int amount) {
        int gained = state.getPlayer(playerId).gainCc(amount, rules.getMaxCc());
        state.getCurrentCcRecord()
                .filter(r -> r.getPlayerId().equals(playerId))
                .ifPresent(r -> r.recordGain(gained));
        return gained;
    }

    private void spendCc(Player player, int amount) {
        player.spendCc(amount);
        state.getCurrentCcRecord()
                .filter(r -> r.getPlayerId().equals(player.getPlayerId()))
                .ifPresent(r -> r.recordSpend(amount));
    }

    @Override
    public void removeStamina(Card card, int amount) {
        card.applyDamage(amount);
        if (card.isInPlay() && stats.isDefeated(card, state)) {
            sleep(card);
        }
    }

    @Override
    public void addModification(Card card, StatModification modification) {
        card.addModification(modification);
    }

    @Override
    public void log(String message) {
        state.addLog(message);
    }

    // ---- GameView ----

    @Override
    public GameState getState() {
        return state;
    }

    @Override
    public GameRules getRules() {
        return rules;
    }

    @Override
    public int getEffectiveStat(Card card, Stat stat) {
        return stats.getEffectiveStat(card, stat, state);
    }

    @Override
    public int getRemainingStamina(Card card) {
        return stats.getRemainingStamina(card, state);
    }

    @Override
    public boolean isProtected(Card target, Effect incoming) {
        return stats.isProtected(target, incoming, state);
    }

    public EffectRegistry getRegistry() {
        return registry;
    }

    public TussleResolver getTussleResolver() {
        return tussles;
    }

    public CostCalculator getCostCalculator() {
        return costs;
    }

    private static String describeTargets(List<Card> targets) {
        if (targets.isEmpty()) {
            return "";
        }
        List<String> names = new ArrayList<>();
        for (Card target : targets) {
            names.add(target.getName());
        }
        return " targeting " + String.join(", ", names);
    }
}
