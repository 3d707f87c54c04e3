package com.ggltcg.simulation;

import com.ggltcg.card.CardDatabase;
import com.ggltcg.card.CardDatabaseException;
import com.ggltcg.game.GameEngine;
import com.ggltcg.game.GameFactory;
import com.ggltcg.game.GameRules;
import com.ggltcg.game.GameState;
import com.ggltcg.game.HandCardSelector;
import com.ggltcg.game.action.ActionResult;
import com.ggltcg.game.action.ActionType;
import com.ggltcg.game.action.GameAction;
import com.ggltcg.game.action.InvalidActionException;
import com.ggltcg.game.action.ValidAction;
import com.ggltcg.rng.GameRng;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Plays games between two random players that choose uniformly among the valid actions.
 */
public final class SelfPlayRunner {
    private static final Logger log = LoggerFactory.getLogger(SelfPlayRunner.class);

    private SelfPlayRunner() {
        // Utility class - prevent instantiation
    }

    /**
     * Play one game to completion or until the action limit.
     *
     * @param db         card table
     * @param rules      rule constants
     * @param deckOne    deck for player one
     * @param deckTwo    deck for player two
     * @param seed       seed for every random choice in the game
     * @param maxActions stop after this many actions
     * @param filterForAi skip tussles the attacker is certain to lose
     */
    public static GameResult playGame(CardDatabase db, GameRules rules, Deck deckOne, Deck deckTwo,
                                      long seed, int maxActions, boolean filterForAi)
            throws CardDatabaseException {
        GameRng rng = new GameRng(seed);
        String first = rng.nextInt(2) == 0 ? GameFactory.PLAYER_ONE : GameFactory.PLAYER_TWO;
        GameState state = GameFactory.createGame("selfplay-" + seed, db,
                deckOne.getDefinitionIds(), deckTwo.getDefinitionIds(), first);
        GameEngine engine = GameFactory.startEngine(state, db, rules, HandCardSelector.random(rng));

        int actions = 0;
        while (!state.isGameOver() && actions < maxActions) {
            String playerId = state.getActivePlayerId();
            List<ValidAction> options = engine.getValidActions(playerId, filterForAi);
            ValidAction choice = chooseAction(options, rng);
            GameAction action = buildAction(choice, playerId, state.getPlayer(playerId).getCc(), rng);
            try {
                ActionResult result = engine.execute(action);
                actions++;
                log.debug("{}: {}", playerId, result.description());
            } catch (InvalidActionException e) {
                // A listed action was rejected: listing and execution disagree.
                throw new IllegalStateException("Listed action rejected: " + choice + ": " + e.getMessage(), e);
            }
        }
        return new GameResult(state.getWinnerId().orElse(null), state.getTurnNumber(), actions, state.getGameLog());
    }

    /**
     * Uniform over non-end-turn actions; ends the turn when nothing else is available
     * or with a one-in-four chance, so games keep moving.
     */
    private static ValidAction chooseAction(List<ValidAction> options, GameRng rng) {
        List<ValidAction> moves = new ArrayList<>();
        ValidAction endTurn = null;
        for (ValidAction option : options) {
            if (option.type() == ActionType.END_TURN) {
                endTurn = option;
            } else {
                moves.add(option);
            }
        }
        if (moves.isEmpty() || rng.nextInt(4) == 0) {
            return endTurn != null ? endTurn : ValidAction.endTurn();
        }
        return rng.pick(moves);
    }

    private static GameAction buildAction(ValidAction choice, String playerId, int cc, GameRng rng) {
        List<String> pool = new ArrayList<>(choice.targetOptions());
        rng.shuffle(pool);
        int available = Math.min(choice.maxTargets(), pool.size());
        int min = Math.min(choice.minTargets(), available);
        int count = min + (available > min ? rng.nextInt(available - min + 1) : 0);
        List<String> targets = new ArrayList<>(pool.subList(0, count));

        String alternative = null;
        boolean mustUseAlternative = choice.cost() != null && choice.cost() > cc;
        if (!choice.alternativeCostOptions().isEmpty() && (mustUseAlternative || rng.nextInt(2) == 0)) {
            alternative = rng.pick(choice.alternativeCostOptions());
        }
        return choice.toAction(playerId, targets, alternative);
    }
}
