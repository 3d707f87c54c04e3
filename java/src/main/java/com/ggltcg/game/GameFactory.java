package com.ggltcg.game;

import com.ggltcg.card.Card;
import com.ggltcg.card.CardDatabase;
import com.ggltcg.card.CardDatabaseException;
import com.ggltcg.card.CardDefinition;
import com.ggltcg.effect.EffectRegistry;

import java.util.List;

/**
 * Sets up new games. Every card starts in its owner's hand with a unique instance id.
 */
public final class GameFactory {
    public static final String PLAYER_ONE = "p1";
    public static final String PLAYER_TWO = "p2";

    private GameFactory() {
        // Utility class - prevent instantiation
    }

    /**
     * Create a game between {@link #PLAYER_ONE} and {@link #PLAYER_TWO}.
     *
     * @param gameId        id for logging and snapshots
     * @param db            card table the deck ids refer to
     * @param deckOne       definition ids for player one
     * @param deckTwo       definition ids for player two
     * @param firstPlayerId which player takes turn 1
     * @throws CardDatabaseException if a deck names an unknown definition
     */
    public static GameState createGame(String gameId, CardDatabase db, List<String> deckOne, List<String> deckTwo,
                                       String firstPlayerId) throws CardDatabaseException {
        Player one = new Player(PLAYER_ONE, "Player 1");
        Player two = new Player(PLAYER_TWO, "Player 2");
        deal(one, deckOne, db);
        deal(two, deckTwo, db);
        if (PLAYER_ONE.equals(firstPlayerId)) {
            return new GameState(gameId, one, two);
        }
        if (PLAYER_TWO.equals(firstPlayerId)) {
            return new GameState(gameId, two, one);
        }
        throw new IllegalArgumentException("Unknown first player: " + firstPlayerId);
    }

    private static void deal(Player player, List<String> definitionIds, CardDatabase db)
            throws CardDatabaseException {
        int index = 1;
        for (String definitionId : definitionIds) {
            CardDefinition definition = db.getDefinition(definitionId);
            String cardId = String.format("%s-%02d", player.getPlayerId(), index++);
            player.getHand().add(new Card(cardId, definition, player.getPlayerId()));
        }
    }

    /**
     * Build an engine for a new game and begin turn 1.
     */
    public static GameEngine startEngine(GameState state, CardDatabase db, GameRules rules,
                                         HandCardSelector handSelector) {
        GameEngine engine = new GameEngine(state, new EffectRegistry(db), rules, handSelector);
        engine.startGame();
        return engine;
    }
}
