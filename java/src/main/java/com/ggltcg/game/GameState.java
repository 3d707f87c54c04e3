package com.ggltcg.game;

import com.ggltcg.card.Card;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Complete state of one game.
 * Storage and lookups only; every mutation goes through the {@link GameEngine}.
 */
public class GameState {
    private final String gameId;
    private final Map<String, Player> players;
    private final String firstPlayerId;

    private String activePlayerId;
    private int turnNumber;
    private Phase phase;
    private int directAttacksThisTurn;
    private String winnerId;

    private final List<String> gameLog;
    private final List<TurnCcRecord> ccHistory;

    public GameState(String gameId, Player firstPlayer, Player secondPlayer) {
        if (firstPlayer.getPlayerId().equals(secondPlayer.getPlayerId())) {
            throw new IllegalArgumentException("Player ids must differ: " + firstPlayer.getPlayerId());
        }
        this.gameId = gameId;
        this.players = new LinkedHashMap<>();
        this.players.put(firstPlayer.getPlayerId(), firstPlayer);
        this.players.put(secondPlayer.getPlayerId(), secondPlayer);
        this.firstPlayerId = firstPlayer.getPlayerId();
        this.activePlayerId = firstPlayerId;
        this.turnNumber = 1;
        this.phase = Phase.START;
        this.directAttacksThisTurn = 0;
        this.winnerId = null;
        this.gameLog = new ArrayList<>();
        this.ccHistory = new ArrayList<>();
    }

    public String getGameId() {
        return gameId;
    }

    // ---- Players ----
    public List<Player> getPlayers() {
        return List.copyOf(players.values());
    }

    /**
     * @throws IllegalArgumentException for an unknown player id
     */
    public Player getPlayer(String playerId) {
        Player player = players.get(playerId);
        if (player == null) {
            throw new IllegalArgumentException("Unknown player: " + playerId);
        }
        return player;
    }

    public boolean hasPlayer(String playerId) {
        return players.containsKey(playerId);
    }

    public String getOpponentId(String playerId) {
        for (String id : players.keySet()) {
            if (!id.equals(playerId)) {
                return id;
            }
        }
        throw new IllegalStateException("No opponent for " + playerId);
    }

    public Player getOpponent(String playerId) {
        return getPlayer(getOpponentId(playerId));
    }

    public String getFirstPlayerId() {
        return firstPlayerId;
    }

    public String getActivePlayerId() {
        return activePlayerId;
    }

    public void setActivePlayerId(String activePlayerId) {
        this.activePlayerId = activePlayerId;
    }

    public Player getActivePlayer() {
        return getPlayer(activePlayerId);
    }

    // ---- Turn info ----
    public int getTurnNumber() {
        return turnNumber;
    }

    public void setTurnNumber(int turnNumber) {
        this.turnNumber = turnNumber;
    }

    public void incrementTurn() {
        turnNumber++;
    }

    public Phase getPhase() {
        return phase;
    }

    public void setPhase(Phase phase) {
        this.phase = phase;
    }

    /**
     * First player's turn 1 and second player's turn 2.
     */
    public boolean isPlayersFirstTurn(String playerId) {
        if (playerId.equals(firstPlayerId)) {
            return turnNumber == 1;
        }
        return turnNumber == 2;
    }

    public int getDirectAttacksThisTurn() {
        return directAttacksThisTurn;
    }

    public void setDirectAttacksThisTurn(int directAttacksThisTurn) {
        this.directAttacksThisTurn = directAttacksThisTurn;
    }

    public void incrementDirectAttacks() {
        directAttacksThisTurn++;
    }

    // ---- Victory ----
    public Optional<String> getWinnerId() {
        return Optional.ofNullable(winnerId);
    }

    public void setWinnerId(String winnerId) {
        this.winnerId = winnerId;
    }

    public boolean isGameOver() {
        return winnerId != null;
    }

    // ---- Card lookups ----

    /**
     * Find a card instance anywhere in the game.
     */
    public Optional<Card> findCard(String cardId) {
        for (Player player : players.values()) {
            for (Card card : player.getAllHeldCards()) {
                if (card.getId().equals(cardId)) {
                    return Optional.of(card);
                }
            }
        }
        return Optional.empty();
    }

    public List<Card> getAllCards() {
        List<Card> all = new ArrayList<>();
        for (Player player : players.values()) {
            all.addAll(player.getAllHeldCards());
        }
        return all;
    }

    /**
     * Cards in play on both sides, first player's side first.
     */
    public List<Card> getAllCardsInPlay() {
        List<Card> all = new ArrayList<>();
        for (Player player : players.values()) {
            all.addAll(player.getInPlay().getCardsMutable());
        }
        return all;
    }

    /**
     * Cards the given player controls in play.
     */
    public List<Card> getCardsInPlay(String playerId) {
        return getPlayer(playerId).getInPlay().getCards();
    }

    /**
     * Every card the player owns, wherever it currently is.
     */
    public List<Card> getCardsOwnedBy(String playerId) {
        List<Card> owned = new ArrayList<>();
        for (Card card : getAllCards()) {
            if (card.getOwner().equals(playerId)) {
                owned.add(card);
            }
        }
        return owned;
    }

    // ---- Play-by-play and CC history ----
    public void addLog(String entry) {
        gameLog.add(entry);
    }

    public List<String> getGameLog() {
        return List.copyOf(gameLog);
    }

    public List<TurnCcRecord> getCcHistory() {
        return List.copyOf(ccHistory);
    }

    public void addCcRecord(TurnCcRecord record) {
        ccHistory.add(record);
    }

    /**
     * The record of the turn in progress, if any.
     */
    public Optional<TurnCcRecord> getCurrentCcRecord() {
        if (ccHistory.isEmpty()) {
            return Optional.empty();
        }
        TurnCcRecord last = ccHistory.get(ccHistory.size() - 1);
        return last.getTurn() == turnNumber ? Optional.of(last) : Optional.empty();
    }
}
