package com.ggltcg.game;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.ggltcg.card.Card;
import com.ggltcg.card.CardDatabase;
import com.ggltcg.card.CardDatabaseException;
import com.ggltcg.card.StatModification;
import com.ggltcg.game.zones.CardZone;
import com.ggltcg.game.zones.Zone;

import java.util.ArrayList;
import java.util.List;

/**
 * Converts a {@link GameState} to JSON and back.
 * Only stored fields are written; effective stats are re-derived from them after loading.
 */
public class GameStateCodec {

    record CardSnapshot(@JsonProperty("id") String id,
                        @JsonProperty("definition_id") String definitionId,
                        @JsonProperty("owner") String owner,
                        @JsonProperty("controller") String controller,
                        @JsonProperty("zone") Zone zone,
                        @JsonProperty("current_stamina") int currentStamina,
                        @JsonProperty("copy_of") String copyOf,
                        @JsonProperty("modifications") List<StatModification> modifications) {}

    record PlayerSnapshot(@JsonProperty("player_id") String playerId,
                          @JsonProperty("name") String name,
                          @JsonProperty("cc") int cc,
                          @JsonProperty("hand") List<CardSnapshot> hand,
                          @JsonProperty("in_play") List<CardSnapshot> inPlay,
                          @JsonProperty("sleep_zone") List<CardSnapshot> sleepZone) {}

    record GameSnapshot(@JsonProperty("game_id") String gameId,
                        @JsonProperty("first_player_id") String firstPlayerId,
                        @JsonProperty("active_player_id") String activePlayerId,
                        @JsonProperty("turn_number") int turnNumber,
                        @JsonProperty("phase") Phase phase,
                        @JsonProperty("direct_attacks_this_turn") int directAttacksThisTurn,
                        @JsonProperty("winner_id") String winnerId,
                        @JsonProperty("players") List<PlayerSnapshot> players,
                        @JsonProperty("game_log") List<String> gameLog,
                        @JsonProperty("cc_history") List<TurnCcRecord> ccHistory) {}

    private final CardDatabase db;
    private final ObjectMapper mapper;

    public GameStateCodec(CardDatabase db) {
        this.db = db;
        this.mapper = new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT);
    }

    public String toJson(GameState state) throws CodecException {
        try {
            return mapper.writeValueAsString(snapshot(state));
        } catch (JsonProcessingException e) {
            throw new CodecException("Failed to write game " + state.getGameId() + ": " + e.getMessage(), e);
        }
    }

    /**
     * Rebuild a game from JSON. Card definitions are looked up in the card table by id.
     */
    public GameState fromJson(String json) throws CodecException {
        GameSnapshot snapshot;
        try {
            snapshot = mapper.readValue(json, GameSnapshot.class);
        } catch (JsonProcessingException e) {
            throw new CodecException("Failed to read game snapshot: " + e.getMessage(), e);
        }
        try {
            return restore(snapshot);
        } catch (CardDatabaseException e) {
            throw new CodecException("Snapshot refers to an unknown card: " + e.getMessage(), e);
        }
    }

    /**
     * Independent deep copy through the JSON form.
     */
    public GameState copy(GameState state) throws CodecException {
        return fromJson(toJson(state));
    }

    private GameSnapshot snapshot(GameState state) {
        List<PlayerSnapshot> players = new ArrayList<>();
        for (Player player : state.getPlayers()) {
            players.add(new PlayerSnapshot(player.getPlayerId(), player.getName(), player.getCc(),
                    snapshot(player.getHand()), snapshot(player.getInPlay()), snapshot(player.getSleepZone())));
        }
        return new GameSnapshot(state.getGameId(), state.getFirstPlayerId(), state.getActivePlayerId(),
                state.getTurnNumber(), state.getPhase(), state.getDirectAttacksThisTurn(),
                state.getWinnerId().orElse(null), players, state.getGameLog(), state.getCcHistory());
    }

    private List<CardSnapshot> snapshot(CardZone zone) {
        List<CardSnapshot> cards = new ArrayList<>();
        for (Card card : zone.getCards()) {
            cards.add(new CardSnapshot(card.getId(), card.getDefinition().getId(), card.getOwner(),
                    card.getController(), card.getZone(), card.getCurrentStamina(),
                    card.isCopy() ? card.getCopyOf().getId() : null, card.getModifications()));
        }
        return cards;
    }

    private GameState restore(GameSnapshot snapshot) throws CardDatabaseException, CodecException {
        if (snapshot.players() == null || snapshot.players().size() != 2) {
            throw new CodecException("A game snapshot needs exactly two players");
        }
        List<Player> players = new ArrayList<>();
        for (PlayerSnapshot ps : snapshot.players()) {
            Player player = new Player(ps.playerId(), ps.name());
            player.setCc(ps.cc());
            restoreZone(player.getHand(), ps.hand());
            restoreZone(player.getInPlay(), ps.inPlay());
            restoreZone(player.getSleepZone(), ps.sleepZone());
            players.add(player);
        }
        Player first = players.get(0);
        Player second = players.get(1);
        if (!first.getPlayerId().equals(snapshot.firstPlayerId())) {
            Player swap = first;
            first = second;
            second = swap;
        }

        GameState state = new GameState(snapshot.gameId(), first, second);
        state.setActivePlayerId(snapshot.activePlayerId());
        state.setTurnNumber(snapshot.turnNumber());
        state.setPhase(snapshot.phase());
        state.setDirectAttacksThisTurn(snapshot.directAttacksThisTurn());
        state.setWinnerId(snapshot.winnerId());
        if (snapshot.gameLog() != null) {
            snapshot.gameLog().forEach(state::addLog);
        }
        if (snapshot.ccHistory() != null) {
            snapshot.ccHistory().forEach(state::addCcRecord);
        }
        return state;
    }

    private void restoreZone(CardZone zone, List<CardSnapshot> cards) throws CardDatabaseException {
        if (cards == null) {
            return;
        }
        for (CardSnapshot cs : cards) {
            Card card = new Card(cs.id(), db.getDefinition(cs.definitionId()), cs.owner(), cs.controller(), cs.zone());
            if (cs.copyOf() != null) {
                card.becomeCopyOf(db.getDefinition(cs.copyOf()));
            }
            card.restoreStamina(cs.currentStamina());
            if (cs.modifications() != null) {
                cs.modifications().forEach(card::addModification);
            }
            zone.add(card);
        }
    }

    /**
     * Exception thrown when a snapshot cannot be written or read.
     */
    public static class CodecException extends Exception {
        public CodecException(String message) {
            super(message);
        }

        public CodecException(String message, Throwable cause) {
            super(message, cause);
        }
    }
}
