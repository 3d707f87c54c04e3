package com.ggltcg.game;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * CC bookkeeping for one player's turn.
 */
public class TurnCcRecord {
    @JsonProperty("turn")
    private int turn;

    @JsonProperty("player_id")
    private String playerId;

    @JsonProperty("cc_start")
    private int ccStart;

    @JsonProperty("cc_gained")
    private int ccGained;

    @JsonProperty("cc_spent")
    private int ccSpent;

    @JsonProperty("cc_end")
    private Integer ccEnd;

    public TurnCcRecord() {
    }

    public TurnCcRecord(int turn, String playerId, int ccStart) {
        this.turn = turn;
        this.playerId = playerId;
        this.ccStart = ccStart;
    }

    public void recordGain(int amount) {
        ccGained += amount;
    }

    public void recordSpend(int amount) {
        ccSpent += amount;
    }

    public void close(int ccEnd) {
        this.ccEnd = ccEnd;
    }

    public int getTurn() {
        return turn;
    }

    public String getPlayerId() {
        return playerId;
    }

    public int getCcStart() {
        return ccStart;
    }

    public int getCcGained() {
        return ccGained;
    }

    public int getCcSpent() {
        return ccSpent;
    }

    /**
     * CC left when the turn ended, or null while the turn is running.
     */
    public Integer getCcEnd() {
        return ccEnd;
    }

    @Override
    public String toString() {
        return "Turn " + turn + " " + playerId + ": start " + ccStart + ", +" + ccGained
                + ", -" + ccSpent + ", end " + (ccEnd != null ? ccEnd : "-");
    }
}
