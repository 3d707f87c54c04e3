package com.ggltcg.game;

import com.ggltcg.card.Card;
import com.ggltcg.game.zones.CardZone;
import com.ggltcg.game.zones.Hand;
import com.ggltcg.game.zones.InPlay;
import com.ggltcg.game.zones.SleepZone;
import com.ggltcg.game.zones.Zone;

import java.util.ArrayList;
import java.util.List;

/**
 * One side of a game: three zones and a CC pool.
 */
public class Player {
    private final String playerId;
    private final String name;
    private final Hand hand;
    private final InPlay inPlay;
    private final SleepZone sleepZone;
    private int cc;

    public Player(String playerId, String name) {
        this.playerId = playerId;
        this.name = name;
        this.hand = new Hand();
        this.inPlay = new InPlay();
        this.sleepZone = new SleepZone();
        this.cc = 0;
    }

    public String getPlayerId() {
        return playerId;
    }

    public String getName() {
        return name;
    }

    // ---- Zone accessors ----
    public Hand getHand() {
        return hand;
    }

    public InPlay getInPlay() {
        return inPlay;
    }

    public SleepZone getSleepZone() {
        return sleepZone;
    }

    public CardZone getZone(Zone zone) {
        return switch (zone) {
            case HAND -> hand;
            case IN_PLAY -> inPlay;
            case SLEEP -> sleepZone;
        };
    }

    public boolean hasToysInPlay() {
        return !inPlay.getToys().isEmpty();
    }

    // ---- CC ----
    public int getCc() {
        return cc;
    }

    public void setCc(int cc) {
        this.cc = cc;
    }

    /**
     * Gain CC up to a cap.
     *
     * @return the amount actually gained
     */
    public int gainCc(int amount, int max) {
        int before = cc;
        cc = Math.min(max, cc + amount);
        return Math.max(0, cc - before);
    }

    /**
     * Spend CC.
     *
     * @throws IllegalStateException if the player cannot afford it; callers validate first
     */
    public void spendCc(int amount) {
        if (amount > cc) {
            throw new IllegalStateException(playerId + " cannot spend " + amount + " CC with " + cc);
        }
        cc -= amount;
    }

    /**
     * Cards currently held in this player's three zones.
     */
    public List<Card> getAllHeldCards() {
        List<Card> all = new ArrayList<>(hand.size() + inPlay.size() + sleepZone.size());
        all.addAll(hand.getCardsMutable());
        all.addAll(inPlay.getCardsMutable());
        all.addAll(sleepZone.getCardsMutable());
        return all;
    }

    @Override
    public String toString() {
        return playerId + " (CC " + cc + ", hand " + hand.size() + ", in play " + inPlay.size()
                + ", sleep " + sleepZone.size() + ")";
    }
}
