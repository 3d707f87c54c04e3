package com.ggltcg.game.zones;

import com.ggltcg.card.Card;

import java.util.ArrayList;
import java.util.List;

/**
 * In play - cards a player currently controls on the table.
 */
public class InPlay extends CardZone {

    @Override
    public Zone getZone() {
        return Zone.IN_PLAY;
    }

    /**
     * Get all Toys in play.
     */
    public List<Card> getToys() {
        List<Card> toys = new ArrayList<>();
        for (Card card : getCardsMutable()) {
            if (card.isToy()) {
                toys.add(card);
            }
        }
        return toys;
    }
}
