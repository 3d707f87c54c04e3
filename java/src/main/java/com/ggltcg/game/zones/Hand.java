package com.ggltcg.game.zones;

/**
 * Hand - cards a player may play.
 */
public class Hand extends CardZone {

    @Override
    public Zone getZone() {
        return Zone.HAND;
    }
}
