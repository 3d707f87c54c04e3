package com.ggltcg.game.zones;

/**
 * Sleep zone - defeated and used cards. Always the owner's, whoever controlled the card last.
 */
public class SleepZone extends CardZone {

    @Override
    public Zone getZone() {
        return Zone.SLEEP;
    }
}
