package com.ggltcg.effect;

import com.ggltcg.card.Card;

/**
 * A game event delivered to triggered effects.
 *
 * @param timing   what happened
 * @param subject  the card the event is about (the sleeped or played card), or null at turn start
 * @param playerId the player the event belongs to (card owner, active player or player who played)
 */
public record TriggerEvent(TriggerTiming timing, Card subject, String playerId) {

    public static TriggerEvent sleeped(Card card) {
        return new TriggerEvent(TriggerTiming.WHEN_SLEEPED, card, card.getOwner());
    }

    public static TriggerEvent startOfTurn(String playerId) {
        return new TriggerEvent(TriggerTiming.START_OF_TURN, null, playerId);
    }

    public static TriggerEvent cardPlayed(Card card, String playerId) {
        return new TriggerEvent(TriggerTiming.WHEN_OTHER_CARD_PLAYED, card, playerId);
    }

    public static TriggerEvent played(Card card, String playerId) {
        return new TriggerEvent(TriggerTiming.WHEN_PLAYED, card, playerId);
    }
}
