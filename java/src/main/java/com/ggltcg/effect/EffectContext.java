package com.ggltcg.effect;

import com.ggltcg.card.Card;
import com.ggltcg.card.StatModification;

/**
 * Mutations an effect may perform while resolving.
 * Zone changes go through here so triggers and zone bookkeeping are never bypassed.
 */
public interface EffectContext extends GameView {

    /**
     * Move a card to its owner's sleep zone. On-sleep triggers fire only if it was in play.
     */
    void sleep(Card card);

    /**
     * Move a sleeping card to its owner's hand with a full reset.
     */
    void wake(Card card);

    /**
     * Return an in-play card to its owner's hand. No on-sleep triggers.
     */
    void returnToHand(Card card);

    /**
     * Give control of an in-play card to another player; modifications are kept.
     */
    void changeController(Card card, String newControllerId);

    /**
     * Grant CC, capped at the rules maximum.
     *
     * @return CC actually gained
     */
    int gainCc(String playerId, int amount);

    /**
     * Remove stamina from a Toy outside of combat; the Toy is sleeped if none remains.
     */
    void removeStamina(Card card, int amount);

    void addModification(Card card, StatModification modification);

    /**
     * Turn a card into a copy of another in-play Toy and put it into play under the player.
     */
    void becomeCopy(Card card, Card original, String playerId);

    /**
     * Append a line to the play-by-play log.
     */
    void log(String message);
}
