package com.ggltcg.game.zones;

import com.ggltcg.card.Card;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Ordered card list backing one of a player's zones.
 * Membership is by card identity (id), never by name.
 */
public abstract class CardZone {
    private final List<Card> cards;

    protected CardZone() {
        this.cards = new ArrayList<>();
    }

    /**
     * The zone value cards held here must carry.
     */
    public abstract Zone getZone();

    public void add(Card card) {
        cards.add(card);
    }

    /**
     * Remove a specific card.
     * @param card The card to remove
     * @return true if the card was found and removed
     */
    public boolean remove(Card card) {
        return cards.remove(card);
    }

    public boolean contains(Card card) {
        return cards.contains(card);
    }

    /**
     * Find a card by instance id.
     */
    public Optional<Card> findById(String cardId) {
        for (Card card : cards) {
            if (card.getId().equals(cardId)) {
                return Optional.of(card);
            }
        }
        return Optional.empty();
    }

    public void clear() {
        cards.clear();
    }

    public int size() {
        return cards.size();
    }

    public boolean isEmpty() {
        return cards.isEmpty();
    }

    /**
     * Get an unmodifiable copy of the cards.
     */
    public List<Card> getCards() {
        return List.copyOf(cards);
    }

    /**
     * Get direct access to the underlying card list.
     */
    public List<Card> getCardsMutable() {
        return cards;
    }

    @Override
    public String toString() {
        return getZone().getJsonValue() + cards;
    }
}
