package com.ggltcg.game;

import com.ggltcg.card.Card;
import com.ggltcg.rng.GameRng;

import java.util.List;

/**
 * Picks the hand card a direct attack sleeps.
 */
@FunctionalInterface
public interface HandCardSelector {

    /**
     * @param hand the opponent's hand, never empty
     */
    Card select(List<Card> hand);

    static HandCardSelector random(GameRng rng) {
        return rng::pick;
    }

    static HandCardSelector first() {
        return hand -> hand.get(0);
    }
}
