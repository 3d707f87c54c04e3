package com.ggltcg.card;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * A stat delta stored on a card instance.
 *
 * @param stat             the modified stat
 * @param amount           signed delta
 * @param expiresAfterTurn turn number after which the modification is dropped, or null if it
 *                         lasts until the card changes zone
 * @param sourceCardId     id of the card whose effect created it
 */
public record StatModification(@JsonProperty("stat") Stat stat,
                               @JsonProperty("amount") int amount,
                               @JsonProperty("expires_after_turn") Integer expiresAfterTurn,
                               @JsonProperty("source_card_id") String sourceCardId) {

    public static StatModification untilEndOfTurn(Stat stat, int amount, int turn, String sourceCardId) {
        return new StatModification(stat, amount, turn, sourceCardId);
    }

    @JsonIgnore
    public boolean isTurnScoped() {
        return expiresAfterTurn != null;
    }

    public boolean isExpired(int currentTurn) {
        return expiresAfterTurn != null && currentTurn >= expiresAfterTurn;
    }
}
