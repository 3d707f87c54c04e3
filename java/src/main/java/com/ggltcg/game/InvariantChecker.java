package com.ggltcg.game;

import com.ggltcg.card.Card;
import com.ggltcg.game.zones.CardZone;
import com.ggltcg.game.zones.Zone;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.HashMap;
import java.util.Map;

/**
 * Zone integrity checks run after each action.
 */
public final class InvariantChecker {
    private static final Logger log = LoggerFactory.getLogger(InvariantChecker.class);

    private InvariantChecker() {
        // Utility class - prevent instantiation
    }

    /**
     * Verify that every card sits in exactly one zone list that agrees with its zone,
     * owner and controller, and that cards out of play carry no modifications.
     *
     * @throws InvariantViolationException on the first inconsistency found
     */
    public static void check(GameState state) {
        Map<String, String> seen = new HashMap<>();
        for (Player player : state.getPlayers()) {
            for (Zone zone : Zone.values()) {
                CardZone cards = player.getZone(zone);
                for (Card card : cards.getCardsMutable()) {
                    String where = player.getPlayerId() + "/" + zone.getJsonValue();
                    String previous = seen.put(card.getId(), where);
                    if (previous != null) {
                        fail(card + " is in both " + previous + " and " + where);
                    }
                    if (card.getZone() != zone) {
                        fail(card + " is listed in " + where + " but its zone is " + card.getZone());
                    }
                    checkHolder(card, player, zone);
                }
            }
        }
    }

    private static void checkHolder(Card card, Player holder, Zone zone) {
        String holderId = holder.getPlayerId();
        if (zone == Zone.IN_PLAY) {
            if (!card.getController().equals(holderId)) {
                fail(card + " is in play for " + holderId + " but controlled by " + card.getController());
            }
            return;
        }
        if (!card.getOwner().equals(holderId)) {
            fail(card + " is in " + holderId + "'s " + zone.getJsonValue() + " but owned by " + card.getOwner());
        }
        if (!card.getController().equals(card.getOwner())) {
            fail(card + " is out of play with controller " + card.getController());
        }
        if (card.hasModifications()) {
            fail(card + " is out of play with modifications " + card.getModifications());
        }
        if (card.isCopy()) {
            fail(card + " is still a copy outside of play");
        }
    }

    private static void fail(String message) {
        log.error("Invariant violation: {}", message);
        throw new InvariantViolationException(message);
    }
}
