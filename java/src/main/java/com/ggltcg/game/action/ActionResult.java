package com.ggltcg.game.action;

import java.util.Optional;

/**
 * Outcome of an executed action.
 *
 * @param description human-readable summary of what happened
 * @param winnerId    the winner, if the action ended the game
 */
public record ActionResult(String description, Optional<String> winnerId) {

    public boolean isGameOver() {
        return winnerId.isPresent();
    }
}
