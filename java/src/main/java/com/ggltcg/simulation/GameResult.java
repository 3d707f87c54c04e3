package com.ggltcg.simulation;

import java.util.List;

/**
 * Result of a single self-play game.
 *
 * @param winnerId     winning player, or null if the action limit was reached first
 * @param turns        turn number when the game stopped
 * @param actionsTaken number of executed actions
 * @param gameLog      the play-by-play log
 */
public record GameResult(String winnerId, int turns, int actionsTaken, List<String> gameLog) {

    public boolean isFinished() {
        return winnerId != null;
    }
}
