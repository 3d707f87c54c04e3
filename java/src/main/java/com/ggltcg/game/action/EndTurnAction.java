package com.ggltcg.game.action;

/**
 * Pass the turn to the opponent.
 */
public record EndTurnAction(String playerId) implements GameAction {

    @Override
    public ActionType getType() {
        return ActionType.END_TURN;
    }
}
