package com.ggltcg.game.action;

/**
 * Attack an opposing Toy with one of your Toys.
 */
public record TussleAction(String playerId, String attackerId, String defenderId) implements GameAction {

    @Override
    public ActionType getType() {
        return ActionType.TUSSLE;
    }
}
