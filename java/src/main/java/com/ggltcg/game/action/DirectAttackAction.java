package com.ggltcg.game.action;

/**
 * Attack the opponent's hand directly with one of your Toys.
 */
public record DirectAttackAction(String playerId, String attackerId) implements GameAction {

    @Override
    public ActionType getType() {
        return ActionType.DIRECT_ATTACK;
    }
}
