package com.ggltcg.game.action;

/**
 * A request by a player to change the game.
 */
public sealed interface GameAction
        permits PlayCardAction, TussleAction, DirectAttackAction, ActivateAbilityAction, EndTurnAction {

    String playerId();

    ActionType getType();
}
