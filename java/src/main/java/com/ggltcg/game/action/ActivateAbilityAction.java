package com.ggltcg.game.action;

import java.util.List;

/**
 * Use the activated ability of one of your cards in play.
 */
public record ActivateAbilityAction(String playerId, String cardId, List<String> targetIds) implements GameAction {

    public ActivateAbilityAction {
        targetIds = targetIds != null ? List.copyOf(targetIds) : List.of();
    }

    @Override
    public ActionType getType() {
        return ActionType.ACTIVATE_ABILITY;
    }
}
