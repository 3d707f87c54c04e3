package com.ggltcg.game.action;

import java.util.List;

/**
 * A legal action with the choices still open to the player.
 *
 * @param type                   kind of action
 * @param cardId                 card played, attacking or activated; null for end turn
 * @param cost                   CC cost; for variable-cost cards the cheapest option
 * @param targetOptions          ids the player may target (the defender for a tussle)
 * @param minTargets             fewest targets to choose
 * @param maxTargets             most targets to choose
 * @param alternativeCostOptions ids the player may sleep instead of paying CC
 * @param description            human-readable summary
 */
public record ValidAction(ActionType type,
                          String cardId,
                          Integer cost,
                          List<String> targetOptions,
                          int minTargets,
                          int maxTargets,
                          List<String> alternativeCostOptions,
                          String description) {

    public ValidAction {
        targetOptions = List.copyOf(targetOptions);
        alternativeCostOptions = List.copyOf(alternativeCostOptions);
    }

    public static ValidAction endTurn() {
        return new ValidAction(ActionType.END_TURN, null, 0, List.of(), 0, 0, List.of(), "End turn");
    }

    /**
     * Build the concrete action for the given choices.
     *
     * @param targetIds             chosen targets (ignored for tussles, which carry their defender)
     * @param alternativeCostCardId card to sleep instead of paying, or null
     */
    public GameAction toAction(String playerId, List<String> targetIds, String alternativeCostCardId) {
        return switch (type) {
            case PLAY_CARD -> new PlayCardAction(playerId, cardId, targetIds, alternativeCostCardId);
            case TUSSLE -> new TussleAction(playerId, cardId, targetOptions.get(0));
            case DIRECT_ATTACK -> new DirectAttackAction(playerId, cardId);
            case ACTIVATE_ABILITY -> new ActivateAbilityAction(playerId, cardId, targetIds);
            case END_TURN -> new EndTurnAction(playerId);
        };
    }
}
