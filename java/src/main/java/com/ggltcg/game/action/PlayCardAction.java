package com.ggltcg.game.action;

import java.util.List;

/**
 * Play a card from hand.
 *
 * @param playerId                  acting player
 * @param cardId                    card in the player's hand
 * @param targetIds                 chosen targets, empty when the card takes none
 * @param alternativeCostCardId     card to sleep instead of paying CC, or null to pay CC
 */
public record PlayCardAction(String playerId, String cardId, List<String> targetIds,
                             String alternativeCostCardId) implements GameAction {

    public PlayCardAction {
        targetIds = targetIds != null ? List.copyOf(targetIds) : List.of();
    }

    public PlayCardAction(String playerId, String cardId) {
        this(playerId, cardId, List.of(), null);
    }

    public PlayCardAction(String playerId, String cardId, List<String> targetIds) {
        this(playerId, cardId, targetIds, null);
    }

    @Override
    public ActionType getType() {
        return ActionType.PLAY_CARD;
    }
}
