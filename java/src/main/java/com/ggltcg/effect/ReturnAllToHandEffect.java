package com.ggltcg.effect;

import com.ggltcg.card.Card;

import java.util.List;

/**
 * return_all_to_hand - every card in play goes back to its owner's hand. Nothing is sleeped.
 */
public class ReturnAllToHandEffect extends AbstractEffect implements PlayEffect {
    public static final String KEYWORD = "return_all_to_hand";

    public ReturnAllToHandEffect(Card source) {
        super(source, KEYWORD);
    }

    @Override
    public void resolve(List<Card> targets, String playerId, EffectContext context) {
        for (Card card : context.getState().getAllCardsInPlay()) {
            if (card.isInPlay() && !context.isProtected(card, this)) {
                context.returnToHand(card);
            }
        }
    }
}
