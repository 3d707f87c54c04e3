package com.ggltcg.effect;

import com.ggltcg.card.Card;

import java.util.List;

/**
 * sleep_all - sleep every card in play, on both sides. On-sleep triggers fire.
 */
public class SleepAllEffect extends AbstractEffect implements PlayEffect {
    public static final String KEYWORD = "sleep_all";

    public SleepAllEffect(Card source) {
        super(source, KEYWORD);
    }

    @Override
    public void resolve(List<Card> targets, String playerId, EffectContext context) {
        for (Card card : context.getState().getAllCardsInPlay()) {
            if (card.isInPlay() && !context.isProtected(card, this)) {
                context.sleep(card);
            }
        }
    }
}
