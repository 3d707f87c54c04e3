package com.ggltcg.effect;

import com.ggltcg.card.Card;

import java.util.ArrayList;
import java.util.List;

/**
 * return_target_to_hand:&lt;n&gt; - return n chosen Toys in play to their owners' hands.
 */
public class ReturnTargetToHandEffect extends AbstractEffect implements PlayEffect {
    public static final String KEYWORD = "return_target_to_hand";

    private final int count;

    public ReturnTargetToHandEffect(Card source, int count) {
        super(source, KEYWORD);
        this.count = count;
    }

    @Override
    public int getMinTargets() {
        return 1;
    }

    @Override
    public int getMaxTargets() {
        return count;
    }

    @Override
    public List<Card> getValidTargets(GameView view, String playerId) {
        List<Card> targets = new ArrayList<>();
        for (Card card : view.getState().getAllCardsInPlay()) {
            if (card.isToy() && !view.isProtected(card, this)) {
                targets.add(card);
            }
        }
        return targets;
    }

    @Override
    public void resolve(List<Card> targets, String playerId, EffectContext context) {
        for (Card target : targets) {
            if (target.isInPlay()) {
                context.returnToHand(target);
            }
        }
    }
}
