package com.ggltcg.effect;

import com.ggltcg.card.Card;

import java.util.ArrayList;
import java.util.List;

/**
 * take_control - put an opposing Toy in play under your control. Ownership does not change.
 */
public class TakeControlEffect extends AbstractEffect implements PlayEffect {
    public static final String KEYWORD = "take_control";

    public TakeControlEffect(Card source) {
        super(source, KEYWORD);
    }

    @Override
    public int getMinTargets() {
        return 1;
    }

    @Override
    public int getMaxTargets() {
        return 1;
    }

    @Override
    public List<Card> getValidTargets(GameView view, String playerId) {
        List<Card> targets = new ArrayList<>();
        for (Card card : view.getState().getCardsInPlay(view.getState().getOpponentId(playerId))) {
            if (card.isToy() && !view.isProtected(card, this)) {
                targets.add(card);
            }
        }
        return targets;
    }

    @Override
    public void resolve(List<Card> targets, String playerId, EffectContext context) {
        for (Card target : targets) {
            if (target.isInPlay() && !target.getController().equals(playerId)) {
                context.changeController(target, playerId);
            }
        }
    }
}
