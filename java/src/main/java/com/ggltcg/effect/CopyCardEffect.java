package com.ggltcg.effect;

import com.ggltcg.card.Card;

import java.util.ArrayList;
import java.util.List;
import java.util.OptionalInt;

/**
 * copy_card - the card costs the printed cost of one of your Toys in play, then enters play as
 * an exact copy of it. It reverts when it leaves play.
 */
public class CopyCardEffect extends AbstractEffect implements PlayEffect {
    public static final String KEYWORD = "copy_card";

    public CopyCardEffect(Card source) {
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
        for (Card card : view.getState().getCardsInPlay(playerId)) {
            if (card.isToy()) {
                targets.add(card);
            }
        }
        return targets;
    }

    @Override
    public OptionalInt costForTargets(List<Card> targets) {
        if (targets.isEmpty()) {
            return OptionalInt.empty();
        }
        Integer printed = targets.get(0).getActiveDefinition().getCost();
        return OptionalInt.of(printed != null ? printed : 0);
    }

    @Override
    public void resolve(List<Card> targets, String playerId, EffectContext context) {
        if (!targets.isEmpty()) {
            context.becomeCopy(getSource(), targets.get(0), playerId);
        }
    }
}
