package com.ggltcg.effect;

import com.ggltcg.card.Card;

import java.util.ArrayList;
import java.util.List;

/**
 * remove_stamina_ability:&lt;n&gt; - for 1 CC, remove n stamina from an opposing Toy.
 */
public class RemoveStaminaAbility extends AbstractEffect implements ActivatedEffect {
    public static final String KEYWORD = "remove_stamina_ability";
    private static final int COST_CC = 1;

    private final int amount;

    public RemoveStaminaAbility(Card source, int amount) {
        super(source, KEYWORD);
        this.amount = amount;
    }

    @Override
    public int getCostCc() {
        return COST_CC;
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
    public void activate(List<Card> targets, String playerId, EffectContext context) {
        for (Card target : targets) {
            if (target.isInPlay()) {
                context.log(getSource().getName() + " removes " + amount + " stamina from " + target.getName());
                context.removeStamina(target, amount);
            }
        }
    }

    public int getAmount() {
        return amount;
    }
}
