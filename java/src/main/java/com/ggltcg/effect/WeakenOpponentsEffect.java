package com.ggltcg.effect;

import com.ggltcg.card.Card;

import java.util.List;

/**
 * on_play_weaken_opponents - when the source enters play, each opposing Toy drops to 1 stamina;
 * Toys already at 1 are sleeped.
 */
public class WeakenOpponentsEffect extends AbstractEffect implements TriggeredEffect {
    public static final String KEYWORD = "on_play_weaken_opponents";

    public WeakenOpponentsEffect(Card source) {
        super(source, KEYWORD);
    }

    @Override
    public TriggerTiming getTiming() {
        return TriggerTiming.WHEN_PLAYED;
    }

    @Override
    public boolean shouldTrigger(TriggerEvent event, GameView view) {
        return getSource().equals(event.subject());
    }

    @Override
    public void apply(TriggerEvent event, EffectContext context) {
        String opponent = context.getState().getOpponentId(getSource().getController());
        List<Card> targets = context.getState().getCardsInPlay(opponent);
        for (Card target : targets) {
            if (!target.isInPlay() || context.isProtected(target, this)) {
                continue;
            }
            int remaining = context.getRemainingStamina(target);
            if (remaining <= 1) {
                context.sleep(target);
            } else {
                context.removeStamina(target, remaining - 1);
            }
        }
    }
}
