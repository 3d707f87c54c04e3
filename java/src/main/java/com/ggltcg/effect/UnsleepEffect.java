package com.ggltcg.effect;

import com.ggltcg.card.Card;
import com.ggltcg.game.zones.Zone;

import java.util.ArrayList;
import java.util.List;

/**
 * unsleep:&lt;n&gt;[:action] - return up to n of your sleeping cards to your hand.
 * With the action flag only Action cards may be chosen. Fewer sleeping cards than n is fine.
 */
public class UnsleepEffect extends AbstractEffect implements PlayEffect {
    public static final String KEYWORD = "unsleep";

    private final int count;
    private final boolean actionsOnly;

    public UnsleepEffect(Card source, int count, boolean actionsOnly) {
        super(source, KEYWORD);
        this.count = count;
        this.actionsOnly = actionsOnly;
    }

    @Override
    public boolean requiresTargets() {
        return true;
    }

    @Override
    public int getMaxTargets() {
        return count;
    }

    @Override
    public List<Card> getValidTargets(GameView view, String playerId) {
        List<Card> targets = new ArrayList<>();
        for (Card card : view.getState().getPlayer(playerId).getSleepZone().getCards()) {
            if (!actionsOnly || card.isAction()) {
                targets.add(card);
            }
        }
        return targets;
    }

    @Override
    public void resolve(List<Card> targets, String playerId, EffectContext context) {
        int woken = 0;
        for (Card target : targets) {
            if (woken == count) {
                break;
            }
            if (target.getOwner().equals(playerId) && target.getZone() == Zone.SLEEP) {
                context.wake(target);
                woken++;
            }
        }
    }

    public boolean isActionsOnly() {
        return actionsOnly;
    }
}
