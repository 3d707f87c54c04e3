package com.ggltcg.effect;

import com.ggltcg.card.Card;
import com.ggltcg.game.GameState;

/**
 * effect_immunity:&lt;keyword&gt; - the source is unaffected by effects parsed from that keyword,
 * whoever controls them.
 */
public class EffectImmunityEffect extends AbstractEffect implements ContinuousEffect {
    public static final String KEYWORD = "effect_immunity";

    private final String blockedKeyword;

    public EffectImmunityEffect(Card source, String blockedKeyword) {
        super(source, KEYWORD);
        this.blockedKeyword = blockedKeyword;
    }

    @Override
    public boolean protects(Card target, Effect incoming, GameState state) {
        return target.equals(getSource()) && incoming.getKeyword().equals(blockedKeyword);
    }

    public String getBlockedKeyword() {
        return blockedKeyword;
    }
}
