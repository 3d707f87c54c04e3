package com.ggltcg.effect;

import com.ggltcg.card.Card;

import java.util.function.Function;

/**
 * A parsed, validated effect token waiting to be bound to a card instance.
 *
 * @param keyword first segment of the token
 * @param token   the full token as written in the card table
 * @param binder  creates the effect for a given source card
 */
public record EffectTemplate(String keyword, String token, Function<Card, Effect> binder) {

    public Effect bind(Card source) {
        return binder.apply(source);
    }

    @Override
    public String toString() {
        return token;
    }
}
