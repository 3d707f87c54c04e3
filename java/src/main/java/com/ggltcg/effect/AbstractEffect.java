package com.ggltcg.effect;

import com.ggltcg.card.Card;

import java.util.Objects;

/**
 * Shared source/keyword storage for concrete effects.
 */
public abstract class AbstractEffect {
    private final Card source;
    private final String keyword;

    protected AbstractEffect(Card source, String keyword) {
        this.source = Objects.requireNonNull(source, "source");
        this.keyword = Objects.requireNonNull(keyword, "keyword");
    }

    public Card getSource() {
        return source;
    }

    public String getKeyword() {
        return keyword;
    }

    @Override
    public String toString() {
        return keyword + "@" + source;
    }
}
