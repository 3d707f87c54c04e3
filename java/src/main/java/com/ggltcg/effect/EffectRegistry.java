package com.ggltcg.effect;

import com.ggltcg.card.Card;
import com.ggltcg.card.CardDefinition;
import com.ggltcg.card.CardDatabase;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Looks up the effects of a card instance.
 * Effects are bound from the templates of the card's active definition and cached per
 * card id and definition id, so a copy picks up its new effects and loses them on revert.
 */
public class EffectRegistry {
    private final CardDatabase database;
    private final Map<String, List<Effect>> cache = new HashMap<>();

    public EffectRegistry(CardDatabase database) {
        this.database = database;
    }

    /**
     * All effects of the card, in card-table order.
     */
    public List<Effect> getEffects(Card card) {
        CardDefinition definition = card.getActiveDefinition();
        String key = card.getId() + "|" + definition.getId();
        return cache.computeIfAbsent(key, k -> bind(card, definition));
    }

    private List<Effect> bind(Card card, CardDefinition definition) {
        List<Effect> effects = new ArrayList<>();
        for (EffectTemplate template : database.getEffectTemplates(definition.getId())) {
            effects.add(template.bind(card));
        }
        return List.copyOf(effects);
    }

    public List<ContinuousEffect> getContinuousEffects(Card card) {
        return ofKind(card, EffectKind.CONTINUOUS, ContinuousEffect.class);
    }

    public List<TriggeredEffect> getTriggeredEffects(Card card, TriggerTiming timing) {
        List<TriggeredEffect> result = new ArrayList<>();
        for (TriggeredEffect effect : ofKind(card, EffectKind.TRIGGERED, TriggeredEffect.class)) {
            if (effect.getTiming() == timing) {
                result.add(effect);
            }
        }
        return result;
    }

    public List<ActivatedEffect> getActivatedEffects(Card card) {
        return ofKind(card, EffectKind.ACTIVATED, ActivatedEffect.class);
    }

    public List<PlayEffect> getPlayEffects(Card card) {
        return ofKind(card, EffectKind.PLAY, PlayEffect.class);
    }

    private <T extends Effect> List<T> ofKind(Card card, EffectKind kind, Class<T> type) {
        List<T> result = new ArrayList<>();
        for (Effect effect : getEffects(card)) {
            if (effect.getKind() == kind) {
                result.add(type.cast(effect));
            }
        }
        return result;
    }
}
