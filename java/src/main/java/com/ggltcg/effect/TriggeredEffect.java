package com.ggltcg.effect;

/**
 * Effect fired by a game event.
 * The engine delivers only events whose timing matches {@link #getTiming()}.
 */
public non-sealed interface TriggeredEffect extends Effect {

    @Override
    default EffectKind getKind() {
        return EffectKind.TRIGGERED;
    }

    TriggerTiming getTiming();

    /**
     * Further filter on a matching event.
     */
    default boolean shouldTrigger(TriggerEvent event, GameView view) {
        return true;
    }

    void apply(TriggerEvent event, EffectContext context);
}
