package com.ggltcg.effect;

/**
 * The four kinds of card effect.
 */
public enum EffectKind {
    /** Always active while the source card is in play. */
    CONTINUOUS,
    /** Fires when a game event happens. */
    TRIGGERED,
    /** Invoked by the controller for a CC cost while the source is in play. */
    ACTIVATED,
    /** Resolves once when an Action card is played. */
    PLAY
}
