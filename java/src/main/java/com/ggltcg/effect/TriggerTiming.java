package com.ggltcg.effect;

/**
 * Game events a triggered effect can listen for.
 */
public enum TriggerTiming {
    /** The source card was sleeped from play. */
    WHEN_SLEEPED,
    /** The source's controller began a turn. */
    START_OF_TURN,
    /** The source's controller played a different card. */
    WHEN_OTHER_CARD_PLAYED,
    /** The source card itself entered play. */
    WHEN_PLAYED
}
