package com.ggltcg.game;

/**
 * Turn phases. Actions are taken only in MAIN.
 */
public enum Phase {
    START,
    MAIN,
    END;

    public boolean isMainPhase() {
        return this == MAIN;
    }
}
