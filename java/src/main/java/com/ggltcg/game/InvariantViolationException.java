package com.ggltcg.game;

/**
 * Internal consistency failure. Indicates a bug in the engine, never a bad action.
 */
public class InvariantViolationException extends IllegalStateException {
    public InvariantViolationException(String message) {
        super(message);
    }
}
