package com.ggltcg.game.action;

/**
 * Exception thrown when an action is illegal in the current state.
 * Always raised before anything is changed.
 */
public class InvalidActionException extends Exception {
    public InvalidActionException(String message) {
        super(message);
    }
}
