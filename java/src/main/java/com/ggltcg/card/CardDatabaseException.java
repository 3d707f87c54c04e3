package com.ggltcg.card;

/**
 * Exception thrown when card definitions cannot be loaded.
 * Covers unreadable tables, malformed effect tokens and unknown deck entries.
 */
public class CardDatabaseException extends Exception {
    public CardDatabaseException(String message) {
        super(message);
    }

    public CardDatabaseException(String message, Throwable cause) {
        super(message, cause);
    }
}
