package com.ggltcg.card;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Card types in GGLTCG.
 */
public enum CardType {
    /**
     * Persistent combat card with speed, strength and stamina.
     */
    TOY("Toy"),

    /**
     * One-shot card that resolves and then goes to sleep.
     */
    ACTION("Action");

    private final String jsonValue;

    CardType(String jsonValue) {
        this.jsonValue = jsonValue;
    }

    @JsonValue
    public String getJsonValue() {
        return jsonValue;
    }

    @JsonCreator
    public static CardType fromString(String value) {
        if (value == null) {
            throw new IllegalArgumentException("Card type cannot be null");
        }
        return switch (value.toLowerCase()) {
            case "toy" -> TOY;
            case "action" -> ACTION;
            default -> throw new IllegalArgumentException("Unknown card type: " + value);
        };
    }
}
