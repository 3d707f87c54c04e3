package com.ggltcg.game.zones;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Zones a card can occupy.
 */
public enum Zone {
    HAND("Hand"),
    IN_PLAY("InPlay"),
    SLEEP("Sleep");

    private final String jsonValue;

    Zone(String jsonValue) {
        this.jsonValue = jsonValue;
    }

    @JsonValue
    public String getJsonValue() {
        return jsonValue;
    }
}
