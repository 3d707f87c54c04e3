package com.ggltcg.card;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.List;

/**
 * Toy stats that effects can modify.
 */
public enum Stat {
    SPEED("speed"),
    STRENGTH("strength"),
    STAMINA("stamina");

    private final String key;

    Stat(String key) {
        this.key = key;
    }

    @JsonValue
    public String getKey() {
        return key;
    }

    /**
     * Resolve a grammar stat name. "all" expands to every stat.
     *
     * @throws IllegalArgumentException for unknown names
     */
    public static List<Stat> parseTarget(String value) {
        if ("all".equals(value)) {
            return List.of(values());
        }
        for (Stat stat : values()) {
            if (stat.key.equals(value)) {
                return List.of(stat);
            }
        }
        throw new IllegalArgumentException("Unknown stat: " + value);
    }
}
