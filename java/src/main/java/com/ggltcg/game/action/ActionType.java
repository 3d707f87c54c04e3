package com.ggltcg.game.action;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Kinds of player action.
 */
public enum ActionType {
    PLAY_CARD("play_card"),
    TUSSLE("tussle"),
    DIRECT_ATTACK("direct_attack"),
    ACTIVATE_ABILITY("activate_ability"),
    END_TURN("end_turn");

    private final String jsonValue;

    ActionType(String jsonValue) {
        this.jsonValue = jsonValue;
    }

    @JsonValue
    public String getJsonValue() {
        return jsonValue;
    }
}
