package com.ggltcg.card;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.ArrayList;
import java.util.List;

/**
 * Printed card definition, loaded once from the card table.
 * The id is the only lookup key; the name is for display.
 */
public class CardDefinition {
    @JsonProperty("id")
    private String id;

    @JsonProperty("name")
    private String name;

    @JsonProperty("card_type")
    private CardType cardType;

    /**
     * Printed cost, or null for cards whose cost is derived from their target.
     */
    @JsonProperty("cost")
    private Integer cost;

    @JsonProperty("speed")
    private Integer speed;

    @JsonProperty("strength")
    private Integer strength;

    @JsonProperty("stamina")
    private Integer stamina;

    @JsonProperty("effect_text")
    private String effectText = "";

    @JsonProperty("effects")
    private List<String> effects = new ArrayList<>();

    public CardDefinition() {
    }

    public String getId() {
        return id;
    }

    public String getName() {
        return name;
    }

    public CardType getCardType() {
        return cardType;
    }

    public Integer getCost() {
        return cost;
    }

    public boolean hasVariableCost() {
        return cost == null;
    }

    public int getSpeed() {
        return speed != null ? speed : 0;
    }

    public int getStrength() {
        return strength != null ? strength : 0;
    }

    public int getStamina() {
        return stamina != null ? stamina : 0;
    }

    /**
     * Printed value of a stat; zero for Actions.
     */
    public int getBaseStat(Stat stat) {
        return switch (stat) {
            case SPEED -> getSpeed();
            case STRENGTH -> getStrength();
            case STAMINA -> getStamina();
        };
    }

    public boolean isToy() {
        return cardType == CardType.TOY;
    }

    public boolean hasStats() {
        return speed != null && strength != null && stamina != null;
    }

    public String getEffectText() {
        return effectText;
    }

    public List<String> getEffects() {
        return effects;
    }

    // Setters for Jackson
    public void setId(String id) { this.id = id; }
    public void setName(String name) { this.name = name; }
    public void setCardType(CardType cardType) { this.cardType = cardType; }
    public void setCost(Integer cost) { this.cost = cost; }
    public void setSpeed(Integer speed) { this.speed = speed; }
    public void setStrength(Integer strength) { this.strength = strength; }
    public void setStamina(Integer stamina) { this.stamina = stamina; }
    public void setEffectText(String effectText) { this.effectText = effectText; }
    public void setEffects(List<String> effects) { this.effects = effects != null ? effects : new ArrayList<>(); }

    @Override
    public String toString() {
        return name + " [" + id + "]";
    }
}
