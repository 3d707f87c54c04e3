package com.ggltcg.game;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.file.Path;

/**
 * Rule constants. Defaults match the printed rules; rules.json may override them.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class GameRules {
    public static final String DEFAULT_RESOURCE = "rules.json";

    @JsonProperty("max_cc")
    private int maxCc = 7;

    @JsonProperty("first_turn_cc")
    private int firstTurnCc = 2;

    @JsonProperty("turn_cc")
    private int turnCc = 4;

    @JsonProperty("tussle_cost")
    private int tussleCost = 2;

    @JsonProperty("max_direct_attacks")
    private int maxDirectAttacks = 2;

    @JsonProperty("attacker_speed_bonus")
    private int attackerSpeedBonus = 1;

    @JsonProperty("check_invariants")
    private boolean checkInvariants = true;

    public GameRules() {
    }

    /**
     * Built-in defaults.
     */
    public static GameRules defaults() {
        return new GameRules();
    }

    /**
     * Load rules from a JSON file.
     */
    public static GameRules fromFile(String path) throws IOException {
        return new ObjectMapper().readValue(Path.of(path).toFile(), GameRules.class);
    }

    /**
     * Load rules from a classpath resource, falling back to defaults if it is absent.
     */
    public static GameRules fromResource(String resourcePath) {
        try (InputStream is = GameRules.class.getClassLoader().getResourceAsStream(resourcePath)) {
            if (is == null) {
                return defaults();
            }
            return new ObjectMapper().readValue(is, GameRules.class);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read " + resourcePath, e);
        }
    }

    public int getMaxCc() {
        return maxCc;
    }

    public int getFirstTurnCc() {
        return firstTurnCc;
    }

    public int getTurnCc() {
        return turnCc;
    }

    public int getTussleCost() {
        return tussleCost;
    }

    public int getMaxDirectAttacks() {
        return maxDirectAttacks;
    }

    public int getAttackerSpeedBonus() {
        return attackerSpeedBonus;
    }

    public boolean isCheckInvariants() {
        return checkInvariants;
    }

    // Setters for Jackson and tests
    public void setMaxCc(int maxCc) { this.maxCc = maxCc; }
    public void setFirstTurnCc(int firstTurnCc) { this.firstTurnCc = firstTurnCc; }
    public void setTurnCc(int turnCc) { this.turnCc = turnCc; }
    public void setTussleCost(int tussleCost) { this.tussleCost = tussleCost; }
    public void setMaxDirectAttacks(int maxDirectAttacks) { this.maxDirectAttacks = maxDirectAttacks; }
    public void setAttackerSpeedBonus(int attackerSpeedBonus) { this.attackerSpeedBonus = attackerSpeedBonus; }
    public void setCheckInvariants(boolean checkInvariants) { this.checkInvariants = checkInvariants; }
}
