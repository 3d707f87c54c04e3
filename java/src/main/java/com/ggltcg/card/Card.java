package com.ggltcg.card;

import com.ggltcg.game.zones.Zone;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * A card instance in a game.
 * Identity is the id; owner is fixed at creation, controller changes only through control transfer.
 * Zone, controller and stamina are mutated by the game engine only.
 */
public class Card {
    private final String id;
    private final CardDefinition definition;
    private final String owner;
    private String controller;
    private Zone zone;
    private int currentStamina;
    private CardDefinition copyOf;
    private final List<StatModification> modifications;

    public Card(String id, CardDefinition definition, String owner) {
        this(id, definition, owner, owner, Zone.HAND);
    }

    public Card(String id, CardDefinition definition, String owner, String controller, Zone zone) {
        this.id = Objects.requireNonNull(id, "id");
        this.definition = Objects.requireNonNull(definition, "definition");
        this.owner = Objects.requireNonNull(owner, "owner");
        this.controller = controller != null ? controller : owner;
        this.zone = zone;
        this.currentStamina = definition.getStamina();
        this.copyOf = null;
        this.modifications = new ArrayList<>();
    }

    public String getId() {
        return id;
    }

    /**
     * The printed definition this card was created from.
     */
    public CardDefinition getDefinition() {
        return definition;
    }

    /**
     * The definition currently in effect: the copied card's while this card is a copy.
     */
    public CardDefinition getActiveDefinition() {
        return copyOf != null ? copyOf : definition;
    }

    public boolean isCopy() {
        return copyOf != null;
    }

    public CardDefinition getCopyOf() {
        return copyOf;
    }

    /**
     * Become an exact copy of another definition. Stamina starts fresh from the copied stats.
     */
    public void becomeCopyOf(CardDefinition target) {
        this.copyOf = target;
        this.currentStamina = target.getStamina();
    }

    public String getName() {
        return getActiveDefinition().getName();
    }

    public CardType getCardType() {
        return getActiveDefinition().getCardType();
    }

    public boolean isToy() {
        return getCardType() == CardType.TOY;
    }

    public boolean isAction() {
        return getCardType() == CardType.ACTION;
    }

    public int getBaseStat(Stat stat) {
        return getActiveDefinition().getBaseStat(stat);
    }

    public String getOwner() {
        return owner;
    }

    public String getController() {
        return controller;
    }

    public void setController(String controller) {
        this.controller = Objects.requireNonNull(controller, "controller");
    }

    public Zone getZone() {
        return zone;
    }

    public void setZone(Zone zone) {
        this.zone = zone;
    }

    public boolean isInPlay() {
        return zone == Zone.IN_PLAY;
    }

    // ---- Stamina / damage ----

    public int getCurrentStamina() {
        return currentStamina;
    }

    /**
     * Stamina lost to damage so far.
     */
    public int getDamage() {
        return getActiveDefinition().getStamina() - currentStamina;
    }

    public void applyDamage(int amount) {
        if (amount > 0) {
            currentStamina -= amount;
        }
    }

    /**
     * Full stamina reset; used on creation-like transitions (return to hand, wake).
     */
    public void resetStamina() {
        currentStamina = getActiveDefinition().getStamina();
    }

    /**
     * Restore a stored stamina value when rebuilding a saved game.
     */
    public void restoreStamina(int value) {
        currentStamina = value;
    }

    // ---- Modifications ----

    public List<StatModification> getModifications() {
        return List.copyOf(modifications);
    }

    public void addModification(StatModification modification) {
        modifications.add(modification);
    }

    public int getModificationTotal(Stat stat) {
        int total = 0;
        for (StatModification mod : modifications) {
            if (mod.stat() == stat) {
                total += mod.amount();
            }
        }
        return total;
    }

    public boolean hasModifications() {
        return !modifications.isEmpty();
    }

    public void clearModifications() {
        modifications.clear();
    }

    /**
     * Drop turn-scoped modifications that expire at the end of the given turn.
     *
     * @return number of modifications removed
     */
    public int expireModifications(int turn) {
        int before = modifications.size();
        modifications.removeIf(mod -> mod.isExpired(turn));
        return before - modifications.size();
    }

    /**
     * Revert to the printed definition; copies stop being copies when they leave play.
     */
    public void revertCopy() {
        copyOf = null;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Card other)) return false;
        return id.equals(other.id);
    }

    @Override
    public int hashCode() {
        return id.hashCode();
    }

    @Override
    public String toString() {
        return getName() + "#" + id;
    }
}
