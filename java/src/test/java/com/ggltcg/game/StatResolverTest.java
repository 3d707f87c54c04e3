package com.ggltcg.game;

import com.ggltcg.card.Card;
import com.ggltcg.card.Stat;
import com.ggltcg.card.StatModification;
import com.ggltcg.effect.ActivatedEffect;
import com.ggltcg.effect.ContinuousEffect;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.ggltcg.game.GameFactory.PLAYER_ONE;
import static com.ggltcg.game.GameFactory.PLAYER_TWO;
import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for StatResolver.
 */
class StatResolverTest {

    @Test
    void testPrintedStats() throws Exception {
        GameFixture game = GameFixture.start(List.of("knight", "rush"), List.of("rush"));
        Card knight = game.card(PLAYER_ONE, "knight");
        Card rush = game.card(PLAYER_ONE, "rush");

        assertEquals(4, game.engine.getEffectiveStat(knight, Stat.SPEED));
        assertEquals(4, game.engine.getEffectiveStat(knight, Stat.STRENGTH));
        assertEquals(3, game.engine.getEffectiveStat(knight, Stat.STAMINA));
        assertEquals(0, game.engine.getEffectiveStat(rush, Stat.STRENGTH), "Actions have no stats");
    }

    @Test
    void testBoostCoversOwnToysInPlay() throws Exception {
        GameFixture game = GameFixture.start(List.of("demideca", "umbruh", "knight"), List.of("umbruh", "rush"));
        Card demideca = game.inPlay(PLAYER_ONE, "demideca");
        Card mine = game.inPlay(PLAYER_ONE, "umbruh");
        Card inHand = game.card(PLAYER_ONE, "knight");
        Card theirs = game.inPlay(PLAYER_TWO, "umbruh");

        assertEquals(3, game.engine.getEffectiveStat(demideca, Stat.SPEED), "The source boosts itself");
        assertEquals(5, game.engine.getEffectiveStat(mine, Stat.SPEED));
        assertEquals(5, game.engine.getEffectiveStat(mine, Stat.STAMINA));
        assertEquals(4, game.engine.getEffectiveStat(inHand, Stat.SPEED));
        assertEquals(4, game.engine.getEffectiveStat(theirs, Stat.SPEED));
    }

    @Test
    void testBoostsStack() throws Exception {
        GameFixture game = GameFixture.start(List.of("ka", "violin", "umbruh"), List.of("rush"));
        game.inPlay(PLAYER_ONE, "ka");
        game.inPlay(PLAYER_ONE, "violin");
        Card umbruh = game.inPlay(PLAYER_ONE, "umbruh");

        assertEquals(8, game.engine.getEffectiveStat(umbruh, Stat.STRENGTH));
    }

    @Test
    void testModificationsAndFloor() throws Exception {
        GameFixture game = GameFixture.start(List.of("umbruh", "rush"), List.of("rush"));
        Card umbruh = game.inPlay(PLAYER_ONE, "umbruh");

        umbruh.addModification(new StatModification(Stat.STRENGTH, 2, null, "test"));
        umbruh.addModification(new StatModification(Stat.SPEED, -10, null, "test"));

        assertEquals(6, game.engine.getEffectiveStat(umbruh, Stat.STRENGTH));
        assertEquals(0, game.engine.getEffectiveStat(umbruh, Stat.SPEED));
    }

    @Test
    void testRemainingStaminaTracksBoostAndDamage() throws Exception {
        GameFixture game = GameFixture.start(List.of("umbruh", "demideca"), List.of("rush"));
        Card umbruh = game.inPlay(PLAYER_ONE, "umbruh");
        umbruh.applyDamage(3);
        assertEquals(1, game.engine.getRemainingStamina(umbruh));

        game.inPlay(PLAYER_ONE, "demideca");
        assertEquals(2, game.engine.getRemainingStamina(umbruh));
    }

    @Test
    void testImmunityOnlyBlocksOpponents() throws Exception {
        GameFixture game = GameFixture.start(List.of("sock_sorcerer", "demideca", "umbruh"),
                List.of("archer", "rush"));
        Card sorcerer = game.inPlay(PLAYER_ONE, "sock_sorcerer");
        Card demideca = game.inPlay(PLAYER_ONE, "demideca");
        Card archer = game.inPlay(PLAYER_TWO, "archer");
        StatResolver stats = new StatResolver(game.engine.getRegistry());

        assertEquals(4, game.engine.getEffectiveStat(sorcerer, Stat.SPEED), "Own boosts still apply");

        ContinuousEffect demidecaBoost = game.engine.getRegistry().getContinuousEffects(demideca).get(0);
        ActivatedEffect archerAbility = game.engine.getRegistry().getActivatedEffects(archer).get(0);
        assertFalse(stats.isProtected(demideca, demidecaBoost, game.state));
        assertTrue(stats.isProtected(demideca, archerAbility, game.state));
        assertFalse(stats.isProtected(archer, demidecaBoost, game.state));
    }
}
