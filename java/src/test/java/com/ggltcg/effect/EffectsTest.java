package com.ggltcg.effect;

import com.ggltcg.card.Card;
import com.ggltcg.card.CardDatabase;
import com.ggltcg.card.Stat;
import com.ggltcg.card.StatModification;
import com.ggltcg.game.GameFixture;
import com.ggltcg.game.GameRules;
import com.ggltcg.game.action.ActionType;
import com.ggltcg.game.action.InvalidActionException;
import com.ggltcg.game.action.ValidAction;
import com.ggltcg.game.zones.Zone;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.ggltcg.game.GameFactory.PLAYER_ONE;
import static com.ggltcg.game.GameFactory.PLAYER_TWO;
import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for card effects resolved through the engine.
 */
class EffectsTest {

    @Test
    void testCleanSleepsEverythingAndTriggersCascade() throws Exception {
        GameFixture game = GameFixture.start(List.of("clean", "umbruh", "rush"), List.of("umbruh", "ka", "rush"));
        Card clean = game.card(PLAYER_ONE, "clean");
        Card mine = game.inPlay(PLAYER_ONE, "umbruh");
        Card theirs = game.inPlay(PLAYER_TWO, "umbruh");
        Card ka = game.inPlay(PLAYER_TWO, "ka");
        game.setCc(PLAYER_ONE, 3);

        game.engine.playCard(PLAYER_ONE, clean.getId(), List.of(), null);

        assertEquals(Zone.SLEEP, mine.getZone());
        assertEquals(Zone.SLEEP, theirs.getZone());
        assertEquals(Zone.SLEEP, ka.getZone());
        assertEquals(Zone.SLEEP, clean.getZone());
        assertEquals(1, game.cc(PLAYER_ONE), "Own Umbruh pays after Clean's cost");
        assertEquals(1, game.cc(PLAYER_TWO));
        assertTrue(game.state.getAllCardsInPlay().isEmpty());
    }

    @Test
    void testTeamImmunityShieldsFromOpponentEffects() throws Exception {
        GameFixture game = GameFixture.start(List.of("clean", "twist", "umbruh", "rush"),
                List.of("sock_sorcerer", "ka", "rush"));
        Card mine = game.inPlay(PLAYER_ONE, "umbruh");
        Card sorcerer = game.inPlay(PLAYER_TWO, "sock_sorcerer");
        Card ka = game.inPlay(PLAYER_TWO, "ka");
        game.setCc(PLAYER_ONE, 7);

        assertThrows(InvalidActionException.class, () -> game.engine.playCard(PLAYER_ONE,
                game.card(PLAYER_ONE, "twist").getId(), List.of(ka.getId()), null));

        game.engine.playCard(PLAYER_ONE, game.card(PLAYER_ONE, "clean").getId(), List.of(), null);

        assertEquals(Zone.IN_PLAY, sorcerer.getZone());
        assertEquals(Zone.IN_PLAY, ka.getZone());
        assertEquals(Zone.SLEEP, mine.getZone());
    }

    @Test
    void testToynadoReturnsCardsFresh() throws Exception {
        GameFixture game = GameFixture.start(List.of("toynado", "umbruh", "rush"), List.of("umbruh", "rush"));
        Card toynado = game.card(PLAYER_ONE, "toynado");
        Card mine = game.inPlay(PLAYER_ONE, "umbruh");
        Card theirs = game.inPlay(PLAYER_TWO, "umbruh");
        mine.applyDamage(2);
        mine.addModification(StatModification.untilEndOfTurn(Stat.SPEED, 1, 1, "test"));

        game.engine.playCard(PLAYER_ONE, toynado.getId(), List.of(), null);

        assertEquals(Zone.HAND, mine.getZone());
        assertEquals(Zone.HAND, theirs.getZone());
        assertEquals(4, mine.getCurrentStamina());
        assertFalse(mine.hasModifications());
        assertEquals(Zone.SLEEP, toynado.getZone());
        assertEquals(0, game.cc(PLAYER_TWO), "Returning to hand is not sleeping");
    }

    @Test
    void testTwistedCardReturnsToOwner() throws Exception {
        GameFixture game = GameFixture.start(List.of("umbruh", "rush"), List.of("twist", "toynado", "rush"));
        Card umbruh = game.inPlay(PLAYER_ONE, "umbruh");
        game.endTurn();

        game.engine.playCard(PLAYER_TWO, game.card(PLAYER_TWO, "twist").getId(), List.of(umbruh.getId()), null);
        assertEquals(PLAYER_TWO, umbruh.getController());
        assertEquals(Zone.IN_PLAY, umbruh.getZone());
        assertEquals(1, game.cc(PLAYER_TWO));

        game.setCc(PLAYER_TWO, 2);
        game.engine.playCard(PLAYER_TWO, game.card(PLAYER_TWO, "toynado").getId(), List.of(), null);

        assertTrue(game.state.getPlayer(PLAYER_ONE).getHand().contains(umbruh));
        assertEquals(PLAYER_ONE, umbruh.getController());
    }

    @Test
    void testCopyEntersPlayAsCopy() throws Exception {
        GameFixture game = GameFixture.start(List.of("copy", "knight", "rush"), List.of("umbruh", "rush"));
        Card copy = game.card(PLAYER_ONE, "copy");
        Card knight = game.inPlay(PLAYER_ONE, "knight");

        ValidAction listed = game.engine.getValidActions(PLAYER_ONE, false).stream()
                .filter(a -> copy.getId().equals(a.cardId()))
                .findFirst().orElseThrow();
        assertEquals(1, listed.cost());
        assertEquals(List.of(knight.getId()), listed.targetOptions());

        game.engine.playCard(PLAYER_ONE, copy.getId(), List.of(knight.getId()), null);

        assertTrue(copy.isCopy());
        assertEquals(Zone.IN_PLAY, copy.getZone());
        assertEquals("Knight", copy.getName());
        assertEquals(4, game.engine.getEffectiveStat(copy, Stat.STRENGTH));
        assertEquals(3, game.engine.getRemainingStamina(copy));
        assertEquals(1, game.cc(PLAYER_ONE));
        assertFalse(game.engine.getRegistry().getContinuousEffects(copy).isEmpty(), "Copies carry the effects");

        game.engine.sleep(copy);

        assertFalse(copy.isCopy());
        assertTrue(game.state.getPlayer(PLAYER_ONE).getSleepZone().contains(copy));
    }

    @Test
    void testCopyRejectsOpponentsToy() throws Exception {
        GameFixture game = GameFixture.start(List.of("copy", "umbruh", "rush"), List.of("knight", "rush"));
        Card copy = game.card(PLAYER_ONE, "copy");
        game.inPlay(PLAYER_ONE, "umbruh");
        Card theirs = game.inPlay(PLAYER_TWO, "knight");

        InvalidActionException e = assertThrows(InvalidActionException.class,
                () -> game.engine.playCard(PLAYER_ONE, copy.getId(), List.of(theirs.getId()), null));

        assertTrue(e.getMessage().contains("not a valid target"));
        assertEquals(Zone.HAND, copy.getZone());
        assertFalse(copy.isCopy());
        assertEquals(2, game.cc(PLAYER_ONE));
        assertEquals(PLAYER_TWO, theirs.getController());
    }

    @Test
    void testUnsleepWithFewerSleepersThanTargets() throws Exception {
        GameFixture game = GameFixture.start(List.of("sun", "umbruh", "rush"), List.of("umbruh", "rush"));
        Card sun = game.card(PLAYER_ONE, "sun");
        Card umbruh = game.asleep(PLAYER_ONE, "umbruh");
        umbruh.applyDamage(3);
        game.setCc(PLAYER_ONE, 3);

        ValidAction listed = game.engine.getValidActions(PLAYER_ONE, false).stream()
                .filter(a -> sun.getId().equals(a.cardId()))
                .findFirst().orElseThrow();
        assertEquals(2, listed.maxTargets());
        assertEquals(List.of(umbruh.getId()), listed.targetOptions());

        game.engine.playCard(PLAYER_ONE, sun.getId(), List.of(umbruh.getId()), null);

        assertEquals(Zone.HAND, umbruh.getZone());
        assertEquals(4, umbruh.getCurrentStamina());
        assertEquals(Zone.SLEEP, sun.getZone());
    }

    @Test
    void testThatWasFunOnlyWakesActions() throws Exception {
        GameFixture game = GameFixture.start(List.of("that_was_fun", "rush", "umbruh", "surge"),
                List.of("umbruh", "rush"));
        Card fun = game.card(PLAYER_ONE, "that_was_fun");
        Card rush = game.asleep(PLAYER_ONE, "rush");
        Card umbruh = game.asleep(PLAYER_ONE, "umbruh");

        assertThrows(InvalidActionException.class,
                () -> game.engine.playCard(PLAYER_ONE, fun.getId(), List.of(umbruh.getId()), null));

        game.engine.playCard(PLAYER_ONE, fun.getId(), List.of(rush.getId()), null);

        assertEquals(Zone.HAND, rush.getZone());
        assertEquals(Zone.SLEEP, umbruh.getZone());
    }

    @Test
    void testDropSleepsAndJumpscareReturns() throws Exception {
        GameFixture game = GameFixture.start(List.of("drop", "jumpscare", "rush"), List.of("umbruh", "ka", "rush"));
        Card umbruh = game.inPlay(PLAYER_TWO, "umbruh");
        Card ka = game.inPlay(PLAYER_TWO, "ka");

        game.engine.playCard(PLAYER_ONE, game.card(PLAYER_ONE, "jumpscare").getId(), List.of(umbruh.getId()), null);
        assertEquals(Zone.HAND, umbruh.getZone());
        assertEquals(0, game.cc(PLAYER_TWO));

        game.engine.playCard(PLAYER_ONE, game.card(PLAYER_ONE, "drop").getId(), List.of(ka.getId()), null);
        assertEquals(Zone.SLEEP, ka.getZone());
        assertEquals(0, game.cc(PLAYER_ONE));
    }

    @Test
    void testBelchalettaPaysAtStartOfOwnTurn() throws Exception {
        GameFixture game = GameFixture.start(List.of("belchaletta", "rush"), List.of("umbruh", "rush"));
        game.inPlay(PLAYER_ONE, "belchaletta");
        game.setCc(PLAYER_ONE, 0);

        game.endTurn();
        assertEquals(4, game.cc(PLAYER_TWO));
        assertEquals(0, game.cc(PLAYER_ONE));

        game.endTurn();
        assertEquals(6, game.cc(PLAYER_ONE));
        assertEquals(6, game.state.getCurrentCcRecord().orElseThrow().getCcGained());
    }

    @Test
    void testHindLegKickerPaysForOtherCards() throws Exception {
        GameFixture game = GameFixture.start(List.of("hind_leg_kicker", "surge", "umbruh"), List.of("umbruh", "rush"));
        game.engine.playCard(PLAYER_ONE, game.card(PLAYER_ONE, "hind_leg_kicker").getId(), List.of(), null);
        assertEquals(1, game.cc(PLAYER_ONE), "No refund for itself");

        game.engine.playCard(PLAYER_ONE, game.card(PLAYER_ONE, "surge").getId(), List.of(), null);
        assertEquals(3, game.cc(PLAYER_ONE));
    }

    @Test
    void testMonsterWeakensOpposingToys() throws Exception {
        GameFixture game = GameFixture.start(List.of("monster", "rush"),
                List.of("umbruh", "hind_leg_kicker", "beary", "rush"));
        Card umbruh = game.inPlay(PLAYER_TWO, "umbruh");
        Card kicker = game.inPlay(PLAYER_TWO, "hind_leg_kicker");
        Card beary = game.inPlay(PLAYER_TWO, "beary");

        game.engine.playCard(PLAYER_ONE, game.card(PLAYER_ONE, "monster").getId(), List.of(), null);

        assertEquals(1, game.engine.getRemainingStamina(umbruh));
        assertEquals(Zone.IN_PLAY, umbruh.getZone());
        assertEquals(Zone.SLEEP, kicker.getZone());
        assertEquals(3, game.engine.getRemainingStamina(beary));
        assertEquals(0, game.cc(PLAYER_TWO));
    }

    @Test
    void testEffectImmunityBlocksOnlyNamedEffect() throws Exception {
        CardDatabase db = CardDatabase.fromJson("""
                [
                  {"id": "shield", "name": "Shield", "card_type": "Toy", "cost": 1,
                   "speed": 1, "strength": 1, "stamina": 1, "effects": ["effect_immunity:sleep_all"]},
                  {"id": "clean", "name": "Clean", "card_type": "Action", "cost": 3, "effects": ["sleep_all"]},
                  {"id": "drop", "name": "Drop", "card_type": "Action", "cost": 2, "effects": ["sleep_target:1"]},
                  {"id": "filler", "name": "Filler", "card_type": "Action", "cost": 0, "effects": ["gain_cc:1"]}
                ]
                """);
        GameFixture game = GameFixture.start(db, List.of("clean", "drop", "filler"), List.of("shield", "filler"),
                GameRules.defaults());
        Card shield = game.inPlay(PLAYER_TWO, "shield");
        game.setCc(PLAYER_ONE, 5);

        game.engine.playCard(PLAYER_ONE, game.card(PLAYER_ONE, "clean").getId(), List.of(), null);
        assertEquals(Zone.IN_PLAY, shield.getZone());

        game.engine.playCard(PLAYER_ONE, game.card(PLAYER_ONE, "drop").getId(), List.of(shield.getId()), null);
        assertEquals(Zone.SLEEP, shield.getZone());
    }

    @Test
    void testValidActionsIncludeAbilityTargets() throws Exception {
        GameFixture game = GameFixture.start(List.of("archer", "rush"), List.of("umbruh", "rush"));
        game.inPlay(PLAYER_ONE, "archer");
        game.inPlay(PLAYER_TWO, "umbruh");

        List<ValidAction> actions = game.engine.getValidActions(PLAYER_ONE, false);

        assertTrue(actions.stream().anyMatch(a -> a.type() == ActionType.ACTIVATE_ABILITY));
        assertTrue(actions.stream().noneMatch(a -> a.type() == ActionType.TUSSLE), "Archer cannot tussle");
        assertEquals(ActionType.END_TURN, actions.get(actions.size() - 1).type());
    }
}
