package com.ggltcg.game;

import com.ggltcg.card.Card;
import com.ggltcg.card.Stat;
import com.ggltcg.game.action.ActionResult;
import com.ggltcg.game.action.ActionType;
import com.ggltcg.game.action.InvalidActionException;
import com.ggltcg.game.action.ValidAction;
import com.ggltcg.game.zones.Zone;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Optional;

import static com.ggltcg.game.GameFactory.PLAYER_ONE;
import static com.ggltcg.game.GameFactory.PLAYER_TWO;
import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for GameEngine: turn structure, costs, attacks and victory.
 */
class GameEngineTest {

    private static final List<String> FILLER = List.of("rush", "surge", "wake");

    @Test
    void testOpeningTurn() throws Exception {
        GameFixture game = GameFixture.start(FILLER, FILLER);

        assertEquals(1, game.state.getTurnNumber());
        assertEquals(PLAYER_ONE, game.state.getActivePlayerId());
        assertEquals(Phase.MAIN, game.state.getPhase());
        assertEquals(2, game.cc(PLAYER_ONE));
        assertEquals(0, game.cc(PLAYER_TWO));
        assertEquals(3, game.state.getPlayer(PLAYER_ONE).getHand().size());
    }

    @Test
    void testTurnGrantsAndCap() throws Exception {
        GameFixture game = GameFixture.start(FILLER, FILLER);

        game.endTurn();
        assertEquals(2, game.state.getTurnNumber());
        assertEquals(PLAYER_TWO, game.state.getActivePlayerId());
        assertEquals(4, game.cc(PLAYER_TWO));

        game.endTurn();
        assertEquals(6, game.cc(PLAYER_ONE));
        game.endTurn();
        assertEquals(7, game.cc(PLAYER_TWO), "CC is capped at 7");
        game.endTurn();
        assertEquals(7, game.cc(PLAYER_ONE));
    }

    @Test
    void testCcHistory() throws Exception {
        GameFixture game = GameFixture.start(FILLER, FILLER);
        game.endTurn();

        List<TurnCcRecord> history = game.state.getCcHistory();
        assertEquals(2, history.size());
        TurnCcRecord first = history.get(0);
        assertEquals(1, first.getTurn());
        assertEquals(PLAYER_ONE, first.getPlayerId());
        assertEquals(0, first.getCcStart());
        assertEquals(2, first.getCcGained());
        assertEquals(2, first.getCcEnd());
        assertNull(history.get(1).getCcEnd(), "The current turn is still open");
    }

    @Test
    void testEndTurnOutOfTurnRejected() throws Exception {
        GameFixture game = GameFixture.start(FILLER, FILLER);

        InvalidActionException e = assertThrows(InvalidActionException.class,
                () -> game.engine.endTurn(PLAYER_TWO));
        assertEquals("It is not your turn", e.getMessage());
        assertEquals(1, game.state.getTurnNumber());
    }

    @Test
    void testStatBoostAppliesImmediately() throws Exception {
        GameFixture game = GameFixture.start(List.of("violin", "umbruh", "rush"), FILLER);
        Card umbruh = game.inPlay(PLAYER_ONE, "umbruh");
        Card violin = game.card(PLAYER_ONE, "violin");
        game.setCc(PLAYER_ONE, 4);
        assertEquals(4, game.engine.getEffectiveStat(umbruh, Stat.STRENGTH));

        game.engine.playCard(PLAYER_ONE, violin.getId(), List.of(), null);

        assertEquals(6, game.engine.getEffectiveStat(umbruh, Stat.STRENGTH));
        assertEquals(4, game.engine.getEffectiveStat(umbruh, Stat.SPEED));
        assertEquals(3, game.cc(PLAYER_ONE));
    }

    @Test
    void testInsufficientCcRejectedWithoutChange() throws Exception {
        GameFixture game = GameFixture.start(List.of("clean", "rush"), FILLER);
        Card clean = game.card(PLAYER_ONE, "clean");

        InvalidActionException e = assertThrows(InvalidActionException.class,
                () -> game.engine.playCard(PLAYER_ONE, clean.getId(), List.of(), null));
        assertTrue(e.getMessage().contains("Not enough CC"));
        assertEquals(Zone.HAND, clean.getZone());
        assertEquals(2, game.cc(PLAYER_ONE));
        assertTrue(game.state.getGameLog().stream().noneMatch(l -> l.contains("plays Clean")));
    }

    @Test
    void testAlternativeCostSleepsChosenCard() throws Exception {
        GameFixture game = GameFixture.start(List.of("ballaber", "surge", "umbruh"), FILLER);
        Card ballaber = game.card(PLAYER_ONE, "ballaber");
        Card surge = game.card(PLAYER_ONE, "surge");
        game.setCc(PLAYER_ONE, 0);

        ValidAction listed = game.engine.getValidActions(PLAYER_ONE, false).stream()
                .filter(a -> ballaber.getId().equals(a.cardId()))
                .findFirst().orElseThrow();
        assertTrue(listed.alternativeCostOptions().contains(surge.getId()));

        game.engine.playCard(PLAYER_ONE, ballaber.getId(), List.of(), surge.getId());

        assertEquals(Zone.IN_PLAY, ballaber.getZone());
        assertEquals(Zone.SLEEP, surge.getZone());
        assertEquals(0, game.cc(PLAYER_ONE));
    }

    @Test
    void testAlternativeCostRejectsOpponentCard() throws Exception {
        GameFixture game = GameFixture.start(List.of("ballaber", "surge"), FILLER);
        Card ballaber = game.card(PLAYER_ONE, "ballaber");
        Card theirs = game.card(PLAYER_TWO, "rush");

        assertThrows(InvalidActionException.class,
                () -> game.engine.playCard(PLAYER_ONE, ballaber.getId(), List.of(), theirs.getId()));
        assertEquals(Zone.HAND, theirs.getZone());
        assertEquals(Zone.HAND, ballaber.getZone());
    }

    @Test
    void testDreamCostsLessPerSleepingCard() throws Exception {
        GameFixture game = GameFixture.start(List.of("dream", "rush", "surge", "umbruh"), FILLER);
        Card dream = game.card(PLAYER_ONE, "dream");
        CostCalculator costs = game.engine.getCostCalculator();
        assertEquals(4, costs.getCardCost(dream, PLAYER_ONE, List.of(), game.state).getAsInt());

        game.asleep(PLAYER_ONE, "rush");
        game.asleep(PLAYER_ONE, "surge");
        assertEquals(2, costs.getCardCost(dream, PLAYER_ONE, List.of(), game.state).getAsInt());

        game.engine.playCard(PLAYER_ONE, dream.getId(), List.of(), null);
        assertEquals(Zone.IN_PLAY, dream.getZone());
        assertEquals(0, game.cc(PLAYER_ONE));
    }

    @Test
    void testGibbersRaisesOpponentCosts() throws Exception {
        GameFixture game = GameFixture.start(List.of("surge", "umbruh"), List.of("gibbers", "surge"));
        Card surge = game.card(PLAYER_ONE, "surge");
        Card theirSurge = game.card(PLAYER_TWO, "surge");
        game.inPlay(PLAYER_TWO, "gibbers");
        CostCalculator costs = game.engine.getCostCalculator();

        assertEquals(1, costs.getCardCost(surge, PLAYER_ONE, List.of(), game.state).getAsInt());
        assertEquals(0, costs.getCardCost(theirSurge, PLAYER_TWO, List.of(), game.state).getAsInt());

        game.engine.playCard(PLAYER_ONE, surge.getId(), List.of(), null);
        assertEquals(2, game.cc(PLAYER_ONE), "Paid 1, gained 1");
    }

    @Test
    void testRushNotOnFirstTurn() throws Exception {
        GameFixture game = GameFixture.start(List.of("rush", "umbruh"), FILLER);
        Card rush = game.card(PLAYER_ONE, "rush");

        assertThrows(InvalidActionException.class,
                () -> game.engine.playCard(PLAYER_ONE, rush.getId(), List.of(), null));
        assertTrue(game.engine.getValidActions(PLAYER_ONE, false).stream()
                .noneMatch(a -> rush.getId().equals(a.cardId())));

        game.endTurn();
        game.endTurn();
        assertEquals(6, game.cc(PLAYER_ONE));
        game.engine.playCard(PLAYER_ONE, rush.getId(), List.of(), null);

        assertEquals(7, game.cc(PLAYER_ONE));
        assertEquals(Zone.SLEEP, rush.getZone());
    }

    @Test
    void testTussleRestrictions() throws Exception {
        GameFixture game = GameFixture.start(List.of("raggy", "archer", "rush"), List.of("umbruh", "rush"));
        Card raggy = game.inPlay(PLAYER_ONE, "raggy");
        Card archer = game.inPlay(PLAYER_ONE, "archer");
        Card umbruh = game.inPlay(PLAYER_TWO, "umbruh");

        assertThrows(InvalidActionException.class,
                () -> game.engine.initiateTussle(raggy.getId(), umbruh.getId(), PLAYER_ONE));
        assertThrows(InvalidActionException.class,
                () -> game.engine.initiateTussle(archer.getId(), umbruh.getId(), PLAYER_ONE));

        game.endTurn();
        game.endTurn();
        assertEquals(0, game.engine.getCostCalculator().getTussleCost(raggy, game.state));
        assertThrows(InvalidActionException.class,
                () -> game.engine.initiateTussle(archer.getId(), umbruh.getId(), PLAYER_ONE));
        game.engine.initiateTussle(raggy.getId(), umbruh.getId(), PLAYER_ONE);
        assertEquals(6, game.cc(PLAYER_ONE));
    }

    @Test
    void testWizardLowersTussleCost() throws Exception {
        GameFixture game = GameFixture.start(List.of("wizard", "umbruh", "rush"), List.of("umbruh", "rush"));
        Card umbruh = game.inPlay(PLAYER_ONE, "umbruh");
        CostCalculator costs = game.engine.getCostCalculator();
        assertEquals(2, costs.getTussleCost(umbruh, game.state));

        game.inPlay(PLAYER_ONE, "wizard");
        assertEquals(1, costs.getTussleCost(umbruh, game.state));

        Card theirs = game.inPlay(PLAYER_TWO, "umbruh");
        assertEquals(2, costs.getTussleCost(theirs, game.state), "Wizard only helps its controller");
    }

    @Test
    void testDirectAttackBlockedByToys() throws Exception {
        GameFixture game = GameFixture.start(List.of("umbruh", "rush"), List.of("umbruh", "rush"));
        Card attacker = game.inPlay(PLAYER_ONE, "umbruh");
        game.inPlay(PLAYER_TWO, "umbruh");

        InvalidActionException e = assertThrows(InvalidActionException.class,
                () -> game.engine.directAttack(attacker.getId(), PLAYER_ONE));
        assertTrue(e.getMessage().contains("opponent has toys in play"));
        assertEquals(2, game.cc(PLAYER_ONE));
        assertEquals(1, game.state.getPlayer(PLAYER_TWO).getHand().size());
        assertEquals(0, game.state.getDirectAttacksThisTurn());
    }

    @Test
    void testDirectAttackLimit() throws Exception {
        GameFixture game = GameFixture.start(List.of("umbruh", "rush"), List.of("rush", "surge", "wake", "clean"));
        Card attacker = game.inPlay(PLAYER_ONE, "umbruh");
        game.setCc(PLAYER_ONE, 6);

        game.engine.directAttack(attacker.getId(), PLAYER_ONE);
        assertEquals(Zone.SLEEP, game.card(PLAYER_TWO, "rush").getZone(), "The selector takes the first hand card");
        game.engine.directAttack(attacker.getId(), PLAYER_ONE);
        assertEquals(2, game.state.getDirectAttacksThisTurn());
        assertEquals(2, game.cc(PLAYER_ONE));

        InvalidActionException e = assertThrows(InvalidActionException.class,
                () -> game.engine.directAttack(attacker.getId(), PLAYER_ONE));
        assertTrue(e.getMessage().contains("limit"));
        assertEquals(2, game.state.getPlayer(PLAYER_TWO).getHand().size());

        game.endTurn();
        assertEquals(0, game.state.getDirectAttacksThisTurn());
    }

    @Test
    void testPaperPlaneAttacksPastToys() throws Exception {
        GameFixture game = GameFixture.start(List.of("paper_plane", "rush"), List.of("umbruh", "surge"));
        Card plane = game.inPlay(PLAYER_ONE, "paper_plane");
        game.inPlay(PLAYER_TWO, "umbruh");

        game.engine.directAttack(plane.getId(), PLAYER_ONE);

        assertEquals(Zone.SLEEP, game.card(PLAYER_TWO, "surge").getZone());
    }

    @Test
    void testVictoryWhenEveryCardSleeps() throws Exception {
        GameFixture game = GameFixture.start(List.of("umbruh", "rush"), List.of("wizard"));
        Card attacker = game.inPlay(PLAYER_ONE, "umbruh");
        Card defender = game.inPlay(PLAYER_TWO, "wizard");

        ActionResult result = game.engine.initiateTussle(attacker.getId(), defender.getId(), PLAYER_ONE);

        assertTrue(result.isGameOver());
        assertEquals(Optional.of(PLAYER_ONE), result.winnerId());
        assertTrue(game.state.isGameOver());
        InvalidActionException e = assertThrows(InvalidActionException.class, game::endTurn);
        assertEquals("The game is over", e.getMessage());
        assertTrue(game.engine.getValidActions(PLAYER_ONE, false).isEmpty());
    }

    @Test
    void testActingPlayerWinsSimultaneousLoss() throws Exception {
        GameFixture game = GameFixture.start(List.of("raggy"), List.of("demideca"));
        Card raggy = game.inPlay(PLAYER_ONE, "raggy");
        Card demideca = game.inPlay(PLAYER_TWO, "demideca");
        game.state.setTurnNumber(3);

        ActionResult result = game.engine.initiateTussle(raggy.getId(), demideca.getId(), PLAYER_ONE);

        assertEquals(Optional.of(PLAYER_ONE), result.winnerId());
    }

    @Test
    void testTurnScopedBoostExpires() throws Exception {
        GameFixture game = GameFixture.start(List.of("very_very_apple_juice", "umbruh", "rush"), FILLER);
        Card umbruh = game.inPlay(PLAYER_ONE, "umbruh");
        Card juice = game.card(PLAYER_ONE, "very_very_apple_juice");

        game.engine.playCard(PLAYER_ONE, juice.getId(), List.of(), null);
        assertEquals(5, game.engine.getEffectiveStat(umbruh, Stat.SPEED));
        assertEquals(5, game.engine.getEffectiveStat(umbruh, Stat.STRENGTH));
        assertEquals(5, game.engine.getRemainingStamina(umbruh));
        assertEquals(Zone.SLEEP, juice.getZone());

        game.endTurn();

        assertEquals(4, game.engine.getEffectiveStat(umbruh, Stat.SPEED));
        assertFalse(umbruh.hasModifications());
    }

    @Test
    void testToySleepsWhenStaminaBoostLeavesPlay() throws Exception {
        GameFixture game = GameFixture.start(List.of("drop", "rush"), List.of("demideca", "umbruh", "rush"));
        Card drop = game.card(PLAYER_ONE, "drop");
        Card demideca = game.inPlay(PLAYER_TWO, "demideca");
        Card umbruh = game.inPlay(PLAYER_TWO, "umbruh");
        umbruh.applyDamage(4);
        assertEquals(1, game.engine.getRemainingStamina(umbruh));

        game.engine.playCard(PLAYER_ONE, drop.getId(), List.of(demideca.getId()), null);

        assertEquals(Zone.SLEEP, demideca.getZone());
        assertEquals(Zone.SLEEP, umbruh.getZone());
        assertEquals(1, game.cc(PLAYER_TWO), "Sleeping from play fires Umbruh");
        assertTrue(game.state.getGameLog().contains("Umbruh has no stamina left"));
        assertFalse(game.state.isGameOver());
    }

    @Test
    void testToySleepsWhenTurnBoostExpires() throws Exception {
        GameFixture game = GameFixture.start(List.of("very_very_apple_juice", "umbruh", "rush"), FILLER);
        Card umbruh = game.inPlay(PLAYER_ONE, "umbruh");
        Card juice = game.card(PLAYER_ONE, "very_very_apple_juice");
        game.engine.playCard(PLAYER_ONE, juice.getId(), List.of(), null);
        umbruh.applyDamage(4);
        assertEquals(Zone.IN_PLAY, umbruh.getZone());

        game.endTurn();

        assertEquals(Zone.SLEEP, umbruh.getZone());
        assertEquals(3, game.cc(PLAYER_ONE));
        assertEquals(Phase.MAIN, game.state.getPhase());
    }

    @Test
    void testSleepingFromHandFiresNoTrigger() throws Exception {
        GameFixture game = GameFixture.start(List.of("knight", "rush"), List.of("umbruh", "rush"));
        Card knight = game.inPlay(PLAYER_ONE, "knight");
        Card theirs = game.card(PLAYER_TWO, "umbruh");

        game.engine.directAttack(knight.getId(), PLAYER_ONE);

        assertEquals(Zone.SLEEP, theirs.getZone());
        assertEquals(0, game.cc(PLAYER_TWO));
    }

    @Test
    void testAlternativeCostFromHandFiresNoTrigger() throws Exception {
        GameFixture game = GameFixture.start(List.of("ballaber", "umbruh", "rush"), FILLER);
        Card ballaber = game.card(PLAYER_ONE, "ballaber");
        Card umbruh = game.card(PLAYER_ONE, "umbruh");
        game.setCc(PLAYER_ONE, 0);

        game.engine.playCard(PLAYER_ONE, ballaber.getId(), List.of(), umbruh.getId());

        assertEquals(Zone.SLEEP, umbruh.getZone());
        assertEquals(0, game.cc(PLAYER_ONE));
    }

    @Test
    void testAlternativeCostFromPlayFiresTrigger() throws Exception {
        GameFixture game = GameFixture.start(List.of("ballaber", "umbruh", "rush"), FILLER);
        Card ballaber = game.card(PLAYER_ONE, "ballaber");
        Card umbruh = game.inPlay(PLAYER_ONE, "umbruh");
        game.setCc(PLAYER_ONE, 0);

        game.engine.playCard(PLAYER_ONE, ballaber.getId(), List.of(), umbruh.getId());

        assertEquals(Zone.SLEEP, umbruh.getZone());
        assertEquals(Zone.IN_PLAY, ballaber.getZone());
        assertEquals(1, game.cc(PLAYER_ONE));
    }

    @Test
    void testArcherRemovesStamina() throws Exception {
        GameFixture game = GameFixture.start(List.of("archer", "rush"), List.of("umbruh", "beary", "rush"));
        Card archer = game.inPlay(PLAYER_ONE, "archer");
        Card umbruh = game.inPlay(PLAYER_TWO, "umbruh");
        Card beary = game.inPlay(PLAYER_TWO, "beary");

        game.engine.activateAbility(PLAYER_ONE, archer.getId(), List.of(umbruh.getId()));
        assertEquals(3, game.engine.getRemainingStamina(umbruh));
        assertEquals(1, game.cc(PLAYER_ONE));

        InvalidActionException e = assertThrows(InvalidActionException.class,
                () -> game.engine.activateAbility(PLAYER_ONE, archer.getId(), List.of(beary.getId())));
        assertTrue(e.getMessage().contains("not a valid target"));
        assertEquals(1, game.cc(PLAYER_ONE));
        assertEquals(3, beary.getCurrentStamina());

        ValidAction listed = game.engine.getValidActions(PLAYER_ONE, false).stream()
                .filter(a -> a.type() == ActionType.ACTIVATE_ABILITY)
                .findFirst().orElseThrow();
        assertEquals(List.of(umbruh.getId()), listed.targetOptions());
    }

    @Test
    void testDuplicateTargetsRejected() throws Exception {
        GameFixture game = GameFixture.start(List.of("sun", "umbruh", "rush"), FILLER);
        Card sun = game.card(PLAYER_ONE, "sun");
        Card umbruh = game.asleep(PLAYER_ONE, "umbruh");
        game.setCc(PLAYER_ONE, 3);

        assertThrows(InvalidActionException.class,
                () -> game.engine.playCard(PLAYER_ONE, sun.getId(), List.of(umbruh.getId(), umbruh.getId()), null));
        assertEquals(Zone.SLEEP, umbruh.getZone());
        assertEquals(3, game.cc(PLAYER_ONE));
    }

    @Test
    void testInvariantsHoldThroughPlay() throws Exception {
        GameFixture game = GameFixture.start(List.of("umbruh", "ka", "rush"), List.of("twist", "wizard", "surge"));
        Card umbruh = game.card(PLAYER_ONE, "umbruh");
        game.engine.playCard(PLAYER_ONE, umbruh.getId(), List.of(), null);
        game.endTurn();
        game.engine.playCard(PLAYER_TWO, game.card(PLAYER_TWO, "twist").getId(), List.of(umbruh.getId()), null);

        assertDoesNotThrow(() -> InvariantChecker.check(game.state));
        assertEquals(PLAYER_TWO, umbruh.getController());
        assertEquals(PLAYER_ONE, umbruh.getOwner());
    }
}
