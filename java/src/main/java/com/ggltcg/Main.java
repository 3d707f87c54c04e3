package com.ggltcg;

import com.ggltcg.card.CardDatabase;
import com.ggltcg.card.CardDatabaseException;
import com.ggltcg.card.CardDefinition;
import com.ggltcg.game.GameFactory;
import com.ggltcg.game.GameRules;
import com.ggltcg.simulation.Deck;
import com.ggltcg.simulation.GameResult;
import com.ggltcg.simulation.SelfPlayRunner;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.io.IOException;
import java.util.concurrent.Callable;

/**
 * GGLTCG engine CLI - Main entry point.
 */
@Command(name = "ggltcg",
        mixinStandardHelpOptions = true,
        version = "1.0",
        description = "GGLTCG rules engine",
        subcommands = {
                Main.CardsCommand.class,
                Main.PlayCommand.class
        })
public class Main implements Runnable {
    static final String DEFAULT_CARDS = "cards.json";
    static final String DEFAULT_DECK_ONE = "decks/starter_one.txt";
    static final String DEFAULT_DECK_TWO = "decks/starter_two.txt";

    public static void main(String[] args) {
        int exitCode = new CommandLine(new Main()).execute(args);
        System.exit(exitCode);
    }

    @Override
    public void run() {
        // Show help if no subcommand
        CommandLine.usage(this, System.out);
    }

    /**
     * Load the card table from a file, or the bundled one when no path is given.
     */
    static CardDatabase loadCards(String cardsPath) throws CardDatabaseException {
        return cardsPath != null ? CardDatabase.fromFile(cardsPath) : CardDatabase.fromResource(DEFAULT_CARDS);
    }

    static GameRules loadRules(String rulesPath) throws IOException {
        return rulesPath != null ? GameRules.fromFile(rulesPath) : GameRules.fromResource(GameRules.DEFAULT_RESOURCE);
    }

    // ========== CARDS COMMAND ==========
    @Command(name = "cards", description = "Load the card table and list it")
    static class CardsCommand implements Callable<Integer> {
        @Option(names = {"-c", "--cards"}, description = "Path to cards database (default: bundled)")
        String cardsPath;

        @Override
        public Integer call() {
            CardDatabase db;
            try {
                db = loadCards(cardsPath);
            } catch (CardDatabaseException e) {
                System.err.println("✗ Failed to load cards: " + e.getMessage());
                return 1;
            }
            System.err.println("✓ Loaded " + db.cardCount() + " cards");
            for (CardDefinition def : db.getDefinitions()) {
                String cost = def.hasVariableCost() ? "?" : String.valueOf(def.getCost());
                String stats = def.isToy()
                        ? String.format(" %d/%d/%d", def.getSpeed(), def.getStrength(), def.getStamina())
                        : "";
                System.out.printf("%-22s %-7s cost %s%s  %s%n", def.getId(), def.getCardType().getJsonValue(),
                        cost, stats, String.join(";", def.getEffects()));
            }
            return 0;
        }
    }

    // ========== PLAY COMMAND ==========
    @Command(name = "play", description = "Play seeded random games between two decks")
    static class PlayCommand implements Callable<Integer> {
        @Option(names = {"-c", "--cards"}, description = "Path to cards database (default: bundled)")
        String cardsPath;

        @Option(names = {"-r", "--rules"}, description = "Path to rules JSON (default: bundled)")
        String rulesPath;

        @Option(names = {"-1", "--deck1"}, description = "Deck file for player one (default: bundled)")
        String deckOnePath;

        @Option(names = {"-2", "--deck2"}, description = "Deck file for player two (default: bundled)")
        String deckTwoPath;

        @Option(names = {"-s", "--seed"}, defaultValue = "1", description = "Random seed")
        long seed;

        @Option(names = {"-n", "--num-games"}, defaultValue = "1", description = "Number of games")
        int numGames;

        @Option(names = {"-m", "--max-actions"}, defaultValue = "500", description = "Action limit per game")
        int maxActions;

        @Option(names = {"--ai-filter"}, description = "Skip tussles the attacker is sure to lose")
        boolean aiFilter;

        @Option(names = {"-v", "--verbose"}, description = "Print the play-by-play log of each game")
        boolean verbose;

        @Override
        public Integer call() {
            CardDatabase db;
            GameRules rules;
            Deck deckOne;
            Deck deckTwo;
            try {
                db = loadCards(cardsPath);
                rules = loadRules(rulesPath);
            } catch (CardDatabaseException | IOException e) {
                System.err.println("✗ Failed to load configuration: " + e.getMessage());
                return 1;
            }
            try {
                deckOne = deckOnePath != null ? Deck.loadFromFile(deckOnePath, db) : Deck.loadFromResource(DEFAULT_DECK_ONE, db);
                deckTwo = deckTwoPath != null ? Deck.loadFromFile(deckTwoPath, db) : Deck.loadFromResource(DEFAULT_DECK_TWO, db);
            } catch (Deck.DeckException e) {
                System.err.println("✗ Failed to parse deck: " + e.getMessage());
                return 1;
            }

            System.out.println("\n=== GGLTCG Self-Play ===\n");
            System.out.println("Deck 1: " + deckOne.getName() + " (" + deckOne.size() + " cards)");
            System.out.println("Deck 2: " + deckTwo.getName() + " (" + deckTwo.size() + " cards)");
            System.out.println("Games: " + numGames + ", seed: " + seed);
            System.out.println();

            int[] wins = new int[3];
            for (int i = 0; i < numGames; i++) {
                GameResult result;
                try {
                    result = SelfPlayRunner.playGame(db, rules, deckOne, deckTwo, seed + i, maxActions, aiFilter);
                } catch (CardDatabaseException e) {
                    System.err.println("✗ Failed to set up game: " + e.getMessage());
                    return 1;
                }
                if (verbose) {
                    result.gameLog().forEach(line -> System.out.println("  " + line));
                    System.out.println();
                }
                String winner = result.isFinished() ? result.winnerId() : "none (action limit)";
                System.out.printf("Game %d: winner %s after %d turns, %d actions%n",
                        i + 1, winner, result.turns(), result.actionsTaken());
                if (!result.isFinished()) {
                    wins[2]++;
                } else if (GameFactory.PLAYER_ONE.equals(result.winnerId())) {
                    wins[0]++;
                } else {
                    wins[1]++;
                }
            }
            System.out.printf("%nPlayer 1 wins: %d, Player 2 wins: %d, unfinished: %d%n", wins[0], wins[1], wins[2]);
            return 0;
        }
    }
}
