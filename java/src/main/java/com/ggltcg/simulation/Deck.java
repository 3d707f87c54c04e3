package com.ggltcg.simulation;

import com.ggltcg.card.CardDatabase;
import com.ggltcg.card.CardDatabaseException;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * A list of card definition ids.
 */
public class Deck {
    private final List<String> definitionIds;
    private final String name;

    public Deck(List<String> definitionIds, String name) {
        this.definitionIds = new ArrayList<>(definitionIds);
        this.name = name;
    }

    /**
     * Load a deck from a file.
     * Format: "1 card_id" per line, supports comments with # or //
     *
     * @param path Path to the deck file
     * @param db   Card database the ids must exist in
     * @return Parsed deck
     * @throws DeckException if parsing fails
     */
    public static Deck loadFromFile(String path, CardDatabase db) throws DeckException {
        try {
            String content = Files.readString(Path.of(path));
            String fileName = Path.of(path).getFileName().toString();
            return parse(content, deckName(fileName), db);
        } catch (IOException e) {
            throw new DeckException("Failed to read deck file: " + e.getMessage());
        }
    }

    /**
     * Load a deck from a classpath resource.
     */
    public static Deck loadFromResource(String resourcePath, CardDatabase db) throws DeckException {
        try (InputStream is = Deck.class.getClassLoader().getResourceAsStream(resourcePath)) {
            if (is == null) {
                throw new DeckException("Resource not found: " + resourcePath);
            }
            String content = new String(is.readAllBytes(), StandardCharsets.UTF_8);
            String fileName = resourcePath.substring(resourcePath.lastIndexOf('/') + 1);
            return parse(content, deckName(fileName), db);
        } catch (IOException e) {
            throw new DeckException("Failed to read deck resource: " + e.getMessage());
        }
    }

    /**
     * Parse deck text.
     */
    public static Deck parse(String content, String name, CardDatabase db) throws DeckException {
        List<String> ids = new ArrayList<>();
        String[] lines = content.split("\n");

        for (int lineNum = 0; lineNum < lines.length; lineNum++) {
            String line = lines[lineNum].trim();

            if (line.isEmpty() || line.startsWith("#") || line.startsWith("//")) {
                continue;
            }

            int spaceIdx = line.indexOf(' ');
            if (spaceIdx == -1) {
                throw new DeckException("Invalid deck format at line " + (lineNum + 1)
                        + ": Expected format 'COUNT CARD_ID'");
            }

            String countStr = line.substring(0, spaceIdx);
            String cardId = line.substring(spaceIdx + 1).trim();

            int count;
            try {
                count = Integer.parseInt(countStr);
            } catch (NumberFormatException e) {
                throw new DeckException("Invalid deck format at line " + (lineNum + 1)
                        + ": '" + countStr + "' is not a valid number");
            }
            if (count <= 0) {
                throw new DeckException("Invalid count at line " + (lineNum + 1) + ": " + count);
            }

            try {
                db.getDefinition(cardId);
            } catch (CardDatabaseException e) {
                throw new DeckException("Card not found at line " + (lineNum + 1) + ": " + cardId);
            }
            for (int i = 0; i < count; i++) {
                ids.add(cardId);
            }
        }

        if (ids.isEmpty()) {
            throw new DeckException("Deck '" + name + "' has no cards");
        }
        return new Deck(ids, name);
    }

    private static String deckName(String fileName) {
        return fileName.endsWith(".txt") ? fileName.substring(0, fileName.length() - 4) : fileName;
    }

    public List<String> getDefinitionIds() {
        return new ArrayList<>(definitionIds);
    }

    public int size() {
        return definitionIds.size();
    }

    public String getName() {
        return name;
    }

    /**
     * Exception thrown when deck parsing fails.
     */
    public static class DeckException extends Exception {
        public DeckException(String message) {
            super(message);
        }
    }
}
