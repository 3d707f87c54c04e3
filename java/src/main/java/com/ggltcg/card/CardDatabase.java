package com.ggltcg.card;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.ggltcg.effect.EffectParser;
import com.ggltcg.effect.EffectTemplate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Card table loaded from JSON.
 * Every definition's effect tokens are parsed while loading, so a bad token fails here
 * and never at play time. Definitions are keyed by their stable id.
 */
public class CardDatabase {
    private static final Logger log = LoggerFactory.getLogger(CardDatabase.class);

    private final Map<String, CardDefinition> definitions;
    private final Map<String, List<EffectTemplate>> templates;

    private CardDatabase(Map<String, CardDefinition> definitions, Map<String, List<EffectTemplate>> templates) {
        this.definitions = Collections.unmodifiableMap(definitions);
        this.templates = Collections.unmodifiableMap(templates);
    }

    /**
     * Load cards from a JSON file using the standard effect grammar.
     */
    public static CardDatabase fromFile(String path) throws CardDatabaseException {
        try {
            String content = Files.readString(Path.of(path));
            return fromJson(content);
        } catch (IOException e) {
            throw new CardDatabaseException("IO error: " + e.getMessage(), e);
        }
    }

    /**
     * Load cards from a classpath resource using the standard effect grammar.
     */
    public static CardDatabase fromResource(String resourcePath) throws CardDatabaseException {
        try (InputStream is = CardDatabase.class.getClassLoader().getResourceAsStream(resourcePath)) {
            if (is == null) {
                throw new CardDatabaseException("Resource not found: " + resourcePath);
            }
            ObjectMapper mapper = new ObjectMapper();
            List<CardDefinition> list = mapper.readValue(is, new TypeReference<List<CardDefinition>>() {});
            return fromDefinitions(list, EffectParser.standard());
        } catch (IOException e) {
            throw new CardDatabaseException("JSON parsing error: " + e.getMessage(), e);
        }
    }

    /**
     * Load cards from a JSON string using the standard effect grammar.
     */
    public static CardDatabase fromJson(String json) throws CardDatabaseException {
        return fromJson(json, EffectParser.standard());
    }

    public static CardDatabase fromJson(String json, EffectParser parser) throws CardDatabaseException {
        try {
            ObjectMapper mapper = new ObjectMapper();
            List<CardDefinition> list = mapper.readValue(json, new TypeReference<List<CardDefinition>>() {});
            return fromDefinitions(list, parser);
        } catch (IOException e) {
            throw new CardDatabaseException("JSON parsing error: " + e.getMessage(), e);
        }
    }

    private static CardDatabase fromDefinitions(List<CardDefinition> list, EffectParser parser)
            throws CardDatabaseException {
        Map<String, CardDefinition> definitions = new LinkedHashMap<>();
        Map<String, List<EffectTemplate>> templates = new LinkedHashMap<>();
        for (CardDefinition definition : list) {
            validate(definition);
            if (definitions.containsKey(definition.getId())) {
                throw new CardDatabaseException("Duplicate card id: " + definition.getId());
            }
            List<EffectTemplate> parsed;
            try {
                parsed = parser.parseAll(definition.getEffects());
            } catch (CardDatabaseException e) {
                throw new CardDatabaseException("Card " + definition + ": " + e.getMessage(), e);
            }
            definitions.put(definition.getId(), definition);
            templates.put(definition.getId(), List.copyOf(parsed));
        }
        log.debug("Loaded {} card definitions", definitions.size());
        return new CardDatabase(definitions, templates);
    }

    private static void validate(CardDefinition definition) throws CardDatabaseException {
        if (definition.getId() == null || definition.getId().isBlank()) {
            throw new CardDatabaseException("Card without id: " + definition.getName());
        }
        if (definition.getName() == null || definition.getName().isBlank()) {
            throw new CardDatabaseException("Card without name: " + definition.getId());
        }
        if (definition.getCardType() == null) {
            throw new CardDatabaseException("Card without card_type: " + definition);
        }
        if (definition.isToy() && !definition.hasStats()) {
            throw new CardDatabaseException("Toy is missing speed/strength/stamina: " + definition);
        }
        if (definition.getCost() != null && definition.getCost() < 0) {
            throw new CardDatabaseException("Negative cost: " + definition);
        }
    }

    /**
     * Get a definition by id.
     * @throws CardDatabaseException if the id is unknown
     */
    public CardDefinition getDefinition(String id) throws CardDatabaseException {
        CardDefinition definition = definitions.get(id);
        if (definition == null) {
            throw new CardDatabaseException("Card not found: " + id);
        }
        return definition;
    }

    /**
     * Parsed effect templates of a definition.
     * @throws IllegalArgumentException if the definition did not come from this database
     */
    public List<EffectTemplate> getEffectTemplates(String definitionId) {
        List<EffectTemplate> list = templates.get(definitionId);
        if (list == null) {
            throw new IllegalArgumentException("Unknown card definition: " + definitionId);
        }
        return list;
    }

    public Collection<CardDefinition> getDefinitions() {
        return new ArrayList<>(definitions.values());
    }

    /**
     * Get total number of definitions.
     */
    public int cardCount() {
        return definitions.size();
    }

    public boolean hasCard(String id) {
        return definitions.containsKey(id);
    }
}
