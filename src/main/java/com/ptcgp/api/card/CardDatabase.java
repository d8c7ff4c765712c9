package com.ptcgp.api.card;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.ptcgp.api.card.CardDatabaseException.Kind;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;
import java.util.Map;

/**
 * Card database that loads cards from JSON.
 *
 * <p>The data file may be a JSON array of cards, an object with a
 * {@code "cards"} array, or an object whose values are the cards. In every
 * case the result is a single ordered, immutable list. Entries are not
 * validated: any JSON value becomes a card.
 */
public class CardDatabase {
    private static final ObjectMapper MAPPER = new ObjectMapper();

    private final List<Card> cards;

    private CardDatabase(List<Card> cards) {
        this.cards = Collections.unmodifiableList(cards);
    }

    /**
     * Load cards from a JSON file.
     */
    public static CardDatabase fromFile(String path) throws CardDatabaseException {
        return fromFile(Path.of(path));
    }

    /**
     * Load cards from a JSON file.
     */
    public static CardDatabase fromFile(Path path) throws CardDatabaseException {
        if (!Files.isRegularFile(path)) {
            throw new CardDatabaseException(Kind.NOT_FOUND, "Cards data file not found: " + path);
        }
        try (InputStream is = Files.newInputStream(path)) {
            return fromTree(MAPPER.readTree(is));
        } catch (JsonProcessingException e) {
            throw invalidJson(e);
        } catch (IOException e) {
            throw new CardDatabaseException(Kind.PARSE_ERROR, "Failed to read cards data: " + e.getMessage(), e);
        }
    }

    /**
     * Load cards from a classpath resource.
     */
    public static CardDatabase fromResource(String resourcePath) throws CardDatabaseException {
        try (InputStream is = CardDatabase.class.getClassLoader().getResourceAsStream(resourcePath)) {
            if (is == null) {
                throw new CardDatabaseException(Kind.NOT_FOUND, "Resource not found: " + resourcePath);
            }
            return fromTree(MAPPER.readTree(is));
        } catch (JsonProcessingException e) {
            throw invalidJson(e);
        } catch (IOException e) {
            throw new CardDatabaseException(Kind.PARSE_ERROR, "Failed to read cards data: " + e.getMessage(), e);
        }
    }

    /**
     * Load cards from a JSON string.
     */
    public static CardDatabase fromJson(String json) throws CardDatabaseException {
        try {
            return fromTree(MAPPER.readTree(json));
        } catch (JsonProcessingException e) {
            throw invalidJson(e);
        }
    }

    private static CardDatabaseException invalidJson(JsonProcessingException e) {
        return new CardDatabaseException(Kind.PARSE_ERROR,
                "Invalid JSON format in cards data: " + e.getOriginalMessage(), e);
    }

    private static CardDatabase fromTree(JsonNode root) throws CardDatabaseException {
        if (root == null || root.isMissingNode()) {
            throw new CardDatabaseException(Kind.PARSE_ERROR, "Cards data is empty");
        }

        List<Card> cards = new ArrayList<>();
        if (root.isArray()) {
            readArray(root, cards);
        } else if (root.isObject()) {
            JsonNode nested = root.get("cards");
            if (nested != null && nested.isArray()) {
                readArray(nested, cards);
            } else {
                Iterator<Map.Entry<String, JsonNode>> fields = root.fields();
                while (fields.hasNext()) {
                    Map.Entry<String, JsonNode> field = fields.next();
                    Card card = toCard(field.getValue(), "'" + field.getKey() + "'");
                    card.assignSourceKey(field.getKey());
                    cards.add(card);
                }
            }
        } else {
            throw new CardDatabaseException(Kind.PARSE_ERROR,
                    "Cards data must be a JSON array or object, got " + root.getNodeType());
        }
        return new CardDatabase(cards);
    }

    private static void readArray(JsonNode array, List<Card> cards) throws CardDatabaseException {
        for (int i = 0; i < array.size(); i++) {
            cards.add(toCard(array.get(i), "at index " + i));
        }
    }

    private static Card toCard(JsonNode node, String location) throws CardDatabaseException {
        if (!node.isObject()) {
            return Card.ofValue(MAPPER.convertValue(node, Object.class));
        }
        try {
            return MAPPER.treeToValue(node, Card.class);
        } catch (JsonProcessingException e) {
            throw new CardDatabaseException(Kind.PARSE_ERROR,
                    "Card entry " + location + " is invalid: " + e.getOriginalMessage(), e);
        }
    }

    /**
     * Get a card by its composite key "/{set}/{number}".
     * A card stored under that key in a keyed data file wins; otherwise the
     * first card whose id matches.
     * @throws CardDatabaseException if the card is not found
     */
    public Card getCard(String key) throws CardDatabaseException {
        Card card = findCard(key);
        if (card == null) {
            throw new CardDatabaseException(Kind.NOT_FOUND, "Card not found");
        }
        return card;
    }

    private Card findCard(String key) {
        for (Card card : cards) {
            if (key.equals(card.sourceKey())) {
                return card;
            }
        }
        for (Card card : cards) {
            if (key.equals(card.getId())) {
                return card;
            }
        }
        return null;
    }

    /**
     * All cards in file order.
     */
    public List<Card> getCards() {
        return cards;
    }

    /**
     * Get total number of cards.
     */
    public int cardCount() {
        return cards.size();
    }

    /**
     * Check if a card exists.
     */
    public boolean hasCard(String key) {
        return findCard(key) != null;
    }
}
