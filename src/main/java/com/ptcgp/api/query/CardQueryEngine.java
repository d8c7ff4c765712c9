package com.ptcgp.api.query;

import com.ptcgp.api.card.Card;
import com.ptcgp.api.card.CardDatabase;
import com.ptcgp.api.card.CardDatabaseException;
import com.ptcgp.api.card.CardDatabaseException.Kind;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Function;
import java.util.function.Predicate;

/**
 * Read-only queries over a published card database.
 *
 * <p>The database is published once; until then every query fails with
 * {@link Kind#NOT_LOADED}. Searches and filters are linear scans and keep
 * file order.
 */
public class CardQueryEngine {
    public static final int MAX_LIMIT = 1000;

    private static final String UNKNOWN = "Unknown";

    private final AtomicReference<CardDatabase> database = new AtomicReference<>();

    /**
     * Engine with nothing published yet.
     */
    public CardQueryEngine() {
    }

    public CardQueryEngine(CardDatabase db) {
        publish(db);
    }

    /**
     * Publish the card database. Allowed exactly once.
     * @throws IllegalStateException if a database was already published
     */
    public void publish(CardDatabase db) {
        if (db == null) {
            throw new IllegalArgumentException("Card database cannot be null");
        }
        if (!database.compareAndSet(null, db)) {
            throw new IllegalStateException("Card database already published");
        }
    }

    public boolean isLoaded() {
        return database.get() != null;
    }

    private CardDatabase loaded() throws CardDatabaseException {
        CardDatabase db = database.get();
        if (db == null) {
            throw new CardDatabaseException(Kind.NOT_LOADED, "Cards data not loaded");
        }
        return db;
    }

    /**
     * Cards in file order, skipping {@code offset} and returning at most {@code limit}.
     *
     * @param limit  maximum number of cards, 1 to {@value #MAX_LIMIT}, or null for all remaining
     * @param offset number of cards to skip, at least 0
     */
    public List<Card> list(Integer limit, int offset) throws CardDatabaseException {
        List<Card> cards = loaded().getCards();
        if (limit != null && (limit < 1 || limit > MAX_LIMIT)) {
            throw new IllegalArgumentException("limit must be between 1 and " + MAX_LIMIT);
        }
        if (offset < 0) {
            throw new IllegalArgumentException("offset must be at least 0");
        }

        int from = Math.min(offset, cards.size());
        int to = limit == null ? cards.size() : (int) Math.min((long) from + limit, cards.size());
        return List.copyOf(cards.subList(from, to));
    }

    /**
     * Card whose id is "/{setId}/{cardId}".
     * @throws CardDatabaseException NOT_FOUND if no card has that id
     */
    public Card getByKey(String setId, String cardId) throws CardDatabaseException {
        return loaded().getCard("/" + setId + "/" + cardId);
    }

    /**
     * Cards whose name contains {@code query}, ignoring case.
     */
    public List<Card> searchByName(String query) throws CardDatabaseException {
        String needle = fold(query);
        return select(card -> fold(orEmpty(card.getName())).contains(needle));
    }

    public List<Card> filterByType(String type) throws CardDatabaseException {
        return selectEqual(Card::getType, type);
    }

    public List<Card> filterByRarity(String rarity) throws CardDatabaseException {
        return selectEqual(Card::getRarity, rarity);
    }

    public List<Card> filterBySet(String setName) throws CardDatabaseException {
        return selectEqual(Card::getSet, setName);
    }

    /**
     * Count cards per type, rarity and set in one pass.
     * Missing values are counted under "Unknown"; labels keep their original case.
     */
    public CardStats stats() throws CardDatabaseException {
        List<Card> cards = loaded().getCards();
        Map<String, Integer> types = new LinkedHashMap<>();
        Map<String, Integer> rarities = new LinkedHashMap<>();
        Map<String, Integer> sets = new LinkedHashMap<>();

        for (Card card : cards) {
            types.merge(orUnknown(card.getType()), 1, Integer::sum);
            rarities.merge(orUnknown(card.getRarity()), 1, Integer::sum);
            sets.merge(orUnknown(card.getSet()), 1, Integer::sum);
        }

        return new CardStats(cards.size(),
                Collections.unmodifiableMap(types),
                Collections.unmodifiableMap(rarities),
                Collections.unmodifiableMap(sets));
    }

    private List<Card> selectEqual(Function<Card, String> field, String value) throws CardDatabaseException {
        String wanted = fold(value);
        return select(card -> fold(orEmpty(field.apply(card))).equals(wanted));
    }

    private List<Card> select(Predicate<Card> predicate) throws CardDatabaseException {
        List<Card> matches = new ArrayList<>();
        for (Card card : loaded().getCards()) {
            if (predicate.test(card)) {
                matches.add(card);
            }
        }
        return matches;
    }

    private static String fold(String value) {
        return value.toLowerCase(Locale.ROOT);
    }

    private static String orEmpty(String value) {
        return value != null ? value : "";
    }

    private static String orUnknown(String value) {
        return value != null ? value : UNKNOWN;
    }
}
