package com.ptcgp.api.card;

import com.fasterxml.jackson.annotation.JsonAnySetter;
import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * A single card record from the cards data file.
 *
 * <p>The five known fields keep whatever JSON value the file holds and are
 * also readable as text; every other key is kept as-is and written back out
 * after them. An entry that is not a JSON object becomes a card with no
 * fields and is written back out unchanged.
 *
 * <p>All values are frozen on load, nested maps and lists included.
 */
public class Card {
    private final Object id;
    private final Object name;
    private final Object type;
    private final Object rarity;
    private final Object set;

    private final Map<String, Object> attributes = new LinkedHashMap<>();

    // Entries that were not JSON objects keep their raw value here
    private final boolean objectEntry;
    private final Object entryValue;

    // Key this card was stored under in a keyed data file; never serialized
    private String sourceKey;

    @JsonCreator
    Card(@JsonProperty("id") Object id,
         @JsonProperty("name") Object name,
         @JsonProperty("type") Object type,
         @JsonProperty("rarity") Object rarity,
         @JsonProperty("set") Object set) {
        this.id = freeze(id);
        this.name = freeze(name);
        this.type = freeze(type);
        this.rarity = freeze(rarity);
        this.set = freeze(set);
        this.objectEntry = true;
        this.entryValue = null;
    }

    private Card(Object entryValue) {
        this.id = null;
        this.name = null;
        this.type = null;
        this.rarity = null;
        this.set = null;
        this.objectEntry = false;
        this.entryValue = freeze(entryValue);
    }

    /**
     * Card for a data file entry that is not a JSON object.
     */
    static Card ofValue(Object entryValue) {
        return new Card(entryValue);
    }

    /**
     * Card id as text, normally "/{set}/{number}". Null when absent or not a scalar.
     */
    public String getId() {
        return text(id);
    }

    public String getName() {
        return text(name);
    }

    public String getType() {
        return text(type);
    }

    public String getRarity() {
        return text(rarity);
    }

    public String getSet() {
        return text(set);
    }

    public String sourceKey() {
        return sourceKey;
    }

    void assignSourceKey(String sourceKey) {
        this.sourceKey = sourceKey;
    }

    /**
     * Fields other than the five known ones, in document order.
     */
    public Map<String, Object> attributes() {
        return Collections.unmodifiableMap(attributes);
    }

    @JsonAnySetter
    void putAttribute(String key, Object value) {
        attributes.put(key, freeze(value));
    }

    /**
     * The JSON value this card is written as: the original entry.
     */
    @JsonValue
    Object toJson() {
        if (!objectEntry) {
            return entryValue;
        }
        Map<String, Object> json = new LinkedHashMap<>();
        putIfPresent(json, "id", id);
        putIfPresent(json, "name", name);
        putIfPresent(json, "type", type);
        putIfPresent(json, "rarity", rarity);
        putIfPresent(json, "set", set);
        json.putAll(attributes);
        return json;
    }

    private static void putIfPresent(Map<String, Object> json, String key, Object value) {
        if (value != null) {
            json.put(key, value);
        }
    }

    // Strings as-is, numbers and booleans in their JSON form, anything else has no text
    private static String text(Object value) {
        if (value instanceof String s) {
            return s;
        }
        if (value instanceof Number || value instanceof Boolean) {
            return String.valueOf(value);
        }
        return null;
    }

    private static Object freeze(Object value) {
        if (value instanceof Map<?, ?> map) {
            Map<Object, Object> copy = new LinkedHashMap<>();
            for (Map.Entry<?, ?> entry : map.entrySet()) {
                copy.put(entry.getKey(), freeze(entry.getValue()));
            }
            return Collections.unmodifiableMap(copy);
        }
        if (value instanceof List<?> list) {
            List<Object> copy = new ArrayList<>(list.size());
            for (Object item : list) {
                copy.add(freeze(item));
            }
            return Collections.unmodifiableList(copy);
        }
        return value;
    }

    @Override
    public String toString() {
        return objectEntry ? "Card{id=" + getId() + ", name=" + getName() + "}" : "Card{" + entryValue + "}";
    }
}
