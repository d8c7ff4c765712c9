package com.ptcgp.api.web;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.ptcgp.api.card.CardDatabase;
import com.ptcgp.api.query.CardQueryEngine;
import org.junit.jupiter.api.AfterAll;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for CardApiServer, over a real HTTP connection.
 */
class CardApiServerTest {

    private static final ObjectMapper MAPPER = new ObjectMapper();
    private static final HttpClient CLIENT = HttpClient.newHttpClient();

    private static CardApiServer server;
    private static CardApiServer unloadedServer;

    @BeforeAll
    static void startServers() throws Exception {
        server = new CardApiServer(new CardQueryEngine(CardDatabase.fromResource("cards.json")))
                .start("127.0.0.1", 0);
        unloadedServer = new CardApiServer(new CardQueryEngine()).start("127.0.0.1", 0);
    }

    @AfterAll
    static void stopServers() {
        server.stop();
        unloadedServer.stop();
    }

    private static HttpResponse<String> get(CardApiServer target, String path)
            throws IOException, InterruptedException {
        HttpRequest request = HttpRequest.newBuilder(
                URI.create("http://127.0.0.1:" + target.port() + path)).GET().build();
        return CLIENT.send(request, HttpResponse.BodyHandlers.ofString());
    }

    private static JsonNode getJson(String path, int expectedStatus) throws IOException, InterruptedException {
        HttpResponse<String> response = get(server, path);
        assertEquals(expectedStatus, response.statusCode(), response.body());
        return MAPPER.readTree(response.body());
    }

    @Test
    void testRoot() throws Exception {
        JsonNode body = getJson("/", 200);
        assertEquals("PTCGP API - TCG Pocket Simulator", body.get("message").asText());
        assertEquals("1.0.0", body.get("version").asText());
    }

    @Test
    void testListCards() throws Exception {
        JsonNode body = getJson("/cards", 200);
        assertTrue(body.isArray());
        assertEquals(10, body.size());
        assertEquals("/A1/001", body.get(0).get("id").asText());
    }

    @Test
    void testListCardsPassesThroughExtraFields() throws Exception {
        JsonNode first = getJson("/cards?limit=1", 200).get(0);
        assertEquals(70, first.get("hp").asInt());
        assertEquals("Bulbasaur", first.get("name").asText());
    }

    @Test
    void testListCardsOmitsMissingFields() throws Exception {
        JsonNode pokeBall = getJson("/cards?offset=8&limit=1", 200).get(0);
        assertEquals("Poke Ball", pokeBall.get("name").asText());
        assertFalse(pokeBall.has("type"));
    }

    @Test
    void testListCardsPaginated() throws Exception {
        JsonNode body = getJson("/cards?limit=2&offset=3", 200);
        assertEquals(2, body.size());
        assertEquals("Charizard ex", body.get(0).get("name").asText());
        assertEquals("Squirtle", body.get(1).get("name").asText());
    }

    @Test
    void testListCardsOffsetPastEnd() throws Exception {
        assertEquals(0, getJson("/cards?offset=50", 200).size());
    }

    @Test
    void testListCardsInvalidParameters() throws Exception {
        assertTrue(getJson("/cards?limit=0", 422).get("detail").asText().contains("limit"));
        getJson("/cards?limit=1001", 422);
        getJson("/cards?offset=-1", 422);
        assertTrue(getJson("/cards?limit=ten", 422).get("detail").asText().contains("integer"));
    }

    @Test
    void testGetCard() throws Exception {
        JsonNode body = getJson("/cards/A1/094", 200);
        assertEquals("Pikachu", body.get("name").asText());
        assertEquals("Lightning", body.get("type").asText());
    }

    @Test
    void testGetCardFromKeyedFileWithOddEntries() throws Exception {
        CardApiServer keyed = new CardApiServer(new CardQueryEngine(CardDatabase.fromJson("""
                {"version": "1.0", "a": {"id": "/A1/001", "name": {"en": "Mew"}, "type": "Psychic"}}
                """))).start("127.0.0.1", 0);
        try {
            HttpResponse<String> response = get(keyed, "/cards/A1/001");
            assertEquals(200, response.statusCode());
            assertEquals("Mew", MAPPER.readTree(response.body()).get("name").get("en").asText());

            JsonNode all = MAPPER.readTree(get(keyed, "/cards").body());
            assertEquals("1.0", all.get(0).asText());
            assertEquals(2, MAPPER.readTree(get(keyed, "/stats").body()).get("total_cards").asInt());
        } finally {
            keyed.stop();
        }
    }

    @Test
    void testGetCardNotFound() throws Exception {
        assertEquals("Card not found", getJson("/cards/A1/999", 404).get("detail").asText());
    }

    @Test
    void testSearchByName() throws Exception {
        JsonNode body = getJson("/cards/search/name/CHAR", 200);
        assertEquals(2, body.size());
        assertEquals("Charmander", body.get(0).get("name").asText());
    }

    @Test
    void testSearchByNameWithEncodedSpace() throws Exception {
        JsonNode body = getJson("/cards/search/name/poke%20ball", 200);
        assertEquals(1, body.size());
    }

    @Test
    void testFilterByType() throws Exception {
        assertEquals(3, getJson("/cards/filter/type/grass", 200).size());
    }

    @Test
    void testFilterByRarity() throws Exception {
        assertEquals(4, getJson("/cards/filter/rarity/common", 200).size());
    }

    @Test
    void testFilterBySet() throws Exception {
        JsonNode body = getJson("/cards/filter/set/A1A", 200);
        assertEquals(1, body.size());
        assertEquals("Celebi ex", body.get(0).get("name").asText());
    }

    @Test
    void testFilterWithNoMatchesIsEmptyList() throws Exception {
        JsonNode body = getJson("/cards/filter/type/Dragon", 200);
        assertTrue(body.isArray());
        assertEquals(0, body.size());
    }

    @Test
    void testStats() throws Exception {
        JsonNode body = getJson("/stats", 200);
        assertEquals(10, body.get("total_cards").asInt());
        assertEquals(3, body.get("types").get("Grass").asInt());
        assertEquals(1, body.get("types").get("Unknown").asInt());
        assertEquals(4, body.get("rarities").get("Double Rare").asInt());
        assertEquals(7, body.get("sets").get("A1").asInt());
    }

    @Test
    void testNotLoaded() throws Exception {
        for (String path : new String[] {"/cards", "/cards/A1/001", "/cards/search/name/pika",
                "/cards/filter/type/Fire", "/cards/filter/rarity/Common", "/cards/filter/set/A1", "/stats"}) {
            HttpResponse<String> response = get(unloadedServer, path);
            assertEquals(500, response.statusCode(), path);
            assertEquals("Cards data not loaded", MAPPER.readTree(response.body()).get("detail").asText());
        }
    }

    @Test
    void testRootWorksWithoutData() throws Exception {
        assertEquals(200, get(unloadedServer, "/").statusCode());
    }
}
