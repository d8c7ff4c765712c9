package com.ptcgp.api.web;

import com.ptcgp.api.card.CardDatabaseException;
import com.ptcgp.api.query.CardQueryEngine;
import io.javalin.Javalin;
import io.javalin.http.Context;
import io.javalin.http.HttpResponseException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * HTTP endpoints over a {@link CardQueryEngine}:
 * <ul>
 *   <li>GET /</li>
 *   <li>GET /cards?limit=..&amp;offset=..</li>
 *   <li>GET /cards/{setId}/{cardId}</li>
 *   <li>GET /cards/search/name/{name}</li>
 *   <li>GET /cards/filter/type/{type}</li>
 *   <li>GET /cards/filter/rarity/{rarity}</li>
 *   <li>GET /cards/filter/set/{setName}</li>
 *   <li>GET /stats</li>
 * </ul>
 */
public class CardApiServer {
    private static final Logger LOG = LoggerFactory.getLogger(CardApiServer.class);

    public static final String TITLE = "PTCGP API - TCG Pocket Simulator";
    public static final String VERSION = "1.0.0";

    private final CardQueryEngine engine;
    private final Javalin app;

    public CardApiServer(CardQueryEngine engine) {
        this.engine = engine;
        this.app = Javalin.create(config -> {
            config.showJavalinBanner = false;
            config.requestLogger.http((ctx, ms) ->
                    LOG.info("{} {} -> {} ({} ms)", ctx.method(), ctx.path(), ctx.status(), ms));
        });
        registerRoutes();
        registerErrorHandlers();
    }

    private void registerRoutes() {
        app.get("/", ctx -> ctx.json(new ApiInfo(TITLE, VERSION)));

        app.get("/cards", ctx -> {
            Integer limit = intQueryParam(ctx, "limit");
            Integer offset = intQueryParam(ctx, "offset");
            ctx.json(engine.list(limit, offset != null ? offset : 0));
        });

        app.get("/cards/{setId}/{cardId}", ctx ->
                ctx.json(engine.getByKey(ctx.pathParam("setId"), ctx.pathParam("cardId"))));

        app.get("/cards/search/name/{name}", ctx ->
                ctx.json(engine.searchByName(ctx.pathParam("name"))));

        app.get("/cards/filter/type/{type}", ctx ->
                ctx.json(engine.filterByType(ctx.pathParam("type"))));

        app.get("/cards/filter/rarity/{rarity}", ctx ->
                ctx.json(engine.filterByRarity(ctx.pathParam("rarity"))));

        app.get("/cards/filter/set/{setName}", ctx ->
                ctx.json(engine.filterBySet(ctx.pathParam("setName"))));

        app.get("/stats", ctx -> ctx.json(engine.stats()));
    }

    private void registerErrorHandlers() {
        app.exception(CardDatabaseException.class, (e, ctx) -> {
            switch (e.getKind()) {
                case NOT_FOUND -> ctx.status(404).json(new ErrorResponse(e.getMessage()));
                default -> {
                    LOG.warn("{} {} failed: {}", ctx.method(), ctx.path(), e.getMessage());
                    ctx.status(500).json(new ErrorResponse(e.getMessage()));
                }
            }
        });

        app.exception(IllegalArgumentException.class, (e, ctx) ->
                ctx.status(422).json(new ErrorResponse(e.getMessage())));

        app.exception(Exception.class, (e, ctx) -> {
            if (e instanceof HttpResponseException response) {
                ctx.status(response.getStatus()).json(new ErrorResponse(response.getMessage()));
                return;
            }
            LOG.error("Unhandled error on {} {}", ctx.method(), ctx.path(), e);
            ctx.status(500).json(new ErrorResponse("Internal server error"));
        });
    }

    private static Integer intQueryParam(Context ctx, String name) {
        String raw = ctx.queryParam(name);
        if (raw == null || raw.isBlank()) {
            return null;
        }
        try {
            return Integer.valueOf(raw.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Query parameter '" + name + "' must be an integer");
        }
    }

    /**
     * Start listening. Use port 0 for an ephemeral port.
     */
    public CardApiServer start(String host, int port) {
        app.start(host, port);
        LOG.info("Card API listening on http://{}:{}", host, app.port());
        return this;
    }

    public int port() {
        return app.port();
    }

    public void stop() {
        app.stop();
    }

    public record ApiInfo(String message, String version) {}

    public record ErrorResponse(String detail) {}
}
