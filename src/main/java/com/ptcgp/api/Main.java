package com.ptcgp.api;

import com.ptcgp.api.card.CardDatabase;
import com.ptcgp.api.card.CardDatabaseException;
import com.ptcgp.api.query.CardQueryEngine;
import com.ptcgp.api.query.CardStats;
import com.ptcgp.api.web.CardApiServer;
import picocli.CommandLine;
import picocli.CommandLine.*;
import picocli.CommandLine.Model.CommandSpec;

import java.io.PrintWriter;
import java.util.Comparator;
import java.util.Map;
import java.util.concurrent.Callable;

/**
 * PTCGP API CLI - Main entry point.
 */
@Command(name = "ptcgp-api",
        mixinStandardHelpOptions = true,
        version = CardApiServer.VERSION,
        description = "API for TCG Pocket Simulator - Card Database",
        subcommands = {
                Main.ServeCommand.class,
                Main.StatsCommand.class
        })
public class Main implements Runnable {

    public static void main(String[] args) {
        int exitCode = new CommandLine(new Main()).execute(args);
        // serve leaves the HTTP server running, so only exit explicitly on failure
        if (exitCode != 0) {
            System.exit(exitCode);
        }
    }

    @Override
    public void run() {
        // Show help if no subcommand
        CommandLine.usage(this, System.out);
    }

    /**
     * Load the card database, reporting the outcome on stderr.
     * Returns null if loading failed.
     */
    static CardDatabase loadCards(String cardsPath, PrintWriter err) {
        try {
            CardDatabase db = CardDatabase.fromFile(cardsPath);
            err.println("✓ Loaded " + db.cardCount() + " cards from " + cardsPath);
            err.flush();
            return db;
        } catch (CardDatabaseException e) {
            err.println("✗ Failed to load cards: " + e.getMessage());
            err.flush();
            return null;
        }
    }

    // ========== SERVE COMMAND ==========
    @Command(name = "serve", description = "Load the cards database and serve it over HTTP")
    static class ServeCommand implements Callable<Integer> {
        @Spec
        CommandSpec spec;

        @Option(names = {"-c", "--cards"}, defaultValue = "data/cards.json",
                description = "Path to cards database")
        String cardsPath;

        @Option(names = {"-H", "--host"}, defaultValue = "0.0.0.0",
                description = "Address to bind")
        String host;

        @Option(names = {"-p", "--port"}, defaultValue = "8000",
                description = "Port to listen on")
        int port;

        @Override
        public Integer call() {
            CardDatabase db = loadCards(cardsPath, spec.commandLine().getErr());
            if (db == null) {
                return 1;
            }

            // Publish before the server accepts any request
            CardQueryEngine engine = new CardQueryEngine(db);
            CardApiServer server = new CardApiServer(engine).start(host, port);
            Runtime.getRuntime().addShutdownHook(new Thread(server::stop, "ptcgp-api-shutdown"));
            return 0;
        }
    }

    // ========== STATS COMMAND ==========
    @Command(name = "stats", description = "Print card counts by type, rarity and set")
    static class StatsCommand implements Callable<Integer> {
        @Spec
        CommandSpec spec;

        @Option(names = {"-c", "--cards"}, defaultValue = "data/cards.json",
                description = "Path to cards database")
        String cardsPath;

        @Override
        public Integer call() throws Exception {
            PrintWriter out = spec.commandLine().getOut();
            CardDatabase db = loadCards(cardsPath, spec.commandLine().getErr());
            if (db == null) {
                return 1;
            }

            CardStats stats = new CardQueryEngine(db).stats();
            out.println("=== Card Stats ===\n");
            out.printf("Total cards: %d%n", stats.total());
            printTable(out, "Types", stats.types());
            printTable(out, "Rarities", stats.rarities());
            printTable(out, "Sets", stats.sets());
            out.flush();
            return 0;
        }
    }

    private static void printTable(PrintWriter out, String title, Map<String, Integer> counts) {
        out.println();
        out.println(title + ":");
        counts.entrySet().stream()
                .sorted(Map.Entry.<String, Integer>comparingByValue(Comparator.reverseOrder())
                        .thenComparing(Map.Entry.comparingByKey()))
                .forEach(e -> out.printf("  %-20s %5d%n", e.getKey(), e.getValue()));
    }
}
