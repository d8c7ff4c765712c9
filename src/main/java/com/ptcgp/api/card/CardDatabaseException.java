package com.ptcgp.api.card;

/**
 * Exception thrown by CardDatabase loading and card queries.
 */
public class CardDatabaseException extends Exception {

    /**
     * What went wrong.
     */
    public enum Kind {
        /** Data file missing, or no card matches a lookup. */
        NOT_FOUND,
        /** Data file is not valid JSON or not shaped like a card collection. */
        PARSE_ERROR,
        /** A query ran before any card data was published. */
        NOT_LOADED
    }

    private final Kind kind;

    public CardDatabaseException(Kind kind, String message) {
        super(message);
        this.kind = kind;
    }

    public CardDatabaseException(Kind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public Kind getKind() {
        return kind;
    }
}
