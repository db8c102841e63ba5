package com.viffx.Parsers.Automata;

/**
 * Thrown when a canonical collection grows past the configured state ceiling.
 */
public class StateLimitExceededException extends RuntimeException {
    private final int limit;

    public StateLimitExceededException(int limit, String message) {
        super(message);
        this.limit = limit;
    }

    public int limit() {
        return limit;
    }
}
