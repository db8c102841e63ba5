package com.viffx.Parsers.Grammar;

import java.io.IOException;

/**
 * Thrown when grammar text cannot be read as a list of productions.
 */
public class GrammarFormatException extends IOException {
    private final int line;

    public GrammarFormatException(String message) {
        this(message, 0);
    }

    public GrammarFormatException(String message, int line) {
        super(message);
        this.line = line;
    }

    /**
     * @return the 1-based line the error was found on, or 0 when it concerns the whole text
     */
    public int line() {
        return line;
    }
}
