package com.viffx.Parsers.Grammar;

/**
 * Reserved grammar symbols.
 */
public final class Symbols {
    /** Marks an empty right hand side. Never stored inside a production. */
    public static final String EPSILON = "ε";
    /** End of input marker appended to every token stream. */
    public static final String EOF = "$";

    private Symbols() {}

    /**
     * Returns whether the given alternative text denotes the empty production.
     *
     * @param alternative a trimmed right hand side alternative
     * @return if {@code alternative} is blank, the epsilon glyph or the word "epsilon"
     */
    public static boolean isEpsilon(String alternative) {
        return alternative.isEmpty() || EPSILON.equals(alternative) || "epsilon".equals(alternative);
    }
}
