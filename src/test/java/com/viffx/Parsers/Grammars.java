package com.viffx.Parsers;

import com.viffx.Parsers.Grammar.Grammar;
import com.viffx.Parsers.Grammar.GrammarFormatException;

/**
 * Grammars shared by the tests.
 */
public final class Grammars {
    public static final String EXPRESSION = """
            # classic expression grammar
            E -> E + T | T
            T -> T * F | F
            F -> ( E ) | id
            """;

    public static final String DANGLING_ELSE = """
            S -> if E then S | if E then S else S | id
            E -> id
            """;

    /** LR(1) but not LALR(1): merging the two states reducing {@code c} collides. */
    public static final String LR1_NOT_LALR = """
            S -> a A d | b B d | a B e | b A e
            A -> c
            B -> c
            """;

    public static final String AMBIGUOUS_REDUCE = """
            S -> A | B
            A -> x
            B -> x
            """;

    public static final String OPTIONAL_TAIL = """
            S -> a A
            A -> b | ε
            """;

    private Grammars() {}

    public static Grammar parse(String text) {
        try {
            return Grammar.parse(text);
        } catch (GrammarFormatException e) {
            throw new AssertionError("fixture grammar does not parse: " + e.getMessage(), e);
        }
    }

    public static Grammar expression() {
        return parse(EXPRESSION);
    }

    public static Grammar danglingElse() {
        return parse(DANGLING_ELSE);
    }
}
