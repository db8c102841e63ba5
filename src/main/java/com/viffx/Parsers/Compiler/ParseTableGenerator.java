package com.viffx.Parsers.Compiler;

import com.viffx.Parsers.Grammar.Grammar;
import org.jetbrains.annotations.NotNull;

/**
 * Builds an LR parse table for a grammar. Implementations never throw on conflicts; they are
 * recorded in the returned table.
 */
public interface ParseTableGenerator {
    /**
     * @param grammar the grammar, not yet augmented
     * @return a complete table over the augmented grammar
     * @throws com.viffx.Parsers.Automata.StateLimitExceededException if the automaton grows too large
     */
    @NotNull
    ParseTable build(@NotNull Grammar grammar);

    ParserKind kind();
}
