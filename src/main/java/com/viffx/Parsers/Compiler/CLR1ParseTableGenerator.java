package com.viffx.Parsers.Compiler;

import com.viffx.Parsers.Automata.AutomatonBuilder;
import com.viffx.Parsers.Grammar.Grammar;
import org.jetbrains.annotations.NotNull;

import java.util.List;
import java.util.Objects;

/**
 * Canonical LR(1) tables: LR(1) states, reducing only on the lookahead of the completed item.
 */
public class CLR1ParseTableGenerator implements ParseTableGenerator {
    private final AutomatonBuilder builder;

    public CLR1ParseTableGenerator() {
        this(new AutomatonBuilder());
    }

    public CLR1ParseTableGenerator(@NotNull AutomatonBuilder builder) {
        this.builder = Objects.requireNonNull(builder, "builder cannot be null");
    }

    @NotNull
    @Override
    public ParseTable build(@NotNull Grammar grammar) {
        return ActionTableWriter.fill(kind(), builder.lr1(grammar), item -> List.of(item.lookahead()));
    }

    @Override
    public ParserKind kind() {
        return ParserKind.CLR1;
    }
}
