package com.viffx.Parsers.Compiler;

import com.viffx.Parsers.Analysis.FirstFollowAnalyzer;
import com.viffx.Parsers.Automata.Automaton;
import com.viffx.Parsers.Automata.AutomatonBuilder;
import com.viffx.Parsers.Grammar.Grammar;
import org.jetbrains.annotations.NotNull;

import java.util.Objects;

/**
 * SLR(1) tables: LR(0) states, reducing on every terminal in FOLLOW of the production's left hand side.
 */
public class SLR1ParseTableGenerator implements ParseTableGenerator {
    private final AutomatonBuilder builder;

    public SLR1ParseTableGenerator() {
        this(new AutomatonBuilder());
    }

    public SLR1ParseTableGenerator(@NotNull AutomatonBuilder builder) {
        this.builder = Objects.requireNonNull(builder, "builder cannot be null");
    }

    @NotNull
    @Override
    public ParseTable build(@NotNull Grammar grammar) {
        Automaton automaton = builder.lr0(grammar);
        FirstFollowAnalyzer analyzer = new FirstFollowAnalyzer(automaton.grammar());
        return ActionTableWriter.fill(kind(), automaton,
                item -> analyzer.follow(automaton.grammar().production(item.index()).lhs()));
    }

    @Override
    public ParserKind kind() {
        return ParserKind.SLR1;
    }
}
