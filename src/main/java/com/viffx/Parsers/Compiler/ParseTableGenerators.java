package com.viffx.Parsers.Compiler;

import com.viffx.Parsers.Automata.AutomatonBuilder;
import com.viffx.Parsers.Utils.ParserSettings;
import org.jetbrains.annotations.NotNull;

/**
 * Picks an LR table generator by parser kind or name.
 */
public final class ParseTableGenerators {
    private ParseTableGenerators() {}

    /**
     * @param name {@code SLR}, {@code SLR(1)}, {@code CLR}, {@code CLR(1)}, {@code LALR} or {@code LALR(1)}, in any case
     * @throws IllegalArgumentException if {@code name} names no LR parser
     */
    public static ParseTableGenerator forName(@NotNull String name) {
        return forKind(ParserKind.of(name), ParserSettings.load());
    }

    public static ParseTableGenerator forName(@NotNull String name, @NotNull ParserSettings settings) {
        return forKind(ParserKind.of(name), settings);
    }

    public static ParseTableGenerator forKind(@NotNull ParserKind kind) {
        return forKind(kind, ParserSettings.load());
    }

    /**
     * @throws IllegalArgumentException for {@link ParserKind#LL1}, which has no LR table
     */
    public static ParseTableGenerator forKind(@NotNull ParserKind kind, @NotNull ParserSettings settings) {
        AutomatonBuilder builder = new AutomatonBuilder(settings);
        return switch (kind) {
            case SLR1 -> new SLR1ParseTableGenerator(builder);
            case CLR1 -> new CLR1ParseTableGenerator(builder);
            case LALR1 -> new LALR1ParseTableGenerator(builder);
            case LL1 -> throw new IllegalArgumentException(kind + " is not an LR parser; use LL1ParseTableGenerator");
        };
    }
}
