package com.viffx.Parsers.Compiler;

import org.jetbrains.annotations.NotNull;

import java.util.Locale;

public enum ParserKind {
    LL1("LL(1)"),
    SLR1("SLR(1)"),
    LALR1("LALR(1)"),
    CLR1("CLR(1)");

    private final String displayName;

    ParserKind(String displayName) {
        this.displayName = displayName;
    }

    public String displayName() {
        return displayName;
    }

    public boolean isLR() {
        return this != LL1;
    }

    /**
     * Looks up a parser kind by name, ignoring case and an optional {@code (1)} suffix:
     * {@code "slr"}, {@code "SLR(1)"} and {@code "SLR1"} all name {@link #SLR1}.
     *
     * @throws IllegalArgumentException if the name matches no kind
     */
    public static ParserKind of(@NotNull String name) {
        String normalized = name.strip().toUpperCase(Locale.ROOT).replace("(1)", "1");
        if (!normalized.endsWith("1")) normalized += "1";
        for (ParserKind kind : values()) {
            if (kind.name().equals(normalized)) return kind;
        }
        throw new IllegalArgumentException("Unknown parser type: " + name + ". Use LL(1), SLR, CLR or LALR.");
    }

    @Override
    public String toString() {
        return displayName;
    }
}
