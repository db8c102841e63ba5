package com.viffx.Parsers.Grammar;

import org.jetbrains.annotations.NotNull;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * A single rule {@code lhs -> rhs}. An empty {@code rhs} is an epsilon production.
 * <p>
 * Epsilon glyphs handed to the constructor are dropped, so {@code A -> ε} and
 * {@code A -> } build equal productions.
 *
 * @param lhs the non-terminal being rewritten
 * @param rhs the ordered right hand side symbols
 */
public record Production(@NotNull String lhs, @NotNull List<String> rhs) {
    public Production {
        Objects.requireNonNull(lhs, "lhs cannot be null");
        Objects.requireNonNull(rhs, "rhs cannot be null");

        // eliminate redundant epsilons
        List<String> symbols = new ArrayList<>(rhs.size());
        for (String symbol : rhs) {
            Objects.requireNonNull(symbol, "rhs symbols cannot be null");
            if (!Symbols.EPSILON.equals(symbol)) symbols.add(symbol);
        }
        rhs = List.copyOf(symbols);
    }

    public Production(String lhs, String... rhs) {
        this(lhs, List.of(rhs));
    }

    public int size() {
        return rhs.size();
    }

    public boolean isEmpty() {
        return rhs.isEmpty();
    }

    public String get(int index) {
        return rhs.get(index);
    }

    public boolean atEnd(int dot) {
        return dot >= rhs.size();
    }

    /**
     * Returns the symbols after the symbol at {@code dot}.
     *
     * @param dot a dot position inside the right hand side
     * @return the (possibly empty) suffix following the symbol at {@code dot}
     */
    public List<String> beta(int dot) {
        int from = dot + 1;
        if (from >= rhs.size()) return List.of();
        return rhs.subList(from, rhs.size());
    }

    @Override
    public String toString() {
        return lhs + " -> " + (rhs.isEmpty() ? Symbols.EPSILON : String.join(" ", rhs));
    }
}
