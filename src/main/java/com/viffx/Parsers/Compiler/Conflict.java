package com.viffx.Parsers.Compiler;

import org.jetbrains.annotations.NotNull;

import java.util.Objects;

/**
 * A collision in the ACTION table.
 *
 * @param state the state whose row collided
 * @param symbol the terminal column
 * @param existing the action the table kept
 * @param rejected the action that was attempted afterwards and discarded
 */
public record Conflict(int state, @NotNull String symbol, @NotNull Action existing, @NotNull Action rejected) {
    public Conflict {
        Objects.requireNonNull(symbol, "symbol cannot be null");
        Objects.requireNonNull(existing, "existing cannot be null");
        Objects.requireNonNull(rejected, "rejected cannot be null");
    }

    public ConflictType type() {
        return ConflictType.classify(existing, rejected);
    }

    @Override
    public String toString() {
        return type() + " conflict in state " + state + " on '" + symbol + "': " + existing + " vs " + rejected;
    }
}
