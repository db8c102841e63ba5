package com.viffx.Parsers.Automata;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.Comparator;

/**
 * An LR item: a production index with a dot position, and for LR(1) items a lookahead terminal.
 * LR(0) items carry a {@code null} lookahead.
 */
public record Item(int index, int dot, @Nullable String lookahead) implements Comparable<Item> {
    private static final Comparator<Item> ORDER = Comparator
            .comparingInt(Item::index)
            .thenComparingInt(Item::dot)
            .thenComparing(Item::lookahead, Comparator.nullsFirst(Comparator.naturalOrder()));

    public Item {
        if (index < 0) throw new IllegalArgumentException("production index must not be negative");
        if (dot < 0) throw new IllegalArgumentException("dot must not be negative");
    }

    public Item(int index, int dot) {
        this(index, dot, null);
    }

    /** The LR(0) part of this item, used to merge LALR states. */
    public Item core() {
        return lookahead == null ? this : new Item(index, dot, null);
    }

    public Item advance() {
        return new Item(index, dot + 1, lookahead);
    }

    @Override
    public int compareTo(@NotNull Item other) {
        return ORDER.compare(this, other);
    }
}
