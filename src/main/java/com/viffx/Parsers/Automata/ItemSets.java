package com.viffx.Parsers.Automata;

import com.viffx.Parsers.Analysis.FirstFollowAnalyzer;
import com.viffx.Parsers.Grammar.Grammar;
import com.viffx.Parsers.Grammar.Symbols;
import org.jetbrains.annotations.NotNull;

import java.util.*;

/**
 * Closure and goto over LR item sets of one (augmented) grammar.
 * <p>
 * Every returned state is an unmodifiable sorted set, so two states holding the same items are
 * equal and hash alike regardless of how they were computed.
 */
public final class ItemSets {
    private final Grammar grammar;
    private final FirstFollowAnalyzer analyzer;

    public ItemSets(@NotNull Grammar grammar) {
        this(grammar, new FirstFollowAnalyzer(grammar));
    }

    /**
     * @param grammar the grammar the items index into
     * @param analyzer precomputed FIRST sets of {@code grammar}, used for LR(1) lookaheads
     */
    public ItemSets(@NotNull Grammar grammar, @NotNull FirstFollowAnalyzer analyzer) {
        this.grammar = Objects.requireNonNull(grammar, "grammar cannot be null");
        this.analyzer = Objects.requireNonNull(analyzer, "analyzer cannot be null");
    }

    public Grammar grammar() {
        return grammar;
    }

    // LR(0)

    /**
     * Adds {@code [B -> • γ]} for every item {@code [A -> α • B β]} until nothing changes.
     *
     * @param items the kernel items
     * @return the closure as a canonical state
     */
    public SortedSet<Item> closure0(Collection<Item> items) {
        Set<Item> closure = new LinkedHashSet<>(items);
        Deque<Item> queue = new ArrayDeque<>(items);
        while (!queue.isEmpty()) {
            Item item = queue.poll();
            String next = grammar.symbol(item);
            if (!grammar.isNonTerminal(next)) continue;

            grammar.forEachProduction(next, index -> {
                Item added = new Item(index, 0);
                if (closure.add(added)) queue.add(added);
            });
        }
        return freeze(closure);
    }

    /**
     * Advances the dot over {@code symbol} in every item of {@code state} and closes the result.
     *
     * @return the successor state, empty if no item of {@code state} expects {@code symbol}
     */
    public SortedSet<Item> goto0(Collection<Item> state, String symbol) {
        List<Item> moved = advance(state, symbol);
        if (moved.isEmpty()) return Collections.emptySortedSet();
        return closure0(moved);
    }

    // LR(1)

    /**
     * Adds {@code [B -> • γ, b]} for every item {@code [A -> α • B β, a]} and every terminal
     * {@code b} in FIRST(βa), until nothing changes. Epsilon is never used as a lookahead.
     *
     * @param items the kernel items, each carrying a lookahead
     * @return the closure as a canonical state
     */
    public SortedSet<Item> closure1(Collection<Item> items) {
        Set<Item> closure = new LinkedHashSet<>(items);
        Deque<Item> queue = new ArrayDeque<>(items);
        while (!queue.isEmpty()) {
            Item item = queue.poll();
            String next = grammar.symbol(item);
            if (!grammar.isNonTerminal(next)) continue;
            if (item.lookahead() == null) {
                throw new IllegalArgumentException("LR(1) closure of an item without lookahead: " + grammar.toString(item));
            }

            // FIRST(βa)
            List<String> betaA = new ArrayList<>(grammar.beta(item));
            betaA.add(item.lookahead());
            Set<String> lookaheads = new LinkedHashSet<>(analyzer.first(betaA));
            lookaheads.remove(Symbols.EPSILON);

            grammar.forEachProduction(next, index -> {
                for (String lookahead : lookaheads) {
                    Item added = new Item(index, 0, lookahead);
                    if (closure.add(added)) queue.add(added);
                }
            });
        }
        return freeze(closure);
    }

    public SortedSet<Item> goto1(Collection<Item> state, String symbol) {
        List<Item> moved = advance(state, symbol);
        if (moved.isEmpty()) return Collections.emptySortedSet();
        return closure1(moved);
    }

    private List<Item> advance(Collection<Item> state, String symbol) {
        List<Item> moved = new ArrayList<>();
        for (Item item : state) {
            if (symbol.equals(grammar.symbol(item))) moved.add(item.advance());
        }
        return moved;
    }

    static SortedSet<Item> freeze(Collection<Item> items) {
        return Collections.unmodifiableSortedSet(new TreeSet<>(items));
    }
}
