package com.viffx.Parsers.Report;

import org.jetbrains.annotations.NotNull;

import java.util.List;

/**
 * @param start the start symbol
 * @param terminals the terminals, sorted
 * @param nonTerminals the non-terminals, sorted
 * @param productions each production as {@code index: A -> α}, in grammar order
 */
public record GrammarSummary(@NotNull String start,
                             @NotNull List<String> terminals,
                             @NotNull List<String> nonTerminals,
                             @NotNull List<String> productions) {
    public GrammarSummary {
        terminals = List.copyOf(terminals);
        nonTerminals = List.copyOf(nonTerminals);
        productions = List.copyOf(productions);
    }

    public int productionCount() {
        return productions.size();
    }
}
