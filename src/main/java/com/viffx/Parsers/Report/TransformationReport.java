package com.viffx.Parsers.Report;

import org.jetbrains.annotations.NotNull;

import java.util.*;

/**
 * A grammar rewrite seen from both ends.
 *
 * @param descriptions every rewrite in the order it was made
 * @param leftRecursionRemoved whether some direct left recursion was eliminated
 * @param leftFactored whether some productions were left factored
 * @param newNonTerminals the introduced non-terminals, sorted
 * @param original the grammar before the rewrite
 * @param transformed the grammar after the rewrite
 * @param details the rewrites each non-terminal underwent
 */
public record TransformationReport(@NotNull List<String> descriptions,
                                   boolean leftRecursionRemoved,
                                   boolean leftFactored,
                                   @NotNull List<String> newNonTerminals,
                                   @NotNull GrammarSummary original,
                                   @NotNull GrammarSummary transformed,
                                   @NotNull Map<String, String> details) {
    public TransformationReport {
        Objects.requireNonNull(original, "original cannot be null");
        Objects.requireNonNull(transformed, "transformed cannot be null");
        descriptions = List.copyOf(descriptions);
        newNonTerminals = List.copyOf(newNonTerminals);
        details = Collections.unmodifiableMap(new LinkedHashMap<>(details));
    }

    public int newNonTerminalCount() {
        return newNonTerminals.size();
    }
}
