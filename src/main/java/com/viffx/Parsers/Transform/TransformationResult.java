package com.viffx.Parsers.Transform;

import com.viffx.Parsers.Grammar.Grammar;
import org.jetbrains.annotations.NotNull;

import java.util.*;

/**
 * What {@link GrammarTransformer#transformForLL1()} did to a grammar.
 *
 * @param original the grammar before the transformation
 * @param transformed the grammar after the transformation
 * @param descriptions every rewrite in the order it was made
 * @param leftRecursionRemoved whether some direct left recursion was eliminated
 * @param leftFactored whether some productions were left factored
 * @param newNonTerminals the non-terminals the transformation introduced, in order of creation
 * @param details the rewrites each non-terminal underwent, joined by {@code "; "}
 */
public record TransformationResult(@NotNull Grammar original,
                                   @NotNull Grammar transformed,
                                   @NotNull List<String> descriptions,
                                   boolean leftRecursionRemoved,
                                   boolean leftFactored,
                                   @NotNull Set<String> newNonTerminals,
                                   @NotNull Map<String, String> details) {
    public TransformationResult {
        Objects.requireNonNull(original, "original cannot be null");
        Objects.requireNonNull(transformed, "transformed cannot be null");
        descriptions = List.copyOf(descriptions);
        newNonTerminals = Collections.unmodifiableSet(new LinkedHashSet<>(newNonTerminals));
        details = Collections.unmodifiableMap(new LinkedHashMap<>(details));
    }

    public boolean changed() {
        return !descriptions.isEmpty();
    }
}
