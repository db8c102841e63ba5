package com.viffx.Parsers.Runtime;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.List;

/**
 * The outcome of one parse: the full trace, whether the input was accepted, and the parse tree
 * when it was.
 */
public record ParseResult(@NotNull List<ParseStep> steps, boolean accepted, @Nullable ParseTreeNode root) {
    public ParseResult {
        steps = List.copyOf(steps);
        if (accepted && root == null) throw new IllegalArgumentException("an accepted parse must have a tree");
    }

    public static ParseResult success(List<ParseStep> steps, @NotNull ParseTreeNode root) {
        return new ParseResult(steps, true, root);
    }

    public static ParseResult failure(List<ParseStep> steps) {
        return new ParseResult(steps, false, null);
    }

    /**
     * @return the step the parse ended on, or {@code null} for an empty trace
     */
    @Nullable
    public ParseStep lastStep() {
        return steps.isEmpty() ? null : steps.get(steps.size() - 1);
    }
}
