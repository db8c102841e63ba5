package com.viffx.Parsers.Runtime;

import org.jetbrains.annotations.NotNull;

import java.util.Objects;

/**
 * One row of a parse trace: the stack and remaining input as they were before the action ran.
 *
 * @param stack the parser stack, bottom first
 * @param input the unread tokens including the end marker
 * @param action what the parser did, or why it stopped
 */
public record ParseStep(@NotNull String stack, @NotNull String input, @NotNull String action) {
    public static final String ERROR_PREFIX = "error: ";

    public ParseStep {
        Objects.requireNonNull(stack, "stack cannot be null");
        Objects.requireNonNull(input, "input cannot be null");
        Objects.requireNonNull(action, "action cannot be null");
    }

    public static ParseStep error(String stack, String input, String reason) {
        return new ParseStep(stack, input, ERROR_PREFIX + reason);
    }

    public boolean isError() {
        return action.startsWith(ERROR_PREFIX);
    }
}
