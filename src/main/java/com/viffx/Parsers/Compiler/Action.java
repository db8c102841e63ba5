package com.viffx.Parsers.Compiler;

import org.jetbrains.annotations.NotNull;

import java.util.Objects;

/**
 * Represents a parsing action in an LR ACTION table.
 * <p>
 * An action consists of a type (SHIFT, REDUCE or ACCEPT) and an integer value whose meaning
 * depends on the action type:
 * <ul>
 *   <li>For {@link ActionType#SHIFT},  {@code data} is the target state to shift to.</li>
 *   <li>For {@link ActionType#REDUCE}, {@code data} is the index of the production to reduce by,
 *       in the augmented grammar of the table.</li>
 *   <li>For {@link ActionType#ACCEPT}, {@code data} is unused (always zero).</li>
 * </ul>
 * GOTO entries are kept in a separate table as plain state numbers.
 *
 * @param type the kind of action to be performed
 * @param data an integer value whose interpretation depends on {@code type}
 */
public record Action(@NotNull ActionType type, int data) {
    public static final Action ACCEPT = new Action(ActionType.ACCEPT, 0);

    public Action {
        Objects.requireNonNull(type, "type cannot be null");
        if (data < 0) throw new IllegalArgumentException("action data must not be negative");
        if (type == ActionType.ACCEPT && data != 0) throw new IllegalArgumentException("accept carries no data");
    }

    public static Action shift(int state) {
        return new Action(ActionType.SHIFT, state);
    }

    public static Action reduce(int production) {
        return new Action(ActionType.REDUCE, production);
    }

    public boolean isShift() {
        return type == ActionType.SHIFT;
    }

    public boolean isReduce() {
        return type == ActionType.REDUCE;
    }

    public boolean isAccept() {
        return type == ActionType.ACCEPT;
    }

    @Override
    public String toString() {
        return switch (type) {
            case SHIFT -> "shift " + data;
            case REDUCE -> "reduce " + data;
            case ACCEPT -> "accept";
        };
    }
}
