package com.viffx.Parsers.Compiler;

/**
 * The kind of collision recorded when two different actions compete for one ACTION cell.
 */
public enum ConflictType {
    SHIFT_REDUCE("shift-reduce"),
    REDUCE_REDUCE("reduce-reduce"),
    OTHER("other");

    private final String label;

    ConflictType(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }

    /**
     * A shift against a reduce (in either order) is a shift-reduce conflict, two reduces are a
     * reduce-reduce conflict, anything involving accept is {@link #OTHER}.
     */
    public static ConflictType classify(Action existing, Action rejected) {
        if (existing.isShift() && rejected.isReduce()) return SHIFT_REDUCE;
        if (existing.isReduce() && rejected.isShift()) return SHIFT_REDUCE;
        if (existing.isReduce() && rejected.isReduce()) return REDUCE_REDUCE;
        return OTHER;
    }

    @Override
    public String toString() {
        return label;
    }
}
