package com.viffx.Parsers.Report;

import com.viffx.Parsers.Compiler.ParserKind;
import org.jetbrains.annotations.NotNull;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/**
 * Conflict counts of several parsers side by side.
 *
 * @param parsers the number of reports summarized
 * @param conflictFree how many of them have no conflicts
 * @param withConflicts how many of them have conflicts
 * @param byParser the per-parser figures
 */
public record ConflictSummary(int parsers,
                              int conflictFree,
                              int withConflicts,
                              @NotNull Map<ParserKind, Counts> byParser) {
    public ConflictSummary {
        Map<ParserKind, Counts> copy = new EnumMap<>(ParserKind.class);
        copy.putAll(byParser);
        byParser = Collections.unmodifiableMap(copy);
    }

    public record Counts(boolean hasConflicts, int conflicts, boolean ambiguous) {}
}
