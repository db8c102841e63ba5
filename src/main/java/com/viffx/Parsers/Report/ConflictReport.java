package com.viffx.Parsers.Report;

import com.viffx.Parsers.Compiler.ParserKind;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.*;

/**
 * Conflicts of one parse table, described for display.
 *
 * @param kind the parser the table belongs to
 * @param entries one entry per recorded conflict, in table order
 * @param ambiguous whether the conflicts suggest the grammar is ambiguous
 * @param ambiguityReason why the grammar looks ambiguous, {@code null} unless {@code ambiguous}
 */
public record ConflictReport(@NotNull ParserKind kind,
                             @NotNull List<Entry> entries,
                             boolean ambiguous,
                             @Nullable String ambiguityReason) {
    public ConflictReport {
        Objects.requireNonNull(kind, "kind cannot be null");
        entries = List.copyOf(entries);
        if (ambiguous != (ambiguityReason != null)) {
            throw new IllegalArgumentException("an ambiguity reason is given exactly when the grammar is ambiguous");
        }
    }

    public boolean hasConflicts() {
        return !entries.isEmpty();
    }

    public int conflictCount() {
        return entries.size();
    }

    /**
     * @param type the conflict type, e.g. {@code Shift-Reduce}
     * @param location where in the table the conflict sits
     * @param description one sentence explaining the conflict
     * @param details labelled values such as the two competing actions
     */
    public record Entry(@NotNull String type,
                        @NotNull String location,
                        @NotNull String description,
                        @NotNull Map<String, String> details) {
        public Entry {
            details = Collections.unmodifiableMap(new LinkedHashMap<>(details));
        }
    }
}
