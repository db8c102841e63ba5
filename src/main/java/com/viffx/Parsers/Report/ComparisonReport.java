package com.viffx.Parsers.Report;

import com.viffx.Parsers.Compiler.ParseTable;
import com.viffx.Parsers.Compiler.ParserKind;
import com.viffx.Parsers.Grammar.Grammar;
import com.viffx.Parsers.Predictive.LL1ParseTable;
import com.viffx.Parsers.Transform.TransformationResult;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.*;

/**
 * How one grammar fares with every parser kind.
 *
 * @param grammar the grammar the LR tables were built from
 * @param transformation the rewrite applied before building the LL(1) table, if any
 * @param summaries a summary for every parser kind
 * @param conflictReports the conflict report of every table that was built
 * @param lrTables the LR tables that were built
 * @param ll1Table the LL(1) table
 * @param conflictFree the kinds whose tables have no conflicts, in order of preference
 * @param best the preferred conflict-free kind, {@code null} if there is none
 * @param recommendation a sentence recommending {@code best}
 */
public record ComparisonReport(@NotNull Grammar grammar,
                               @Nullable TransformationResult transformation,
                               @NotNull Map<ParserKind, ParserSummary> summaries,
                               @NotNull Map<ParserKind, ConflictReport> conflictReports,
                               @NotNull Map<ParserKind, ParseTable> lrTables,
                               @NotNull LL1ParseTable ll1Table,
                               @NotNull List<ParserKind> conflictFree,
                               @Nullable ParserKind best,
                               @NotNull String recommendation) {
    public ComparisonReport {
        Objects.requireNonNull(grammar, "grammar cannot be null");
        Objects.requireNonNull(ll1Table, "ll1Table cannot be null");
        Objects.requireNonNull(recommendation, "recommendation cannot be null");
        summaries = byKind(summaries);
        conflictReports = byKind(conflictReports);
        lrTables = byKind(lrTables);
        conflictFree = List.copyOf(conflictFree);
    }

    public ParserSummary summary(ParserKind kind) {
        return summaries.get(kind);
    }

    @Nullable
    public ParseTable table(ParserKind kind) {
        return lrTables.get(kind);
    }

    private static <T> Map<ParserKind, T> byKind(Map<ParserKind, T> values) {
        Map<ParserKind, T> copy = new EnumMap<>(ParserKind.class);
        copy.putAll(values);
        return Collections.unmodifiableMap(copy);
    }
}
