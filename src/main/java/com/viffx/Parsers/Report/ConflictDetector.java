package com.viffx.Parsers.Report;

import com.viffx.Parsers.Compiler.Conflict;
import com.viffx.Parsers.Compiler.ConflictType;
import com.viffx.Parsers.Compiler.ParseTable;
import com.viffx.Parsers.Compiler.ParserKind;
import com.viffx.Parsers.Predictive.LL1Conflict;
import com.viffx.Parsers.Predictive.LL1ParseTable;
import org.jetbrains.annotations.NotNull;

import java.util.*;

/**
 * Turns the conflicts recorded in parse tables into {@link ConflictReport}s.
 */
public final class ConflictDetector {
    private ConflictDetector() {}

    /**
     * Describes every conflict of an LR table. A canonical LR(1) table with reduce-reduce
     * conflicts is reported as probably ambiguous; no other table is.
     */
    public static ConflictReport analyze(@NotNull ParseTable table) {
        List<ConflictReport.Entry> entries = new ArrayList<>();
        int reduceReduce = 0;
        for (Conflict conflict : table.conflicts()) {
            String location = "state " + conflict.state() + ", symbol '" + conflict.symbol() + "'";
            String description = switch (conflict.type()) {
                case SHIFT_REDUCE -> "Shift-Reduce conflict at " + location
                        + ". Parser cannot decide whether to shift or reduce.";
                case REDUCE_REDUCE -> "Reduce-Reduce conflict at " + location
                        + ". Parser cannot decide which production to use for reduction.";
                case OTHER -> "Conflict at " + location;
            };
            if (conflict.type() == ConflictType.REDUCE_REDUCE) reduceReduce++;

            Map<String, String> details = new LinkedHashMap<>();
            details.put("Existing", describe(table, conflict.existing().toString(), conflict.existing().isReduce(), conflict.existing().data()));
            details.put("Rejected", describe(table, conflict.rejected().toString(), conflict.rejected().isReduce(), conflict.rejected().data()));
            entries.add(new ConflictReport.Entry(title(conflict.type()), location, description, details));
        }

        boolean ambiguous = reduceReduce > 0 && table.kind() == ParserKind.CLR1;
        String reason = ambiguous
                ? "Grammar has " + reduceReduce + " reduce-reduce conflict(s) in the CLR(1) table. This typically indicates the grammar is ambiguous."
                : null;
        return new ConflictReport(table.kind(), entries, ambiguous, reason);
    }

    /**
     * Describes every conflict of an LL(1) table. LL(1) conflicts say nothing about ambiguity.
     */
    public static ConflictReport analyze(@NotNull LL1ParseTable table) {
        List<ConflictReport.Entry> entries = new ArrayList<>();
        for (LL1Conflict conflict : table.conflicts()) {
            Map<String, String> details = new LinkedHashMap<>();
            details.put("Production 1", conflict.retained().toString());
            details.put("Production 2", conflict.rejected().toString());
            entries.add(new ConflictReport.Entry(
                    "LL(1) Multiple Productions",
                    "table[" + conflict.nonTerminal() + ", " + conflict.terminal() + "]",
                    "Multiple productions for (" + conflict.nonTerminal() + ", " + conflict.terminal() + ")",
                    details));
        }
        return new ConflictReport(ParserKind.LL1, entries, false, null);
    }

    /**
     * Puts the conflict figures of several reports side by side. When two reports are for the
     * same parser, the later one is kept.
     */
    public static ConflictSummary summarize(@NotNull Collection<ConflictReport> reports) {
        int conflictFree = 0;
        Map<ParserKind, ConflictSummary.Counts> byParser = new EnumMap<>(ParserKind.class);
        for (ConflictReport report : reports) {
            if (!report.hasConflicts()) conflictFree++;
            byParser.put(report.kind(),
                    new ConflictSummary.Counts(report.hasConflicts(), report.conflictCount(), report.ambiguous()));
        }
        return new ConflictSummary(reports.size(), conflictFree, reports.size() - conflictFree, byParser);
    }

    /**
     * Renders an entry as a heading line followed by indented description and detail lines.
     */
    public static String format(@NotNull ConflictReport.Entry entry) {
        StringJoiner lines = new StringJoiner("\n");
        lines.add(entry.type() + " at " + entry.location());
        lines.add("   " + entry.description());
        entry.details().forEach((label, value) -> lines.add("   " + label + ": " + value));
        return lines.toString();
    }

    private static String title(ConflictType type) {
        return switch (type) {
            case SHIFT_REDUCE -> "Shift-Reduce";
            case REDUCE_REDUCE -> "Reduce-Reduce";
            case OTHER -> "Other";
        };
    }

    private static String describe(ParseTable table, String action, boolean reduce, int production) {
        return reduce ? action + " (" + table.grammar().production(production) + ")" : action;
    }
}
