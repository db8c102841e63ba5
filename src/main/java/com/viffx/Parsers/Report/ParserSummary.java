package com.viffx.Parsers.Report;

import com.viffx.Parsers.Compiler.ParseTable;
import com.viffx.Parsers.Compiler.ParserKind;
import com.viffx.Parsers.Grammar.Grammar;
import com.viffx.Parsers.Predictive.LL1ParseTable;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.Objects;

/**
 * Size and health of one parser's table, or the reason the table could not be built.
 *
 * @param kind the parser
 * @param conflictFree whether the table has no conflicts; {@code false} when it was not built
 * @param conflicts the number of recorded conflicts
 * @param states the automaton size, 0 for LL(1)
 * @param tableEntries the number of filled ACTION, GOTO or LL(1) cells
 * @param totalCells the number of cells the table has room for
 * @param error why the table could not be built, {@code null} if it was
 */
public record ParserSummary(@NotNull ParserKind kind,
                            boolean conflictFree,
                            int conflicts,
                            int states,
                            int tableEntries,
                            int totalCells,
                            @Nullable String error) {
    public ParserSummary {
        Objects.requireNonNull(kind, "kind cannot be null");
    }

    public static ParserSummary of(@NotNull ParseTable table) {
        Grammar grammar = table.grammar();
        // ACTION columns are the terminals and the end marker, GOTO columns every non-terminal but the augmented start
        int columns = grammar.terminals().size() + 1 + grammar.nonTerminals().size() - 1;
        return new ParserSummary(table.kind(), table.isConflictFree(), table.conflicts().size(), table.stateCount(),
                table.actionEntryCount() + table.gotoEntryCount(), table.stateCount() * columns, null);
    }

    public static ParserSummary of(@NotNull LL1ParseTable table) {
        return new ParserSummary(ParserKind.LL1, table.isConflictFree(), table.conflicts().size(), 0,
                table.filledCells(), table.totalCells(), null);
    }

    public static ParserSummary failed(@NotNull ParserKind kind, @NotNull String error) {
        return new ParserSummary(kind, false, 0, 0, 0, 0, error);
    }

    public boolean built() {
        return error == null;
    }

    /**
     * @return the filled share of the table in percent, 0 for an empty or unbuilt table
     */
    public double coverage() {
        return totalCells == 0 ? 0 : tableEntries * 100.0 / totalCells;
    }
}
