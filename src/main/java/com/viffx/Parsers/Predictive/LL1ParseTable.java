package com.viffx.Parsers.Predictive;

import com.viffx.Parsers.Grammar.Grammar;
import com.viffx.Parsers.Grammar.Production;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.*;

/**
 * A predictive parse table: for each non-terminal and lookahead terminal, the index of the
 * production to expand. Columns are the grammar's terminals plus the end marker.
 */
public final class LL1ParseTable {
    private final Grammar grammar;
    private final Map<String, Map<String, Integer>> cells;
    private final List<LL1Conflict> conflicts;

    public LL1ParseTable(@NotNull Grammar grammar,
                         @NotNull Map<String, ? extends Map<String, Integer>> cells,
                         @NotNull List<LL1Conflict> conflicts) {
        this.grammar = Objects.requireNonNull(grammar, "grammar cannot be null");
        Map<String, Map<String, Integer>> copy = new LinkedHashMap<>();
        cells.forEach((nonTerminal, row) -> copy.put(nonTerminal, Collections.unmodifiableMap(new LinkedHashMap<>(row))));
        this.cells = Collections.unmodifiableMap(copy);
        this.conflicts = List.copyOf(conflicts);
    }

    public Grammar grammar() {
        return grammar;
    }

    /**
     * @return the index of the production predicted for {@code nonTerminal} on {@code terminal},
     *         or {@code null} if the cell is empty
     */
    @Nullable
    public Integer entry(String nonTerminal, String terminal) {
        Map<String, Integer> row = cells.get(nonTerminal);
        return row == null ? null : row.get(terminal);
    }

    @Nullable
    public Production production(String nonTerminal, String terminal) {
        Integer index = entry(nonTerminal, terminal);
        return index == null ? null : grammar.production(index);
    }

    public Map<String, Integer> row(String nonTerminal) {
        return cells.getOrDefault(nonTerminal, Map.of());
    }

    public Map<String, Map<String, Integer>> cells() {
        return cells;
    }

    public List<LL1Conflict> conflicts() {
        return conflicts;
    }

    public boolean isConflictFree() {
        return conflicts.isEmpty();
    }

    public int filledCells() {
        int count = 0;
        for (Map<String, Integer> row : cells.values()) count += row.size();
        return count;
    }

    public int totalCells() {
        return grammar.nonTerminals().size() * (grammar.terminals().size() + 1);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        LL1ParseTable that = (LL1ParseTable) o;
        return grammar.equals(that.grammar) && cells.equals(that.cells) && conflicts.equals(that.conflicts);
    }

    @Override
    public int hashCode() {
        return Objects.hash(grammar, cells, conflicts);
    }

    @Override
    public String toString() {
        return "LL(1) table{cells=" + filledCells() + "/" + totalCells() + ", conflicts=" + conflicts.size() + '}';
    }
}
