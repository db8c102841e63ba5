package com.viffx.Parsers.Compiler;

import com.viffx.Parsers.Automata.Automaton;
import com.viffx.Parsers.Grammar.Grammar;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.*;

/**
 * ACTION and GOTO tables of an LR parser together with the automaton they were read from.
 * <p>
 * Reduce actions refer to productions of the augmented grammar returned by {@link #grammar()}.
 * A table with conflicts is still complete: each contested cell holds the first action written
 * to it.
 */
public final class ParseTable {
    // ====== INSTANCE FIELDS ====== //
    private final ParserKind kind;
    private final Automaton automaton;
    private final List<Map<String, Action>> actions;
    private final List<Map<String, Integer>> gotos;
    private final List<Conflict> conflicts;

    // ====== CONSTRUCTORS ====== //
    public ParseTable(@NotNull ParserKind kind,
                      @NotNull Automaton automaton,
                      @NotNull List<? extends Map<String, Action>> actions,
                      @NotNull List<? extends Map<String, Integer>> gotos,
                      @NotNull List<Conflict> conflicts) {
        this.kind = Objects.requireNonNull(kind, "kind cannot be null");
        this.automaton = Objects.requireNonNull(automaton, "automaton cannot be null");
        if (actions.size() != automaton.size() || gotos.size() != automaton.size()) {
            throw new IllegalArgumentException("expected one ACTION and one GOTO row per state");
        }
        List<Map<String, Action>> actionRows = new ArrayList<>(actions.size());
        for (Map<String, Action> row : actions) actionRows.add(Collections.unmodifiableMap(new LinkedHashMap<>(row)));
        List<Map<String, Integer>> gotoRows = new ArrayList<>(gotos.size());
        for (Map<String, Integer> row : gotos) gotoRows.add(Collections.unmodifiableMap(new LinkedHashMap<>(row)));
        this.actions = Collections.unmodifiableList(actionRows);
        this.gotos = Collections.unmodifiableList(gotoRows);
        this.conflicts = List.copyOf(conflicts);
    }

    // ====== PUBLIC API ====== //
    public ParserKind kind() {
        return kind;
    }

    public Automaton automaton() {
        return automaton;
    }

    /**
     * @return the augmented grammar the table was built from
     */
    public Grammar grammar() {
        return automaton.grammar();
    }

    public int stateCount() {
        return automaton.size();
    }

    /**
     * @return the action for {@code terminal} in {@code state}, or {@code null} if the cell is empty
     */
    @Nullable
    public Action action(int state, String terminal) {
        return actions.get(state).get(terminal);
    }

    /**
     * @return the successor of {@code state} after reducing to {@code nonTerminal}, or {@code null}
     */
    @Nullable
    public Integer goTo(int state, String nonTerminal) {
        return gotos.get(state).get(nonTerminal);
    }

    public Map<String, Action> actions(int state) {
        return actions.get(state);
    }

    public Map<String, Integer> gotos(int state) {
        return gotos.get(state);
    }

    public List<Map<String, Action>> actionTable() {
        return actions;
    }

    public List<Map<String, Integer>> gotoTable() {
        return gotos;
    }

    public List<Conflict> conflicts() {
        return conflicts;
    }

    public boolean isConflictFree() {
        return conflicts.isEmpty();
    }

    public int actionEntryCount() {
        int count = 0;
        for (Map<String, Action> row : actions) count += row.size();
        return count;
    }

    public int gotoEntryCount() {
        int count = 0;
        for (Map<String, Integer> row : gotos) count += row.size();
        return count;
    }

    // ====== DEBUG ====== //

    /**
     * Renders one line per state listing its ACTION and GOTO entries.
     */
    public String describe() {
        StringBuilder text = new StringBuilder();
        for (int i = 0; i < actions.size(); i++) {
            text.append(i).append(' ');
            StringJoiner row = new StringJoiner(", ", "[", "]");
            actions.get(i).forEach((symbol, action) -> row.add('"' + symbol + "\" ==> " + action));
            gotos.get(i).forEach((symbol, state) -> row.add('"' + symbol + "\" ==> goto " + state));
            text.append(row).append('\n');
        }
        return text.toString();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        ParseTable that = (ParseTable) o;
        return kind == that.kind
                && automaton.equals(that.automaton)
                && actions.equals(that.actions)
                && gotos.equals(that.gotos)
                && conflicts.equals(that.conflicts);
    }

    @Override
    public int hashCode() {
        return Objects.hash(kind, automaton, actions, gotos, conflicts);
    }

    @Override
    public String toString() {
        return kind + " table{states=" + stateCount() + ", actions=" + actionEntryCount()
                + ", gotos=" + gotoEntryCount() + ", conflicts=" + conflicts.size() + '}';
    }
}
