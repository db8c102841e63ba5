package com.viffx.Parsers.Automata;

import com.viffx.Parsers.Grammar.Grammar;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.*;

/**
 * A canonical collection of LR states over an augmented grammar.
 * <p>
 * State {@code 0} is the closure of the augmented start item. {@code transitions(s)} maps each
 * symbol with a successor of state {@code s} to that successor's id.
 */
public final class Automaton {
    private final Grammar grammar;
    private final List<SortedSet<Item>> states;
    private final List<Map<String, Integer>> transitions;
    private final boolean lookaheads;

    /**
     * @param grammar the augmented grammar, its production 0 being {@code S' -> S}
     * @param states the states by id
     * @param transitions the outgoing transitions of each state, indexed like {@code states}
     * @param lookaheads whether the items carry LR(1) lookaheads
     */
    public Automaton(@NotNull Grammar grammar,
                     @NotNull List<? extends Collection<Item>> states,
                     @NotNull List<? extends Map<String, Integer>> transitions,
                     boolean lookaheads) {
        Objects.requireNonNull(grammar, "grammar cannot be null");
        if (states.size() != transitions.size()) {
            throw new IllegalArgumentException("expected " + states.size() + " transition rows, got " + transitions.size());
        }
        this.grammar = grammar;
        List<SortedSet<Item>> frozenStates = new ArrayList<>(states.size());
        for (Collection<Item> state : states) frozenStates.add(ItemSets.freeze(state));
        List<Map<String, Integer>> frozenTransitions = new ArrayList<>(transitions.size());
        for (Map<String, Integer> row : transitions) {
            frozenTransitions.add(Collections.unmodifiableMap(new LinkedHashMap<>(row)));
        }
        this.states = Collections.unmodifiableList(frozenStates);
        this.transitions = Collections.unmodifiableList(frozenTransitions);
        this.lookaheads = lookaheads;
    }

    public Grammar grammar() {
        return grammar;
    }

    public List<SortedSet<Item>> states() {
        return states;
    }

    public SortedSet<Item> state(int id) {
        return states.get(id);
    }

    public int size() {
        return states.size();
    }

    public Map<String, Integer> transitions(int state) {
        return transitions.get(state);
    }

    /**
     * @return the successor of {@code state} on {@code symbol}, or {@code null} if there is none
     */
    @Nullable
    public Integer transition(int state, String symbol) {
        return transitions.get(state).get(symbol);
    }

    public int transitionCount() {
        int count = 0;
        for (Map<String, Integer> row : transitions) count += row.size();
        return count;
    }

    public boolean hasLookaheads() {
        return lookaheads;
    }

    /**
     * Renders every state with its items and outgoing transitions, one line per entry.
     */
    public String describe() {
        StringBuilder text = new StringBuilder();
        for (int i = 0; i < states.size(); i++) {
            text.append("State ").append(i).append(":\n");
            for (Item item : states.get(i)) {
                text.append("\t").append(grammar.toString(item)).append('\n');
            }
            transitions.get(i).forEach((symbol, target) ->
                    text.append("\ton ").append(symbol).append(" goto ").append(target).append('\n'));
        }
        return text.toString();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Automaton that = (Automaton) o;
        return lookaheads == that.lookaheads
                && grammar.equals(that.grammar)
                && states.equals(that.states)
                && transitions.equals(that.transitions);
    }

    @Override
    public int hashCode() {
        return Objects.hash(grammar, states, transitions, lookaheads);
    }

    @Override
    public String toString() {
        return "Automaton{states=" + states.size() + ", transitions=" + transitionCount() + ", lr1=" + lookaheads + '}';
    }
}
