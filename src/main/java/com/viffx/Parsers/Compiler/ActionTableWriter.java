package com.viffx.Parsers.Compiler;

import com.viffx.Parsers.Automata.Automaton;
import com.viffx.Parsers.Automata.Item;
import com.viffx.Parsers.Grammar.Grammar;
import com.viffx.Parsers.Grammar.Symbols;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;
import java.util.function.Function;

/**
 * Fills ACTION and GOTO rows from an automaton.
 * <p>
 * The first action written to a cell wins. A later, different action for the same cell is
 * recorded as a {@link Conflict} and discarded; writing the same action again does nothing.
 */
final class ActionTableWriter {
    private static final Logger log = LoggerFactory.getLogger(ActionTableWriter.class);

    private final List<Map<String, Action>> actions = new ArrayList<>();
    private final List<Conflict> conflicts = new ArrayList<>();

    ActionTableWriter(int states) {
        for (int i = 0; i < states; i++) actions.add(new LinkedHashMap<>());
    }

    void write(int state, String symbol, Action action) {
        Map<String, Action> row = actions.get(state);
        Action existing = row.get(symbol);
        if (existing == null) {
            row.put(symbol, action);
            return;
        }
        if (existing.equals(action)) return;

        Conflict conflict = new Conflict(state, symbol, existing, action);
        log.debug("{}", conflict);
        conflicts.add(conflict);
    }

    List<Map<String, Action>> actions() {
        return actions;
    }

    List<Conflict> conflicts() {
        return conflicts;
    }

    /**
     * Builds a table over {@code automaton}, states in ascending order and items in sorted order.
     * <ul>
     *   <li>an item with a terminal after the dot shifts to that terminal's successor;</li>
     *   <li>the complete augmented item accepts on the end marker;</li>
     *   <li>every other complete item reduces on each terminal {@code reduceOn} yields for it.</li>
     * </ul>
     */
    static ParseTable fill(ParserKind kind, Automaton automaton, Function<Item, Collection<String>> reduceOn) {
        Grammar grammar = automaton.grammar();
        ActionTableWriter writer = new ActionTableWriter(automaton.size());
        List<Map<String, Integer>> gotos = new ArrayList<>(automaton.size());

        for (int state = 0; state < automaton.size(); state++) {
            for (Item item : automaton.state(state)) {
                String next = grammar.symbol(item);
                if (next != null) {
                    if (!grammar.isTerminal(next)) continue;
                    Integer target = automaton.transition(state, next);
                    if (target != null) writer.write(state, next, Action.shift(target));
                    continue;
                }

                // the augmented production always sits at index 0
                if (item.index() == 0) {
                    writer.write(state, Symbols.EOF, Action.ACCEPT);
                    continue;
                }
                for (String terminal : reduceOn.apply(item)) {
                    writer.write(state, terminal, Action.reduce(item.index()));
                }
            }

            Map<String, Integer> row = new LinkedHashMap<>();
            automaton.transitions(state).forEach((symbol, target) -> {
                if (grammar.isNonTerminal(symbol)) row.put(symbol, target);
            });
            gotos.add(row);
        }

        ParseTable table = new ParseTable(kind, automaton, writer.actions(), gotos, writer.conflicts());
        log.debug("Built {}", table);
        if (log.isTraceEnabled()) log.trace("{} table:\n{}", kind, table.describe());
        return table;
    }
}
