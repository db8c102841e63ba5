package com.viffx.Parsers.Automata;

import com.viffx.Parsers.Analysis.FirstFollowAnalyzer;
import com.viffx.Parsers.Grammar.Grammar;
import com.viffx.Parsers.Grammar.Symbols;
import com.viffx.Parsers.Utils.ParserSettings;
import org.jetbrains.annotations.NotNull;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;
import java.util.function.BiFunction;

/**
 * Builds canonical LR(0) and LR(1) collections by breadth-first state discovery.
 */
public final class AutomatonBuilder {
    private static final Logger log = LoggerFactory.getLogger(AutomatonBuilder.class);

    private final ParserSettings settings;

    public AutomatonBuilder() {
        this(ParserSettings.load());
    }

    public AutomatonBuilder(@NotNull ParserSettings settings) {
        this.settings = Objects.requireNonNull(settings, "settings cannot be null");
    }

    /**
     * Builds the LR(0) collection of {@code grammar}. The grammar is augmented first.
     *
     * @throws StateLimitExceededException if the collection outgrows {@link ParserSettings#maxStates()}
     */
    public Automaton lr0(@NotNull Grammar grammar) {
        Grammar augmented = grammar.augment();
        ItemSets itemSets = new ItemSets(augmented);
        SortedSet<Item> start = itemSets.closure0(List.of(new Item(0, 0)));
        return build(augmented, start, itemSets::goto0, false);
    }

    /**
     * Builds the LR(1) collection of {@code grammar}, seeding the start item with the end marker.
     * The grammar is augmented first.
     *
     * @throws StateLimitExceededException if the collection outgrows {@link ParserSettings#maxStates()}
     */
    public Automaton lr1(@NotNull Grammar grammar) {
        Grammar augmented = grammar.augment();
        ItemSets itemSets = new ItemSets(augmented, new FirstFollowAnalyzer(augmented));
        SortedSet<Item> start = itemSets.closure1(List.of(new Item(0, 0, Symbols.EOF)));
        return build(augmented, start, itemSets::goto1, true);
    }

    private Automaton build(Grammar augmented,
                            SortedSet<Item> start,
                            BiFunction<Collection<Item>, String, SortedSet<Item>> gotoFunction,
                            boolean lookaheads) {
        // State machine bookkeeping
        List<SortedSet<Item>> states = new ArrayList<>();
        List<Map<String, Integer>> transitions = new ArrayList<>();
        Map<Set<Item>, Integer> stateToId = new HashMap<>();
        Queue<Integer> queue = new ArrayDeque<>();

        states.add(start);
        transitions.add(new LinkedHashMap<>());
        stateToId.put(start, 0);
        queue.add(0);

        while (!queue.isEmpty()) {
            int fromState = queue.poll();
            SortedSet<Item> state = states.get(fromState);

            // only symbols that some item expects can have a successor
            Set<String> expected = new HashSet<>();
            for (Item item : state) {
                String next = augmented.symbol(item);
                if (next != null) expected.add(next);
            }

            for (String symbol : augmented.symbols()) {
                if (!expected.contains(symbol)) continue;
                SortedSet<Item> target = gotoFunction.apply(state, symbol);
                if (target.isEmpty()) continue;

                Integer toState = stateToId.get(target);
                if (toState == null) {
                    if (states.size() >= settings.maxStates()) {
                        throw new StateLimitExceededException(settings.maxStates(), String.format(
                                "%s collection exceeded %d states for a grammar of %d productions",
                                lookaheads ? "LR(1)" : "LR(0)", settings.maxStates(), augmented.size()));
                    }
                    toState = states.size();
                    states.add(target);
                    transitions.add(new LinkedHashMap<>());
                    stateToId.put(target, toState);
                    queue.add(toState);
                }
                transitions.get(fromState).put(symbol, toState);
            }
        }

        Automaton automaton = new Automaton(augmented, states, transitions, lookaheads);
        log.debug("Built {} collection: {} states, {} transitions",
                lookaheads ? "LR(1)" : "LR(0)", automaton.size(), automaton.transitionCount());
        if (log.isTraceEnabled()) log.trace("\n{}", automaton.describe());
        return automaton;
    }
}
