package com.viffx.Parsers.Compiler;

import com.viffx.Parsers.Automata.Automaton;
import com.viffx.Parsers.Automata.AutomatonBuilder;
import com.viffx.Parsers.Automata.Item;
import com.viffx.Parsers.Grammar.Grammar;
import org.jetbrains.annotations.NotNull;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;

/**
 * LALR(1) tables: the canonical LR(1) collection with every group of states sharing a core merged
 * into one state, then filled like a canonical LR(1) table.
 * <p>
 * Merging can introduce reduce-reduce conflicts the canonical collection does not have.
 */
public class LALR1ParseTableGenerator implements ParseTableGenerator {
    private static final Logger log = LoggerFactory.getLogger(LALR1ParseTableGenerator.class);

    //[INSTANCE_FIELDS]
    private final AutomatonBuilder builder;

    //[CONSTRUCTORS]
    public LALR1ParseTableGenerator() {
        this(new AutomatonBuilder());
    }

    public LALR1ParseTableGenerator(@NotNull AutomatonBuilder builder) {
        this.builder = Objects.requireNonNull(builder, "builder cannot be null");
    }

    //[PUBLIC_METHODS]
    @NotNull
    @Override
    public ParseTable build(@NotNull Grammar grammar) {
        Automaton canonical = builder.lr1(grammar);
        Automaton merged = merge(canonical);
        log.debug("Merged {} LR(1) states into {} LALR(1) states", canonical.size(), merged.size());
        return ActionTableWriter.fill(kind(), merged, item -> List.of(item.lookahead()));
    }

    @Override
    public ParserKind kind() {
        return ParserKind.LALR1;
    }

    /**
     * Merges the states of an LR(1) collection that have the same core.
     * <p>
     * Merged states are numbered in order of the first state of each core, so state 0 stays the
     * start state. The items of a merged state are the union of its members' items, and each
     * transition of a member is redirected to the merged state of its target.
     *
     * @param canonical an LR(1) collection
     * @return the merged collection over the same grammar
     */
    public static Automaton merge(@NotNull Automaton canonical) {
        Map<Set<Item>, Integer> coreToId = new HashMap<>();
        List<Set<Item>> states = new ArrayList<>();
        int[] mergedId = new int[canonical.size()];

        for (int i = 0; i < canonical.size(); i++) {
            SortedSet<Item> state = canonical.state(i);
            Set<Item> core = core(state);
            Integer id = coreToId.get(core);
            if (id == null) {
                id = states.size();
                coreToId.put(core, id);
                states.add(new TreeSet<>());
            }
            states.get(id).addAll(state);
            mergedId[i] = id;
        }

        List<Map<String, Integer>> transitions = new ArrayList<>(states.size());
        for (int i = 0; i < states.size(); i++) transitions.add(new LinkedHashMap<>());
        for (int i = 0; i < canonical.size(); i++) {
            Map<String, Integer> row = transitions.get(mergedId[i]);
            canonical.transitions(i).forEach((symbol, target) -> row.put(symbol, mergedId[target]));
        }

        return new Automaton(canonical.grammar(), states, transitions, canonical.hasLookaheads());
    }

    //[HELPER_METHODS]
    private static Set<Item> core(Collection<Item> state) {
        Set<Item> core = new TreeSet<>();
        for (Item item : state) core.add(item.core());
        return core;
    }
}
