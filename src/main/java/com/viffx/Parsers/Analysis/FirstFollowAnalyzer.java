package com.viffx.Parsers.Analysis;

import com.viffx.Parsers.Grammar.Grammar;
import com.viffx.Parsers.Grammar.Production;
import com.viffx.Parsers.Grammar.Symbols;
import org.jetbrains.annotations.NotNull;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;

/**
 * FIRST and FOLLOW sets of a grammar, computed once by fixed-point iteration.
 * <p>
 * FIRST sets contain {@link Symbols#EPSILON} when the symbol is nullable. Symbols that are not
 * non-terminals of the grammar (terminals, {@link Symbols#EOF}) have themselves as FIRST set.
 */
public final class FirstFollowAnalyzer {
    private static final Logger log = LoggerFactory.getLogger(FirstFollowAnalyzer.class);

    private final Grammar grammar;
    private final Map<String, Set<String>> first = new LinkedHashMap<>();
    private final Map<String, Set<String>> follow = new LinkedHashMap<>();

    public FirstFollowAnalyzer(@NotNull Grammar grammar) {
        this.grammar = Objects.requireNonNull(grammar, "grammar cannot be null");
        calculateFirstSets();
        calculateFollowSets();
        if (log.isDebugEnabled()) {
            log.debug("FIRST sets for {} productions: {}", grammar.size(), first);
            log.debug("FOLLOW sets: {}", follow);
        }
    }

    // ====== QUERIES ====== //

    /**
     * Returns FIRST of a single symbol.
     *
     * @param symbol any grammar symbol or the end marker
     * @return the FIRST set; a singleton of {@code symbol} for anything that is not a non-terminal
     */
    public Set<String> first(String symbol) {
        Set<String> set = first.get(symbol);
        if (set != null) return Collections.unmodifiableSet(set);
        if (grammar.isNonTerminal(symbol)) return Set.of();
        return Set.of(symbol);
    }

    /**
     * Returns FIRST of a symbol sequence.
     * <p>
     * FIRST of each symbol (minus epsilon) is collected until a symbol that is not nullable is
     * reached. Epsilon is included only when every symbol is nullable, which includes the empty
     * sequence.
     *
     * @param sequence the symbols, possibly empty
     * @return the terminals that can begin the sequence, plus epsilon when it is nullable
     */
    public Set<String> first(List<String> sequence) {
        Set<String> result = new LinkedHashSet<>();
        for (String symbol : sequence) {
            Set<String> symbolFirst = first(symbol);
            for (String terminal : symbolFirst) {
                if (!Symbols.EPSILON.equals(terminal)) result.add(terminal);
            }
            if (!symbolFirst.contains(Symbols.EPSILON)) return result;
        }
        result.add(Symbols.EPSILON);
        return result;
    }

    public Set<String> follow(String nonTerminal) {
        Set<String> set = follow.get(nonTerminal);
        return set == null ? Set.of() : Collections.unmodifiableSet(set);
    }

    public boolean isNullable(String symbol) {
        return first(symbol).contains(Symbols.EPSILON);
    }

    public boolean isNullable(List<String> sequence) {
        return first(sequence).contains(Symbols.EPSILON);
    }

    /**
     * @return FIRST of every grammar symbol and the end marker, in grammar symbol order
     */
    public Map<String, Set<String>> firstSets() {
        return copy(first);
    }

    /**
     * @return FOLLOW of every non-terminal, in definition order
     */
    public Map<String, Set<String>> followSets() {
        return copy(follow);
    }

    public Grammar grammar() {
        return grammar;
    }

    // ====== FIXED POINTS ====== //
    private void calculateFirstSets() {
        for (String nonTerminal : grammar.nonTerminals()) first.put(nonTerminal, new LinkedHashSet<>());
        for (String terminal : grammar.terminals()) first.put(terminal, new LinkedHashSet<>(List.of(terminal)));
        first.put(Symbols.EOF, new LinkedHashSet<>(List.of(Symbols.EOF)));

        boolean changed;
        do {
            changed = false;
            for (Production production : grammar.productions()) {
                Set<String> lhsFirst = first.get(production.lhs());

                boolean allNullable = true;
                for (String symbol : production.rhs()) {
                    Set<String> symbolFirst = first.get(symbol);

                    // add everything except EPSILON
                    for (String terminal : symbolFirst) {
                        if (!Symbols.EPSILON.equals(terminal) && lhsFirst.add(terminal)) changed = true;
                    }

                    if (!symbolFirst.contains(Symbols.EPSILON)) {
                        allNullable = false;
                        break;
                    }
                }

                if (allNullable && lhsFirst.add(Symbols.EPSILON)) changed = true;
            }
        } while (changed);
    }

    private void calculateFollowSets() {
        for (String nonTerminal : grammar.nonTerminals()) follow.put(nonTerminal, new LinkedHashSet<>());
        follow.get(grammar.start()).add(Symbols.EOF);

        boolean changed;
        do {
            changed = false;
            for (Production production : grammar.productions()) {
                List<String> rhs = production.rhs();
                for (int i = 0; i < rhs.size(); i++) {
                    String symbol = rhs.get(i);
                    if (!grammar.isNonTerminal(symbol)) continue;

                    Set<String> symbolFollow = follow.get(symbol);
                    Set<String> firstBeta = first(production.beta(i));
                    for (String terminal : firstBeta) {
                        if (!Symbols.EPSILON.equals(terminal) && symbolFollow.add(terminal)) changed = true;
                    }

                    // the suffix can vanish, so whatever follows the lhs follows the symbol
                    if (firstBeta.contains(Symbols.EPSILON)) {
                        changed |= symbolFollow.addAll(follow.get(production.lhs()));
                    }
                }
            }
        } while (changed);
    }

    private static Map<String, Set<String>> copy(Map<String, Set<String>> sets) {
        Map<String, Set<String>> copy = new LinkedHashMap<>();
        sets.forEach((symbol, set) -> copy.put(symbol, Collections.unmodifiableSet(new LinkedHashSet<>(set))));
        return Collections.unmodifiableMap(copy);
    }
}
