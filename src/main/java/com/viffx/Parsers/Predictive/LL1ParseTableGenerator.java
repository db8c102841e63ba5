package com.viffx.Parsers.Predictive;

import com.viffx.Parsers.Analysis.FirstFollowAnalyzer;
import com.viffx.Parsers.Grammar.Grammar;
import com.viffx.Parsers.Grammar.Production;
import com.viffx.Parsers.Grammar.Symbols;
import org.jetbrains.annotations.NotNull;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;

/**
 * Builds LL(1) tables from FIRST+ sets. The grammar is used as given; left recursive or
 * unfactored grammars simply produce conflicts.
 */
public class LL1ParseTableGenerator {
    private static final Logger log = LoggerFactory.getLogger(LL1ParseTableGenerator.class);

    /**
     * Fills cell {@code (A, t)} with production {@code A -> α} for every terminal {@code t} in
     * FIRST+(A -> α). When a cell is already taken by another production, the first one stays
     * and the collision is recorded.
     */
    @NotNull
    public LL1ParseTable build(@NotNull Grammar grammar) {
        FirstFollowAnalyzer analyzer = new FirstFollowAnalyzer(grammar);
        Map<String, Map<String, Integer>> cells = new LinkedHashMap<>();
        List<LL1Conflict> conflicts = new ArrayList<>();
        for (String nonTerminal : grammar.nonTerminals()) cells.put(nonTerminal, new LinkedHashMap<>());

        for (int index = 0; index < grammar.size(); index++) {
            Production production = grammar.production(index);
            Map<String, Integer> row = cells.get(production.lhs());
            for (String terminal : firstPlus(analyzer, production)) {
                Integer existing = row.putIfAbsent(terminal, index);
                if (existing == null || existing == index) continue;

                LL1Conflict conflict = new LL1Conflict(production.lhs(), terminal, grammar.production(existing), production);
                log.debug("{}", conflict);
                conflicts.add(conflict);
            }
        }

        LL1ParseTable table = new LL1ParseTable(grammar, cells, conflicts);
        log.debug("Built {}", table);
        return table;
    }

    /**
     * FIRST+ of a production: FOLLOW(A) for an empty right hand side, otherwise FIRST(α) without
     * epsilon, together with FOLLOW(A) when α is nullable.
     */
    public static Set<String> firstPlus(@NotNull FirstFollowAnalyzer analyzer, @NotNull Production production) {
        if (production.isEmpty()) return new LinkedHashSet<>(analyzer.follow(production.lhs()));

        Set<String> first = new LinkedHashSet<>(analyzer.first(production.rhs()));
        if (first.remove(Symbols.EPSILON)) first.addAll(analyzer.follow(production.lhs()));
        return first;
    }
}
