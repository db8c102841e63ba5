package com.viffx.Parsers.Report;

import com.viffx.Parsers.Automata.StateLimitExceededException;
import com.viffx.Parsers.Compiler.ParseTable;
import com.viffx.Parsers.Compiler.ParseTableGenerators;
import com.viffx.Parsers.Compiler.ParserKind;
import com.viffx.Parsers.Grammar.Grammar;
import com.viffx.Parsers.Predictive.LL1ParseTable;
import com.viffx.Parsers.Predictive.LL1ParseTableGenerator;
import com.viffx.Parsers.Transform.GrammarTransformer;
import com.viffx.Parsers.Transform.TransformationResult;
import com.viffx.Parsers.Utils.ParserSettings;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;

/**
 * Builds every kind of parse table for one grammar and recommends the simplest parser whose
 * table has no conflicts. Preference runs LL(1), SLR(1), LALR(1), CLR(1).
 */
public final class ParserComparator {
    private static final Logger log = LoggerFactory.getLogger(ParserComparator.class);

    private static final Map<ParserKind, String> RECOMMENDATIONS = new EnumMap<>(ParserKind.class);
    static {
        RECOMMENDATIONS.put(ParserKind.LL1, "Use LL(1) predictive parser. Grammar is suitable for top-down parsing (simplest and most efficient).");
        RECOMMENDATIONS.put(ParserKind.SLR1, "Use SLR(1) parser. Grammar works with Simple LR parsing (good balance of power and efficiency).");
        RECOMMENDATIONS.put(ParserKind.LALR1, "Use LALR(1) parser. Grammar requires LALR parsing (standard choice, used by YACC/Bison).");
        RECOMMENDATIONS.put(ParserKind.CLR1, "Use CLR(1) parser. Grammar needs canonical LR parsing (most powerful but more states).");
    }
    static final String NO_PARSER = "Grammar is not suitable for any tested parser. "
            + "Consider rewriting the grammar to eliminate ambiguity and conflicts.";

    private final ParserSettings settings;

    public ParserComparator() {
        this(ParserSettings.load());
    }

    public ParserComparator(@NotNull ParserSettings settings) {
        this.settings = Objects.requireNonNull(settings, "settings cannot be null");
    }

    /**
     * Builds the LL(1) table, from the LL(1) rewrite of {@code grammar} when {@code transformForLL1}
     * is set, and the three LR tables from {@code grammar} itself. An LR table that outgrows the
     * state limit is reported as failed; the other kinds are still compared.
     */
    public ComparisonReport compare(@NotNull Grammar grammar, boolean transformForLL1) {
        Objects.requireNonNull(grammar, "grammar cannot be null");
        Map<ParserKind, ParserSummary> summaries = new EnumMap<>(ParserKind.class);
        Map<ParserKind, ConflictReport> reports = new EnumMap<>(ParserKind.class);
        Map<ParserKind, ParseTable> tables = new EnumMap<>(ParserKind.class);

        TransformationResult transformation = null;
        Grammar ll1Grammar = grammar;
        if (transformForLL1) {
            transformation = new GrammarTransformer(grammar).transformForLL1();
            ll1Grammar = transformation.transformed();
        }
        LL1ParseTable ll1Table = new LL1ParseTableGenerator().build(ll1Grammar);
        summaries.put(ParserKind.LL1, ParserSummary.of(ll1Table));
        reports.put(ParserKind.LL1, ConflictDetector.analyze(ll1Table));

        for (ParserKind kind : ParserKind.values()) {
            if (!kind.isLR()) continue;
            try {
                ParseTable table = ParseTableGenerators.forKind(kind, settings).build(grammar);
                tables.put(kind, table);
                summaries.put(kind, ParserSummary.of(table));
                reports.put(kind, ConflictDetector.analyze(table));
            } catch (StateLimitExceededException e) {
                log.warn("Could not build {} table: {}", kind, e.getMessage());
                summaries.put(kind, ParserSummary.failed(kind, e.getMessage()));
            }
        }

        List<ParserKind> conflictFree = new ArrayList<>();
        for (ParserKind kind : ParserKind.values()) {
            if (summaries.get(kind).conflictFree()) conflictFree.add(kind);
        }
        ParserKind best = conflictFree.isEmpty() ? null : conflictFree.get(0);
        String recommendation = recommend(best, conflictFree);
        log.debug("Conflict-free parsers: {}, best: {}", conflictFree, best);

        return new ComparisonReport(grammar, transformation, summaries, reports, tables, ll1Table,
                conflictFree, best, recommendation);
    }

    static String recommend(@Nullable ParserKind best, List<ParserKind> conflictFree) {
        if (best == null) return NO_PARSER;

        StringBuilder recommendation = new StringBuilder(RECOMMENDATIONS.get(best));
        StringJoiner others = new StringJoiner(", ", " (Also works: ", ")");
        others.setEmptyValue("");
        for (ParserKind kind : conflictFree) {
            if (kind != best) others.add(kind.displayName());
        }
        return recommendation.append(others).toString();
    }
}
