package com.viffx.Parsers.Report;

import com.viffx.Parsers.Analysis.FirstFollowAnalyzer;
import com.viffx.Parsers.Compiler.ParseTable;
import com.viffx.Parsers.Compiler.ParserKind;
import com.viffx.Parsers.Grammar.Grammar;
import com.viffx.Parsers.Predictive.LL1ParseTable;
import com.viffx.Parsers.Runtime.ParseResult;
import com.viffx.Parsers.Runtime.ParseStep;
import com.viffx.Parsers.Transform.TransformationResult;
import org.jetbrains.annotations.NotNull;

import java.util.*;

/**
 * Plain text and record views of grammars, tables and parse traces.
 */
public final class ReportGenerator {
    private ReportGenerator() {}

    public static GrammarSummary grammarSummary(@NotNull Grammar grammar) {
        List<String> productions = new ArrayList<>(grammar.size());
        for (int i = 0; i < grammar.size(); i++) productions.add(i + ": " + grammar.production(i));
        return new GrammarSummary(grammar.start(), sorted(grammar.terminals()), sorted(grammar.nonTerminals()), productions);
    }

    public static TransformationReport transformation(@NotNull TransformationResult result) {
        return new TransformationReport(result.descriptions(), result.leftRecursionRemoved(), result.leftFactored(),
                sorted(result.newNonTerminals()), grammarSummary(result.original()), grammarSummary(result.transformed()),
                result.details());
    }

    /**
     * Renders FIRST and FOLLOW of every non-terminal, one line each:
     * <pre>
     *   E    FIRST = {(, id}    FOLLOW = {$, ), +}
     * </pre>
     * Set members are sorted.
     */
    public static String firstFollow(@NotNull FirstFollowAnalyzer analyzer) {
        Grammar grammar = analyzer.grammar();
        int width = 0;
        for (String nonTerminal : grammar.nonTerminals()) width = Math.max(width, nonTerminal.length());

        StringBuilder text = new StringBuilder();
        for (String nonTerminal : grammar.nonTerminals()) {
            text.append(pad(nonTerminal, width))
                    .append("    FIRST = ").append(braces(analyzer.first(nonTerminal)))
                    .append("    FOLLOW = ").append(braces(analyzer.follow(nonTerminal)))
                    .append('\n');
        }
        return text.toString();
    }

    public static ParserSummary summarize(@NotNull ParseTable table) {
        return ParserSummary.of(table);
    }

    public static ParserSummary summarize(@NotNull LL1ParseTable table) {
        return ParserSummary.of(table);
    }

    public static ParseReport parseReport(@NotNull ParseResult result, @NotNull ParserKind kind) {
        List<ParseReport.Row> rows = new ArrayList<>(result.steps().size());
        for (int i = 0; i < result.steps().size(); i++) rows.add(new ParseReport.Row(i + 1, result.steps().get(i)));
        return new ParseReport(kind, result.accepted(), rows);
    }

    /**
     * Renders a parse trace as a table of numbered steps followed by the verdict.
     */
    public static String render(@NotNull ParseResult result) {
        int stackWidth = "Stack".length();
        int inputWidth = "Input".length();
        for (ParseStep step : result.steps()) {
            stackWidth = Math.max(stackWidth, step.stack().length());
            inputWidth = Math.max(inputWidth, step.input().length());
        }

        StringBuilder text = new StringBuilder();
        text.append(String.format("%-4s  %s  %s  %s%n", "Step", pad("Stack", stackWidth), pad("Input", inputWidth), "Action"));
        for (int i = 0; i < result.steps().size(); i++) {
            ParseStep step = result.steps().get(i);
            text.append(String.format("%-4d  %s  %s  %s%n", i + 1, pad(step.stack(), stackWidth), pad(step.input(), inputWidth), step.action()));
        }
        text.append(result.accepted() ? "Result: accepted" : "Result: rejected").append(System.lineSeparator());
        return text.toString();
    }

    private static List<String> sorted(Collection<String> symbols) {
        List<String> sorted = new ArrayList<>(symbols);
        Collections.sort(sorted);
        return sorted;
    }

    private static String braces(Collection<String> symbols) {
        return "{" + String.join(", ", sorted(symbols)) + "}";
    }

    private static String pad(String text, int width) {
        return text + " ".repeat(Math.max(0, width - text.length()));
    }
}
