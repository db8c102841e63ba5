package com.viffx.Parsers.Predictive;

import com.viffx.Parsers.Grammar.Grammar;
import com.viffx.Parsers.Grammar.Production;
import com.viffx.Parsers.Grammar.Symbols;
import com.viffx.Parsers.Runtime.ParseResult;
import com.viffx.Parsers.Runtime.ParseStep;
import com.viffx.Parsers.Runtime.ParseTreeNode;
import com.viffx.Parsers.Runtime.ShiftReduceParser;
import com.viffx.Parsers.Utils.ParserSettings;
import org.jetbrains.annotations.NotNull;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;

/**
 * Table driven top-down parser. The stack starts as {@code $ S}; a terminal on top is matched
 * against the input, a non-terminal is replaced by the right hand side its table cell predicts.
 * <p>
 * Tables with conflicts are refused. On acceptance the parse tree is rebuilt from the leftmost
 * derivation the parse produced.
 */
public final class PredictiveParser {
    private static final Logger log = LoggerFactory.getLogger(PredictiveParser.class);

    private final ParserSettings settings;

    public PredictiveParser() {
        this(ParserSettings.load());
    }

    public PredictiveParser(@NotNull ParserSettings settings) {
        this.settings = Objects.requireNonNull(settings, "settings cannot be null");
    }

    public ParseResult parse(@NotNull LL1ParseTable table, @NotNull String input) {
        Objects.requireNonNull(table, "table cannot be null");
        Grammar grammar = table.grammar();
        List<String> tokens = ShiftReduceParser.tokenize(input);

        Stack<String> stack = new Stack<>();
        stack.push(Symbols.EOF);
        stack.push(grammar.start());

        List<ParseStep> steps = new ArrayList<>();
        if (!table.isConflictFree()) {
            steps.add(ParseStep.error(String.join(" ", stack), String.join(" ", tokens),
                    "grammar is not LL(1), table has " + table.conflicts().size() + " conflicts"));
            return ParseResult.failure(steps);
        }

        int marker = ShiftReduceParser.misplacedEndMarker(tokens);
        if (marker >= 0) {
            steps.add(ParseStep.error(String.join(" ", stack), String.join(" ", tokens),
                    ShiftReduceParser.endMarkerMessage(marker)));
            return ParseResult.failure(steps);
        }

        List<Integer> derivation = new ArrayList<>();
        int position = 0;
        while (true) {
            String top = stack.peek();
            String token = tokens.get(position);
            String stackText = String.join(" ", stack);
            String inputText = String.join(" ", tokens.subList(position, tokens.size()));

            if (steps.size() >= settings.maxParseSteps()) {
                steps.add(ParseStep.error(stackText, inputText, "step limit of " + settings.maxParseSteps() + " exceeded"));
                return ParseResult.failure(steps);
            }

            if (top.equals(Symbols.EOF)) {
                if (!token.equals(Symbols.EOF)) {
                    steps.add(ParseStep.error(stackText, inputText, "unexpected input '" + token + "'"));
                    return ParseResult.failure(steps);
                }
                steps.add(new ParseStep(stackText, inputText, "accept"));
                log.debug("Accepted '{}' after {} steps", input, steps.size());
                return ParseResult.success(steps, tree(grammar, derivation));
            }

            if (!grammar.isNonTerminal(top)) {
                if (!top.equals(token)) {
                    steps.add(ParseStep.error(stackText, inputText, "expected '" + top + "', got '" + token + "'"));
                    return ParseResult.failure(steps);
                }
                steps.add(new ParseStep(stackText, inputText, "match '" + top + "'"));
                stack.pop();
                position++;
                continue;
            }

            Integer index = table.entry(top, token);
            if (index == null) {
                steps.add(ParseStep.error(stackText, inputText, "no table entry for (" + top + ", " + token + ")"));
                return ParseResult.failure(steps);
            }
            Production production = grammar.production(index);
            steps.add(new ParseStep(stackText, inputText, "output " + production));
            derivation.add(index);
            stack.pop();
            for (int i = production.size() - 1; i >= 0; i--) stack.push(production.get(i));
        }
    }

    /**
     * Rebuilds the tree of a leftmost derivation: productions are consumed in order, each one
     * expanding the leftmost unexpanded non-terminal.
     */
    static ParseTreeNode tree(Grammar grammar, List<Integer> derivation) {
        return expand(grammar, grammar.start(), derivation.iterator());
    }

    private static ParseTreeNode expand(Grammar grammar, String symbol, Iterator<Integer> derivation) {
        if (!grammar.isNonTerminal(symbol)) return ParseTreeNode.leaf(symbol);

        Production production = grammar.production(derivation.next());
        List<ParseTreeNode> children = new ArrayList<>();
        for (String child : production.rhs()) children.add(expand(grammar, child, derivation));
        if (children.isEmpty()) children.add(ParseTreeNode.epsilon());
        return new ParseTreeNode(production.lhs(), children);
    }
}
