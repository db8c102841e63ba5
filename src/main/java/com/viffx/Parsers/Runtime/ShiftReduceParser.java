package com.viffx.Parsers.Runtime;

import com.viffx.Parsers.Compiler.Action;
import com.viffx.Parsers.Compiler.ParseTable;
import com.viffx.Parsers.Grammar.Production;
import com.viffx.Parsers.Grammar.Symbols;
import com.viffx.Parsers.Utils.ParserSettings;
import org.jetbrains.annotations.NotNull;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;

/**
 * Runs an LR parse table over a whitespace separated token string.
 * <p>
 * Every action appends one {@link ParseStep} recorded before the action takes effect, and a
 * rejected input ends with one error step. A reduction whose GOTO entry is missing therefore
 * leaves two steps: the reduction, then the error. The stack is rendered with states and
 * symbols interleaved, for example {@code 0 E 1 + 6}.
 */
public final class ShiftReduceParser {
    private static final Logger log = LoggerFactory.getLogger(ShiftReduceParser.class);

    private final ParserSettings settings;

    public ShiftReduceParser() {
        this(ParserSettings.load());
    }

    public ShiftReduceParser(@NotNull ParserSettings settings) {
        this.settings = Objects.requireNonNull(settings, "settings cannot be null");
    }

    /**
     * Parses {@code input} with {@code table}. Parse errors never throw; they end the trace with an
     * error step and a rejected result.
     *
     * @param table an SLR, CLR or LALR table
     * @param input tokens separated by whitespace, without the end marker
     * @return the trace, and the parse tree if the input was accepted
     */
    public ParseResult parse(@NotNull ParseTable table, @NotNull String input) {
        Objects.requireNonNull(table, "table cannot be null");
        List<String> tokens = tokenize(input);

        Stack<Integer> states = new Stack<>();
        Stack<String> symbols = new Stack<>();
        Stack<ParseTreeNode> nodes = new Stack<>();
        states.push(0);

        List<ParseStep> steps = new ArrayList<>();
        int marker = misplacedEndMarker(tokens);
        if (marker >= 0) {
            steps.add(ParseStep.error(render(states, symbols), String.join(" ", tokens), endMarkerMessage(marker)));
            return reject(steps);
        }

        int position = 0;
        while (true) {
            int state = states.peek();
            String token = tokens.get(position);
            String stackText = render(states, symbols);
            String inputText = String.join(" ", tokens.subList(position, tokens.size()));

            if (steps.size() >= settings.maxParseSteps()) {
                steps.add(ParseStep.error(stackText, inputText, "step limit of " + settings.maxParseSteps() + " exceeded"));
                return reject(steps);
            }

            Action action = table.action(state, token);
            if (action == null) {
                steps.add(ParseStep.error(stackText, inputText, "no action for state " + state + " on '" + token + "'"));
                return reject(steps);
            }

            switch (action.type()) {
                case SHIFT -> {
                    steps.add(new ParseStep(stackText, inputText, action.toString()));
                    nodes.push(ParseTreeNode.leaf(token));
                    symbols.push(token);
                    states.push(action.data());
                    position++;
                }
                case REDUCE -> {
                    Production production = table.grammar().production(action.data());
                    steps.add(new ParseStep(stackText, inputText, action + ": " + production));

                    LinkedList<ParseTreeNode> children = new LinkedList<>();
                    for (int i = 0; i < production.size(); i++) {
                        children.addFirst(nodes.pop());
                        symbols.pop();
                        states.pop();
                    }
                    if (children.isEmpty()) children.add(ParseTreeNode.epsilon());

                    // Now do GOTO based on the state under the popped handle
                    int exposed = states.peek();
                    Integer next = table.goTo(exposed, production.lhs());
                    if (next == null) {
                        steps.add(ParseStep.error(stackText, inputText,
                                "no goto for state " + exposed + " on '" + production.lhs() + "'"));
                        return reject(steps);
                    }
                    nodes.push(new ParseTreeNode(production.lhs(), children));
                    symbols.push(production.lhs());
                    states.push(next);
                }
                case ACCEPT -> {
                    steps.add(new ParseStep(stackText, inputText, action.toString()));
                    log.debug("Accepted '{}' after {} steps", input, steps.size());
                    return ParseResult.success(steps, nodes.peek());
                }
            }
        }
    }

    /**
     * Splits {@code input} on whitespace and appends the end marker.
     */
    public static List<String> tokenize(@NotNull String input) {
        List<String> tokens = new ArrayList<>();
        String stripped = input.strip();
        if (!stripped.isEmpty()) tokens.addAll(Arrays.asList(stripped.split("\\s+")));
        tokens.add(Symbols.EOF);
        return tokens;
    }

    /**
     * Finds an end marker typed by the caller. Only the marker {@link #tokenize(String)} appends
     * may end a token list; {@code $} is never a grammar terminal.
     *
     * @param tokens a token list ending with the end marker
     * @return the position of the first end marker before the last token, or {@code -1} if there is none
     */
    public static int misplacedEndMarker(@NotNull List<String> tokens) {
        for (int i = 0; i < tokens.size() - 1; i++) {
            if (Symbols.EOF.equals(tokens.get(i))) return i;
        }
        return -1;
    }

    public static String endMarkerMessage(int position) {
        return "end marker '" + Symbols.EOF + "' is not allowed in the input (token " + (position + 1) + ")";
    }

    private static ParseResult reject(List<ParseStep> steps) {
        log.debug("Rejected input: {}", steps.get(steps.size() - 1).action());
        return ParseResult.failure(steps);
    }

    private static String render(List<Integer> states, List<String> symbols) {
        StringBuilder text = new StringBuilder().append(states.get(0));
        for (int i = 0; i < symbols.size(); i++) {
            text.append(' ').append(symbols.get(i)).append(' ').append(states.get(i + 1));
        }
        return text.toString();
    }
}
