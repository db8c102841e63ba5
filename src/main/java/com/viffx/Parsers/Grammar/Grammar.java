package com.viffx.Parsers.Grammar;

import com.viffx.Parsers.Automata.Item;
import org.jetbrains.annotations.Contract;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.*;
import java.util.function.IntConsumer;
import java.util.stream.Collectors;

public final class Grammar {
    // ====== INSTANCE FIELDS ====== //
    // Productions fields
    private final List<Production> productions;
    private final String start;
    private final Map<String, List<Integer>> pointers = new LinkedHashMap<>();

    // Symbols fields
    private final Set<String> nonTerminals;
    private final Set<String> terminals;
    private final List<String> symbols;

    // ====== CONSTRUCTORS ====== //
    public Grammar(@NotNull List<Production> productions, @NotNull String start) {
        Objects.requireNonNull(productions, "productions cannot be null");
        Objects.requireNonNull(start, "start cannot be null");
        this.productions = List.copyOf(productions);
        this.start = start;

        // every left hand side is a non-terminal; record where its productions live
        Set<String> nonTerminals = new LinkedHashSet<>();
        for (int i = 0; i < this.productions.size(); i++) {
            String lhs = this.productions.get(i).lhs();
            nonTerminals.add(lhs);
            pointers.computeIfAbsent(lhs, k -> new ArrayList<>()).add(i);
        }
        pointers.replaceAll((nonTerminal, indices) -> List.copyOf(indices));
        if (!nonTerminals.contains(start)) {
            throw new IllegalArgumentException("start symbol '" + start + "' has no productions");
        }

        // every other right hand side symbol is a terminal
        Set<String> terminals = new LinkedHashSet<>();
        for (Production production : this.productions) {
            for (String symbol : production.rhs()) {
                if (!nonTerminals.contains(symbol)) terminals.add(symbol);
            }
        }

        List<String> symbols = new ArrayList<>(nonTerminals);
        symbols.addAll(terminals);

        this.nonTerminals = Collections.unmodifiableSet(nonTerminals);
        this.terminals = Collections.unmodifiableSet(terminals);
        this.symbols = List.copyOf(symbols);
    }

    /**
     * @param start the start symbol, which must have a production
     * @param productions the productions in order
     * @return a grammar over {@code productions}
     */
    @NotNull
    @Contract("_, _ -> new")
    public static Grammar of(@NotNull String start, @NotNull Production... productions) {
        return new Grammar(List.of(productions), start);
    }

    /**
     * Reads a grammar from its textual form.
     * <p>
     * Each non-blank line that does not start with {@code #} holds one rule:
     * <pre>
     *   E -> E + T | T
     *   T → T * F | F
     *   F -> ( E ) | id | ε
     * </pre>
     * Alternatives are separated by {@code |} and symbols by whitespace. A blank alternative,
     * {@code ε} or the word {@code epsilon} is an empty production. The first left hand side
     * read becomes the start symbol.
     *
     * @param text the grammar source
     * @return the parsed grammar
     * @throws GrammarFormatException if a rule lacks a separator or left hand side, or no rule was found
     */
    @NotNull
    @Contract("_ -> new")
    public static Grammar parse(@NotNull String text) throws GrammarFormatException {
        Objects.requireNonNull(text, "text cannot be null");

        List<Production> productions = new ArrayList<>();
        String start = null;

        String[] lines = text.split("\\R", -1);
        for (int number = 1; number <= lines.length; number++) {
            String line = lines[number - 1].strip();
            if (line.isEmpty() || line.startsWith("#")) continue;

            // split on the first separator glyph
            int arrow = line.indexOf("->");
            int width = 2;
            int glyph = line.indexOf('→');
            if (arrow < 0 || (glyph >= 0 && glyph < arrow)) {
                arrow = glyph;
                width = 1;
            }
            if (arrow < 0) {
                throw new GrammarFormatException(errorContext(number, line) + "missing production separator '->'", number);
            }

            String lhs = line.substring(0, arrow).strip();
            if (lhs.isEmpty()) {
                throw new GrammarFormatException(errorContext(number, line) + "missing left hand side", number);
            }
            if (lhs.split("\\s+").length != 1) {
                throw new GrammarFormatException(errorContext(number, line) + "left hand side must be a single symbol", number);
            }
            if (start == null) start = lhs;

            // parse the alternatives
            for (String alternative : line.substring(arrow + width).split("\\|", -1)) {
                alternative = alternative.strip();
                if (Symbols.isEpsilon(alternative)) {
                    productions.add(new Production(lhs, List.of()));
                    continue;
                }
                productions.add(new Production(lhs, Arrays.asList(alternative.split("\\s+"))));
            }
        }

        if (start == null) throw new GrammarFormatException("No productions found in grammar.");
        return new Grammar(productions, start);
    }

    /**
     * Returns a new grammar with a fresh start symbol {@code S'} and the production {@code S' -> S}
     * placed at index 0, followed by the productions of this grammar.
     * <p>
     * The fresh symbol is the old start symbol with primes appended until it collides with no
     * symbol of this grammar.
     *
     * @return the augmented grammar
     */
    @NotNull
    @Contract(" -> new")
    public Grammar augment() {
        String augmented = start + "'";
        while (nonTerminals.contains(augmented) || terminals.contains(augmented)) {
            augmented += "'";
        }
        List<Production> augmentedProductions = new ArrayList<>(productions.size() + 1);
        augmentedProductions.add(new Production(augmented, List.of(start)));
        augmentedProductions.addAll(productions);
        return new Grammar(augmentedProductions, augmented);
    }

    // ====== PUBLIC API ====== //

    // Items

    /**
     * Returns if the input {@code item} is at or beyond the end of the production it references
     *
     * @param item the grammar item whose dot position is inspected
     * @return if the item's dot is at or beyond the end of the production it references
     * @throws NullPointerException if {@code item} is {@code null}
     */
    public boolean atEnd(@NotNull Item item) {
        Objects.requireNonNull(item, "item cannot be null");
        return productions.get(item.index()).atEnd(item.dot());
    }

    /**
     * Returns the grammar symbol immediately after the dot of the given item.
     *
     * @param item the grammar item whose dot position is inspected
     * @return the symbol after the dot, or {@code null} if the dot is at the end of the production
     * @throws NullPointerException if {@code item} is {@code null}
     */
    @Nullable
    public String symbol(@NotNull Item item) {
        Objects.requireNonNull(item, "item cannot be null");
        Production production = productions.get(item.index());
        if (production.atEnd(item.dot())) return null;
        return production.get(item.dot());
    }

    /**
     * Returns the symbols after the symbol directly after the dot of {@code item}.
     *
     * @param item the grammar item whose dot position is inspected
     * @return the (possibly empty) list of symbols following the symbol after the dot
     * @throws NullPointerException if {@code item} is {@code null}
     */
    public List<String> beta(@NotNull Item item) {
        Objects.requireNonNull(item, "item cannot be null");
        return productions.get(item.index()).beta(item.dot());
    }

    // Productions

    public Production production(int index) {
        return productions.get(index);
    }

    public List<Production> productions() {
        return productions;
    }

    /**
     * Returns the indices of the productions of {@code nonTerminal} in grammar order.
     *
     * @param nonTerminal the left hand side to look up
     * @return the production indices, empty when {@code nonTerminal} has no productions
     */
    public List<Integer> productions(String nonTerminal) {
        return pointers.getOrDefault(nonTerminal, List.of());
    }

    /**
     * Applies the given action to the index of each production of {@code nonTerminal}.
     *
     * @param nonTerminal the non-terminal whose productions to iterate over
     * @param consumer a function to process each production index belonging to that non-terminal
     */
    public void forEachProduction(String nonTerminal, IntConsumer consumer) {
        for (int index : productions(nonTerminal)) {
            consumer.accept(index);
        }
    }

    public int size() {
        return productions.size();
    }

    // Symbols

    public String start() {
        return start;
    }

    public Set<String> nonTerminals() {
        return nonTerminals;
    }

    public Set<String> terminals() {
        return terminals;
    }

    /**
     * @return the non-terminals in order of definition followed by the terminals in order of appearance
     */
    public List<String> symbols() {
        return symbols;
    }

    public boolean isNonTerminal(@Nullable String symbol) {
        return symbol != null && nonTerminals.contains(symbol);
    }

    public boolean isTerminal(@Nullable String symbol) {
        return symbol != null && terminals.contains(symbol);
    }

    // ====== DEBUG ====== //

    /**
     * Returns a string representation of the given grammar {@link Item} in dotted notation:
     * <pre>
     *   E -> E • + T, [$]
     * </pre>
     * The lookahead bracket is omitted for LR(0) items.
     *
     * @param item the grammar item to represent as a string
     * @return a human-readable string showing the production and dot position
     */
    public String toString(@Nullable Item item) {
        if (item == null) return "null";
        Production production = productions.get(item.index());

        StringBuilder builder = new StringBuilder();
        builder.append(production.lhs()).append(" ->");
        for (int i = 0; i < production.size(); i++) {
            if (i == item.dot()) builder.append(" •");
            builder.append(' ').append(production.get(i));
        }
        if (production.atEnd(item.dot())) builder.append(" •");
        if (item.lookahead() != null) builder.append(", [").append(item.lookahead()).append(']');
        return builder.toString();
    }

    public String toString(Collection<Item> state) {
        return state.stream().map(this::toString).collect(Collectors.joining("; ", "{", "}"));
    }

    @Override
    public String toString() {
        StringBuilder builder = new StringBuilder("Grammar(start=").append(start).append(')');
        for (int i = 0; i < productions.size(); i++) {
            builder.append("\n  ").append(i).append(": ").append(productions.get(i));
        }
        return builder.toString();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Grammar that = (Grammar) o;
        return start.equals(that.start) && productions.equals(that.productions);
    }

    @Override
    public int hashCode() {
        return Objects.hash(productions, start);
    }

    // ====== ERROR REPORTING ====== //
    private static String errorContext(int line, String text) {
        return "line " + line + ": '" + text + "': ";
    }
}
