package com.viffx.Parsers.Transform;

import com.viffx.Parsers.Grammar.Grammar;
import com.viffx.Parsers.Grammar.Production;
import org.jetbrains.annotations.NotNull;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;

/**
 * Rewrites a grammar for predictive parsing: left recursion elimination and left factoring.
 * <p>
 * A transformer records every rewrite it performs, so an instance is meant for one grammar and
 * one thread. {@link #transformForLL1()} starts a fresh record each time it runs.
 */
public final class GrammarTransformer {
    private static final Logger log = LoggerFactory.getLogger(GrammarTransformer.class);

    // ====== INSTANCE FIELDS ====== //
    private final Grammar grammar;

    // Rewrite record
    private final List<String> descriptions = new ArrayList<>();
    private final Map<String, String> details = new LinkedHashMap<>();
    private final Set<String> newNonTerminals = new LinkedHashSet<>();
    private boolean leftRecursionRemoved;
    private boolean leftFactored;

    // ====== CONSTRUCTORS ====== //
    public GrammarTransformer(@NotNull Grammar grammar) {
        this.grammar = Objects.requireNonNull(grammar, "grammar cannot be null");
    }

    // ====== PUBLIC API ====== //

    /**
     * Removes immediate left recursion from the productions of {@code nonTerminal}.
     * <pre>
     *   A -> A α1 | ... | A αm | β1 | ... | βn
     * </pre>
     * becomes
     * <pre>
     *   A  -> β1 A' | ... | βn A'
     *   A' -> α1 A' | ... | αm A' | ε
     * </pre>
     * If every production is left recursive, {@code A -> ε} is used as the only base. A cyclic
     * production {@code A -> A} derives nothing new and is dropped.
     *
     * @param nonTerminal the left hand side
     * @param productions the productions of {@code nonTerminal}
     * @return the rewritten productions, or {@code productions} unchanged if none is left recursive
     */
    public List<Production> eliminateDirectLeftRecursion(@NotNull String nonTerminal, @NotNull List<Production> productions) {
        List<Production> recursive = new ArrayList<>();
        List<Production> base = new ArrayList<>();
        for (Production production : productions) {
            if (!production.isEmpty() && production.get(0).equals(nonTerminal)) recursive.add(production);
            else base.add(production);
        }
        if (recursive.isEmpty()) return productions;

        if (base.isEmpty()) base.add(new Production(nonTerminal, List.of()));
        String fresh = freshNonTerminal(nonTerminal);

        List<Production> rewritten = new ArrayList<>();
        for (Production production : base) {
            List<String> rhs = new ArrayList<>(production.rhs());
            rhs.add(fresh);
            rewritten.add(new Production(nonTerminal, rhs));
        }
        for (Production production : recursive) {
            List<String> alpha = new ArrayList<>(production.rhs().subList(1, production.size()));
            if (alpha.isEmpty()) continue;
            alpha.add(fresh);
            rewritten.add(new Production(fresh, alpha));
        }
        rewritten.add(new Production(fresh, List.of()));

        leftRecursionRemoved = true;
        record(nonTerminal, "Eliminated direct left recursion in " + nonTerminal + ", created " + fresh);
        return rewritten;
    }

    /**
     * Removes left recursion through chains of non-terminals.
     * <p>
     * Non-terminals are processed in alphabetical order. Each production {@code Ai -> Aj γ} with
     * {@code Aj} earlier in that order is replaced by {@code Ai -> δ γ} for every production
     * {@code Aj -> δ}, then immediate left recursion of {@code Ai} is removed. The order only
     * depends on the names, so some grammars whose cycles run against it keep a left recursive
     * chain.
     *
     * @return a grammar with the same start symbol and no left recursion reachable through the order
     */
    public Grammar eliminateIndirectLeftRecursion() {
        List<String> order = new ArrayList<>(grammar.nonTerminals());
        Collections.sort(order);

        // productions of each non-terminal, keyed in definition order
        Map<String, List<Production>> own = new LinkedHashMap<>();
        for (String nonTerminal : grammar.nonTerminals()) {
            List<Production> productions = new ArrayList<>();
            grammar.forEachProduction(nonTerminal, index -> productions.add(grammar.production(index)));
            own.put(nonTerminal, productions);
        }
        Map<String, List<Production>> introduced = new HashMap<>();

        for (int i = 0; i < order.size(); i++) {
            String ai = order.get(i);
            List<Production> current = own.get(ai);

            for (int j = 0; j < i; j++) {
                String aj = order.get(j);
                List<Production> remaining = new ArrayList<>();
                List<Production> substituted = new ArrayList<>();
                for (Production production : current) {
                    if (production.isEmpty() || !production.get(0).equals(aj)) {
                        remaining.add(production);
                        continue;
                    }
                    List<String> gamma = production.rhs().subList(1, production.size());
                    for (Production delta : own.get(aj)) {
                        List<String> rhs = new ArrayList<>(delta.rhs());
                        rhs.addAll(gamma);
                        substituted.add(new Production(ai, rhs));
                    }
                }
                if (substituted.isEmpty()) continue;
                remaining.addAll(substituted);
                current = remaining;
                record(ai, "Substituted " + aj + " in " + ai + " productions");
            }

            List<Production> rewritten = eliminateDirectLeftRecursion(ai, current);
            List<Production> kept = new ArrayList<>();
            List<Production> fresh = new ArrayList<>();
            for (Production production : rewritten) {
                (production.lhs().equals(ai) ? kept : fresh).add(production);
            }
            own.put(ai, kept);
            introduced.put(ai, fresh);
        }

        List<Production> productions = new ArrayList<>();
        own.forEach((nonTerminal, kept) -> {
            productions.addAll(kept);
            productions.addAll(introduced.getOrDefault(nonTerminal, List.of()));
        });
        return new Grammar(productions, grammar.start());
    }

    /**
     * Left factors the productions of {@code nonTerminal} on their first symbol.
     * <pre>
     *   A -> x β1 | ... | x βn | γ
     * </pre>
     * becomes
     * <pre>
     *   A  -> x A' | γ
     *   A' -> β1 | ... | βn
     * </pre>
     * The new non-terminal is factored the same way, until no two productions of one
     * non-terminal start with the same symbol. A factored production keeps the position of the
     * first production of its group; the productions of new non-terminals follow.
     *
     * @param nonTerminal the left hand side
     * @param productions the productions of {@code nonTerminal}
     * @return the factored productions, or {@code productions} unchanged if no two share a first symbol
     */
    public List<Production> applyLeftFactoring(@NotNull String nonTerminal, @NotNull List<Production> productions) {
        Map<String, List<Production>> groups = new LinkedHashMap<>();
        for (Production production : productions) {
            if (production.isEmpty()) continue;
            groups.computeIfAbsent(production.get(0), k -> new ArrayList<>()).add(production);
        }
        groups.values().removeIf(group -> group.size() < 2);
        if (groups.isEmpty()) return productions;

        List<Production> factored = new ArrayList<>();
        List<Production> suffixes = new ArrayList<>();
        Set<String> emitted = new HashSet<>();
        for (Production production : productions) {
            String first = production.isEmpty() ? null : production.get(0);
            List<Production> group = first == null ? null : groups.get(first);
            if (group == null) {
                factored.add(production);
                continue;
            }
            if (!emitted.add(first)) continue;

            String fresh = freshNonTerminal(nonTerminal);
            factored.add(new Production(nonTerminal, List.of(first, fresh)));
            List<Production> suffix = new ArrayList<>();
            for (Production member : group) {
                suffix.add(new Production(fresh, member.rhs().subList(1, member.size())));
            }
            leftFactored = true;
            record(nonTerminal, "Left factored " + nonTerminal + " with prefix '" + first + "', created " + fresh);
            suffixes.addAll(applyLeftFactoring(fresh, suffix));
        }
        factored.addAll(suffixes);
        return factored;
    }

    /**
     * Eliminates left recursion over the whole grammar, then left factors every non-terminal.
     *
     * @return the transformed grammar together with a record of each rewrite
     */
    public TransformationResult transformForLL1() {
        descriptions.clear();
        details.clear();
        newNonTerminals.clear();
        leftRecursionRemoved = false;
        leftFactored = false;

        Grammar withoutRecursion = eliminateIndirectLeftRecursion();

        List<Production> productions = new ArrayList<>();
        for (String nonTerminal : withoutRecursion.nonTerminals()) {
            List<Production> own = new ArrayList<>();
            withoutRecursion.forEachProduction(nonTerminal, index -> own.add(withoutRecursion.production(index)));
            productions.addAll(applyLeftFactoring(nonTerminal, own));
        }
        Grammar transformed = new Grammar(productions, grammar.start());

        log.debug("Transformed grammar for LL(1) with {} rewrites, new non-terminals {}", descriptions.size(), newNonTerminals);
        return new TransformationResult(grammar, transformed, descriptions, leftRecursionRemoved, leftFactored,
                newNonTerminals, details);
    }

    public Grammar grammar() {
        return grammar;
    }

    // ====== CHECKS ====== //

    /**
     * @return the non-terminals with a production whose right hand side starts with themselves
     */
    public static Set<String> directlyLeftRecursive(@NotNull Grammar grammar) {
        Set<String> recursive = new LinkedHashSet<>();
        for (Production production : grammar.productions()) {
            if (!production.isEmpty() && production.get(0).equals(production.lhs())) recursive.add(production.lhs());
        }
        return recursive;
    }

    /**
     * @return for each non-terminal with two productions starting with the same symbol, those symbols
     */
    public static Map<String, Set<String>> commonFirstSymbols(@NotNull Grammar grammar) {
        Map<String, Set<String>> common = new LinkedHashMap<>();
        for (String nonTerminal : grammar.nonTerminals()) {
            Set<String> seen = new HashSet<>();
            for (int index : grammar.productions(nonTerminal)) {
                Production production = grammar.production(index);
                if (production.isEmpty()) continue;
                if (!seen.add(production.get(0))) {
                    common.computeIfAbsent(nonTerminal, k -> new LinkedHashSet<>()).add(production.get(0));
                }
            }
        }
        return common;
    }

    // ====== HELPERS ====== //
    private String freshNonTerminal(String base) {
        String fresh = base + "'";
        while (grammar.nonTerminals().contains(fresh) || grammar.terminals().contains(fresh) || newNonTerminals.contains(fresh)) {
            fresh += "'";
        }
        newNonTerminals.add(fresh);
        return fresh;
    }

    private void record(String nonTerminal, String description) {
        log.debug(description);
        descriptions.add(description);
        details.merge(nonTerminal, description, (previous, next) -> previous + "; " + next);
    }
}
