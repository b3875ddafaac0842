package io.github.cyfko.cnfcyk.core.normalization;

import io.github.cyfko.cnfcyk.core.config.ConversionPolicy;
import io.github.cyfko.cnfcyk.core.exception.GrammarComplexityException;
import io.github.cyfko.cnfcyk.core.model.Grammar;
import io.github.cyfko.cnfcyk.core.model.Symbol;
import io.github.cyfko.cnfcyk.core.utils.GrammarFormatUtils;

import java.util.*;
import java.util.logging.Logger;

/**
 * First stage of the CNF pipeline: removes empty right-hand sides.
 * <ol>
 *   <li>The nullable set is computed as a fixpoint: a non-terminal is nullable if it owns an
 *       empty right-hand side or a right-hand side made only of nullable symbols.</li>
 *   <li>Every non-empty right-hand side is expanded into all its variants that keep each
 *       non-nullable symbol and freely keep or drop each nullable one. The empty variant is
 *       discarded and duplicates are removed.</li>
 *   <li>If the start symbol is nullable, the empty string must survive on the start symbol
 *       only. When the start symbol appears on no right-hand side it simply keeps
 *       {@code S -> ε}. Otherwise a fresh start symbol {@code S'} is introduced with
 *       {@code S' -> S | ε}.</li>
 * </ol>
 *
 * <pre>{@code
 * S -> A B | a S      A -> a | ε      B -> b | ε
 * // becomes
 * S0 -> S | ε   S -> A B | B | A | a S | a   A -> a   B -> b
 * }</pre>
 * <p>
 * Keeping the start symbol when it is not referenced leaves a grammar already in CNF
 * untouched.
 * </p>
 *
 * @since 1.0.0
 */
public final class EpsilonEliminator {

    private static final Logger log = Logger.getLogger(EpsilonEliminator.class.getName());

    private EpsilonEliminator() {}

    /**
     * Computes the non-terminals from which the empty string is derivable.
     *
     * @param grammar source grammar, not modified
     * @return the nullable non-terminals, in discovery order
     */
    public static Set<Symbol> nullableSymbols(Grammar grammar) {
        Map<Symbol, List<List<Symbol>>> productions = grammar.getProductions();
        Set<Symbol> nullable = new LinkedHashSet<>();

        productions.forEach((left, rights) -> {
            if (rights.stream().anyMatch(List::isEmpty)) {
                nullable.add(left);
            }
        });

        boolean changed = true;
        while (changed) {
            changed = false;
            for (var entry : productions.entrySet()) {
                if (nullable.contains(entry.getKey())) continue;
                for (List<Symbol> right : entry.getValue()) {
                    if (!right.isEmpty() && nullable.containsAll(right)) {
                        nullable.add(entry.getKey());
                        changed = true;
                        break;
                    }
                }
            }
        }
        return nullable;
    }

    /**
     * Expands a right-hand side into its variants without some nullable symbols.
     * <p>
     * The first variant is the right-hand side itself; the empty variant is never returned.
     * </p>
     *
     * @param right                  non-empty right-hand side
     * @param nullable               nullable non-terminals
     * @param maxRightHandSideLength most nullable occurrences expanded in one right-hand side
     * @return distinct non-empty variants
     * @throws GrammarComplexityException if the right-hand side holds more nullable occurrences than allowed
     */
    public static List<List<Symbol>> expandNullable(List<Symbol> right, Set<Symbol> nullable, int maxRightHandSideLength) {
        int[] optional = new int[right.size()];
        int optionalCount = 0;
        for (int i = 0; i < right.size(); i++) {
            if (nullable.contains(right.get(i))) {
                optional[optionalCount++] = i;
            }
        }
        if (optionalCount == 0) {
            return List.of(List.copyOf(right));
        }
        if (optionalCount > maxRightHandSideLength) {
            throw new GrammarComplexityException(String.format(
                    "Too many nullable symbols for epsilon elimination (%d nullable occurrences, max: %d): %s",
                    optionalCount, maxRightHandSideLength, GrammarFormatUtils.formatRightHandSide(right)
            ));
        }

        Set<List<Symbol>> variants = new LinkedHashSet<>();
        // bit b of the mask keeps the b-th nullable occurrence
        for (long mask = (1L << optionalCount) - 1; mask >= 0; mask--) {
            List<Symbol> variant = new ArrayList<>(right.size());
            int b = 0;
            for (int i = 0; i < right.size(); i++) {
                if (b < optionalCount && optional[b] == i) {
                    if ((mask >>> b & 1L) != 0) {
                        variant.add(right.get(i));
                    }
                    b++;
                } else {
                    variant.add(right.get(i));
                }
            }
            if (!variant.isEmpty()) {
                variants.add(List.copyOf(variant));
            }
        }
        return new ArrayList<>(variants);
    }

    /**
     * Runs the stage.
     *
     * @param grammar   source grammar, not modified
     * @param generator fresh name source of the current conversion run
     * @param policy    conversion policy
     * @return a new grammar without empty right-hand sides outside the start symbol
     */
    public static Grammar eliminate(Grammar grammar, FreshSymbolGenerator generator, ConversionPolicy policy) {
        Set<Symbol> nullable = nullableSymbols(grammar);
        log.fine(() -> "Nullable symbols: " + GrammarFormatUtils.sortedNames(nullable));

        Symbol start = grammar.getStartSymbol();
        boolean startNullable = start != null && nullable.contains(start);
        boolean startKeepsEmpty = startNullable && !appearsOnRightHandSide(grammar, start);

        Map<Symbol, List<List<Symbol>>> rewritten = new LinkedHashMap<>();
        grammar.getProductions().forEach((left, rights) -> {
            Set<List<Symbol>> kept = new LinkedHashSet<>();
            for (List<Symbol> right : rights) {
                if (!right.isEmpty()) {
                    kept.addAll(expandNullable(right, nullable, policy.maxRightHandSideLength()));
                } else if (startKeepsEmpty && left.equals(start)) {
                    kept.add(right);
                }
            }
            if (!kept.isEmpty()) {
                rewritten.put(left, new ArrayList<>(kept));
            }
        });

        Set<Symbol> nonTerminals = new LinkedHashSet<>(grammar.getNonTerminals());
        if (!startNullable) {
            return Grammar.of(start, grammar.getTerminals(), nonTerminals, rewritten);
        }

        if (startKeepsEmpty) {
            List<List<Symbol>> startRights = rewritten.computeIfAbsent(start, k -> new ArrayList<>());
            if (!startRights.contains(List.<Symbol>of())) {
                startRights.add(List.of());
            }
            log.fine(() -> String.format("Start symbol '%s' is nullable and keeps its empty right-hand side",
                    start.name()));
            return Grammar.of(start, grammar.getTerminals(), nonTerminals, rewritten);
        }

        Symbol newStart = generator.next(policy.startPrefix());
        nonTerminals.add(newStart);

        Map<Symbol, List<List<Symbol>>> withNewStart = new LinkedHashMap<>();
        withNewStart.put(newStart, List.of(List.of(start), List.of()));
        withNewStart.putAll(rewritten);

        log.fine(() -> String.format("Start symbol '%s' is nullable, new start symbol is '%s'",
                start.name(), newStart.name()));
        return Grammar.of(newStart, grammar.getTerminals(), nonTerminals, withNewStart);
    }

    private static boolean appearsOnRightHandSide(Grammar grammar, Symbol symbol) {
        for (List<List<Symbol>> rights : grammar.getProductions().values()) {
            for (List<Symbol> right : rights) {
                if (right.contains(symbol)) {
                    return true;
                }
            }
        }
        return false;
    }
}
