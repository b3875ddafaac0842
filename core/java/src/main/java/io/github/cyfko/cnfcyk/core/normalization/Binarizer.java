package io.github.cyfko.cnfcyk.core.normalization;

import io.github.cyfko.cnfcyk.core.config.ConversionPolicy;
import io.github.cyfko.cnfcyk.core.model.Grammar;
import io.github.cyfko.cnfcyk.core.model.Symbol;

import java.util.*;
import java.util.logging.Logger;

/**
 * Last stage of the CNF pipeline: brings every right-hand side to length two or less.
 * <ol>
 *   <li>Terminal lifting: inside a right-hand side of length two or more, each terminal
 *       {@code a} is replaced by a proxy non-terminal {@code T} with the single rule
 *       {@code T -> a}. One proxy is created per terminal.</li>
 *   <li>Chain rewrite: {@code A -> a1 a2 ... ak} becomes {@code A -> a1 Y1},
 *       {@code Y1 -> a2 Y2}, ..., {@code Y(k-2) -> a(k-1) ak}. Chains are strictly
 *       right-branching and never shared between productions, even when suffixes are
 *       identical.</li>
 * </ol>
 *
 * @since 1.0.0
 */
public final class Binarizer {

    private static final Logger log = Logger.getLogger(Binarizer.class.getName());

    private Binarizer() {}

    /**
     * Runs the stage.
     *
     * @param grammar   source grammar, not modified
     * @param generator fresh name source of the current conversion run
     * @param policy    conversion policy, supplies the name prefixes
     * @return a new grammar whose right-hand sides have at most two symbols
     */
    public static Grammar binarize(Grammar grammar, FreshSymbolGenerator generator, ConversionPolicy policy) {
        Set<Symbol> nonTerminals = new LinkedHashSet<>(grammar.getNonTerminals());
        Map<Symbol, Symbol> proxies = new LinkedHashMap<>();
        Map<Symbol, List<List<Symbol>>> rewritten = new LinkedHashMap<>();
        int chains = 0;

        for (var entry : grammar.getProductions().entrySet()) {
            Symbol left = entry.getKey();
            for (List<Symbol> right : entry.getValue()) {
                List<Symbol> lifted = right.size() >= 2
                        ? liftTerminals(right, proxies, nonTerminals, generator, policy)
                        : right;
                if (lifted.size() <= 2) {
                    append(rewritten, left, lifted);
                } else {
                    chain(left, lifted, rewritten, nonTerminals, generator, policy);
                    chains++;
                }
            }
        }
        proxies.forEach((terminal, proxy) -> append(rewritten, proxy, List.of(terminal)));

        int chainCount = chains;
        log.fine(() -> String.format("Binarization: %d chains, %d terminal proxies", chainCount, proxies.size()));
        return Grammar.of(grammar.getStartSymbol(), grammar.getTerminals(), nonTerminals, rewritten);
    }

    private static List<Symbol> liftTerminals(List<Symbol> right,
                                              Map<Symbol, Symbol> proxies,
                                              Set<Symbol> nonTerminals,
                                              FreshSymbolGenerator generator,
                                              ConversionPolicy policy) {
        List<Symbol> lifted = new ArrayList<>(right.size());
        for (Symbol symbol : right) {
            if (symbol.isTerminal()) {
                Symbol proxy = proxies.computeIfAbsent(symbol, t -> generator.next(policy.terminalPrefix()));
                nonTerminals.add(proxy);
                lifted.add(proxy);
            } else {
                lifted.add(symbol);
            }
        }
        return lifted;
    }

    private static void chain(Symbol left,
                              List<Symbol> right,
                              Map<Symbol, List<List<Symbol>>> rewritten,
                              Set<Symbol> nonTerminals,
                              FreshSymbolGenerator generator,
                              ConversionPolicy policy) {
        Symbol current = left;
        List<Symbol> rest = right;
        while (rest.size() > 2) {
            Symbol intermediate = generator.next(policy.chainPrefix());
            nonTerminals.add(intermediate);
            append(rewritten, current, List.of(rest.get(0), intermediate));
            current = intermediate;
            rest = rest.subList(1, rest.size());
        }
        append(rewritten, current, List.copyOf(rest));
    }

    private static void append(Map<Symbol, List<List<Symbol>>> productions, Symbol left, List<Symbol> right) {
        productions.computeIfAbsent(left, k -> new ArrayList<>()).add(right);
    }
}
