package io.github.cyfko.cnfcyk.core.normalization;

import io.github.cyfko.cnfcyk.core.model.Grammar;
import io.github.cyfko.cnfcyk.core.model.Symbol;
import io.github.cyfko.cnfcyk.core.utils.GrammarFormatUtils;

import java.util.*;
import java.util.logging.Logger;

/**
 * Third stage of the CNF pipeline: removes symbols that can never take part in a
 * derivation of a terminal string from the start symbol.
 * <p>
 * Non-generating symbols are removed <em>before</em> unreachable ones. The reverse order can
 * keep a symbol that was only reachable through a non-generating one.
 * </p>
 * <ol>
 *   <li>Generating symbols: every terminal, then every non-terminal owning a right-hand side
 *       made only of generating symbols, up to a fixpoint. Productions mentioning a
 *       non-generating symbol are dropped, then non-generating left-hand sides.</li>
 *   <li>Reachable symbols: the start symbol and every symbol appearing in a production of
 *       a reachable non-terminal. Unreachable left-hand sides are dropped.</li>
 *   <li>The non-terminal set becomes exactly the surviving left-hand sides.</li>
 * </ol>
 *
 * @since 1.0.0
 */
public final class UselessSymbolEliminator {

    private static final Logger log = Logger.getLogger(UselessSymbolEliminator.class.getName());

    private UselessSymbolEliminator() {}

    /**
     * @param grammar source grammar, not modified
     * @return the terminals plus every non-terminal that derives some terminal string
     */
    public static Set<Symbol> generatingSymbols(Grammar grammar) {
        Map<Symbol, List<List<Symbol>>> productions = grammar.getProductions();
        Set<Symbol> generating = new LinkedHashSet<>(grammar.getTerminals());

        boolean changed = true;
        while (changed) {
            changed = false;
            for (var entry : productions.entrySet()) {
                if (generating.contains(entry.getKey())) continue;
                for (List<Symbol> right : entry.getValue()) {
                    if (generating.containsAll(right)) {
                        generating.add(entry.getKey());
                        changed = true;
                        break;
                    }
                }
            }
        }
        return generating;
    }

    /**
     * @param grammar source grammar, not modified
     * @return every symbol reachable from the start symbol, the start symbol included;
     * empty when no start symbol is set
     */
    public static Set<Symbol> reachableSymbols(Grammar grammar) {
        Symbol start = grammar.getStartSymbol();
        if (start == null) {
            return Set.of();
        }

        Set<Symbol> reachable = new LinkedHashSet<>();
        Deque<Symbol> pending = new ArrayDeque<>();
        reachable.add(start);
        pending.push(start);
        while (!pending.isEmpty()) {
            for (List<Symbol> right : grammar.getProductions(pending.pop())) {
                for (Symbol symbol : right) {
                    if (reachable.add(symbol) && symbol.isNonTerminal()) {
                        pending.push(symbol);
                    }
                }
            }
        }
        return reachable;
    }

    /**
     * Runs the stage.
     *
     * @param grammar source grammar, not modified
     * @return a new grammar holding only generating, reachable non-terminals
     */
    public static Grammar eliminate(Grammar grammar) {
        Set<Symbol> generating = generatingSymbols(grammar);

        Map<Symbol, List<List<Symbol>>> generatingOnly = new LinkedHashMap<>();
        grammar.getProductions().forEach((left, rights) -> {
            if (!generating.contains(left)) return;
            List<List<Symbol>> kept = new ArrayList<>();
            for (List<Symbol> right : rights) {
                if (generating.containsAll(right)) {
                    kept.add(right);
                }
            }
            generatingOnly.put(left, kept);
        });

        Grammar intermediate = Grammar.of(grammar.getStartSymbol(), grammar.getTerminals(),
                generatingOnly.keySet(), generatingOnly);
        Set<Symbol> reachable = reachableSymbols(intermediate);

        Map<Symbol, List<List<Symbol>>> useful = new LinkedHashMap<>();
        generatingOnly.forEach((left, rights) -> {
            if (reachable.contains(left)) {
                useful.put(left, rights);
            }
        });

        log.fine(() -> {
            Set<Symbol> removed = new TreeSet<>(grammar.getNonTerminals());
            removed.removeAll(useful.keySet());
            return "Useless symbols removed: " + GrammarFormatUtils.sortedNames(removed);
        });
        return Grammar.of(grammar.getStartSymbol(), grammar.getTerminals(), useful.keySet(), useful);
    }
}
