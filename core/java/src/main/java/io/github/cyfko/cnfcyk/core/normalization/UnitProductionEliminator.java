package io.github.cyfko.cnfcyk.core.normalization;

import io.github.cyfko.cnfcyk.core.model.Grammar;
import io.github.cyfko.cnfcyk.core.model.Symbol;

import java.util.*;
import java.util.logging.Logger;

/**
 * Second stage of the CNF pipeline: removes unit productions {@code A -> B}.
 * <p>
 * The unit pairs {@code (A, B)} are closed transitively; each non-terminal then receives its
 * own non-unit right-hand sides plus the non-unit right-hand sides of every {@code B} it
 * reaches through unit pairs. Unit right-hand sides are dropped. Cycles such as
 * {@code A -> B, B -> A} and self pairs terminate because the closure only grows.
 * </p>
 *
 * @since 1.0.0
 */
public final class UnitProductionEliminator {

    private static final Logger log = Logger.getLogger(UnitProductionEliminator.class.getName());

    private UnitProductionEliminator() {}

    /**
     * Computes the transitive closure of the unit pairs.
     *
     * @param grammar source grammar, not modified
     * @return for each non-terminal {@code A}, every {@code B} such that {@code A =>+ B}
     * through unit productions only
     */
    public static Map<Symbol, Set<Symbol>> unitClosure(Grammar grammar) {
        Map<Symbol, Set<Symbol>> closure = new LinkedHashMap<>();
        grammar.getProductions().forEach((left, rights) -> {
            for (List<Symbol> right : rights) {
                if (Grammar.isUnit(right)) {
                    closure.computeIfAbsent(left, k -> new LinkedHashSet<>()).add(right.get(0));
                }
            }
        });

        boolean changed = true;
        while (changed) {
            changed = false;
            for (Set<Symbol> targets : closure.values()) {
                for (Symbol middle : List.copyOf(targets)) {
                    Set<Symbol> next = closure.get(middle);
                    if (next == null) continue;
                    for (Symbol target : List.copyOf(next)) {
                        changed |= targets.add(target);
                    }
                }
            }
        }
        return closure;
    }

    /**
     * Runs the stage.
     *
     * @param grammar source grammar, not modified
     * @return a new grammar without unit productions
     */
    public static Grammar eliminate(Grammar grammar) {
        Map<Symbol, List<List<Symbol>>> productions = grammar.getProductions();
        Map<Symbol, Set<Symbol>> closure = unitClosure(grammar);
        log.fine(() -> "Unit pairs after closure: " + closure);

        Map<Symbol, List<List<Symbol>>> rewritten = new LinkedHashMap<>();
        productions.forEach((left, rights) -> {
            Set<List<Symbol>> kept = new LinkedHashSet<>();
            addNonUnit(rights, kept);
            for (Symbol target : closure.getOrDefault(left, Set.of())) {
                addNonUnit(productions.getOrDefault(target, List.of()), kept);
            }
            if (!kept.isEmpty()) {
                rewritten.put(left, new ArrayList<>(kept));
            }
        });

        return Grammar.of(grammar.getStartSymbol(), grammar.getTerminals(), grammar.getNonTerminals(), rewritten);
    }

    private static void addNonUnit(List<List<Symbol>> rights, Set<List<Symbol>> into) {
        for (List<Symbol> right : rights) {
            if (!Grammar.isUnit(right)) {
                into.add(right);
            }
        }
    }
}
