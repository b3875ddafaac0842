package io.github.cyfko.cnfcyk.core.normalization;

import io.github.cyfko.cnfcyk.core.model.Grammar;
import io.github.cyfko.cnfcyk.core.model.Symbol;

import java.util.HashSet;
import java.util.Set;

/**
 * Issues non-terminal names that are unique within one conversion run.
 * <p>
 * Names are built from a prefix and a monotonically increasing counter shared by all
 * prefixes ({@code S0}, {@code Y1}, {@code Y2}, ...). A candidate whose name is already
 * used by any symbol of the grammar, or was issued before, is skipped. One generator is
 * created per run and threaded explicitly through the stages that need it.
 * </p>
 *
 * @since 1.0.0
 */
public final class FreshSymbolGenerator {

    private final Set<String> takenNames;
    private int counter;

    public FreshSymbolGenerator(Grammar grammar) {
        this.takenNames = new HashSet<>(grammar.symbolNames());
    }

    /**
     * @param prefix name prefix
     * @return a non-terminal whose name is not in use
     */
    public Symbol next(String prefix) {
        while (true) {
            String candidate = prefix + counter++;
            if (takenNames.add(candidate)) {
                return Symbol.nonTerminal(candidate);
            }
        }
    }

    /**
     * @return the next counter value, i.e. the number of candidates examined so far
     */
    public int counter() {
        return counter;
    }
}
