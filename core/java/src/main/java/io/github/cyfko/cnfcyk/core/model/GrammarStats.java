package io.github.cyfko.cnfcyk.core.model;

/**
 * Size summary of a {@link Grammar}.
 *
 * @param nonTerminalCount            number of registered non-terminals
 * @param terminalCount               number of registered terminals
 * @param productionCount             number of right-hand sides over all left-hand sides
 * @param nonTerminalsWithProductions number of non-terminals owning at least one production
 * @param startSymbol                 the start symbol, or {@code null} when none is set
 * @param inCnf                       whether the grammar is in Chomsky Normal Form
 * @since 1.0.0
 */
public record GrammarStats(
        int nonTerminalCount,
        int terminalCount,
        int productionCount,
        int nonTerminalsWithProductions,
        Symbol startSymbol,
        boolean inCnf
) {
}
