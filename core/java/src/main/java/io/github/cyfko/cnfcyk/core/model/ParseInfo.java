package io.github.cyfko.cnfcyk.core.model;

/**
 * Summary of one parse.
 *
 * @param sentenceLength   number of tokens
 * @param filledEntries    number of (cell, non-terminal) entries in the chart
 * @param grammarSize      number of non-terminals owning productions
 * @param terminalCount    number of terminals of the grammar
 * @param nonTerminalCount number of non-terminals of the grammar
 * @param accepted         whether the sentence was accepted
 * @param startSymbol      start symbol of the grammar
 * @since 1.0.0
 */
public record ParseInfo(
        int sentenceLength,
        int filledEntries,
        int grammarSize,
        int terminalCount,
        int nonTerminalCount,
        boolean accepted,
        Symbol startSymbol
) {
}
