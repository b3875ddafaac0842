package io.github.cyfko.cnfcyk.core.exception;

/**
 * Thrown when a production refers, by name, to a symbol that was never declared as a
 * terminal or as a non-terminal.
 *
 * <pre>{@code
 * Grammar grammar = new Grammar();
 * grammar.declareNonTerminal("S");
 * grammar.addProduction("S", List.of("a"));
 * // → "Symbol 'a' is neither a declared terminal nor a declared non-terminal"
 * }</pre>
 *
 * @since 1.0.0
 */
public class UnclassifiedSymbolException extends CnfCykException {

    private final String symbolName;

    public UnclassifiedSymbolException(String symbolName) {
        super(String.format(
                "Symbol '%s' is neither a declared terminal nor a declared non-terminal",
                symbolName
        ));
        this.symbolName = symbolName;
    }

    /**
     * @return the name that could not be classified
     */
    public String getSymbolName() {
        return symbolName;
    }
}
