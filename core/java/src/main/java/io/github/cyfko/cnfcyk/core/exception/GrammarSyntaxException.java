package io.github.cyfko.cnfcyk.core.exception;

/**
 * Exception thrown when grammar text cannot be read.
 * <p>
 * Messages carry the 1-based line number of the offending line:
 * </p>
 * <pre>{@code
 * GrammarTextFormat.parse("S -> A ε");
 * // → "Line 1: 'ε' must stand alone in an alternative"
 *
 * GrammarTextFormat.parse("A B -> c");
 * // → "Line 1: left-hand side 'A B' must be a single symbol"
 * }</pre>
 *
 * @since 1.0.0
 * @see io.github.cyfko.cnfcyk.core.parsing.GrammarTextFormat
 */
public class GrammarSyntaxException extends CnfCykException {

    private final int lineNumber;

    public GrammarSyntaxException(int lineNumber, String message) {
        super("Line " + lineNumber + ": " + message);
        this.lineNumber = lineNumber;
    }

    public int getLineNumber() {
        return lineNumber;
    }
}
