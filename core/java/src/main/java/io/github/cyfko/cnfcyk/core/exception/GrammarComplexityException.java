package io.github.cyfko.cnfcyk.core.exception;

/**
 * Thrown when an input exceeds a limit configured by a policy: the length of a
 * right-hand side handed to epsilon elimination, or the length of a sentence handed to
 * the recognizer.
 *
 * @since 1.0.0
 * @see io.github.cyfko.cnfcyk.core.config.ConversionPolicy
 * @see io.github.cyfko.cnfcyk.core.config.ParserPolicy
 */
public class GrammarComplexityException extends CnfCykException {

    public GrammarComplexityException(String message) {
        super(message);
    }
}
