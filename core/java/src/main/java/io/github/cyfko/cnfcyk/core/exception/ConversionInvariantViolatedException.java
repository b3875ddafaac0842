package io.github.cyfko.cnfcyk.core.exception;

import java.util.List;

/**
 * Thrown when the grammar produced by the normalization pipeline is not in Chomsky Normal
 * Form.
 * <p>
 * The usual cause is a start symbol that generates no terminal string at all: useless
 * symbol elimination then removes every production, and the resulting grammar has a start
 * symbol without productions. The exception lists every violation found.
 * </p>
 *
 * @since 1.0.0
 * @see io.github.cyfko.cnfcyk.core.config.ConversionPolicy#failOnInvariantViolation()
 */
public class ConversionInvariantViolatedException extends CnfCykException {

    private final List<String> violations;

    public ConversionInvariantViolatedException(List<String> violations) {
        super("Converted grammar is not in Chomsky Normal Form: " + String.join("; ", violations));
        this.violations = List.copyOf(violations);
    }

    /**
     * @return the CNF violations, one description per offending rule or condition
     */
    public List<String> getViolations() {
        return violations;
    }
}
