package io.github.cyfko.cnfcyk.core.exception;

import java.util.List;

/**
 * Thrown when a recognizer is constructed over a grammar that is not in Chomsky Normal
 * Form. This is a caller contract violation: the CYK algorithm is only defined over CNF
 * rules and never attempts best-effort matching over other rule shapes.
 *
 * @since 1.0.0
 */
public class GrammarNotInCnfException extends CnfCykException {

    private final List<String> violations;

    public GrammarNotInCnfException(List<String> violations) {
        super("Recognizer requires a grammar in Chomsky Normal Form: " + String.join("; ", violations));
        this.violations = List.copyOf(violations);
    }

    public List<String> getViolations() {
        return violations;
    }
}
