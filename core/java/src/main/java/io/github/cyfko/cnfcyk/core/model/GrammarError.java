package io.github.cyfko.cnfcyk.core.model;

import java.util.Objects;

/**
 * A structural problem found by {@link Grammar#validate()}.
 * <p>
 * Grammar problems are reported as values so that callers can collect and report all of
 * them at once instead of stopping at the first one.
 * </p>
 *
 * @param code    machine readable category
 * @param message human readable description
 * @since 1.0.0
 */
public record GrammarError(Code code, String message) {

    public GrammarError {
        Objects.requireNonNull(code, "Error code is required");
        Objects.requireNonNull(message, "Error message is required");
    }

    public enum Code {
        /** No start symbol was designated. */
        MISSING_START_SYMBOL,
        /** The grammar holds no production at all. */
        NO_PRODUCTIONS,
        /** The start symbol owns no production. */
        START_WITHOUT_PRODUCTIONS,
        /** A non-terminal is referenced in a right-hand side but owns no production. */
        UNDEFINED_NON_TERMINAL,
        /** The same name is used both as a terminal and as a non-terminal. */
        CONFLICTING_SYMBOL_KIND
    }

    @Override
    public String toString() {
        return code + ": " + message;
    }
}
