package io.github.cyfko.cnfcyk.core.model;

/**
 * Classification of a grammar {@link Symbol}.
 * <p>
 * Every symbol carries exactly one kind, assigned when the symbol is created.
 * The kind is never derived from the spelling of the symbol name.
 * </p>
 *
 * @since 1.0.0
 */
public enum SymbolKind {
    TERMINAL,
    NON_TERMINAL
}
