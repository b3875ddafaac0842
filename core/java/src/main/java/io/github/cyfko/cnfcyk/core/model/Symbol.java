package io.github.cyfko.cnfcyk.core.model;

import java.util.Comparator;
import java.util.Objects;

/**
 * A grammar symbol: an opaque name tagged with an explicit {@link SymbolKind}.
 * <p>
 * Two symbols are equal when both their name and their kind are equal, so a terminal
 * {@code "a"} and a non-terminal {@code "a"} are distinct symbols. Symbols are ordered by
 * name first and kind second; every deterministic iteration in the library relies on
 * this ordering.
 * </p>
 *
 * <pre>{@code
 * Symbol expr = Symbol.nonTerminal("E");
 * Symbol plus = Symbol.terminal("+");
 * }</pre>
 *
 * @param name symbol name, never blank
 * @param kind symbol classification
 * @since 1.0.0
 */
public record Symbol(String name, SymbolKind kind) implements Comparable<Symbol> {

    private static final Comparator<Symbol> ORDER = Comparator
            .comparing(Symbol::name)
            .thenComparing(Symbol::kind);

    /**
     * Canonical constructor with validation.
     */
    public Symbol {
        Objects.requireNonNull(name, "Symbol name is required");
        Objects.requireNonNull(kind, "Symbol kind is required");
        if (name.isBlank()) {
            throw new IllegalArgumentException("Symbol name cannot be blank");
        }
    }

    public static Symbol terminal(String name) {
        return new Symbol(name, SymbolKind.TERMINAL);
    }

    public static Symbol nonTerminal(String name) {
        return new Symbol(name, SymbolKind.NON_TERMINAL);
    }

    public boolean isTerminal() {
        return kind == SymbolKind.TERMINAL;
    }

    public boolean isNonTerminal() {
        return kind == SymbolKind.NON_TERMINAL;
    }

    @Override
    public int compareTo(Symbol other) {
        return ORDER.compare(this, other);
    }

    @Override
    public String toString() {
        return name;
    }
}
