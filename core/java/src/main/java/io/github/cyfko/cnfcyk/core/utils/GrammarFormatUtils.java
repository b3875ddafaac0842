package io.github.cyfko.cnfcyk.core.utils;

import io.github.cyfko.cnfcyk.core.model.Symbol;

import java.util.Collection;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Text helpers shared by grammar dumps, the textual grammar format and parse reports.
 *
 * @since 1.0.0
 */
public final class GrammarFormatUtils {

    /** Printed in place of an empty right-hand side. */
    public static final String EPSILON = "ε";

    /** Separates a left-hand side from its alternatives. */
    public static final String ARROW = "->";

    /** Separates alternatives of the same left-hand side. */
    public static final String ALTERNATIVE_SEPARATOR = "|";

    private GrammarFormatUtils() {}

    public static String formatRightHandSide(List<Symbol> right) {
        if (right.isEmpty()) {
            return EPSILON;
        }
        return right.stream().map(Symbol::name).collect(Collectors.joining(" "));
    }

    public static String formatAlternatives(Collection<List<Symbol>> rights) {
        return rights.stream()
                .map(GrammarFormatUtils::formatRightHandSide)
                .collect(Collectors.joining(" " + ALTERNATIVE_SEPARATOR + " "));
    }

    /**
     * Formats a single rule, for instance {@code "E -> E Y0"} or {@code "S0 -> ε"}.
     *
     * @param left  left-hand side
     * @param right right-hand side
     * @return the rule text
     */
    public static String formatProduction(Symbol left, List<Symbol> right) {
        return left.name() + " " + ARROW + " " + formatRightHandSide(right);
    }

    public static List<String> sortedNames(Collection<Symbol> symbols) {
        return symbols.stream().map(Symbol::name).sorted().collect(Collectors.toList());
    }
}
