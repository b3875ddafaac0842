package io.github.cyfko.cnfcyk.core.model;

import io.github.cyfko.cnfcyk.core.utils.ValidationResult;

import java.util.*;

/**
 * Outcome of one conversion run: the untouched original, the converted grammar and the
 * intermediate facts computed on the way.
 *
 * @param original       copy of the grammar handed to the converter
 * @param result         the converted grammar
 * @param nullableSymbols non-terminals found nullable by epsilon elimination
 * @param unitClosure    closed unit pairs found by unit production elimination
 * @since 1.0.0
 */
public record ConversionReport(
        Grammar original,
        Grammar result,
        Set<Symbol> nullableSymbols,
        Map<Symbol, Set<Symbol>> unitClosure
) {

    public ConversionReport {
        Objects.requireNonNull(original, "Original grammar is required");
        Objects.requireNonNull(result, "Result grammar is required");
        nullableSymbols = Collections.unmodifiableSet(new LinkedHashSet<>(nullableSymbols));
        Map<Symbol, Set<Symbol>> closure = new LinkedHashMap<>();
        unitClosure.forEach((left, targets) -> closure.put(left, Collections.unmodifiableSet(new LinkedHashSet<>(targets))));
        unitClosure = Collections.unmodifiableMap(closure);
    }

    public ConversionStats stats() {
        return new ConversionStats(
                original.getNonTerminals().size(),
                result.getNonTerminals().size(),
                original.productionCount(),
                result.productionCount(),
                original.getTerminals().size(),
                result.getTerminals().size(),
                result.isInCnf()
        );
    }

    /**
     * Checks the converted grammar: CNF shape, a start symbol, at least one production, the
     * empty right-hand side on the start symbol only, and no unit production.
     *
     * @return the validation outcome
     */
    public ValidationResult validateConversion() {
        List<String> errors = new ArrayList<>();
        Symbol start = result.getStartSymbol();

        if (!result.isInCnf()) {
            errors.add("The resulting grammar is not in CNF");
        }
        if (start == null) {
            errors.add("No start symbol is defined");
        }
        if (result.productionCount() == 0) {
            errors.add("The resulting grammar has no productions");
        }
        result.getProductions().forEach((left, rights) -> {
            if (!left.equals(start) && rights.stream().anyMatch(List::isEmpty)) {
                errors.add("Empty right-hand side on non-start symbol '" + left.name() + "'");
            }
        });
        if (result.hasUnitProductions()) {
            errors.add("Unit productions remain");
        }
        return ValidationResult.failure(errors);
    }
}
