package io.github.cyfko.cnfcyk.core.model;

/**
 * Size comparison between a grammar and its Chomsky Normal Form.
 *
 * @param originalNonTerminals non-terminal count before conversion
 * @param finalNonTerminals    non-terminal count after conversion
 * @param originalProductions  production count before conversion
 * @param finalProductions     production count after conversion
 * @param originalTerminals    terminal count before conversion
 * @param finalTerminals       terminal count after conversion
 * @param inCnf                whether the result is in CNF
 * @since 1.0.0
 */
public record ConversionStats(
        int originalNonTerminals,
        int finalNonTerminals,
        int originalProductions,
        int finalProductions,
        int originalTerminals,
        int finalTerminals,
        boolean inCnf
) {

    public int nonTerminalsAdded() {
        return finalNonTerminals - originalNonTerminals;
    }

    public int productionsAdded() {
        return finalProductions - originalProductions;
    }
}
