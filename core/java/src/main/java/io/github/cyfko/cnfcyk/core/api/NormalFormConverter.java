package io.github.cyfko.cnfcyk.core.api;

import io.github.cyfko.cnfcyk.core.model.ConversionReport;
import io.github.cyfko.cnfcyk.core.model.Grammar;

/**
 * Transforms a context-free grammar into an equivalent grammar in Chomsky Normal Form.
 * <p>
 * Implementations never modify the grammar they receive.
 * </p>
 *
 * @since 1.0.0
 * @see io.github.cyfko.cnfcyk.core.impl.CnfConverter
 */
public interface NormalFormConverter {

    /**
     * @param grammar source grammar with a start symbol
     * @return a new grammar in Chomsky Normal Form
     */
    default Grammar toCnf(Grammar grammar) {
        return convert(grammar).result();
    }

    /**
     * Same as {@link #toCnf(Grammar)}, keeping the intermediate facts of the run.
     *
     * @param grammar source grammar with a start symbol
     * @return the conversion report
     */
    ConversionReport convert(Grammar grammar);
}
