package io.github.cyfko.cnfcyk.core.api;

import io.github.cyfko.cnfcyk.core.model.ParseResult;

import java.util.List;

/**
 * Decides whether a grammar derives a token sequence and, when it does, produces a parse
 * tree.
 *
 * @since 1.0.0
 * @see io.github.cyfko.cnfcyk.core.impl.CykParser
 */
public interface Recognizer {

    /**
     * @param tokens the sentence, one terminal name per token
     * @return the recognition outcome
     */
    ParseResult parse(List<String> tokens);

    default boolean accepts(List<String> tokens) {
        return parse(tokens).accepted();
    }

    /**
     * @return {@code true} if the grammar derives the empty sentence
     */
    boolean acceptsEmpty();
}
