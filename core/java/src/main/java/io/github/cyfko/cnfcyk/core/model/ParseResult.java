package io.github.cyfko.cnfcyk.core.model;

import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Outcome of one recognition call.
 *
 * @param accepted      whether the grammar derives the sentence
 * @param elapsed       time spent parsing, informational only
 * @param tree          the parse tree, empty when rejected
 * @param unknownTokens tokens that are not terminals of the grammar, in input order
 * @param chart         the filled recognition table
 * @param info          summary of the parse
 * @since 1.0.0
 */
public record ParseResult(
        boolean accepted,
        Duration elapsed,
        Optional<ParseTree> tree,
        List<String> unknownTokens,
        CykChart chart,
        ParseInfo info
) {

    public ParseResult {
        Objects.requireNonNull(elapsed, "Elapsed time is required");
        Objects.requireNonNull(chart, "Chart is required");
        Objects.requireNonNull(info, "Parse info is required");
        Objects.requireNonNull(tree, "Tree is required, empty when rejected");
        unknownTokens = List.copyOf(unknownTokens);
        if (accepted != tree.isPresent()) {
            throw new IllegalArgumentException("An accepted sentence has a parse tree, a rejected one has none");
        }
    }
}
