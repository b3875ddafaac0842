package io.github.cyfko.cnfcyk.core.model;

import java.util.Objects;

/**
 * Backpointer recorded in a {@link CykChart} cell: the single derivation kept for a
 * non-terminal over a token span.
 *
 * @since 1.0.0
 */
public interface Derivation {

    /**
     * Diagonal derivation {@code A -> token}.
     *
     * @param terminal the terminal matched
     * @param token    the input token at that position
     */
    record Lexical(Symbol terminal, String token) implements Derivation {
        public Lexical {
            Objects.requireNonNull(terminal, "Terminal is required");
            Objects.requireNonNull(token, "Token is required");
        }
    }

    /**
     * Interior derivation {@code A -> left right}, {@code left} spanning {@code [i, split]}
     * and {@code right} spanning {@code [split + 1, j]}.
     *
     * @param left  first non-terminal
     * @param right second non-terminal
     * @param split last token index covered by {@code left}
     */
    record Binary(Symbol left, Symbol right, int split) implements Derivation {
        public Binary {
            Objects.requireNonNull(left, "Left symbol is required");
            Objects.requireNonNull(right, "Right symbol is required");
        }
    }
}
