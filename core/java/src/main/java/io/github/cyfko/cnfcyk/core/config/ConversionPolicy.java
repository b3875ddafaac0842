package io.github.cyfko.cnfcyk.core.config;

/**
 * Configuration of the Chomsky Normal Form conversion pipeline.
 *
 * <h2>Configurable Limits</h2>
 * <ul>
 *   <li><strong>maxRightHandSideLength</strong>: most nullable occurrences in one right-hand side
 *       that epsilon elimination expands. Its subset enumeration is exponential in that number,
 *       so pathological grammars are rejected up front. Right-hand sides without nullable
 *       symbols are never limited.</li>
 *   <li><strong>failOnInvariantViolation</strong>: whether a converted grammar that is not in
 *       CNF raises an exception (recommended) or only logs a warning.</li>
 * </ul>
 *
 * <h2>Fresh Symbol Prefixes</h2>
 * <ul>
 *   <li><strong>startPrefix</strong>: new start symbol introduced when the old one is nullable (default {@code S})</li>
 *   <li><strong>chainPrefix</strong>: intermediates of binarized long right-hand sides (default {@code Y})</li>
 *   <li><strong>terminalPrefix</strong>: proxies standing for terminals inside long right-hand sides (default {@code T})</li>
 * </ul>
 *
 * <h2>Preset Configurations</h2>
 * <pre>{@code
 * ConversionPolicy policy = ConversionPolicy.defaults();
 * ConversionPolicy policy = ConversionPolicy.strict();
 * ConversionPolicy policy = ConversionPolicy.relaxed();
 *
 * ConversionPolicy policy = ConversionPolicy.builder()
 *     .maxRightHandSideLength(16)
 *     .chainPrefix("X")
 *     .build();
 * }</pre>
 *
 * @param policyName               name of the policy, for diagnostics
 * @param maxRightHandSideLength   maximum nullable occurrences per right-hand side expanded by epsilon elimination
 * @param failOnInvariantViolation whether a non-CNF result is a hard failure
 * @param startPrefix              prefix of a fresh start symbol
 * @param chainPrefix              prefix of binarization intermediates
 * @param terminalPrefix           prefix of terminal proxies
 * @since 1.0.0
 */
public record ConversionPolicy(
        String policyName,
        int maxRightHandSideLength,
        boolean failOnInvariantViolation,
        String startPrefix,
        String chainPrefix,
        String terminalPrefix
) {

    /** Masks over right-hand side positions are held in a {@code long}. */
    public static final int MAX_SUPPORTED_RIGHT_HAND_SIDE_LENGTH = 62;

    /**
     * Canonical constructor with validation.
     *
     * @throws IllegalArgumentException if a limit or a prefix is invalid
     */
    public ConversionPolicy {
        if (policyName == null || policyName.isBlank()) {
            throw new IllegalArgumentException("Policy name is required");
        }
        if (maxRightHandSideLength <= 0 || maxRightHandSideLength > MAX_SUPPORTED_RIGHT_HAND_SIDE_LENGTH) {
            throw new IllegalArgumentException(String.format(
                    "maxRightHandSideLength must be in [1, %d], got: %d",
                    MAX_SUPPORTED_RIGHT_HAND_SIDE_LENGTH, maxRightHandSideLength
            ));
        }
        requirePrefix(startPrefix, "startPrefix");
        requirePrefix(chainPrefix, "chainPrefix");
        requirePrefix(terminalPrefix, "terminalPrefix");
    }

    /**
     * Balanced configuration: right-hand sides up to 32 symbols, non-CNF results fail.
     *
     * @return default configuration
     */
    public static ConversionPolicy defaults() {
        return new ConversionPolicy(PolicyName.DEFAULT_POLICY.name(), 32, true, "S", "Y", "T");
    }

    /**
     * Configuration for grammars coming from untrusted sources: right-hand sides up to
     * 12 symbols.
     *
     * @return strict configuration
     */
    public static ConversionPolicy strict() {
        return new ConversionPolicy(PolicyName.STRICT_POLICY.name(), 12, true, "S", "Y", "T");
    }

    /**
     * Configuration for trusted grammars and diagnostics: right-hand sides up to 62
     * symbols, and a non-CNF result is only logged.
     *
     * @return relaxed configuration
     */
    public static ConversionPolicy relaxed() {
        return new ConversionPolicy(PolicyName.RELAXED_POLICY.name(), MAX_SUPPORTED_RIGHT_HAND_SIDE_LENGTH, false, "S", "Y", "T");
    }

    /**
     * Builder parameters start from the values of {@link #defaults()}.
     *
     * @return the {@link Builder} instance
     */
    public static Builder builder() {
        return new Builder();
    }

    private static void requirePrefix(String prefix, String name) {
        if (prefix == null || prefix.isBlank() || prefix.chars().anyMatch(Character::isWhitespace)) {
            throw new IllegalArgumentException(name + " must be a non-blank token without whitespace");
        }
    }

    public static class Builder {
        private String _policyName = PolicyName.CUSTOM_POLICY.name();
        private int _maxRightHandSideLength = 32;
        private boolean _failOnInvariantViolation = true;
        private String _startPrefix = "S";
        private String _chainPrefix = "Y";
        private String _terminalPrefix = "T";

        private Builder() {}

        public ConversionPolicy build() {
            return new ConversionPolicy(_policyName, _maxRightHandSideLength, _failOnInvariantViolation,
                    _startPrefix, _chainPrefix, _terminalPrefix);
        }

        public Builder policyName(String policyName) { this._policyName = policyName; return this; }
        public Builder maxRightHandSideLength(int max) { this._maxRightHandSideLength = max; return this; }
        public Builder failOnInvariantViolation(boolean fail) { this._failOnInvariantViolation = fail; return this; }
        public Builder startPrefix(String prefix) { this._startPrefix = prefix; return this; }
        public Builder chainPrefix(String prefix) { this._chainPrefix = prefix; return this; }
        public Builder terminalPrefix(String prefix) { this._terminalPrefix = prefix; return this; }
    }

    public enum PolicyName {
        DEFAULT_POLICY,
        STRICT_POLICY,
        RELAXED_POLICY,
        CUSTOM_POLICY
    }
}
