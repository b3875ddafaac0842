package io.github.cyfko.cnfcyk.core.config;

/**
 * Configuration of the CYK recognizer.
 * <p>
 * The recognizer runs in O(n³ · |N|²) time for a sentence of n tokens, so the only limit
 * is the sentence length.
 * </p>
 *
 * <ul>
 *   <li>Default: 512 tokens</li>
 *   <li>Strict: 128 tokens</li>
 *   <li>Relaxed: 4096 tokens</li>
 * </ul>
 *
 * @param policyName        name of the policy, for diagnostics
 * @param maxSentenceLength maximum number of tokens per parse
 * @since 1.0.0
 */
public record ParserPolicy(String policyName, int maxSentenceLength) {

    public ParserPolicy {
        if (policyName == null || policyName.isBlank()) {
            throw new IllegalArgumentException("Policy name is required");
        }
        if (maxSentenceLength <= 0) {
            throw new IllegalArgumentException("maxSentenceLength must be positive, got: " + maxSentenceLength);
        }
    }

    public static ParserPolicy defaults() {
        return new ParserPolicy(ConversionPolicy.PolicyName.DEFAULT_POLICY.name(), 512);
    }

    public static ParserPolicy strict() {
        return new ParserPolicy(ConversionPolicy.PolicyName.STRICT_POLICY.name(), 128);
    }

    public static ParserPolicy relaxed() {
        return new ParserPolicy(ConversionPolicy.PolicyName.RELAXED_POLICY.name(), 4096);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private String _policyName = ConversionPolicy.PolicyName.CUSTOM_POLICY.name();
        private int _maxSentenceLength = 512;

        private Builder() {}

        public ParserPolicy build() {
            return new ParserPolicy(_policyName, _maxSentenceLength);
        }

        public Builder policyName(String policyName) { this._policyName = policyName; return this; }
        public Builder maxSentenceLength(int max) { this._maxSentenceLength = max; return this; }
    }
}
