package io.arithma.core.config;

/**
 * Tunables of the math engine. Use {@link #builder()} to construct instances; every field has a
 * default.
 *
 * @param maxUnrollTerms largest summation the simplifier expands into an explicit sum
 * @param inlineBoundVariables whether the simplifier replaces variables bound in the environment by
 *     their values
 * @param integrationConstant suffix appended to rendered indefinite integrals
 * @param summationMaxTerms largest number of terms the evaluator adds up for one summation
 */
public record EngineConfig(
        int maxUnrollTerms, boolean inlineBoundVariables, String integrationConstant, long summationMaxTerms) {

    public static final int DEFAULT_MAX_UNROLL_TERMS = 10;
    public static final String DEFAULT_INTEGRATION_CONSTANT = " + C";
    public static final long DEFAULT_SUMMATION_MAX_TERMS = 1_000_000L;

    /** Configuration with every field at its default. */
    public static final EngineConfig DEFAULT = builder().build();

    public EngineConfig {
        if (maxUnrollTerms < 0) {
            throw new IllegalArgumentException("maxUnrollTerms must not be negative, got: " + maxUnrollTerms);
        }
        if (summationMaxTerms <= 0) {
            throw new IllegalArgumentException("summationMaxTerms must be positive, got: " + summationMaxTerms);
        }
        if (integrationConstant == null) {
            integrationConstant = "";
        }
    }

    /** Creates a new builder with the defaults. */
    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private int maxUnrollTerms = DEFAULT_MAX_UNROLL_TERMS;
        private boolean inlineBoundVariables = false;
        private String integrationConstant = DEFAULT_INTEGRATION_CONSTANT;
        private long summationMaxTerms = DEFAULT_SUMMATION_MAX_TERMS;

        private Builder() {}

        public Builder maxUnrollTerms(int maxUnrollTerms) {
            this.maxUnrollTerms = maxUnrollTerms;
            return this;
        }

        public Builder inlineBoundVariables(boolean inlineBoundVariables) {
            this.inlineBoundVariables = inlineBoundVariables;
            return this;
        }

        public Builder integrationConstant(String integrationConstant) {
            this.integrationConstant = integrationConstant;
            return this;
        }

        public Builder summationMaxTerms(long summationMaxTerms) {
            this.summationMaxTerms = summationMaxTerms;
            return this;
        }

        public EngineConfig build() {
            return new EngineConfig(maxUnrollTerms, inlineBoundVariables, integrationConstant, summationMaxTerms);
        }
    }
}
