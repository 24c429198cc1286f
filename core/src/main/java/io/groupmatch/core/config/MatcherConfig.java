package io.groupmatch.core.config;

import java.util.Objects;

/**
 * Matcher settings. Defaults: checks that throw are recorded as mismatch reasons, and suggestions
 * ({@code allow_unwrapped}, {@code flatten_subgroups}, regex quoting) are emitted.
 *
 * @param checkFailurePolicy handling of checks that throw
 * @param suggestions        whether diagnostics include "did you mean" suggestions
 */
public record MatcherConfig(CheckFailurePolicy checkFailurePolicy, boolean suggestions) {

    private static final MatcherConfig DEFAULTS = builder().build();

    public MatcherConfig {
        Objects.requireNonNull(checkFailurePolicy, "checkFailurePolicy must not be null");
    }

    public static MatcherConfig defaults() {
        return DEFAULTS;
    }

    public static Builder builder() {
        return new Builder();
    }

    /** Builder with the documented defaults. */
    public static final class Builder {

        private CheckFailurePolicy checkFailurePolicy = CheckFailurePolicy.RECORD;
        private boolean suggestions = true;

        private Builder() {}

        public Builder checkFailurePolicy(CheckFailurePolicy policy) {
            this.checkFailurePolicy = policy;
            return this;
        }

        public Builder suggestions(boolean enabled) {
            this.suggestions = enabled;
            return this;
        }

        public MatcherConfig build() {
            return new MatcherConfig(checkFailurePolicy, suggestions);
        }
    }
}
