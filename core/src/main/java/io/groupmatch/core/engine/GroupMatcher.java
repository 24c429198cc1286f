package io.groupmatch.core.engine;

import io.groupmatch.core.config.MatcherConfig;
import io.groupmatch.core.model.ExpectedSpec;
import io.groupmatch.core.model.GroupSpec;
import io.groupmatch.core.model.MatchOutcome;
import io.groupmatch.core.model.RaisedException;
import io.groupmatch.core.model.SpecRenderer;
import io.groupmatch.core.spi.CheckDisplay;
import io.groupmatch.core.spi.ExceptionRenderer;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Matches raised exceptions, lone or grouped, against an {@link ExpectedSpec} and explains
 * mismatches.
 *
 * <pre>{@code
 * GroupMatcher matcher = GroupMatcher.create();
 * ExpectedSpec spec = ExpectedSpec.group(ExpectedSpec.type(IllegalStateException.class));
 * MatchOutcome outcome = matcher.match(spec, raised);
 * if (!outcome.success()) {
 *     System.err.println(outcome.diagnostic());
 * }
 * }</pre>
 *
 * <p>
 * Instances are immutable and thread-safe, provided any check predicate, {@link
 * ExceptionRenderer} and {@link CheckDisplay} given to them are.
 */
public final class GroupMatcher {

    private static final Logger LOG = LoggerFactory.getLogger(GroupMatcher.class);

    static final String GROUP_PREFIX = "Raised exception group did not match: ";
    static final String UNWRAPPED_PREFIX = "Raised exception (group) did not match: ";
    static final String LONE_PREFIX = "Raised exception did not match: ";

    private final MatcherConfig config;
    private final ExceptionRenderer renderer;
    private final SpecRenderer specRenderer;
    private final SpecEvaluator evaluator;

    private GroupMatcher(MatcherConfig config, ExceptionRenderer renderer, CheckDisplay checkDisplay) {
        this.config = config;
        this.renderer = renderer;
        this.specRenderer = new SpecRenderer(checkDisplay);
        this.evaluator = new SpecEvaluator(config, renderer, specRenderer);
    }

    /** Matcher with {@link MatcherConfig#defaults()} and the default renderers. */
    public static GroupMatcher create() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public MatcherConfig config() {
        return config;
    }

    /**
     * Matches {@code raised} against {@code spec}. A {@code null} exception never matches.
     *
     * @throws RuntimeException only what a check throws under {@link
     *     io.groupmatch.core.config.CheckFailurePolicy#PROPAGATE}
     */
    public MatchOutcome match(ExpectedSpec spec, Throwable raised) {
        Objects.requireNonNull(spec, "spec must not be null");
        if (raised == null) {
            return MatchOutcome.failed("exception is null");
        }
        return match(spec, RaisedException.snapshot(raised, renderer));
    }

    /** Matches an already captured snapshot. */
    public MatchOutcome match(ExpectedSpec spec, RaisedException raised) {
        Objects.requireNonNull(spec, "spec must not be null");
        Objects.requireNonNull(raised, "raised must not be null");
        String reason = evaluator.evaluate(spec, raised, false, config.suggestions());
        if (reason == null) {
            LOG.debug("{} matched {}", raised.repr(), describe(spec));
            return MatchOutcome.matched();
        }
        LOG.debug("{} did not match {}", raised.repr(), describe(spec));
        return MatchOutcome.failed(reason);
    }

    /** Boolean form of {@link #match(ExpectedSpec, Throwable)}. */
    public boolean matches(ExpectedSpec spec, Throwable raised) {
        return match(spec, raised).success();
    }

    /**
     * Test-assertion form: returns normally on a match, otherwise throws an {@link AssertionError}
     * carrying the diagnostic, with {@code raised} as its cause.
     */
    public void assertMatches(ExpectedSpec spec, Throwable raised) {
        Objects.requireNonNull(spec, "spec must not be null");
        if (raised == null) {
            throw new AssertionError("DID NOT RAISE any exception, expected " + describe(spec));
        }
        MatchOutcome outcome = match(spec, raised);
        if (!outcome.success()) {
            throw new AssertionError(failurePrefix(spec) + outcome.diagnostic(), raised);
        }
    }

    /** Canonical form of {@code spec}, with checks shown through this matcher's {@link CheckDisplay}. */
    public String describe(ExpectedSpec spec) {
        return specRenderer.render(spec);
    }

    static String failurePrefix(ExpectedSpec spec) {
        if (spec instanceof GroupSpec group) {
            return group.allowUnwrapped() ? UNWRAPPED_PREFIX : GROUP_PREFIX;
        }
        return LONE_PREFIX;
    }

    /** Builder for {@link GroupMatcher}. */
    public static final class Builder {

        private MatcherConfig config = MatcherConfig.defaults();
        private ExceptionRenderer renderer = ExceptionRenderer.DEFAULT;
        private CheckDisplay checkDisplay = CheckDisplay.DEFAULT;

        private Builder() {}

        public Builder config(MatcherConfig config) {
            this.config = Objects.requireNonNull(config, "config must not be null");
            return this;
        }

        public Builder exceptionRenderer(ExceptionRenderer renderer) {
            this.renderer = Objects.requireNonNull(renderer, "renderer must not be null");
            return this;
        }

        public Builder checkDisplay(CheckDisplay checkDisplay) {
            this.checkDisplay = Objects.requireNonNull(checkDisplay, "checkDisplay must not be null");
            return this;
        }

        public GroupMatcher build() {
            return new GroupMatcher(config, renderer, checkDisplay);
        }
    }
}
