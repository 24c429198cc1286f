package io.groupmatch.core.engine;

import io.groupmatch.core.config.CheckFailurePolicy;
import io.groupmatch.core.config.MatcherConfig;
import io.groupmatch.core.model.ExpectedSpec;
import io.groupmatch.core.model.GroupSpec;
import io.groupmatch.core.model.Literals;
import io.groupmatch.core.model.PredicateSpec;
import io.groupmatch.core.model.RaisedException;
import io.groupmatch.core.model.SpecRenderer;
import io.groupmatch.core.model.ThrowableGroup;
import io.groupmatch.core.model.TypeSpec;
import io.groupmatch.core.spi.ExceptionRenderer;
import java.util.List;
import java.util.function.Predicate;
import java.util.regex.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Evaluates a spec tree against a raised snapshot. Every method returns {@code null} on a match and
 * the mismatch reason otherwise.
 *
 * <p>
 * Suggestions are found by re-running the evaluation on a modified spec with suggestions turned
 * off, so a probe never nests another probe.
 *
 * <p>
 * Thread-safe: all state lives on the stack of one call.
 */
final class SpecEvaluator {

    private static final Logger LOG = LoggerFactory.getLogger(SpecEvaluator.class);

    /** Aligns a nested group's flatten hint under the text following its canonical form. */
    private static final String NESTED_HINT_INDENT = "      ";

    static final String SUGGEST_UNWRAPPED = ", but would match with `allow_unwrapped=True`";
    static final String FLATTEN_HINT = "Did you mean to use `flatten_subgroups=True`?";
    static final String SUGGEST_FLATTEN = "\n" + FLATTEN_HINT;
    static final String SUGGEST_QUOTE = "\nDid you mean to `Pattern.quote()` the regex?";

    private final MatcherConfig config;
    private final ExceptionRenderer renderer;
    private final SpecRenderer specs;
    private final DiagnosticBuilder diagnostics;

    SpecEvaluator(MatcherConfig config, ExceptionRenderer renderer, SpecRenderer specs) {
        this.config = config;
        this.renderer = renderer;
        this.specs = specs;
        this.diagnostics = new DiagnosticBuilder(specs);
    }

    /**
     * Top-level entry.
     *
     * @param nested whether the reason will be shown after the spec's canonical form, which already
     *     names the check
     */
    String evaluate(ExpectedSpec spec, RaisedException actual, boolean nested, boolean suggest) {
        if (spec instanceof TypeSpec type) {
            return checkType(type.exceptionType(), actual);
        }
        if (spec instanceof PredicateSpec predicate) {
            return evaluatePredicate(predicate, actual, nested, suggest);
        }
        if (spec instanceof GroupSpec group) {
            return evaluateGroup(group, actual, nested, suggest);
        }
        throw new IllegalStateException("Unknown spec variant: " + spec.getClass());
    }

    String checkType(Class<? extends Throwable> expected, RaisedException actual) {
        if (expected.isInstance(actual.exception())) {
            return null;
        }
        String prefix = actual.isGroup() && !ThrowableGroup.class.isAssignableFrom(expected) ? "inner " : "";
        return prefix + Literals.quote(actual.typeName()) + " is not of type "
                + Literals.quote(renderer.typeName(expected));
    }

    /**
     * Reason for a child spec inside a group, prefixed with the child's canonical form unless the
     * child is a plain type.
     */
    String checkChild(ExpectedSpec child, RaisedException actual, boolean suggest) {
        if (child instanceof TypeSpec type) {
            return checkType(type.exceptionType(), actual);
        }
        String reason = evaluate(child, actual, true, suggest);
        if (reason == null) {
            return null;
        }
        String name = specs.render(child);
        if (reason.startsWith("\n")) {
            return "\n" + name + ": " + DiagnosticBuilder.indent(reason, "  ");
        }
        return name + ": " + reason;
    }

    private String evaluatePredicate(PredicateSpec spec, RaisedException actual, boolean nested, boolean suggest) {
        if (spec.exceptionType() != null) {
            String reason = checkType(spec.exceptionType(), actual);
            if (reason != null) {
                return reason;
            }
        }
        if (spec.pattern() != null && !spec.pattern().matcher(actual.display()).find()) {
            String reason = patternReason(spec.pattern(), actual);
            if (suggest && quotable(spec.pattern())
                    && evaluatePredicate(spec.withPattern(quoted(spec.pattern())), actual, nested, false) == null) {
                reason += SUGGEST_QUOTE;
            }
            return reason;
        }
        if (spec.check() != null) {
            return runCheck(spec.check(), actual, nested);
        }
        return null;
    }

    private String evaluateGroup(GroupSpec spec, RaisedException actual, boolean nested, boolean suggest) {
        if (!actual.isGroup()) {
            return evaluateUnwrapped(spec, actual, suggest);
        }
        if (spec.hasExplicitType() && !spec.exceptionType().isInstance(actual.exception())) {
            return Literals.quote(actual.typeName()) + " is not of type "
                    + Literals.quote(renderer.typeName(spec.exceptionType()));
        }
        if (spec.pattern() != null && !spec.pattern().matcher(actual.display()).find()) {
            String reason = patternReason(spec.pattern(), actual);
            if (suggest && quotable(spec.pattern())
                    && evaluateGroup(spec.withPattern(quoted(spec.pattern())), actual, nested, false) == null) {
                reason += SUGGEST_QUOTE;
            }
            return reason;
        }

        List<RaisedException> actuals = TreePreprocessor.childrenFor(spec, actual);
        MatchAttempt attempt =
                PairingEngine.pair(spec.children(), actuals, (child, raised) -> checkChild(child, raised, suggest));
        if (!attempt.isComplete()) {
            String reason = diagnostics.describe(attempt);
            if (suggest
                    && !spec.flattenSubgroups()
                    && TreePreprocessor.canFlatten(spec)
                    && TreePreprocessor.hasSubgroups(actuals)
                    && evaluateGroup(spec.withFlattenSubgroups(true), actual, nested, false) == null) {
                reason += nested && !reason.startsWith("\n")
                        ? "\n" + NESTED_HINT_INDENT + FLATTEN_HINT
                        : SUGGEST_FLATTEN;
            }
            return reason;
        }

        if (spec.check() != null) {
            return runCheck(spec.check(), actual, nested);
        }
        return null;
    }

    private String evaluateUnwrapped(GroupSpec spec, RaisedException actual, boolean suggest) {
        String notGroup = Literals.quote(actual.typeName()) + " is not an exception group";
        if (spec.children().size() > 1) {
            return notGroup;
        }
        ExpectedSpec only = spec.children().get(0);
        if (spec.allowUnwrapped()) {
            return checkChild(only, actual, suggest);
        }
        if (suggest && TreePreprocessor.canUnwrap(spec) && checkChild(only, actual, false) == null) {
            return notGroup + SUGGEST_UNWRAPPED;
        }
        return notGroup;
    }

    private String runCheck(Predicate<Throwable> check, RaisedException actual, boolean nested) {
        String label = nested ? "check" : "check " + specs.displayCheck(check);
        boolean accepted;
        try {
            accepted = check.test(actual.exception());
        } catch (RuntimeException e) {
            if (config.checkFailurePolicy() == CheckFailurePolicy.PROPAGATE) {
                throw e;
            }
            LOG.warn("Check {} threw while evaluating {}; treating as mismatch",
                    specs.displayCheck(check), actual.repr(), e);
            return label + " raised " + renderer.repr(e);
        }
        return accepted ? null : label + " did not return true";
    }

    private static String patternReason(Pattern pattern, RaisedException actual) {
        return "Regex pattern " + Literals.quote(pattern.pattern()) + " did not match "
                + Literals.quote(actual.display());
    }

    private static boolean quotable(Pattern pattern) {
        return (pattern.flags() & Pattern.LITERAL) == 0;
    }

    private static Pattern quoted(Pattern pattern) {
        return Pattern.compile(Pattern.quote(pattern.pattern()), pattern.flags());
    }
}
