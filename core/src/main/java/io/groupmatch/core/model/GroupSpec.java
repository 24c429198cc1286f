package io.groupmatch.core.model;

import io.groupmatch.core.error.SpecConfigurationException;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;
import java.util.function.Predicate;
import java.util.regex.Pattern;

/**
 * Matches an exception group whose children pair up one-to-one with {@link #children()}, in any
 * order.
 *
 * <p>
 * Options:
 *
 * <ul>
 *   <li>{@code flattenSubgroups}: nested groups inside the raised group are spliced into its child
 *       list before matching, so the nesting depth is irrelevant. Incompatible with nested group
 *       specs.
 *   <li>{@code allowUnwrapped}: a lone, ungrouped exception is accepted if it matches the single
 *       child spec. Requires exactly one non-group child and no group-level pattern or check, since
 *       those could never apply to the unwrapped exception.
 * </ul>
 *
 * <p>
 * The group type shown in the canonical form is {@link ExceptionGroup}, or {@link
 * BaseExceptionGroup} when any child expects a base-only exception. The flag is derived once,
 * bottom-up, at construction. An explicit type, if given, must implement {@link ThrowableGroup} and
 * is also checked against the raised group.
 *
 * <p>
 * Immutable and thread-safe, provided the check is.
 */
public final class GroupSpec implements ExpectedSpec {

    private final List<ExpectedSpec> children;
    private final boolean flattenSubgroups;
    private final boolean allowUnwrapped;
    private final Class<? extends Throwable> explicitType;
    private final Pattern pattern;
    private final Predicate<Throwable> check;
    private final boolean baseGroup;

    GroupSpec(
            List<ExpectedSpec> children,
            boolean flattenSubgroups,
            boolean allowUnwrapped,
            Class<? extends Throwable> explicitType,
            Pattern pattern,
            Predicate<Throwable> check) {
        Objects.requireNonNull(children, "children must not be null");
        if (children.isEmpty()) {
            throw new SpecConfigurationException("A group spec must expect at least one exception.");
        }
        for (ExpectedSpec child : children) {
            Objects.requireNonNull(child, "children must not contain null");
        }
        if (allowUnwrapped && children.size() > 1) {
            throw new SpecConfigurationException("You cannot specify multiple exceptions with allow_unwrapped=True."
                    + " If you want to match one of multiple possible exceptions you should use a Matcher."
                    + " E.g. Matcher(check=<predicate accepting either type>)");
        }
        if (allowUnwrapped && children.get(0) instanceof GroupSpec) {
            throw new SpecConfigurationException(
                    "allow_unwrapped=True has no effect when expecting a nested group. You might want it in the"
                            + " expected nested group, or flatten_subgroups=True if you don't care about the"
                            + " structure.");
        }
        if (allowUnwrapped && (pattern != null || check != null)) {
            throw new SpecConfigurationException(
                    "allow_unwrapped=True bypasses the match and check parameters if the exception is unwrapped."
                            + " If you intended to match/check the exception you should use a Matcher object."
                            + " If you want to match/check the exception group when the exception *is* wrapped"
                            + " you need to match the group separately afterwards.");
        }
        if (flattenSubgroups) {
            for (ExpectedSpec child : children) {
                if (child instanceof GroupSpec) {
                    throw new SpecConfigurationException(
                            "You cannot specify a nested structure inside a group with flatten_subgroups=True."
                                    + " The parameter will flatten subgroups in the raised exception group before"
                                    + " matching, which would never match a nested structure.");
                }
            }
        }
        if (explicitType != null) {
            SpecSupport.requireThrowable(explicitType);
            if (!ThrowableGroup.class.isAssignableFrom(explicitType)) {
                throw new SpecConfigurationException("group type " + explicitType.getName() + " must implement "
                        + ThrowableGroup.class.getSimpleName());
            }
        }
        this.children = List.copyOf(children);
        this.flattenSubgroups = flattenSubgroups;
        this.allowUnwrapped = allowUnwrapped;
        this.explicitType = explicitType;
        this.pattern = pattern;
        this.check = check;
        boolean base = false;
        for (ExpectedSpec child : this.children) {
            base |= SpecSupport.isBaseOnly(child);
        }
        this.baseGroup = base;
    }

    public static Builder builder() {
        return new Builder();
    }

    /** Expected children in declaration order. */
    public List<ExpectedSpec> children() {
        return children;
    }

    public boolean flattenSubgroups() {
        return flattenSubgroups;
    }

    public boolean allowUnwrapped() {
        return allowUnwrapped;
    }

    /** The explicit group type, or the derived {@link ExceptionGroup}/{@link BaseExceptionGroup}. */
    public Class<? extends Throwable> exceptionType() {
        if (explicitType != null) {
            return explicitType;
        }
        return baseGroup ? BaseExceptionGroup.class : ExceptionGroup.class;
    }

    /** Whether a group type was given explicitly rather than derived. */
    public boolean hasExplicitType() {
        return explicitType != null;
    }

    /** Regex searched in the group message and notes, or {@code null}. */
    public Pattern pattern() {
        return pattern;
    }

    /** Check run on the group once its children matched, or {@code null}. */
    public Predicate<Throwable> check() {
        return check;
    }

    /** True when any child, at any depth below, expects a base-only exception. */
    public boolean isBaseGroup() {
        return baseGroup;
    }

    /** Copy with {@code flattenSubgroups} changed; validation applies. */
    public GroupSpec withFlattenSubgroups(boolean flatten) {
        return new GroupSpec(children, flatten, allowUnwrapped, explicitType, pattern, check);
    }

    /** Copy with {@code allowUnwrapped} changed; validation applies. */
    public GroupSpec withAllowUnwrapped(boolean unwrapped) {
        return new GroupSpec(children, flattenSubgroups, unwrapped, explicitType, pattern, check);
    }

    /** Copy with another group-level pattern. */
    public GroupSpec withPattern(Pattern replacement) {
        return new GroupSpec(children, flattenSubgroups, allowUnwrapped, explicitType, replacement, check);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof GroupSpec that)) return false;
        return flattenSubgroups == that.flattenSubgroups
                && allowUnwrapped == that.allowUnwrapped
                && children.equals(that.children)
                && Objects.equals(explicitType, that.explicitType)
                && SpecSupport.samePattern(pattern, that.pattern)
                && Objects.equals(check, that.check);
    }

    @Override
    public int hashCode() {
        return Objects.hash(
                children, flattenSubgroups, allowUnwrapped, explicitType, SpecSupport.patternHash(pattern), check);
    }

    @Override
    public String toString() {
        return SpecRenderer.DEFAULT.render(this);
    }

    /** Fluent builder for {@link GroupSpec}. */
    public static final class Builder {

        private final List<ExpectedSpec> children = new ArrayList<>();
        private boolean flattenSubgroups;
        private boolean allowUnwrapped;
        private Class<? extends Throwable> exceptionType;
        private Pattern pattern;
        private Predicate<Throwable> check;

        private Builder() {}

        public Builder expect(ExpectedSpec... specs) {
            return expect(Arrays.asList(specs));
        }

        public Builder expect(List<? extends ExpectedSpec> specs) {
            for (ExpectedSpec spec : specs) {
                children.add(Objects.requireNonNull(spec, "spec must not be null"));
            }
            return this;
        }

        /** Shorthand for {@code expect(new TypeSpec(type))}. */
        public Builder expect(Class<? extends Throwable> type) {
            children.add(new TypeSpec(type));
            return this;
        }

        public Builder flattenSubgroups() {
            return flattenSubgroups(true);
        }

        public Builder flattenSubgroups(boolean flatten) {
            this.flattenSubgroups = flatten;
            return this;
        }

        public Builder allowUnwrapped() {
            return allowUnwrapped(true);
        }

        public Builder allowUnwrapped(boolean unwrapped) {
            this.allowUnwrapped = unwrapped;
            return this;
        }

        /** Explicit group type; must implement {@link ThrowableGroup}. */
        public Builder exceptionType(Class<? extends Throwable> type) {
            this.exceptionType = type;
            return this;
        }

        public Builder match(String regex) {
            return match(Pattern.compile(Objects.requireNonNull(regex, "regex must not be null")));
        }

        public Builder match(Pattern pattern) {
            this.pattern = pattern;
            return this;
        }

        public Builder check(Predicate<? super Throwable> check) {
            this.check = check == null ? null : TypedCheck.of(Throwable.class, check);
            return this;
        }

        /**
         * Builds and validates the spec.
         *
         * @throws io.groupmatch.core.error.SpecConfigurationException on contradictory options
         */
        public GroupSpec build() {
            return new GroupSpec(children, flattenSubgroups, allowUnwrapped, exceptionType, pattern, check);
        }
    }
}
