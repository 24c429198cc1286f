package io.groupmatch.core.model;

import io.groupmatch.core.error.SpecConfigurationException;
import java.util.Objects;
import java.util.function.Predicate;
import java.util.regex.Pattern;

/**
 * Matches an exception by an optional type, an optional regex searched in its message and notes,
 * and an optional check predicate, evaluated in that order. At least one criterion is required.
 *
 * <p>
 * Renders as {@code Matcher(Type, match='regex', check=<display>)}.
 *
 * <p>
 * Immutable and thread-safe, provided the check is.
 *
 * @param exceptionType required type, or {@code null}
 * @param pattern       regex searched with {@link java.util.regex.Matcher#find()}, or {@code null}
 * @param check         predicate run on the exception once type and pattern pass, or {@code null}
 */
public record PredicateSpec(Class<? extends Throwable> exceptionType, Pattern pattern, Predicate<Throwable> check)
        implements ExpectedSpec {

    public PredicateSpec {
        if (exceptionType == null && pattern == null && check == null) {
            throw new SpecConfigurationException("You must specify at least one parameter to match on.");
        }
        SpecSupport.requireThrowable(exceptionType);
    }

    /** Copy with another pattern; used to probe whether a quoted regex would have matched. */
    public PredicateSpec withPattern(Pattern replacement) {
        return new PredicateSpec(exceptionType, replacement, check);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof PredicateSpec that)) return false;
        return Objects.equals(exceptionType, that.exceptionType)
                && SpecSupport.samePattern(pattern, that.pattern)
                && Objects.equals(check, that.check);
    }

    @Override
    public int hashCode() {
        return Objects.hash(exceptionType, SpecSupport.patternHash(pattern), check);
    }

    @Override
    public String toString() {
        return SpecRenderer.DEFAULT.render(this);
    }

    /**
     * Fluent builder; the type parameter narrows what the check receives.
     *
     * @param <T> the exception type the check is written against
     */
    public static final class Builder<T extends Throwable> {

        private final Class<T> exceptionType;
        private final Class<T> checkType;
        private Pattern pattern;
        private Predicate<Throwable> check;

        Builder(Class<T> exceptionType, Class<T> checkType) {
            this.exceptionType = exceptionType;
            this.checkType = checkType;
        }

        /** Regex searched in the message and notes. */
        public Builder<T> match(String regex) {
            return match(Pattern.compile(Objects.requireNonNull(regex, "regex must not be null")));
        }

        public Builder<T> match(Pattern pattern) {
            this.pattern = Objects.requireNonNull(pattern, "pattern must not be null");
            return this;
        }

        /**
         * Custom check. It only ever sees exceptions that already passed the type constraint, so a
         * check written against {@code T} is safe.
         */
        public Builder<T> check(Predicate<? super T> check) {
            this.check = TypedCheck.of(checkType, Objects.requireNonNull(check, "check must not be null"));
            return this;
        }

        public PredicateSpec build() {
            return new PredicateSpec(exceptionType, pattern, check);
        }
    }
}
