package io.groupmatch.core.model;

import io.groupmatch.core.error.SpecConfigurationException;
import java.util.Objects;
import java.util.regex.Pattern;

/** Validation and equality helpers for the spec records. */
final class SpecSupport {

    private SpecSupport() {}

    /**
     * Rejects a class that is not a {@link Throwable}. Generic signatures already prevent this, but
     * the parser and loader resolve classes by name at runtime.
     */
    static void requireThrowable(Class<?> type) {
        if (type != null && !Throwable.class.isAssignableFrom(type)) {
            throw new SpecConfigurationException(
                    "exception type " + type.getName() + " must be a subclass of Throwable");
        }
    }

    /** {@link Pattern} has identity equality; compare source and flags instead. */
    static boolean samePattern(Pattern a, Pattern b) {
        if (a == null || b == null) {
            return a == b;
        }
        return a.pattern().equals(b.pattern()) && a.flags() == b.flags();
    }

    static int patternHash(Pattern pattern) {
        return pattern == null ? 0 : Objects.hash(pattern.pattern(), pattern.flags());
    }

    /** True when a spec node expects something outside {@link Exception}. */
    static boolean isBaseOnly(ExpectedSpec spec) {
        if (spec instanceof TypeSpec type) {
            return !Exception.class.isAssignableFrom(type.exceptionType());
        }
        if (spec instanceof PredicateSpec predicate) {
            return predicate.exceptionType() != null && !Exception.class.isAssignableFrom(predicate.exceptionType());
        }
        if (spec instanceof GroupSpec group) {
            return group.isBaseGroup();
        }
        throw new IllegalStateException("Unknown spec variant: " + spec.getClass());
    }
}
