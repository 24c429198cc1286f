package io.groupmatch.core.spi;

import java.util.function.Predicate;

/**
 * Renders a caller-supplied check predicate as a display token inside canonical spec strings and
 * diagnostics ({@code Matcher(check=<token>)}).
 *
 * <p>
 * The token is opaque to the engine: lambdas typically render with a JVM-assigned identity that
 * is not stable across runs. Use {@link io.groupmatch.core.model.NamedCheck} when a stable token is
 * needed, for example to parse a rendered spec back.
 */
@FunctionalInterface
public interface CheckDisplay {

    /** Uses the predicate's {@code toString()}. */
    CheckDisplay DEFAULT = check -> String.valueOf(check);

    /**
     * Returns the display token for the given check.
     *
     * @param check the predicate, never null
     */
    String display(Predicate<?> check);
}
