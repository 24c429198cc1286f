package io.groupmatch.core.model;

import java.util.Objects;
import java.util.function.Predicate;

/**
 * Adapts a check written against a narrower exception type to {@code Predicate<Throwable>}.
 * Equality follows the wrapped check, so specs built twice from the same check stay equal.
 *
 * <p>
 * The engine runs a check only after the type constraint passed; an exception of another type
 * fails the check instead of reaching it.
 */
record TypedCheck<T extends Throwable>(Class<T> type, Predicate<? super T> check) implements Predicate<Throwable> {

    TypedCheck {
        Objects.requireNonNull(type, "type must not be null");
        Objects.requireNonNull(check, "check must not be null");
    }

    /** {@code check} itself when it is a {@link NamedCheck}, otherwise a wrapper. */
    static <T extends Throwable> Predicate<Throwable> of(Class<T> type, Predicate<? super T> check) {
        if (check instanceof NamedCheck named) {
            return named;
        }
        return new TypedCheck<>(type, check);
    }

    @Override
    public boolean test(Throwable exception) {
        return type.isInstance(exception) && check.test(type.cast(exception));
    }

    @Override
    public String toString() {
        return check.toString();
    }
}
