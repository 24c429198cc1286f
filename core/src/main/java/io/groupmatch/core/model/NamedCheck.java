package io.groupmatch.core.model;

import java.util.Objects;
import java.util.function.Predicate;

/**
 * A check predicate with a stable display name. Its {@code toString()} is the name, so canonical
 * spec strings stay deterministic and can be parsed back when the parser knows the name.
 *
 * @param name      display name, e.g. {@code errno_is_5}
 * @param predicate the actual test
 */
public record NamedCheck(String name, Predicate<Throwable> predicate) implements Predicate<Throwable> {

    public NamedCheck {
        Objects.requireNonNull(name, "name must not be null");
        Objects.requireNonNull(predicate, "predicate must not be null");
        if (name.isBlank()) {
            throw new IllegalArgumentException("check name must not be blank");
        }
    }

    public static NamedCheck of(String name, Predicate<? super Throwable> predicate) {
        Objects.requireNonNull(predicate, "predicate must not be null");
        return new NamedCheck(name, predicate::test);
    }

    /**
     * Names a predicate written against a narrower exception type. Exceptions of any other type fail
     * the check without reaching {@code predicate}.
     */
    public static <T extends Throwable> NamedCheck of(String name, Class<T> type, Predicate<? super T> predicate) {
        return new NamedCheck(name, new TypedCheck<>(type, predicate));
    }

    @Override
    public boolean test(Throwable exception) {
        return predicate.test(exception);
    }

    @Override
    public String toString() {
        return name;
    }
}
