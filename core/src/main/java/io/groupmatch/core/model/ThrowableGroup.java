package io.groupmatch.core.model;

import java.util.List;
import java.util.Objects;

/**
 * Group shape shared by {@link ExceptionGroup} and {@link BaseExceptionGroup}: a message plus an
 * ordered, non-empty list of sibling exceptions, any of which may itself be a group.
 */
public interface ThrowableGroup extends HasNotes {

    /** The group message as passed at construction, never null. */
    String getMessage();

    /** The direct children in their original order. Unmodifiable. */
    List<Throwable> exceptions();

    /** Appends a note; returns this group for chaining. */
    ThrowableGroup addNote(String note);

    /** This group as a throwable. */
    Throwable asThrowable();

    /**
     * Creates an {@link ExceptionGroup} when every child is an {@link Exception}, a {@link
     * BaseExceptionGroup} otherwise.
     *
     * @throws IllegalArgumentException if {@code exceptions} is empty
     */
    static Throwable of(String message, List<? extends Throwable> exceptions) {
        Objects.requireNonNull(exceptions, "exceptions must not be null");
        for (Throwable child : exceptions) {
            if (!(child instanceof Exception)) {
                return new BaseExceptionGroup(message, exceptions);
            }
        }
        return new ExceptionGroup(message, exceptions);
    }

    /** Varargs form of {@link #of(String, List)}. */
    static Throwable of(String message, Throwable... exceptions) {
        return of(message, List.of(exceptions));
    }

    /** Validates and copies a child list for a group constructor. */
    static List<Throwable> copyChildren(List<? extends Throwable> exceptions) {
        Objects.requireNonNull(exceptions, "exceptions must not be null");
        if (exceptions.isEmpty()) {
            throw new IllegalArgumentException("an exception group requires at least one exception");
        }
        for (Throwable child : exceptions) {
            Objects.requireNonNull(child, "exceptions must not contain null");
        }
        return List.copyOf(exceptions);
    }
}
