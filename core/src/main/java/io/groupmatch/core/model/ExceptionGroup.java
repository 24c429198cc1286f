package io.groupmatch.core.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * An unchecked group of {@link Exception}s raised together, typically by a set of concurrent tasks.
 * Children are also registered as suppressed exceptions so stack traces show them.
 *
 * <p>
 * Use {@link BaseExceptionGroup} when a child is not an {@code Exception}.
 */
public class ExceptionGroup extends RuntimeException implements ThrowableGroup {

    private static final long serialVersionUID = 1L;

    private final List<Throwable> exceptions;
    private final List<String> notes = new ArrayList<>();

    public ExceptionGroup(String message, List<? extends Throwable> exceptions) {
        super(Objects.requireNonNull(message, "message must not be null"));
        this.exceptions = ThrowableGroup.copyChildren(exceptions);
        for (Throwable child : this.exceptions) {
            if (!(child instanceof Exception)) {
                throw new IllegalArgumentException("Cannot nest " + child.getClass().getSimpleName()
                        + " in an ExceptionGroup, use BaseExceptionGroup instead");
            }
            addSuppressed(child);
        }
    }

    public ExceptionGroup(String message, Throwable... exceptions) {
        this(message, List.of(exceptions));
    }

    @Override
    public List<Throwable> exceptions() {
        return exceptions;
    }

    @Override
    public List<String> notes() {
        return Collections.unmodifiableList(notes);
    }

    @Override
    public ExceptionGroup addNote(String note) {
        notes.add(Objects.requireNonNull(note, "note must not be null"));
        return this;
    }

    @Override
    public Throwable asThrowable() {
        return this;
    }
}
