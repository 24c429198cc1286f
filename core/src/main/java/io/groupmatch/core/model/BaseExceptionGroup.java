package io.groupmatch.core.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * A group that may hold any {@link Throwable}, including {@link Error}s. Being an {@code Error}
 * itself, it is "base-only": it does not derive from {@link Exception}.
 */
public class BaseExceptionGroup extends Error implements ThrowableGroup {

    private static final long serialVersionUID = 1L;

    private final List<Throwable> exceptions;
    private final List<String> notes = new ArrayList<>();

    public BaseExceptionGroup(String message, List<? extends Throwable> exceptions) {
        super(Objects.requireNonNull(message, "message must not be null"));
        this.exceptions = ThrowableGroup.copyChildren(exceptions);
        for (Throwable child : this.exceptions) {
            addSuppressed(child);
        }
    }

    public BaseExceptionGroup(String message, Throwable... exceptions) {
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
    public BaseExceptionGroup addNote(String note) {
        notes.add(Objects.requireNonNull(note, "note must not be null"));
        return this;
    }

    @Override
    public Throwable asThrowable() {
        return this;
    }
}
