package io.groupmatch.core.model;

import java.util.Objects;

/**
 * Matches any exception that is an instance of {@code exceptionType}. Renders as the bare simple type
 * name.
 *
 * <p>
 * Immutable and thread-safe.
 */
public record TypeSpec(Class<? extends Throwable> exceptionType) implements ExpectedSpec {

    public TypeSpec {
        Objects.requireNonNull(exceptionType, "exceptionType must not be null");
        SpecSupport.requireThrowable(exceptionType);
    }

    @Override
    public String toString() {
        return SpecRenderer.DEFAULT.render(this);
    }
}
