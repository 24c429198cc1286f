package io.groupmatch.core.spec;

import io.groupmatch.core.model.BaseExceptionGroup;
import io.groupmatch.core.model.ExceptionGroup;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Resolves exception type names found in spec expressions and expectation documents.
 *
 * <p>
 * Lookup order: registered classes (by simple or fully qualified name), the name as a fully
 * qualified class, then the name inside {@code java.lang}, {@code java.io}, {@code java.util},
 * {@code java.util.concurrent} and {@code java.time}. Only {@link Throwable} subclasses resolve.
 *
 * <p>
 * Immutable and thread-safe.
 */
public final class TypeResolver {

    private static final List<String> IMPLICIT_PACKAGES =
            List.of("java.lang.", "java.io.", "java.util.", "java.util.concurrent.", "java.time.");

    private static final TypeResolver DEFAULTS =
            new TypeResolver(Map.of()).with(ExceptionGroup.class, BaseExceptionGroup.class);

    private final Map<String, Class<? extends Throwable>> registered;

    private TypeResolver(Map<String, Class<? extends Throwable>> registered) {
        this.registered = registered;
    }

    /** Resolver knowing the two group types and the implicit JDK packages. */
    public static TypeResolver defaults() {
        return DEFAULTS;
    }

    /** Copy that also resolves {@code types} by simple and fully qualified name. */
    @SafeVarargs
    public final TypeResolver with(Class<? extends Throwable>... types) {
        Map<String, Class<? extends Throwable>> copy = new LinkedHashMap<>(registered);
        for (Class<? extends Throwable> type : types) {
            Objects.requireNonNull(type, "type must not be null");
            copy.put(type.getSimpleName(), type);
            copy.put(type.getName(), type);
        }
        return new TypeResolver(Map.copyOf(copy));
    }

    /** The throwable class named {@code name}, or empty when nothing matches. */
    public Optional<Class<? extends Throwable>> resolve(String name) {
        Class<? extends Throwable> type = registered.get(name);
        if (type != null) {
            return Optional.of(type);
        }
        type = load(name);
        for (int i = 0; type == null && i < IMPLICIT_PACKAGES.size() && name.indexOf('.') < 0; i++) {
            type = load(IMPLICIT_PACKAGES.get(i) + name);
        }
        return Optional.ofNullable(type);
    }

    private static Class<? extends Throwable> load(String className) {
        Class<?> candidate;
        try {
            candidate = Class.forName(className, false, TypeResolver.class.getClassLoader());
        } catch (ClassNotFoundException | LinkageError e) {
            return null;
        }
        return Throwable.class.isAssignableFrom(candidate) ? candidate.asSubclass(Throwable.class) : null;
    }
}
