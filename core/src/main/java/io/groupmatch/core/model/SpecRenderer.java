package io.groupmatch.core.model;

import io.groupmatch.core.spi.CheckDisplay;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.StringJoiner;
import java.util.function.Predicate;
import java.util.regex.Pattern;

/**
 * Canonical string form of a spec tree, used by diagnostics and by {@code toString()}:
 *
 * <ul>
 *   <li>{@link TypeSpec}: {@code IllegalStateException}
 *   <li>{@link PredicateSpec}: {@code Matcher(IOException, match='disk', check=<display>)}
 *   <li>{@link GroupSpec}: {@code ExceptionGroup(IllegalStateException, flatten_subgroups=True)}
 * </ul>
 *
 * <p>
 * Absent parts and default options are omitted. An explicit {@link ExceptionGroup} or {@link
 * BaseExceptionGroup} group type is written with its fully qualified name.
 *
 * <p>
 * The form is read back by {@code io.groupmatch.core.spec.SpecParser}.
 *
 * <p>
 * Thread-safe if the {@link CheckDisplay} is.
 */
public final class SpecRenderer {

    /** Renderer using each check's {@code toString()}. */
    public static final SpecRenderer DEFAULT = new SpecRenderer(CheckDisplay.DEFAULT);

    /** Token naming a {@link PredicateSpec} in the canonical form. */
    public static final String MATCHER = "Matcher";

    private final CheckDisplay checkDisplay;

    public SpecRenderer(CheckDisplay checkDisplay) {
        this.checkDisplay = Objects.requireNonNull(checkDisplay, "checkDisplay must not be null");
    }

    public String render(ExpectedSpec spec) {
        if (spec instanceof TypeSpec type) {
            return Literals.typeName(type.exceptionType());
        }
        if (spec instanceof PredicateSpec predicate) {
            List<String> parts = new ArrayList<>();
            if (predicate.exceptionType() != null) {
                parts.add(Literals.typeName(predicate.exceptionType()));
            }
            addPattern(parts, predicate.pattern());
            if (predicate.check() != null) {
                parts.add("check=" + checkDisplay.display(predicate.check()));
            }
            return MATCHER + "(" + String.join(", ", parts) + ")";
        }
        if (spec instanceof GroupSpec group) {
            List<String> parts = new ArrayList<>();
            for (ExpectedSpec child : group.children()) {
                parts.add(render(child));
            }
            if (group.flattenSubgroups()) {
                parts.add("flatten_subgroups=True");
            }
            if (group.allowUnwrapped()) {
                parts.add("allow_unwrapped=True");
            }
            addPattern(parts, group.pattern());
            if (group.check() != null) {
                parts.add("check=" + checkDisplay.display(group.check()));
            }
            return groupTypeName(group) + "(" + String.join(", ", parts) + ")";
        }
        throw new IllegalStateException("Unknown spec variant: " + spec.getClass());
    }

    /** {@code [a, b, c]} over the canonical forms. */
    public String renderAll(List<? extends ExpectedSpec> specs) {
        StringJoiner joiner = new StringJoiner(", ", "[", "]");
        for (ExpectedSpec spec : specs) {
            joiner.add(render(spec));
        }
        return joiner.toString();
    }

    /** Display token of a check through this renderer's {@link CheckDisplay}. */
    public String displayCheck(Predicate<?> check) {
        return checkDisplay.display(check);
    }

    /**
     * The simple names {@code ExceptionGroup} and {@code BaseExceptionGroup} stand for the derived type,
     * so an explicit one is written fully qualified.
     */
    private static String groupTypeName(GroupSpec group) {
        Class<? extends Throwable> type = group.exceptionType();
        if (group.hasExplicitType() && (type == ExceptionGroup.class || type == BaseExceptionGroup.class)) {
            return type.getName();
        }
        return Literals.typeName(type);
    }

    private static void addPattern(List<String> parts, Pattern pattern) {
        if (pattern == null) {
            return;
        }
        parts.add("match=" + Literals.quote(pattern.pattern()));
        if (pattern.flags() != 0) {
            parts.add("flags=" + Literals.flagNames(pattern.flags()));
        }
    }
}
