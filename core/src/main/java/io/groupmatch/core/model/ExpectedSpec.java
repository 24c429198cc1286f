package io.groupmatch.core.model;

import java.util.ArrayList;
import java.util.List;

/**
 * Expected shape of a raised exception: one node of a spec tree.
 *
 * <p>
 * The hierarchy is sealed; the engine dispatches on the three variants with {@code instanceof}
 * patterns:
 *
 * <ul>
 *   <li>{@link TypeSpec}: the exception is an instance of a type;
 *   <li>{@link PredicateSpec}: optional type, regex searched in the message and notes, and a custom
 *       check;
 *   <li>{@link GroupSpec}: an exception group whose children match a list of nested specs.
 * </ul>
 *
 * <p>
 * Spec trees are immutable and validated at construction; invalid combinations throw {@link
 * io.groupmatch.core.error.SpecConfigurationException}. {@code toString()} returns the canonical
 * form rendered by {@link SpecRenderer}.
 */
public sealed interface ExpectedSpec permits TypeSpec, PredicateSpec, GroupSpec {

    /** Spec matching any instance of {@code type}. */
    static TypeSpec type(Class<? extends Throwable> type) {
        return new TypeSpec(type);
    }

    /** Starts a predicate spec without a type constraint. */
    static PredicateSpec.Builder<Throwable> matcher() {
        return new PredicateSpec.Builder<>(null, Throwable.class);
    }

    /** Starts a predicate spec restricted to {@code type}. */
    static <T extends Throwable> PredicateSpec.Builder<T> matcher(Class<T> type) {
        return new PredicateSpec.Builder<>(type, type);
    }

    /** Starts a group spec. */
    static GroupSpec.Builder group() {
        return GroupSpec.builder();
    }

    /** Group spec with default options expecting the given children. */
    static GroupSpec group(ExpectedSpec... children) {
        return GroupSpec.builder().expect(children).build();
    }

    /** Group spec with default options expecting one instance of each type. */
    @SafeVarargs
    static GroupSpec groupOf(Class<? extends Throwable>... types) {
        List<ExpectedSpec> children = new ArrayList<>(types.length);
        for (Class<? extends Throwable> type : types) {
            children.add(new TypeSpec(type));
        }
        return GroupSpec.builder().expect(children).build();
    }
}
