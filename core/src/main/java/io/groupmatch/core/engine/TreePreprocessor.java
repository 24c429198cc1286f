package io.groupmatch.core.engine;

import io.groupmatch.core.model.ExpectedSpec;
import io.groupmatch.core.model.GroupSpec;
import io.groupmatch.core.model.RaisedException;
import java.util.ArrayList;
import java.util.List;

/**
 * Applies a {@link GroupSpec}'s own options to the raised tree before its children are paired. Only
 * the view of that one spec node changes; nested specs see the original subtrees.
 *
 * <p>
 * Thread-safe and stateless.
 */
final class TreePreprocessor {

    private TreePreprocessor() {}

    /** The child list a group spec pairs against: flattened when the spec asks for it. */
    static List<RaisedException> childrenFor(GroupSpec spec, RaisedException group) {
        return spec.flattenSubgroups() ? flatten(group.children()) : group.children();
    }

    /**
     * Replaces every group in {@code children} by its own children, recursively, keeping the
     * relative order. The result holds no groups.
     */
    static List<RaisedException> flatten(List<RaisedException> children) {
        List<RaisedException> flat = new ArrayList<>(children.size());
        for (RaisedException child : children) {
            if (child.isGroup()) {
                flat.addAll(flatten(child.children()));
            } else {
                flat.add(child);
            }
        }
        return flat;
    }

    /** Whether flattening would change {@code children}. */
    static boolean hasSubgroups(List<RaisedException> children) {
        for (RaisedException child : children) {
            if (child.isGroup()) {
                return true;
            }
        }
        return false;
    }

    /** Whether {@code flatten_subgroups=True} would be a legal option for this spec. */
    static boolean canFlatten(GroupSpec spec) {
        for (ExpectedSpec child : spec.children()) {
            if (child instanceof GroupSpec) {
                return false;
            }
        }
        return true;
    }

    /** Whether {@code allow_unwrapped=True} would be a legal option for this spec. */
    static boolean canUnwrap(GroupSpec spec) {
        return spec.children().size() == 1
                && !(spec.children().get(0) instanceof GroupSpec)
                && spec.pattern() == null
                && spec.check() == null;
    }
}
