package io.groupmatch.core.model;

import io.groupmatch.core.spi.ExceptionRenderer;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Read-only snapshot of a raised exception tree, as seen by the matcher.
 *
 * <p>
 * {@code children} is non-null iff the exception is a {@link ThrowableGroup}. {@code baseOnly}
 * is true when the exception is not an {@link Exception} or when any descendant is base-only.
 *
 * @param exception the raised throwable, handed to check predicates
 * @param typeName  simple type name used in reasons
 * @param display   message and notes, searched by {@code match} patterns
 * @param repr      compact form identifying the exception in reports
 * @param children  group children in original order, or {@code null} for a lone exception
 * @param baseOnly  base-ness, propagated upward
 */
public record RaisedException(
        Throwable exception,
        String typeName,
        String display,
        String repr,
        List<RaisedException> children,
        boolean baseOnly) {

    public RaisedException {
        Objects.requireNonNull(exception, "exception must not be null");
        Objects.requireNonNull(typeName, "typeName must not be null");
        Objects.requireNonNull(display, "display must not be null");
        Objects.requireNonNull(repr, "repr must not be null");
        children = children == null ? null : List.copyOf(children);
    }

    /** Snapshot with the {@link ExceptionRenderer#DEFAULT default renderer}. */
    public static RaisedException snapshot(Throwable exception) {
        return snapshot(exception, ExceptionRenderer.DEFAULT);
    }

    /** Snapshots {@code exception} and, for groups, its whole subtree. */
    public static RaisedException snapshot(Throwable exception, ExceptionRenderer renderer) {
        Objects.requireNonNull(exception, "exception must not be null");
        Objects.requireNonNull(renderer, "renderer must not be null");
        List<RaisedException> children = null;
        boolean baseOnly = !(exception instanceof Exception);
        if (exception instanceof ThrowableGroup group) {
            children = new ArrayList<>(group.exceptions().size());
            for (Throwable child : group.exceptions()) {
                RaisedException node = snapshot(child, renderer);
                baseOnly |= node.baseOnly();
                children.add(node);
            }
        }
        return new RaisedException(
                exception,
                renderer.typeName(exception.getClass()),
                renderer.display(exception),
                renderer.repr(exception),
                children,
                baseOnly);
    }

    /** Whether this node is an exception group. */
    public boolean isGroup() {
        return children != null;
    }

    @Override
    public String toString() {
        return repr;
    }
}
