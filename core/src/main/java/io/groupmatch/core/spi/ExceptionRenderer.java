package io.groupmatch.core.spi;

import io.groupmatch.core.model.HasNotes;
import io.groupmatch.core.model.Literals;
import io.groupmatch.core.model.ThrowableGroup;
import java.util.StringJoiner;

/**
 * Renders raised exceptions as text. Two forms are used:
 *
 * <ul>
 *   <li>{@link #display(Throwable)}: the text a {@code match} pattern is searched in (message
 *       followed by notes, newline separated);
 *   <li>{@link #repr(Throwable)}: the compact form used to identify an exception inside a
 *       diagnostic, e.g. {@code IllegalStateException('boom')}.
 * </ul>
 *
 * <p>
 * Every method has a default; override selectively and pass the renderer to the matcher builder.
 */
public interface ExceptionRenderer {

    /** The stock renderer. */
    ExceptionRenderer DEFAULT = new ExceptionRenderer() {};

    /** Simple class name, falling back to the binary name for anonymous classes. */
    default String typeName(Class<?> type) {
        return Literals.typeName(type);
    }

    /** Message (empty when null) followed by each note on its own line. */
    default String display(Throwable exception) {
        String message = exception.getMessage();
        StringBuilder text = new StringBuilder(message == null ? "" : message);
        if (exception instanceof HasNotes noted) {
            for (String note : noted.notes()) {
                text.append('\n').append(note);
            }
        }
        return text.toString();
    }

    /**
     * {@code Type('message')}, {@code Type()} for a null message, and {@code Type('message',
     * [children])} for groups.
     */
    default String repr(Throwable exception) {
        String name = typeName(exception.getClass());
        if (exception instanceof ThrowableGroup group) {
            StringJoiner children = new StringJoiner(", ", "[", "]");
            for (Throwable child : group.exceptions()) {
                children.add(repr(child));
            }
            return name + "(" + Literals.quote(group.getMessage()) + ", " + children + ")";
        }
        String message = exception.getMessage();
        return message == null ? name + "()" : name + "(" + Literals.quote(message) + ")";
    }
}
