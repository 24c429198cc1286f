package io.groupmatch.core.error;

/**
 * Thrown when a canonical spec expression or an expectation document cannot be read: bad syntax,
 * unknown keys, unresolvable type or check names. Carries the {@code source} (file path or
 * {@code "<expression>"}) and, for expressions, the character {@code position} of the problem.
 */
public final class SpecParseException extends GroupMatchException {

    private static final long serialVersionUID = 1L;

    private final String source;
    private final int position;

    public SpecParseException(String message, String source) {
        this(message, source, -1);
    }

    public SpecParseException(String message, String source, int position) {
        super(message, Phase.PARSE);
        this.source = source;
        this.position = position;
    }

    public SpecParseException(String message, Throwable cause, String source) {
        super(message, cause, Phase.PARSE);
        this.source = source;
        this.position = -1;
    }

    /** The file path or resource identifier that caused the error. */
    public String source() {
        return source;
    }

    /** Zero-based offset into the parsed expression, or {@code -1} when not applicable. */
    public int position() {
        return position;
    }
}
