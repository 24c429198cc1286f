package io.groupmatch.core.error;

/**
 * Abstract base for all group-match exceptions. Never thrown directly: use {@link
 * SpecConfigurationException}, {@link SpecParseException} or {@link ConfigLoadException}.
 *
 * <p>
 * A failed match is not an exception; it is a negative {@code MatchOutcome}.
 */
public abstract class GroupMatchException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    /** Phase in which the error occurred. */
    public enum Phase {
        CONSTRUCTION,
        PARSE,
        CONFIG
    }

    private final Phase phase;

    protected GroupMatchException(String message, Phase phase) {
        super(message);
        this.phase = phase;
    }

    protected GroupMatchException(String message, Throwable cause, Phase phase) {
        super(message, cause);
        this.phase = phase;
    }

    /** Human-readable error description (alias for {@link #getMessage()}). */
    public String detail() {
        return getMessage();
    }

    /** The phase in which the error occurred. */
    public Phase phase() {
        return phase;
    }
}
