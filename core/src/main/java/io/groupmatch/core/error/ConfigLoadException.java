package io.groupmatch.core.error;

/** Thrown when the matcher configuration file is missing, unreadable or holds an invalid value. */
public final class ConfigLoadException extends GroupMatchException {

    private static final long serialVersionUID = 1L;

    public ConfigLoadException(String message) {
        super(message, Phase.CONFIG);
    }

    public ConfigLoadException(String message, Throwable cause) {
        super(message, cause, Phase.CONFIG);
    }
}
