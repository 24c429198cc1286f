package io.groupmatch.core.error;

/**
 * Thrown synchronously while constructing an expected spec whose options contradict each other
 * (for example {@code allow_unwrapped} with several children). Never thrown by matching.
 */
public final class SpecConfigurationException extends GroupMatchException {

    private static final long serialVersionUID = 1L;

    public SpecConfigurationException(String message) {
        super(message, Phase.CONSTRUCTION);
    }

    public SpecConfigurationException(String message, Throwable cause) {
        super(message, cause, Phase.CONSTRUCTION);
    }
}
