package io.groupmatch.core.model;

/**
 * Result of matching a spec tree against a raised exception. A failed match is an ordinary value,
 * not an exception.
 *
 * @param success    whether the exception conforms to the spec
 * @param diagnostic explanation of the mismatch; present iff {@code success} is false
 */
public record MatchOutcome(boolean success, String diagnostic) {

    private static final MatchOutcome MATCHED = new MatchOutcome(true, null);

    public MatchOutcome {
        if (success && diagnostic != null) {
            throw new IllegalArgumentException("a successful outcome carries no diagnostic");
        }
        if (!success && diagnostic == null) {
            throw new IllegalArgumentException("a failed outcome requires a diagnostic");
        }
    }

    public static MatchOutcome matched() {
        return MATCHED;
    }

    public static MatchOutcome failed(String diagnostic) {
        return new MatchOutcome(false, diagnostic);
    }
}
