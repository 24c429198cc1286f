package io.groupmatch.core.config;

import java.util.Locale;

/** What the matcher does when a caller-supplied check throws a {@link RuntimeException}. */
public enum CheckFailurePolicy {
    /** Record {@code check raised <repr>} as the pair's mismatch reason and keep matching. */
    RECORD,
    /** Rethrow, aborting the whole match. */
    PROPAGATE;

    /**
     * Parses {@code record} / {@code propagate}, case-insensitively.
     *
     * @throws IllegalArgumentException for any other value
     */
    public static CheckFailurePolicy parse(String value) {
        String normalized = value.trim().toUpperCase(Locale.ROOT).replace('-', '_');
        for (CheckFailurePolicy policy : values()) {
            if (policy.name().equals(normalized)) {
                return policy;
            }
        }
        throw new IllegalArgumentException(
                "Unknown check failure policy '" + value + "', expected 'record' or 'propagate'");
    }
}
