package com.autoregister.registry;

import java.util.Locale;

/**
 * What a registration does after its creator fails.
 */
public enum FailurePolicy {

    /**
     * Leave the entry empty; the next lookup invokes the creator again.
     */
    RETRY,

    /**
     * Remember the failure; later lookups return empty without invoking the creator.
     */
    STICKY;

    /**
     * Parse a policy name as written in configuration ({@code retry}, {@code sticky}).
     *
     * @param value the configured value
     * @return the policy
     * @throws IllegalArgumentException if the value names no policy
     */
    public static FailurePolicy fromString(String value) {
        if (value == null) {
            throw new IllegalArgumentException("Failure policy cannot be null");
        }
        try {
            return valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown failure policy: " + value, e);
        }
    }
}
