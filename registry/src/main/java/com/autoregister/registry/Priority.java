package com.autoregister.registry;

/**
 * Priority range for batch initialization. Lower values run earlier.
 */
public final class Priority {

    /** Earliest priority. */
    public static final int MIN = 0;

    /** Latest priority. */
    public static final int MAX = 10;

    /** Priority used when a registration does not name one. */
    public static final int DEFAULT = 5;

    private Priority() {}

    /**
     * Clamp a priority into {@code [MIN, MAX]}.
     *
     * @param priority the requested priority
     * @return the effective priority
     */
    public static int clamp(int priority) {
        return Math.max(MIN, Math.min(MAX, priority));
    }
}
