package com.autoregister.registry;

/**
 * Lifecycle state of a {@link RegistrationEntry}.
 *
 * <pre>
 * EMPTY ──► BUILT ──► INITIALIZED
 *   │
 *   └──► FAILED   (sticky failure policy only)
 * </pre>
 */
public enum EntryState {

    /**
     * Registered, no instance built yet (or the last creation failed).
     */
    EMPTY,

    /**
     * Instance created and cached, initializer not yet completed.
     */
    BUILT,

    /**
     * Instance created and initializer completed. Terminal.
     */
    INITIALIZED,

    /**
     * Creation failed under {@link FailurePolicy#STICKY}. Terminal until re-registered.
     */
    FAILED;

    /**
     * Check if an instance is held in this state.
     *
     * @return true if BUILT or INITIALIZED
     */
    public boolean hasInstance() {
        return this == BUILT || this == INITIALIZED;
    }

    /**
     * Check if transition to the target state is valid from this state.
     *
     * @param target the target state
     * @return true if the transition is valid
     */
    public boolean canTransitionTo(EntryState target) {
        return switch (this) {
            case EMPTY -> target == BUILT || target == FAILED;
            case BUILT -> target == INITIALIZED;
            case INITIALIZED, FAILED -> false;
        };
    }
}
