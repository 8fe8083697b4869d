package com.autoregister.registry;

/**
 * Access to the process-wide registry.
 *
 * <p>Prefer passing an explicit {@link AutoRegistry} through the program; this
 * accessor exists for code that has no other way to reach it. The shared
 * registry is built on first use from the classpath configuration, including
 * the files it lists under {@code autoregister.config-files}.</p>
 */
public final class AutoRegistries {

    private AutoRegistries() {}

    /**
     * Get the lazily constructed process-wide registry.
     */
    public static DefaultAutoRegistry shared() {
        return Holder.INSTANCE;
    }

    private static final class Holder {
        static final DefaultAutoRegistry INSTANCE = DefaultAutoRegistry.create();
    }
}
