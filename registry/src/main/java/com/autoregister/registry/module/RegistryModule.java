package com.autoregister.registry.module;

import com.autoregister.registry.AutoRegistry;

/**
 * Contributes registrations to a registry at start-up.
 *
 * <p>Implementations are discovered with {@link java.util.ServiceLoader}: list the
 * implementation class in {@code META-INF/services/com.autoregister.registry.module.RegistryModule}
 * and call {@code DefaultAutoRegistry.loadModules()} from the entry point.</p>
 *
 * <pre>{@code
 * public class StorageModule implements RegistryModule {
 *     @Override
 *     public void register(AutoRegistry registry) {
 *         registry.registerClass(Config.class, 0);
 *         registry.registerClass(DatabaseService.class, DatabaseService::connect, 3);
 *     }
 * }
 * }</pre>
 */
public interface RegistryModule {

    /**
     * Install this module's registrations.
     *
     * @param registry the registry to register into
     */
    void register(AutoRegistry registry);

    /**
     * Name used in diagnostics.
     */
    default String getName() {
        return getClass().getSimpleName();
    }
}
