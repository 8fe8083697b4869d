package com.autoregister.registry;

/**
 * Post-construction hook run once on a freshly created instance.
 *
 * <p>A no-argument member method works as an initializer through a method reference:</p>
 * <pre>{@code
 * registry.registerClass(Logger.class, Logger::start, 1);
 * }</pre>
 *
 * @param <T> the instance type
 */
@FunctionalInterface
public interface InstanceInitializer<T> {

    /**
     * Initialize the instance.
     *
     * @param instance the created instance, never null
     * @throws Exception if initialization fails
     */
    void initialize(T instance) throws Exception;
}
