package com.autoregister.registry;

import java.io.PrintStream;
import java.util.Optional;
import java.util.Set;

/**
 * Type-keyed directory of lazily created singletons with priority-ordered initialization.
 *
 * <p>The registry provides a central point for:</p>
 * <ul>
 *   <li>Registering creators (and optional initializers) by type, optionally qualified by an instance name</li>
 *   <li>Creating and retrieving instances on first lookup</li>
 *   <li>Eagerly building and initializing entries in ascending priority order</li>
 * </ul>
 *
 * <p>Example usage:</p>
 * <pre>{@code
 * AutoRegistry registry = DefaultAutoRegistry.create();
 *
 * registry.registerClass(Logger.class, Logger::start, 1);
 * registry.registerCreator(DatabaseService.class,
 *     () -> new DatabaseService(settings),
 *     db -> db.connect(registry.getInstance(Logger.class).orElseThrow()),
 *     3);
 * registry.registerNamedClass("replica", Connection.class);
 *
 * registry.executeAllInits();
 *
 * Optional<Connection> replica = registry.getInstance("replica", Connection.class);
 * }</pre>
 *
 * <p>All operations are thread-safe. Client creators and initializers never run
 * while the registry's own lock is held, so they may call back into the registry.</p>
 */
public interface AutoRegistry {

    // ==================== Registration ====================

    /**
     * Register a creator and optional initializer for a type.
     * All convenience overloads funnel into this method.
     *
     * <p>If the key is already registered, a warning is logged and the previous
     * entry, including any instance it built, is replaced.</p>
     *
     * @param type the registered type; its identity forms the key
     * @param name the instance name, or null for the unnamed registration
     * @param creator parameterless factory
     * @param initializer post-construction hook, or null
     * @param priority batch priority, clamped into {@code [0, 10]}
     * @param <T> the instance type
     * @throws IllegalArgumentException if the name is empty or contains {@link RegistryKeys#SEPARATOR}
     */
    <T> void register(Class<T> type, String name, InstanceCreator<? extends T> creator,
                      InstanceInitializer<? super T> initializer, int priority);

    /**
     * Priority applied by overloads that do not take one.
     */
    int defaultPriority();

    default <T> void registerClass(Class<T> type) {
        registerClass(type, defaultPriority());
    }

    /**
     * Register default construction of {@code type}.
     */
    default <T> void registerClass(Class<T> type, int priority) {
        register(type, null, InstanceCreator.constructing(type), null, priority);
    }

    default <T> void registerClass(Class<T> type, InstanceInitializer<? super T> initializer) {
        registerClass(type, initializer, defaultPriority());
    }

    /**
     * Register default construction of {@code type} followed by {@code initializer}.
     * A no-arg member method can be passed as a method reference ({@code Logger::start}).
     */
    default <T> void registerClass(Class<T> type, InstanceInitializer<? super T> initializer, int priority) {
        register(type, null, InstanceCreator.constructing(type), initializer, priority);
    }

    default <T> void registerNamedClass(String name, Class<T> type) {
        registerNamedClass(name, type, defaultPriority());
    }

    default <T> void registerNamedClass(String name, Class<T> type, int priority) {
        register(type, name, InstanceCreator.constructing(type), null, priority);
    }

    default <T> void registerNamedClass(String name, Class<T> type, InstanceInitializer<? super T> initializer) {
        registerNamedClass(name, type, initializer, defaultPriority());
    }

    default <T> void registerNamedClass(String name, Class<T> type, InstanceInitializer<? super T> initializer,
                                        int priority) {
        register(type, name, InstanceCreator.constructing(type), initializer, priority);
    }

    default <T> void registerCreator(Class<T> type, InstanceCreator<? extends T> creator) {
        registerCreator(type, creator, defaultPriority());
    }

    /**
     * Register a captured factory for {@code type}.
     */
    default <T> void registerCreator(Class<T> type, InstanceCreator<? extends T> creator, int priority) {
        register(type, null, creator, null, priority);
    }

    default <T> void registerCreator(Class<T> type, InstanceCreator<? extends T> creator,
                                     InstanceInitializer<? super T> initializer) {
        registerCreator(type, creator, initializer, defaultPriority());
    }

    default <T> void registerCreator(Class<T> type, InstanceCreator<? extends T> creator,
                                     InstanceInitializer<? super T> initializer, int priority) {
        register(type, null, creator, initializer, priority);
    }

    default <T> void registerNamedCreator(String name, Class<T> type, InstanceCreator<? extends T> creator) {
        registerNamedCreator(name, type, creator, defaultPriority());
    }

    default <T> void registerNamedCreator(String name, Class<T> type, InstanceCreator<? extends T> creator,
                                          int priority) {
        register(type, name, creator, null, priority);
    }

    default <T> void registerNamedCreator(String name, Class<T> type, InstanceCreator<? extends T> creator,
                                          InstanceInitializer<? super T> initializer) {
        registerNamedCreator(name, type, creator, initializer, defaultPriority());
    }

    default <T> void registerNamedCreator(String name, Class<T> type, InstanceCreator<? extends T> creator,
                                          InstanceInitializer<? super T> initializer, int priority) {
        register(type, name, creator, initializer, priority);
    }

    // ==================== Lookup ====================

    /**
     * Get the unnamed instance of a type, creating and initializing it on first access.
     *
     * @param type the registered type
     * @param <T> the instance type
     * @return the initialized instance, or empty if not registered or if creation
     *         or initialization failed
     */
    default <T> Optional<T> getInstance(Class<T> type) {
        return getInstance(null, type);
    }

    /**
     * Get a named instance of a type, creating and initializing it on first access.
     *
     * @param name the instance name, or null for the unnamed registration
     * @param type the registered type
     * @param <T> the instance type
     * @return the initialized instance, or empty if not registered, if the name is
     *         empty or contains {@link RegistryKeys#SEPARATOR}, or if creation or
     *         initialization failed
     * @throws ClassCastException if the stored instance is not a {@code type} and strict types are off
     */
    <T> Optional<T> getInstance(String name, Class<T> type);

    default <T> Optional<T> createTransient(Class<T> type) {
        return createTransient(null, type);
    }

    /**
     * Run the registered creator and initializer for a fresh instance that is
     * neither cached nor counted. The registered entry is not touched.
     */
    <T> Optional<T> createTransient(String name, Class<T> type);

    /**
     * Check if the unnamed registration of a type exists.
     */
    default boolean has(Class<?> type) {
        return has(null, type);
    }

    /**
     * Check if a registration exists for the type and instance name. A name that
     * registration would reject is reported as absent.
     */
    boolean has(String name, Class<?> type);

    default boolean hasInstance(Class<?> type) {
        return hasInstance(null, type);
    }

    /**
     * Check if the registration exists and has built its instance.
     */
    boolean hasInstance(String name, Class<?> type);

    default Optional<EntryState> entryState(Class<?> type) {
        return entryState(null, type);
    }

    /**
     * Get the lifecycle state of a registration.
     */
    Optional<EntryState> entryState(String name, Class<?> type);

    // ==================== Batch initialization ====================

    /**
     * Build and initialize every entry. Equivalent to {@code executePriorInits(Priority.MAX)}.
     *
     * @return number of entries initialized after the pass
     */
    default int executeAllInits() {
        return executePriorInits(Priority.MAX);
    }

    /**
     * Build, then initialize, every entry whose priority is at most {@code maxPriority},
     * in ascending priority order. All creators in the slice run before any initializer.
     * Failures are logged per entry and never abort the batch.
     *
     * @param maxPriority the highest priority to include, clamped into range
     * @return number of entries in the slice that are initialized after the pass
     */
    int executePriorInits(int maxPriority);

    /**
     * Same as {@link #executePriorInits(int)} restricted to one priority.
     */
    int executeInitsAtPriority(int priority);

    // ==================== Diagnostics ====================

    int getRegisteredCount();

    /**
     * Number of entries holding a built instance.
     */
    int getInstanceCount();

    /**
     * Snapshot of the registered keys.
     */
    Set<String> getRegisteredKeys();

    void dumpEntries(PrintStream out);

    void dumpInstances(PrintStream out);

    /**
     * Discard every entry and cached instance.
     */
    void clear();
}
