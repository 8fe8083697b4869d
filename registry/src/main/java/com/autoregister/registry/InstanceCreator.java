package com.autoregister.registry;

import java.lang.reflect.Constructor;
import java.lang.reflect.InvocationTargetException;

/**
 * Parameterless factory for registry instances.
 *
 * <p>Example:</p>
 * <pre>{@code
 * InstanceCreator<DatabaseService> creator = () -> new DatabaseService(config, logger);
 * registry.registerCreator(DatabaseService.class, creator);
 * }</pre>
 *
 * @param <T> the instance type to create
 */
@FunctionalInterface
public interface InstanceCreator<T> {

    /**
     * Create a fresh instance.
     *
     * @return the created instance; {@code null} is treated as a failed creation
     * @throws Exception if creation fails
     */
    T create() throws Exception;

    /**
     * Creator that invokes the no-argument constructor of {@code type}.
     *
     * <p>A failing static initializer of {@code type} (and the
     * {@link NoClassDefFoundError} seen on every later attempt) is reported as an
     * {@link InstantiationException}, so it counts as an ordinary creation failure.</p>
     *
     * @param type the class to construct
     * @param <T> the instance type
     * @return a creator for default construction
     */
    static <T> InstanceCreator<T> constructing(Class<T> type) {
        return () -> {
            Constructor<T> constructor = type.getDeclaredConstructor();
            constructor.setAccessible(true);
            try {
                return constructor.newInstance();
            } catch (InvocationTargetException e) {
                Throwable cause = e.getCause();
                if (cause instanceof Exception) {
                    throw (Exception) cause;
                }
                throw e;
            } catch (LinkageError e) {
                InstantiationException failure =
                        new InstantiationException("Cannot initialize " + type.getName() + ": " + e);
                failure.initCause(e);
                throw failure;
            }
        };
    }
}
