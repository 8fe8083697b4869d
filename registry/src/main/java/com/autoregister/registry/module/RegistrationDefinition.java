package com.autoregister.registry.module;

import com.autoregister.registry.InstanceInitializer;
import com.autoregister.registry.Priority;
import com.autoregister.registry.RegistrationException;
import com.autoregister.registry.RegistrySettings;
import com.typesafe.config.Config;

import java.lang.reflect.InvocationTargetException;
import java.lang.reflect.Method;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * A registration declared in configuration.
 *
 * <p>Definitions in HOCON config look like:</p>
 * <pre>{@code
 * autoregister {
 *   registrations {
 *     logger {
 *       type = "com.example.Logger"
 *       priority = 1
 *       init-method = "start"
 *     }
 *     primary-db {
 *       type = "com.example.DatabaseService"
 *       name = "primary"
 *       priority = 3
 *       init-method = "connect"
 *     }
 *   }
 * }
 * }</pre>
 *
 * <p>The type is default-constructed; {@code init-method}, when present, names a
 * public no-argument method invoked as the initializer.</p>
 */
public final class RegistrationDefinition {

    /** Path of the registrations block in the root configuration. */
    public static final String REGISTRATIONS_PATH = RegistrySettings.ROOT_PATH + ".registrations";

    private final String id;
    private final boolean enabled;
    private final String typeName;
    private final Class<?> type;
    private final String instanceName;
    private final Integer priority;
    private final String initMethod;

    private RegistrationDefinition(String id, boolean enabled, String typeName, Class<?> type,
                                   String instanceName, Integer priority, String initMethod) {
        this.id = id;
        this.enabled = enabled;
        this.typeName = typeName;
        this.type = type;
        this.instanceName = instanceName;
        this.priority = priority;
        this.initMethod = initMethod;
    }

    /**
     * Parse a definition from its configuration block. The type of a disabled
     * definition is not loaded, so it may name a class that is absent.
     *
     * @param id the definition id (key in config)
     * @param config the definition's configuration block
     * @return the parsed definition
     * @throws RegistrationException if the type is missing, or cannot be loaded for an enabled definition
     */
    public static RegistrationDefinition fromConfig(String id, Config config) {
        boolean enabled = !config.hasPath("enabled") || config.getBoolean("enabled");
        if (!config.hasPath("type")) {
            throw new RegistrationException("Registration '" + id + "' has no 'type'");
        }
        String typeName = config.getString("type");
        Class<?> type = enabled ? loadType(id, typeName) : null;
        String name = config.hasPath("name") ? config.getString("name") : null;
        Integer priority = config.hasPath("priority") ? config.getInt("priority") : null;
        String initMethod = config.hasPath("init-method") ? config.getString("init-method") : null;

        return new RegistrationDefinition(id, enabled, typeName, type, name, priority, initMethod);
    }

    /**
     * Load all definitions from the root configuration.
     *
     * @param rootConfig the root configuration
     * @return map of definition id to definition, in configuration order
     */
    public static Map<String, RegistrationDefinition> loadAll(Config rootConfig) {
        Map<String, RegistrationDefinition> result = new LinkedHashMap<>();

        if (!rootConfig.hasPath(REGISTRATIONS_PATH)) {
            return result;
        }

        Config registrations = rootConfig.getConfig(REGISTRATIONS_PATH);

        for (String id : registrations.root().keySet()) {
            try {
                result.put(id, fromConfig(id, registrations.getConfig(id)));
            } catch (RegistrationException e) {
                throw e;
            } catch (Exception e) {
                throw new RegistrationException("Failed to load registration definition: " + id, e);
            }
        }

        return result;
    }

    private static Class<?> loadType(String id, String className) {
        try {
            return Class.forName(className);
        } catch (ClassNotFoundException e) {
            throw new RegistrationException(
                "Registration '" + id + "' names an unknown type: " + className, e);
        }
    }

    /**
     * Resolve {@code init-method} into an initializer.
     *
     * @return the initializer, or null when no init method is configured or the definition is disabled
     * @throws RegistrationException if the method does not exist
     */
    public InstanceInitializer<Object> initializer() {
        if (initMethod == null || type == null) {
            return null;
        }
        Method method;
        try {
            method = type.getMethod(initMethod);
        } catch (NoSuchMethodException e) {
            throw new RegistrationException(
                "Registration '" + id + "': " + type.getName() + " has no public no-arg method '" + initMethod + "'", e);
        }
        return instance -> {
            try {
                method.invoke(instance);
            } catch (InvocationTargetException e) {
                Throwable cause = e.getCause();
                if (cause instanceof Exception) {
                    throw (Exception) cause;
                }
                throw e;
            }
        };
    }

    /**
     * Get the definition id (key in configuration).
     */
    public String getId() {
        return id;
    }

    public boolean isEnabled() {
        return enabled;
    }

    /**
     * Get the configured class name.
     */
    public String getTypeName() {
        return typeName;
    }

    /**
     * Get the loaded type, or null for a disabled definition.
     */
    public Class<?> getType() {
        return type;
    }

    /**
     * Get the instance name, or null for the unnamed registration.
     */
    public String getInstanceName() {
        return instanceName;
    }

    /**
     * Get the configured priority clamped into range, or {@code fallback} when none is configured.
     */
    public int getPriority(int fallback) {
        return Priority.clamp(priority != null ? priority : fallback);
    }

    public String getInitMethod() {
        return initMethod;
    }

    @Override
    public String toString() {
        return "RegistrationDefinition{" +
               "id='" + id + '\'' +
               ", enabled=" + enabled +
               ", type=" + typeName +
               ", name=" + instanceName +
               ", priority=" + priority +
               ", initMethod=" + initMethod +
               '}';
    }
}
