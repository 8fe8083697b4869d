package com.autoregister.registry;

import java.util.Objects;

/**
 * Key derivation for registry entries.
 *
 * <p>An unnamed registration is keyed by the binary class name
 * ({@code com.example.Logger}); a named one appends the separator and the
 * instance name ({@code com.example.Conn#primary}). Class names never contain
 * {@link #SEPARATOR}, so the two forms cannot collide.</p>
 */
public final class RegistryKeys {

    /** Reserved separator between type identity and instance name. */
    public static final char SEPARATOR = '#';

    private RegistryKeys() {}

    /**
     * Key for the default (unnamed) registration of a type.
     *
     * @param type the registered type
     * @return the key
     */
    public static String of(Class<?> type) {
        return of(type, null);
    }

    /**
     * Key for a registration of a type, optionally qualified by an instance name.
     *
     * @param type the registered type
     * @param name the instance name, or null for the unnamed registration
     * @return the key
     * @throws IllegalArgumentException if the name is empty or contains {@link #SEPARATOR}
     */
    public static String of(Class<?> type, String name) {
        Objects.requireNonNull(type, "type");
        if (name == null) {
            return type.getName();
        }
        validateName(name);
        return type.getName() + SEPARATOR + name;
    }

    /**
     * Check whether a key addresses a named registration.
     */
    public static boolean isNamed(String key) {
        return key.indexOf(SEPARATOR) >= 0;
    }

    private static void validateName(String name) {
        if (name.isEmpty()) {
            throw new IllegalArgumentException("Instance name cannot be empty");
        }
        if (name.indexOf(SEPARATOR) >= 0) {
            throw new IllegalArgumentException(
                "Instance name cannot contain '" + SEPARATOR + "': " + name);
        }
    }
}
