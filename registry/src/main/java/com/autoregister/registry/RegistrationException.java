package com.autoregister.registry;

/**
 * Thrown when a registration cannot be installed, such as a config-driven
 * definition naming a class or init method that does not exist.
 */
public class RegistrationException extends RuntimeException {

    public RegistrationException(String message) {
        super(message);
    }

    public RegistrationException(String message, Throwable cause) {
        super(message, cause);
    }
}
