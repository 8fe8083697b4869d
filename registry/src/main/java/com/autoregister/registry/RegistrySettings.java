package com.autoregister.registry;

import com.autoregister.config.ConfigLoader.ConfigurationException;
import com.typesafe.config.Config;

/**
 * Settings for a {@link DefaultAutoRegistry}, read from the {@code autoregister} block.
 *
 * <pre>{@code
 * autoregister {
 *   name = "default"
 *   default-priority = 5
 *   failure-policy = retry      # retry | sticky
 *   strict-types = false
 *   log-registrations = true
 * }
 * }</pre>
 */
public final class RegistrySettings {

    /** Root path of the registry configuration block. */
    public static final String ROOT_PATH = "autoregister";

    private final String name;
    private final int defaultPriority;
    private final FailurePolicy failurePolicy;
    private final boolean strictTypes;
    private final boolean logRegistrations;

    private RegistrySettings(Builder builder) {
        this.name = builder.name;
        this.defaultPriority = Priority.clamp(builder.defaultPriority);
        this.failurePolicy = builder.failurePolicy;
        this.strictTypes = builder.strictTypes;
        this.logRegistrations = builder.logRegistrations;
    }

    /**
     * Create settings from the root configuration. Missing keys keep their defaults.
     *
     * @param root the root config containing an {@code autoregister} block
     * @return the parsed settings
     * @throws ConfigurationException if a value has the wrong type or names no failure policy
     */
    public static RegistrySettings fromConfig(Config root) {
        if (!root.hasPath(ROOT_PATH)) {
            return defaults();
        }
        Config config = root.getConfig(ROOT_PATH);
        Builder builder = builder();
        try {
            if (config.hasPath("name")) {
                builder.name(config.getString("name"));
            }
            if (config.hasPath("default-priority")) {
                builder.defaultPriority(config.getInt("default-priority"));
            }
            if (config.hasPath("failure-policy")) {
                builder.failurePolicy(FailurePolicy.fromString(config.getString("failure-policy")));
            }
            if (config.hasPath("strict-types")) {
                builder.strictTypes(config.getBoolean("strict-types"));
            }
            if (config.hasPath("log-registrations")) {
                builder.logRegistrations(config.getBoolean("log-registrations"));
            }
        } catch (RuntimeException e) {
            throw new ConfigurationException("Invalid " + ROOT_PATH + " configuration: " + e.getMessage(), e);
        }
        return builder.build();
    }

    /**
     * Settings with every default applied.
     */
    public static RegistrySettings defaults() {
        return builder().build();
    }

    public String getName() {
        return name;
    }

    public int getDefaultPriority() {
        return defaultPriority;
    }

    public FailurePolicy getFailurePolicy() {
        return failurePolicy;
    }

    public boolean isStrictTypes() {
        return strictTypes;
    }

    public boolean isLogRegistrations() {
        return logRegistrations;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private String name = "default";
        private int defaultPriority = Priority.DEFAULT;
        private FailurePolicy failurePolicy = FailurePolicy.RETRY;
        private boolean strictTypes = false;
        private boolean logRegistrations = true;

        private Builder() {}

        public Builder name(String name) {
            this.name = name;
            return this;
        }

        public Builder defaultPriority(int defaultPriority) {
            this.defaultPriority = defaultPriority;
            return this;
        }

        public Builder failurePolicy(FailurePolicy failurePolicy) {
            this.failurePolicy = failurePolicy;
            return this;
        }

        public Builder strictTypes(boolean strictTypes) {
            this.strictTypes = strictTypes;
            return this;
        }

        public Builder logRegistrations(boolean logRegistrations) {
            this.logRegistrations = logRegistrations;
            return this;
        }

        public RegistrySettings build() {
            if (name == null || name.isBlank()) {
                throw new IllegalArgumentException("Registry name cannot be blank");
            }
            if (failurePolicy == null) {
                throw new IllegalArgumentException("Failure policy cannot be null");
            }
            return new RegistrySettings(this);
        }
    }

    @Override
    public String toString() {
        return "RegistrySettings{" +
                "name='" + name + '\'' +
                ", defaultPriority=" + defaultPriority +
                ", failurePolicy=" + failurePolicy +
                ", strictTypes=" + strictTypes +
                ", logRegistrations=" + logRegistrations +
                '}';
    }
}
