package com.autoregister.config;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigException;
import com.typesafe.config.ConfigFactory;
import com.typesafe.config.ConfigParseOptions;
import com.typesafe.config.ConfigResolveOptions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * Builds the configuration a registry is created from.
 *
 * <p>Layers, later overriding earlier:</p>
 * <ol>
 *   <li>reference.conf (classpath defaults)</li>
 *   <li>application.conf (classpath)</li>
 *   <li>files listed under {@value #CONFIG_FILES_PATH}</li>
 *   <li>files passed to {@link #load(String...)} or {@link #load(List)}</li>
 *   <li>system properties</li>
 * </ol>
 *
 * <p>A path is read from the filesystem when such a file exists and from the
 * classpath otherwise. A path found in neither place is skipped with a warning.</p>
 *
 * <pre>{@code
 * // application.conf
 * autoregister.config-files = ["registrations/storage.conf"]
 *
 * Config config = ConfigLoader.load("/etc/app/overrides.conf");
 * DefaultAutoRegistry registry = DefaultAutoRegistry.create(config);
 * }</pre>
 */
public final class ConfigLoader {

    private static final Logger log = LoggerFactory.getLogger(ConfigLoader.class);

    /** Config files layered over application.conf, in order. */
    public static final String CONFIG_FILES_PATH = "autoregister.config-files";

    private ConfigLoader() {}

    /**
     * Load the classpath configuration plus any files it lists.
     */
    public static Config load() {
        return load(Collections.emptyList());
    }

    /**
     * Load the classpath configuration with additional config files.
     *
     * @param configFiles paths to config files, later overriding earlier
     * @return merged, resolved configuration
     */
    public static Config load(String... configFiles) {
        return load(Arrays.asList(configFiles));
    }

    /**
     * Load the classpath configuration with additional config files.
     *
     * @param configFiles paths to config files, later overriding earlier
     * @return merged, resolved configuration
     * @throws ConfigurationException if a file cannot be parsed or the result cannot be resolved
     */
    public static Config load(List<String> configFiles) {
        Config base = ConfigFactory.defaultApplication().withFallback(ConfigFactory.defaultReference());
        Config overrides = ConfigFactory.systemProperties();

        List<String> paths = new ArrayList<>(listedFiles(overrides.withFallback(base)));
        paths.addAll(configFiles);

        Config merged = base;
        for (String path : paths) {
            Config layer = loadConfigFile(path);
            if (layer != null) {
                merged = layer.withFallback(merged);
                log.info("Loaded config file: {}", path);
            }
        }

        try {
            return overrides.withFallback(merged).resolve();
        } catch (ConfigException e) {
            throw new ConfigurationException("Failed to resolve configuration", e);
        }
    }

    /**
     * Parse a HOCON string on top of the classpath defaults.
     * Handy for tests and for embedding small registrations inline.
     *
     * @param hocon the configuration text
     * @return the resolved configuration
     */
    public static Config parse(String hocon) {
        try {
            return ConfigFactory.parseString(hocon)
                    .withFallback(ConfigFactory.defaultReference())
                    .resolve();
        } catch (ConfigException e) {
            throw new ConfigurationException("Failed to parse inline config", e);
        }
    }

    private static List<String> listedFiles(Config config) {
        Config resolved = config.resolve(ConfigResolveOptions.defaults().setAllowUnresolved(true));
        if (!resolved.hasPath(CONFIG_FILES_PATH)) {
            return Collections.emptyList();
        }
        try {
            return resolved.getStringList(CONFIG_FILES_PATH);
        } catch (ConfigException e) {
            throw new ConfigurationException("'" + CONFIG_FILES_PATH + "' must be a list of paths", e);
        }
    }

    private static Config loadConfigFile(String path) {
        File file = new File(path);
        try {
            if (file.exists()) {
                return ConfigFactory.parseFile(file, ConfigParseOptions.defaults());
            }
            Config classpathConfig = ConfigFactory.parseResources(path, ConfigParseOptions.defaults());
            if (!classpathConfig.isEmpty()) {
                return classpathConfig;
            }
        } catch (ConfigException e) {
            log.error("Failed to parse config file: {}", path, e);
            throw new ConfigurationException("Failed to parse config file: " + path, e);
        }
        log.warn("Config file not found: {}", path);
        return null;
    }

    /**
     * Thrown when configuration cannot be loaded or holds invalid values.
     */
    public static class ConfigurationException extends RuntimeException {
        public ConfigurationException(String message) {
            super(message);
        }

        public ConfigurationException(String message, Throwable cause) {
            super(message, cause);
        }
    }
}
