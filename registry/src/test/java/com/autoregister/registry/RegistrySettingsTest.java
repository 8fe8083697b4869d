package com.autoregister.registry;

import com.autoregister.config.ConfigLoader;
import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for RegistrySettings.
 */
class RegistrySettingsTest {

    @TempDir
    Path tempDir;

    @Test
    void fromConfig_readsReferenceDefaults() {
        RegistrySettings settings = RegistrySettings.fromConfig(ConfigLoader.load());

        assertEquals("default", settings.getName());
        assertEquals(Priority.DEFAULT, settings.getDefaultPriority());
        assertEquals(FailurePolicy.RETRY, settings.getFailurePolicy());
        assertFalse(settings.isStrictTypes());
        assertTrue(settings.isLogRegistrations());
    }

    @Test
    void fromConfig_missingBlockUsesDefaults() {
        RegistrySettings settings = RegistrySettings.fromConfig(ConfigFactory.empty());

        assertEquals("default", settings.getName());
        assertEquals(FailurePolicy.RETRY, settings.getFailurePolicy());
    }

    @Test
    void fromConfig_overridesValues() {
        Config config = ConfigLoader.parse("""
            autoregister {
              name = "services"
              default-priority = 3
              failure-policy = sticky
              strict-types = true
              log-registrations = false
            }
            """);

        RegistrySettings settings = RegistrySettings.fromConfig(config);

        assertEquals("services", settings.getName());
        assertEquals(3, settings.getDefaultPriority());
        assertEquals(FailurePolicy.STICKY, settings.getFailurePolicy());
        assertTrue(settings.isStrictTypes());
        assertFalse(settings.isLogRegistrations());
    }

    @ParameterizedTest
    @CsvSource({
        "-4, 0",
        "0, 0",
        "7, 7",
        "10, 10",
        "25, 10"
    })
    void fromConfig_clampsDefaultPriority(int configured, int expected) {
        Config config = ConfigLoader.parse("autoregister.default-priority = " + configured);

        assertEquals(expected, RegistrySettings.fromConfig(config).getDefaultPriority());
    }

    @Test
    void fromConfig_unknownFailurePolicyThrows() {
        Config config = ConfigLoader.parse("autoregister.failure-policy = sometimes");

        assertThrows(ConfigLoader.ConfigurationException.class, () -> RegistrySettings.fromConfig(config));
    }

    @Test
    void fromConfig_wrongValueTypeThrows() {
        Config config = ConfigLoader.parse("autoregister.default-priority = high");

        assertThrows(ConfigLoader.ConfigurationException.class, () -> RegistrySettings.fromConfig(config));
    }

    @Test
    void builder_rejectsBlankName() {
        assertThrows(IllegalArgumentException.class, () -> RegistrySettings.builder().name(" ").build());
    }

    @Test
    void failurePolicy_parsesCaseInsensitively() {
        assertEquals(FailurePolicy.STICKY, FailurePolicy.fromString(" Sticky "));
        assertEquals(FailurePolicy.RETRY, FailurePolicy.fromString("RETRY"));
        assertThrows(IllegalArgumentException.class, () -> FailurePolicy.fromString(null));
    }

    @Test
    void registryFromConfig_usesSettings() {
        DefaultAutoRegistry registry = DefaultAutoRegistry.create(ConfigLoader.parse("""
            autoregister {
              name = "from-config"
              default-priority = 8
            }
            """));

        assertEquals("from-config", registry.getName());
        assertEquals(8, registry.defaultPriority());
        assertEquals(8, registry.getSettings().getDefaultPriority());
    }

    @Test
    void registryFromConfigFiles_laterFileOverridesEarlier() throws IOException {
        Path base = tempDir.resolve("registry.conf");
        Files.writeString(base, """
            autoregister {
              name = "from-file"
              default-priority = 2
              failure-policy = sticky
            }
            """);
        Path override = tempDir.resolve("override.conf");
        Files.writeString(override, "autoregister.default-priority = 9");

        DefaultAutoRegistry registry = DefaultAutoRegistry.create(base.toString(), override.toString());

        assertEquals("from-file", registry.getName());
        assertEquals(9, registry.defaultPriority());
        assertEquals(FailurePolicy.STICKY, registry.getSettings().getFailurePolicy());
    }

    @Test
    void registryFromConfigFiles_registrationsComeFromFile() throws IOException {
        Path file = tempDir.resolve("registrations.conf");
        Files.writeString(file, """
            autoregister.registrations {
              marker { type = "%s", priority = 1 }
            }
            """.formatted(Marker.class.getName()));

        DefaultAutoRegistry registry = DefaultAutoRegistry.create(file.toString());

        assertEquals(1, registry.loadRegistrationsFromConfig());
        assertEquals(1, registry.executePriorInits(1));
        assertTrue(registry.hasInstance(Marker.class));
    }

    @Test
    void registryFromMalformedFile_throwsConfigurationException() throws IOException {
        Path broken = tempDir.resolve("broken.conf");
        Files.writeString(broken, "autoregister { name = ");

        assertThrows(ConfigLoader.ConfigurationException.class,
                () -> DefaultAutoRegistry.create(broken.toString()));
    }

    static class Marker { }
}
