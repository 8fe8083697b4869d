package com.autoregister.config;

import com.typesafe.config.Config;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for ConfigLoader.
 */
class ConfigLoaderTest {

    @TempDir
    Path tempDir;

    @Test
    void load_layersApplicationAndListedFilesOverReference() {
        Config config = ConfigLoader.load();

        assertEquals(1, config.getInt("loader-test.level"));
        assertEquals("application", config.getString("loader-test.source"));
        // listed.conf is named by autoregister.config-files in application.conf
        assertTrue(config.getBoolean("loader-test.listed"));
        assertEquals("listed-name", config.getString("loader-test.name"));
        assertEquals(List.of("listed.conf"), config.getStringList(ConfigLoader.CONFIG_FILES_PATH));
    }

    @Test
    void load_explicitFileOverridesListedFiles() throws IOException {
        Path configFile = tempDir.resolve("custom.conf");
        Files.writeString(configFile, """
            loader-test {
              name = "custom"
              level = 5
            }
            """);

        Config config = ConfigLoader.load(configFile.toString());

        assertEquals("custom", config.getString("loader-test.name"));
        assertEquals(5, config.getInt("loader-test.level"));
        assertTrue(config.getBoolean("loader-test.listed"));
        assertEquals("application", config.getString("loader-test.source"));
    }

    @Test
    void load_laterFileOverridesEarlier() throws IOException {
        Path baseConfig = tempDir.resolve("base.conf");
        Files.writeString(baseConfig, """
            loader-test {
              name = "base"
              level = 2
            }
            """);

        Path overrideConfig = tempDir.resolve("override.conf");
        Files.writeString(overrideConfig, "loader-test.level = 3");

        Config config = ConfigLoader.load(List.of(baseConfig.toString(), overrideConfig.toString()));

        assertEquals("base", config.getString("loader-test.name"));
        assertEquals(3, config.getInt("loader-test.level"));
    }

    @Test
    void load_fallsBackToClasspathResource() {
        Config config = ConfigLoader.load("classpath-override.conf");

        assertEquals(7, config.getInt("loader-test.level"));
    }

    @Test
    void load_missingFileIsSkipped() {
        Config config = ConfigLoader.load(tempDir.resolve("does-not-exist.conf").toString());

        assertEquals("listed-name", config.getString("loader-test.name"));
    }

    @Test
    void load_substitutionAcrossLayersIsResolved() throws IOException {
        Path configFile = tempDir.resolve("substitution.conf");
        Files.writeString(configFile, "loader-test.derived = ${loader-test.name}\"-derived\"");

        Config config = ConfigLoader.load(configFile.toString());

        assertEquals("listed-name-derived", config.getString("loader-test.derived"));
    }

    @Test
    void load_malformedFileThrows() throws IOException {
        Path broken = tempDir.resolve("broken.conf");
        Files.writeString(broken, "loader-test { name = ");

        assertThrows(ConfigLoader.ConfigurationException.class,
                () -> ConfigLoader.load(broken.toString()));
    }

    @Test
    void load_unresolvedSubstitutionThrows() throws IOException {
        Path configFile = tempDir.resolve("unresolved.conf");
        Files.writeString(configFile, "holder.value = ${missing.path}");

        assertThrows(ConfigLoader.ConfigurationException.class,
                () -> ConfigLoader.load(configFile.toString()));
    }

    @Test
    void parseInlineConfig_fallsBackToReference() {
        Config config = ConfigLoader.parse("loader-test.level = 9");

        assertEquals(9, config.getInt("loader-test.level"));
        assertEquals("reference-name", config.getString("loader-test.name"));
        assertFalse(config.hasPath("loader-test.listed"));
    }

    @Test
    void parseInlineConfig_malformedThrows() {
        assertThrows(ConfigLoader.ConfigurationException.class,
                () -> ConfigLoader.parse("broken = {"));
    }
}
