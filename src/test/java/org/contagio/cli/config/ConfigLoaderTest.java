package org.contagio.cli.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.File;
import java.net.URISyntaxException;
import java.net.URL;
import java.util.ArrayList;
import java.util.List;

import org.contagio.junit.extensions.logging.LogWatchExtension;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;

/**
 * Unit tests for {@link ConfigLoader} to verify the configuration priority hierarchy:
 * <ol>
 *   <li>System Properties (highest priority)</li>
 *   <li>Environment Variables</li>
 *   <li>Configuration File</li>
 *   <li>Default reference configuration (lowest priority)</li>
 * </ol>
 */
@Tag("unit")
@ExtendWith(LogWatchExtension.class)
class ConfigLoaderTest {

    @BeforeEach
    void setUp() {
        ConfigFactory.invalidateCaches();
    }

    @AfterEach
    void tearDown() {
        System.clearProperty("test.value");
        System.clearProperty("test.priority");
        System.clearProperty("test.nested.setting");
        System.clearProperty("contagio.experiment.seed");
        ConfigFactory.invalidateCaches();
    }

    @Test
    @DisplayName("loadFromFile should merge the file over the reference defaults")
    void loadFromFile_shouldLoadConfigFileWithDefaults() {
        Config config = ConfigLoader.loadFromFile(testResource("test-config.conf"));

        assertEquals("file-value", config.getString("test.value"));
        assertEquals("file-nested", config.getString("test.nested.setting"));
        assertEquals(3, config.getInt("contagio.experiment.replicates"));
        assertEquals(1000, config.getLong("contagio.experiment.max-steps"));
        assertEquals("success-biased", config.getString("contagio.model.learning.strategy"));
    }

    @Test
    @DisplayName("System property should override file configuration")
    void loadFromFile_systemPropertyShouldOverrideFileConfig() {
        System.setProperty("test.value", "system-value");
        System.setProperty("test.nested.setting", "system-nested");
        ConfigFactory.invalidateCaches();

        Config config = ConfigLoader.loadFromFile(testResource("test-config.conf"));

        assertEquals("system-value", config.getString("test.value"));
        assertEquals("system-nested", config.getString("test.nested.setting"));
        assertEquals("file-priority", config.getString("test.priority"));
    }

    @Test
    @DisplayName("System property should override reference defaults")
    void loadDefaults_systemPropertyShouldOverrideReference() {
        System.setProperty("contagio.experiment.seed", "99");
        ConfigFactory.invalidateCaches();

        Config config = ConfigLoader.loadDefaults();

        assertEquals(99L, config.getLong("contagio.experiment.seed"));
        assertEquals(10, config.getInt("contagio.experiment.replicates"));
        assertEquals("PLAIN", config.getString("logging.format"));
    }

    @Test
    @DisplayName("Substitutions should resolve across the file and the reference layer")
    void loadFromFile_shouldResolveConfigurationReferences() {
        System.setProperty("test.priority", "system-override");
        ConfigFactory.invalidateCaches();

        Config config = ConfigLoader.loadFromFile(testResource("references-config.conf"));

        assertEquals("base-suffix", config.getString("test.referenced-value"));
        assertEquals("system-override", config.getString("test.priority"));
        assertEquals(1000, config.getInt("contagio.model.network.size"));
    }

    @Test
    @DisplayName("An explicit file takes precedence and is reported")
    void resolve_shouldUseExplicitFile() {
        List<String> messages = new ArrayList<>();
        File file = testResource("test-config.conf");

        Config config = ConfigLoader.resolve(file, (level, message) -> messages.add(level + " " + message));

        assertEquals(3, config.getInt("contagio.experiment.replicates"));
        assertEquals(1, messages.size());
        assertTrue(messages.get(0).startsWith("INFO Using configuration file specified via --config"));
    }

    @Test
    @DisplayName("A missing explicit file is rejected")
    void resolve_shouldRejectMissingExplicitFile() {
        File missing = new File("does-not-exist/contagio.conf");

        IllegalArgumentException e = assertThrows(IllegalArgumentException.class,
                () -> ConfigLoader.resolve(missing, (level, message) -> { }));

        assertTrue(e.getMessage().contains("Configuration file not found"));
    }

    @Test
    @DisplayName("The logging format maps to the Logback appender name")
    void formatProperty_shouldSelectAppender() {
        assertEquals("STDOUT_PLAIN", LoggingConfigurator.formatProperty(ConfigFactory.parseString("logging.format = plain")));
        assertEquals("STDOUT", LoggingConfigurator.formatProperty(ConfigFactory.parseString("logging.format = COLOR")));
        assertEquals("STDOUT_PLAIN", LoggingConfigurator.formatProperty(ConfigFactory.empty()));
    }

    private File testResource(final String name) {
        final URL url = getClass().getResource(name);
        assertNotNull(url, "Test resource not found: " + name);
        try {
            return new File(url.toURI());
        } catch (URISyntaxException e) {
            throw new IllegalArgumentException("Invalid test resource URI: " + url, e);
        }
    }
}
