package org.pysyntax.config;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigException;
import com.typesafe.config.ConfigFactory;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.pysyntax.api.PythonSyntax;
import org.pysyntax.junit.extensions.logging.AllowLog;
import org.pysyntax.junit.extensions.logging.ExpectLog;
import org.pysyntax.junit.extensions.logging.LogLevel;
import org.pysyntax.junit.extensions.logging.LogWatchExtension;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Contains unit tests for the configuration layers of {@link ConfigLoader} and their validation.
 */
@Tag("unit")
@ExtendWith(LogWatchExtension.class)
@AllowLog(level = LogLevel.INFO, loggerPattern = ".*ConfigLoader")
public class ConfigLoaderTest {

    private static final String INDENT_WIDTH = "pysyntax.codegen.indent-width";

    @BeforeEach
    void setUp() {
        System.clearProperty(INDENT_WIDTH);
        ConfigFactory.invalidateCaches();
    }

    @AfterEach
    void tearDown() {
        System.clearProperty(INDENT_WIDTH);
        ConfigFactory.invalidateCaches();
    }

    @Test
    @ExpectLog(level = LogLevel.INFO, loggerPattern = ".*ConfigLoader", messagePattern = "Configuration file .* not found.*")
    void testDefaultsFromReferenceConf(@TempDir Path dir) {
        // Act
        Config config = ConfigLoader.load(dir.resolve("missing.conf"));

        // Assert
        assertThat(config.getInt(INDENT_WIDTH)).isEqualTo(4);
        assertThat(config.getBoolean("pysyntax.codegen.trailing-commas")).isTrue();
        assertThat(config.getInt("pysyntax.codegen.max-line-length")).isEqualTo(88);
        assertThat(config.getString("pysyntax.codegen.quote-style")).isEqualTo("double");
    }

    @Test
    @ExpectLog(level = LogLevel.INFO, loggerPattern = ".*ConfigLoader", messagePattern = "Loading configuration from file: .*")
    void testFileOverridesDefaults(@TempDir Path dir) throws Exception {
        // Arrange
        Path file = dir.resolve("pysyntax.conf");
        Files.writeString(file, "pysyntax.codegen { indent-width = 2 }\n", StandardCharsets.UTF_8);

        // Act
        Config config = ConfigLoader.load(file);

        // Assert
        assertThat(config.getInt(INDENT_WIDTH)).isEqualTo(2);
        assertThat(config.getString("pysyntax.codegen.quote-style")).isEqualTo("double");
    }

    /**
     * A system property wins over the configuration file.
     */
    @Test
    void testSystemPropertyOverridesFile(@TempDir Path dir) throws Exception {
        // Arrange
        Path file = dir.resolve("pysyntax.conf");
        Files.writeString(file, "pysyntax.codegen { indent-width = 2 }\n", StandardCharsets.UTF_8);
        System.setProperty(INDENT_WIDTH, "8");
        ConfigFactory.invalidateCaches();

        // Act
        Config config = ConfigLoader.load(file);

        // Assert
        assertThat(config.getInt(INDENT_WIDTH)).isEqualTo(8);
    }

    @Test
    void testDirectoryIsNotReadAsFile(@TempDir Path dir) {
        Config config = ConfigLoader.load(dir);

        assertThat(config.getInt(INDENT_WIDTH)).isEqualTo(4);
    }

    @Test
    void testOnlyPysyntaxSettingsAreKept(@TempDir Path dir) {
        // Act
        Config config = ConfigLoader.load(dir.resolve("missing.conf"));

        // Assert
        assertThat(config.root().keySet()).containsExactly("pysyntax");
        assertThat(config.hasPath("java.version")).isFalse();
    }

    /**
     * A value whose type differs from its default is rejected while loading.
     */
    @Test
    void testWrongTypeIsRejected(@TempDir Path dir) throws Exception {
        // Arrange
        Path file = dir.resolve("pysyntax.conf");
        Files.writeString(file, "pysyntax.codegen { indent-width = [2, 4] }\n", StandardCharsets.UTF_8);

        // Act & Assert
        assertThatThrownBy(() -> ConfigLoader.load(file))
                .isInstanceOf(ConfigException.ValidationFailed.class)
                .hasMessageContaining("indent-width");
    }

    @Test
    void testMalformedFileIsRejected(@TempDir Path dir) throws Exception {
        // Arrange
        Path file = dir.resolve("pysyntax.conf");
        Files.writeString(file, "pysyntax.codegen { indent-width = \n", StandardCharsets.UTF_8);

        // Act & Assert
        assertThatThrownBy(() -> ConfigLoader.load(file)).isInstanceOf(ConfigException.class);
    }

    /**
     * The loaded settings reach the code generator of the service.
     */
    @Test
    void testLoadSyntaxAppliesFormatting(@TempDir Path dir) throws Exception {
        // Arrange
        Path file = dir.resolve("pysyntax.conf");
        Files.writeString(file, "pysyntax.codegen { indent-width = 2, quote-style = single }\n",
                StandardCharsets.UTF_8);

        // Act
        PythonSyntax syntax = ConfigLoader.loadSyntax(file);
        String generated = syntax.generate(syntax.parse("if a:\n    x = \"b\"\n"));

        // Assert
        assertThat(generated).isEqualTo("if a:\n  x = 'b'\n");
    }
}
