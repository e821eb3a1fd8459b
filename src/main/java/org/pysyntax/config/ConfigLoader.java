package org.pysyntax.config;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigException;
import com.typesafe.config.ConfigFactory;
import com.typesafe.config.ConfigParseOptions;
import com.typesafe.config.ConfigRenderOptions;
import org.pysyntax.api.PythonSyntax;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Assembles the {@code pysyntax} settings and builds a configured {@link PythonSyntax} from them.
 * <p>
 * Sources, highest precedence first:
 * <ol>
 *   <li>environment overrides such as {@code CONFIG_FORCE_pysyntax_codegen_indent__width=2}</li>
 *   <li>system properties such as {@code -Dpysyntax.codegen.indent-width=2}</li>
 *   <li>a {@code pysyntax.conf} file, if present</li>
 *   <li>the defaults in {@code reference.conf}</li>
 * </ol>
 * Every setting is checked against the type of its default while loading.
 */
public final class ConfigLoader {

    private static final Logger LOG = LoggerFactory.getLogger(ConfigLoader.class);

    /** The file looked up in the working directory by {@link #load()}. */
    public static final String CONFIG_FILE_NAME = "pysyntax.conf";
    static final String ROOT_PATH = "pysyntax";

    private ConfigLoader() {
    }

    /**
     * Loads the settings with {@code pysyntax.conf} in the working directory as the file layer.
     * @return The {@code pysyntax} settings.
     * @see #load(Path)
     */
    public static Config load() {
        return load(Path.of(CONFIG_FILE_NAME));
    }

    /**
     * Merges all sources and keeps only the {@code pysyntax} block.
     * @param configFile The optional configuration file.
     * @return The resolved settings, still rooted at {@code pysyntax}.
     * @throws ConfigException.ValidationFailed if a setting does not have the type of its default.
     * @throws ConfigException.Parse if the file is not valid HOCON.
     */
    public static Config load(Path configFile) {
        Config defaults = ConfigFactory.parseResources(ConfigLoader.class.getClassLoader(), "reference.conf")
                .resolve();
        Config merged = ConfigFactory.systemEnvironmentOverrides()
                .withFallback(ConfigFactory.systemProperties())
                .withFallback(fileLayer(configFile))
                .withFallback(defaults)
                .resolve()
                .withOnlyPath(ROOT_PATH);
        merged.checkValid(defaults, ROOT_PATH);
        return merged;
    }

    /**
     * Loads the settings and builds the service they describe.
     * @param configFile The optional configuration file.
     * @return A syntax service whose code generator uses the loaded formatting.
     */
    public static PythonSyntax loadSyntax(Path configFile) {
        Config settings = load(configFile);
        LOG.debug("Code generation settings: {}",
                settings.getConfig(ROOT_PATH + ".codegen").root().render(ConfigRenderOptions.concise()));
        return PythonSyntax.fromConfig(settings);
    }

    private static Config fileLayer(Path configFile) {
        if (!Files.isRegularFile(configFile)) {
            LOG.info("Configuration file '{}' not found, using defaults", configFile);
            return ConfigFactory.empty();
        }
        LOG.info("Loading configuration from file: {}", configFile.toAbsolutePath());
        return ConfigFactory.parseFile(configFile.toFile(), ConfigParseOptions.defaults().setAllowMissing(false));
    }
}
