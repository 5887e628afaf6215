package org.pl0vm.config;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;
import java.nio.file.Path;

/**
 * Loads the application configuration, merging, highest precedence first:
 * <ol>
 *   <li>Environment variables</li>
 *   <li>Java system properties ({@code -Dpl0vm.vm.max-steps=10})</li>
 *   <li>A configuration file: an explicit path, or {@code pl0vm.conf} in the working directory</li>
 *   <li>Defaults from {@code reference.conf} on the classpath</li>
 * </ol>
 */
public final class ConfigLoader {

    private static final Logger LOG = LoggerFactory.getLogger(ConfigLoader.class);
    static final String CONFIG_FILE_NAME = "pl0vm.conf";

    /** Root path of the application settings. */
    public static final String ROOT = "pl0vm";

    private ConfigLoader() {}

    /**
     * Loads the configuration, looking for {@code pl0vm.conf} in the working directory.
     * @return The resolved configuration.
     */
    public static Config load() {
        return load(null);
    }

    /**
     * Loads the configuration.
     * @param explicitFile A configuration file to use instead of {@code pl0vm.conf}, or {@code null}.
     * @return The resolved configuration.
     * @throws IllegalArgumentException if the explicit file does not exist.
     */
    public static Config load(Path explicitFile) {
        final Config envConfig = ConfigFactory.systemEnvironment();
        final Config propertiesConfig = ConfigFactory.systemProperties();

        final Config fileConfig;
        if (explicitFile != null) {
            File file = explicitFile.toFile();
            if (!file.isFile()) {
                throw new IllegalArgumentException("Configuration file not found: " + explicitFile);
            }
            LOG.debug("Loading configuration from file: {}", file.getAbsolutePath());
            fileConfig = ConfigFactory.parseFile(file);
        } else {
            File file = new File(CONFIG_FILE_NAME);
            if (file.isFile()) {
                LOG.debug("Loading configuration from file: {}", file.getAbsolutePath());
                fileConfig = ConfigFactory.parseFile(file);
            } else {
                LOG.debug("Configuration file '{}' not found, using defaults.", file.getPath());
                fileConfig = ConfigFactory.empty();
            }
        }

        final Config defaultConfig = ConfigFactory.parseResources("reference.conf");

        return envConfig
                .withFallback(propertiesConfig)
                .withFallback(fileConfig)
                .withFallback(defaultConfig)
                .resolve();
    }

    /**
     * Returns a subtree of the application settings, or an empty config if it is absent.
     * @param config The loaded configuration.
     * @param path The path below {@link #ROOT}, e.g. {@code vm}.
     * @return The subtree.
     */
    public static Config section(Config config, String path) {
        String full = ROOT + "." + path;
        return config.hasPath(full) ? config.getConfig(full) : ConfigFactory.empty();
    }
}
