package org.eden.config;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;

/**
 * Loads the lexer configuration from its layered sources.
 * The first source that defines a setting wins:
 * <ol>
 *   <li>Environment variables</li>
 *   <li>JVM system properties (e.g., {@code -Deden.lexer.location=true})</li>
 *   <li>The configuration file ({@code eden.conf} in the working directory unless given)</li>
 *   <li>{@code reference.conf} on the classpath</li>
 * </ol>
 */
public final class ConfigLoader {

    private static final Logger LOG = LoggerFactory.getLogger(ConfigLoader.class);
    /** Name of the configuration file looked up in the working directory. */
    public static final String CONFIG_FILE_NAME = "eden.conf";

    private ConfigLoader() {}

    /**
     * Loads the configuration using {@value #CONFIG_FILE_NAME} from the working directory.
     * @return The merged and resolved configuration.
     */
    public static Config load() {
        return load(CONFIG_FILE_NAME);
    }

    /**
     * Loads the configuration using the given configuration file.
     * A missing file is skipped.
     *
     * @param configFileName Path of the HOCON file to read.
     * @return The merged and resolved configuration.
     */
    public static Config load(final String configFileName) {
        final Config envConfig = ConfigFactory.systemEnvironment();
        final Config propertiesConfig = ConfigFactory.systemProperties();

        final File configFile = new File(configFileName);
        final Config fileConfig;
        if (configFile.exists() && !configFile.isDirectory()) {
            LOG.info("Loading configuration from file: {}", configFile.getAbsolutePath());
            fileConfig = ConfigFactory.parseFile(configFile);
        } else {
            LOG.info("Configuration file '{}' not found or is a directory. Skipping file-based configuration.", configFile.getPath());
            fileConfig = ConfigFactory.empty();
        }

        final Config defaultConfig = ConfigFactory.parseResources("reference.conf");

        return envConfig
            .withFallback(propertiesConfig)
            .withFallback(fileConfig)
            .withFallback(defaultConfig)
            .resolve();
    }
}
