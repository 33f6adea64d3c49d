package org.spelunk.config;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;

/**
 * Responsible for loading the generator configuration from various sources.
 * The loader respects a specific precedence order to allow for flexible configuration.
 */
public final class ConfigLoader {

    private static final Logger LOG = LoggerFactory.getLogger(ConfigLoader.class);
    public static final String CONFIG_FILE_NAME = "spelunk.conf";

    private ConfigLoader() {
        // Private constructor to prevent instantiation
    }

    /**
     * Loads the configuration with {@code spelunk.conf} from the working directory as the file layer.
     *
     * @return A resolved {@link Config}.
     */
    public static Config load() {
        return load(new File(CONFIG_FILE_NAME));
    }

    /**
     * Loads the configuration, respecting the precedence order:
     * 1. System properties (e.g., -Dspelunk.generation.width=80)
     * 2. Environment variables
     * 3. The given configuration file, if it exists
     * 4. Default values (reference.conf on the classpath)
     *
     * @param configFile Optional file layer, may be null.
     * @return A resolved {@link Config} object containing the merged configuration.
     */
    public static Config load(final File configFile) {
        final Config fileConfig;
        if (configFile != null && configFile.exists() && !configFile.isDirectory()) {
            LOG.info("Loading configuration from file: {}", configFile.getAbsolutePath());
            fileConfig = ConfigFactory.parseFile(configFile);
        } else {
            LOG.debug("Configuration file '{}' not found. Using defaults.", configFile == null ? CONFIG_FILE_NAME : configFile.getPath());
            fileConfig = ConfigFactory.empty();
        }

        return ConfigFactory.systemProperties()
            .withFallback(ConfigFactory.systemEnvironment())
            .withFallback(fileConfig)
            .withFallback(ConfigFactory.parseResources("reference.conf"))
            .resolve();
    }

    /**
     * Loads a classpath resource layered over reference.conf. System properties and the environment
     * are ignored, which keeps tests hermetic.
     *
     * @param resource classpath resource name, e.g. "test-generation.conf"
     * @return the resolved configuration
     */
    public static Config loadResource(final String resource) {
        return ConfigFactory.parseResources(resource)
            .withFallback(ConfigFactory.parseResources("reference.conf"))
            .resolve();
    }
}
