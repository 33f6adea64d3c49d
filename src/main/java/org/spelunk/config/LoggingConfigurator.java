package org.spelunk.config;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.LoggerContext;
import com.typesafe.config.Config;
import com.typesafe.config.ConfigValue;
import org.slf4j.LoggerFactory;

import java.util.Map;

/**
 * Applies the HOCON logging block to Logback at runtime.
 *
 * <h3>Configuration Structure:</h3>
 * <pre>
 * logging {
 *   format = "PLAIN"        # "PLAIN" or "KEYVALUE"
 *   default-level = "INFO"
 *   levels {
 *     "org.spelunk.runtime.placement" = "DEBUG"
 *   }
 * }
 * </pre>
 */
public final class LoggingConfigurator {

    private static final org.slf4j.Logger LOGGER = LoggerFactory.getLogger(LoggingConfigurator.class);
    private static final String LOGGING_CONFIG_PATH = "logging";
    private static final String FORMAT_KEY = "format";
    private static final String DEFAULT_LEVEL_KEY = "default-level";
    private static final String LEVELS_KEY = "levels";
    public static final String FORMAT_PROPERTY = "spelunk.logging.format";

    private static boolean loggingConfigured = false;

    private LoggingConfigurator() {
    }

    /**
     * Configures the logging system. Idempotent until {@link #reset()} is called.
     *
     * @param config The configuration containing the logging block.
     */
    public static void configure(final Config config) {
        if (loggingConfigured) {
            LOGGER.debug("Logging already configured, skipping.");
            return;
        }
        if (!config.hasPath(LOGGING_CONFIG_PATH)) {
            loggingConfigured = true;
            return;
        }

        final Config loggingConfig = config.getConfig(LOGGING_CONFIG_PATH);
        final LoggerContext context = (LoggerContext) LoggerFactory.getILoggerFactory();
        configureFormat(loggingConfig, context);
        configureDefaultLevel(loggingConfig, context);
        configureSpecificLevels(loggingConfig, context);
        loggingConfigured = true;
    }

    private static void configureFormat(final Config loggingConfig, final LoggerContext context) {
        final String format = loggingConfig.hasPath(FORMAT_KEY) ? loggingConfig.getString(FORMAT_KEY) : "PLAIN";
        final String appender = "PLAIN".equalsIgnoreCase(format) ? "STDOUT_PLAIN" : "STDOUT";
        context.putProperty(FORMAT_PROPERTY, appender);
        System.setProperty(FORMAT_PROPERTY, appender);
    }

    private static void configureDefaultLevel(final Config loggingConfig, final LoggerContext context) {
        if (loggingConfig.hasPath(DEFAULT_LEVEL_KEY)) {
            final Level level = Level.toLevel(loggingConfig.getString(DEFAULT_LEVEL_KEY), Level.INFO);
            context.getLogger(Logger.ROOT_LOGGER_NAME).setLevel(level);
        }
    }

    private static void configureSpecificLevels(final Config loggingConfig, final LoggerContext context) {
        if (!loggingConfig.hasPath(LEVELS_KEY)) {
            return;
        }
        for (final Map.Entry<String, ConfigValue> entry : loggingConfig.getConfig(LEVELS_KEY).root().entrySet()) {
            final String levelName = entry.getValue().unwrapped().toString();
            final Level level = Level.toLevel(levelName, null);
            if (level == null) {
                LOGGER.warn("Ignoring unknown log level '{}' for logger '{}'", levelName, entry.getKey());
                continue;
            }
            context.getLogger(entry.getKey()).setLevel(level);
        }
    }

    /**
     * Resets the configured flag. Tests only.
     */
    public static void reset() {
        loggingConfigured = false;
    }
}
