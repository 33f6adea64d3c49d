package org.spelunk.config;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.LoggerContext;
import com.typesafe.config.ConfigFactory;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.slf4j.LoggerFactory;
import org.spelunk.junit.extensions.logging.ExpectLog;
import org.spelunk.junit.extensions.logging.LogLevel;
import org.spelunk.junit.extensions.logging.LogWatchExtension;

import static org.assertj.core.api.Assertions.assertThat;

@Tag("unit")
@ExtendWith(LogWatchExtension.class)
class LoggingConfiguratorTest {

    private final LoggerContext context = (LoggerContext) LoggerFactory.getILoggerFactory();
    private Level rootLevel;

    @BeforeEach
    void setUp() {
        rootLevel = context.getLogger(Logger.ROOT_LOGGER_NAME).getLevel();
        LoggingConfigurator.reset();
    }

    @AfterEach
    void tearDown() {
        context.getLogger(Logger.ROOT_LOGGER_NAME).setLevel(rootLevel);
        context.getLogger("org.spelunk.sample").setLevel(null);
        System.clearProperty(LoggingConfigurator.FORMAT_PROPERTY);
        LoggingConfigurator.reset();
    }

    @Test
    @DisplayName("Root and per-logger levels are applied")
    void appliesLevels() {
        LoggingConfigurator.configure(ConfigFactory.parseString(
            "logging { default-level = ERROR, levels { \"org.spelunk.sample\" = DEBUG } }"));

        assertThat(context.getLogger(Logger.ROOT_LOGGER_NAME).getLevel()).isEqualTo(Level.ERROR);
        assertThat(context.getLogger("org.spelunk.sample").getLevel()).isEqualTo(Level.DEBUG);
    }

    @Test
    @DisplayName("Key-value format selects the structured appender")
    void selectsFormat() {
        LoggingConfigurator.configure(ConfigFactory.parseString("logging { format = KEYVALUE }"));
        assertThat(System.getProperty(LoggingConfigurator.FORMAT_PROPERTY)).isEqualTo("STDOUT");

        LoggingConfigurator.reset();
        LoggingConfigurator.configure(ConfigFactory.parseString("logging { format = plain }"));
        assertThat(System.getProperty(LoggingConfigurator.FORMAT_PROPERTY)).isEqualTo("STDOUT_PLAIN");
    }

    @Test
    @DisplayName("Second configuration is ignored until reset")
    void idempotent() {
        LoggingConfigurator.configure(ConfigFactory.parseString("logging { default-level = ERROR }"));
        LoggingConfigurator.configure(ConfigFactory.parseString("logging { default-level = TRACE }"));
        assertThat(context.getLogger(Logger.ROOT_LOGGER_NAME).getLevel()).isEqualTo(Level.ERROR);
    }

    @Test
    @ExpectLog(level = LogLevel.WARN, messagePattern = "Ignoring unknown log level 'LOUD' for logger 'org.spelunk.sample'")
    @DisplayName("Unknown levels are skipped with a warning")
    void unknownLevel() {
        LoggingConfigurator.configure(ConfigFactory.parseString(
            "logging { levels { \"org.spelunk.sample\" = LOUD } }"));
        assertThat(context.getLogger("org.spelunk.sample").getLevel()).isNull();
    }
}
