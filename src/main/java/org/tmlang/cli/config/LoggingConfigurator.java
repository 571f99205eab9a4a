package org.tmlang.cli.config;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.LoggerContext;
import com.typesafe.config.Config;
import com.typesafe.config.ConfigValue;
import org.slf4j.LoggerFactory;

import java.util.Map;

/**
 * Applies the log levels of the HOCON configuration to Logback at runtime.
 *
 * <h3>Configuration Structure:</h3>
 * <pre>
 * logging {
 *   default-level = "WARN"
 *   levels {
 *     "org.tmlang.runtime" = "TRACE"
 *   }
 * }
 * </pre>
 */
public final class LoggingConfigurator {

    private static final org.slf4j.Logger LOGGER = LoggerFactory.getLogger(LoggingConfigurator.class);
    private static final String LOGGING_CONFIG_PATH = "logging";
    private static final String DEFAULT_LEVEL_KEY = "default-level";
    private static final String LEVELS_KEY = "levels";

    private LoggingConfigurator() {
    }

    /**
     * Configures the logging system based on the provided configuration.
     * A missing {@code logging} block leaves the Logback defaults in place.
     *
     * @param config The application configuration containing logging settings.
     */
    public static void configure(final Config config) {
        if (!config.hasPath(LOGGING_CONFIG_PATH)) {
            LOGGER.debug("No logging configuration found, using Logback defaults.");
            return;
        }
        final Config loggingConfig = config.getConfig(LOGGING_CONFIG_PATH);
        final LoggerContext context = (LoggerContext) LoggerFactory.getILoggerFactory();

        if (loggingConfig.hasPath(DEFAULT_LEVEL_KEY)) {
            final Level level = Level.toLevel(loggingConfig.getString(DEFAULT_LEVEL_KEY), Level.WARN);
            context.getLogger(Logger.ROOT_LOGGER_NAME).setLevel(level);
            LOGGER.debug("Configured default log level: {}", level);
        }

        if (loggingConfig.hasPath(LEVELS_KEY)) {
            for (final Map.Entry<String, ConfigValue> entry : loggingConfig.getConfig(LEVELS_KEY).root().entrySet()) {
                final String loggerName = entry.getKey();
                final String levelName = entry.getValue().unwrapped().toString();
                final Level level = Level.toLevel(levelName, null);
                if (level == null) {
                    LOGGER.warn("Ignoring unknown level '{}' for logger '{}'.", levelName, loggerName);
                    continue;
                }
                context.getLogger(loggerName).setLevel(level);
                LOGGER.debug("Configured logger '{}' to level: {}", loggerName, level);
            }
        }
    }
}
