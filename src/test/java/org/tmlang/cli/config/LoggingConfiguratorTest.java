package org.tmlang.cli.config;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.LoggerContext;
import com.typesafe.config.ConfigFactory;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.slf4j.LoggerFactory;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Contains unit tests for the {@link LoggingConfigurator}.
 */
@Tag("unit")
public class LoggingConfiguratorTest {

    private static final String RUNTIME_LOGGER = "org.tmlang.runtime";
    private static final String PARSER_LOGGER = "org.tmlang.compiler.frontend.parser";

    private final LoggerContext context = (LoggerContext) LoggerFactory.getILoggerFactory();
    private final Level rootLevel = context.getLogger(Logger.ROOT_LOGGER_NAME).getLevel();

    @AfterEach
    void restoreLevels() {
        context.getLogger(Logger.ROOT_LOGGER_NAME).setLevel(rootLevel);
        context.getLogger(RUNTIME_LOGGER).setLevel(null);
        context.getLogger(PARSER_LOGGER).setLevel(null);
    }

    /**
     * Verifies that the default and per-logger levels are applied.
     */
    @Test
    void appliesLevels() {
        LoggingConfigurator.configure(ConfigFactory.parseString(
                "logging { default-level = \"ERROR\", levels { \"" + RUNTIME_LOGGER + "\" = \"TRACE\" } }"));

        assertThat(context.getLogger(Logger.ROOT_LOGGER_NAME).getLevel()).isEqualTo(Level.ERROR);
        assertThat(context.getLogger(RUNTIME_LOGGER).getLevel()).isEqualTo(Level.TRACE);
    }

    /**
     * Verifies that an unknown level name leaves the logger untouched.
     */
    @Test
    void ignoresUnknownLevel() {
        LoggingConfigurator.configure(ConfigFactory.parseString(
                "logging.levels { \"" + PARSER_LOGGER + "\" = \"LOUD\" }"));

        assertThat(context.getLogger(PARSER_LOGGER).getLevel()).isNull();
    }

    /**
     * Verifies that a configuration without a logging block changes nothing.
     */
    @Test
    void missingBlockChangesNothing() {
        LoggingConfigurator.configure(ConfigFactory.parseString("tmlang.runtime.max-steps = 3"));

        assertThat(context.getLogger(Logger.ROOT_LOGGER_NAME).getLevel()).isEqualTo(rootLevel);
    }
}
