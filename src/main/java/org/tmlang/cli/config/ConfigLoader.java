package org.tmlang.cli.config;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;

/**
 * Loads the application configuration from various sources.
 * The loader respects a specific precedence order to allow for flexible configuration.
 */
public final class ConfigLoader {

    private static final Logger LOG = LoggerFactory.getLogger(ConfigLoader.class);

    /** The file looked up in the working directory when no file is given. */
    public static final String CONFIG_FILE_NAME = "tmlang.conf";

    private ConfigLoader() {
    }

    /**
     * Loads the application configuration, respecting the precedence order:
     * 1. Java system properties ({@code -Dtmlang.runtime.max-steps=500})
     * 2. The configuration file
     * 3. Default values from {@code reference.conf}, which also picks up the
     *    {@code TMLANG_MAX_STEPS} and {@code TMLANG_MODE} environment variables
     *
     * @param configFile The configuration file, or {@code null} to use {@value #CONFIG_FILE_NAME}
     *                   in the working directory if it exists.
     * @return The resolved configuration.
     * @throws com.typesafe.config.ConfigException if a file cannot be parsed.
     */
    public static Config load(final File configFile) {
        final File file = configFile != null ? configFile : new File(CONFIG_FILE_NAME);
        final Config fileConfig;
        if (file.isFile()) {
            LOG.debug("Loading configuration from file: {}", file.getAbsolutePath());
            fileConfig = ConfigFactory.parseFile(file);
        } else {
            if (configFile != null) {
                LOG.warn("Configuration file '{}' not found. Using defaults.", file.getPath());
            } else {
                LOG.debug("No '{}' in the working directory. Using defaults.", CONFIG_FILE_NAME);
            }
            fileConfig = ConfigFactory.empty();
        }

        return ConfigFactory.systemProperties()
                .withFallback(fileConfig)
                .withFallback(ConfigFactory.defaultReference())
                .resolve();
    }
}
