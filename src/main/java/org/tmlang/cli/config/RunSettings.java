package org.tmlang.cli.config;

import com.typesafe.config.Config;

import java.util.Locale;

/**
 * The settings of the {@code run} command, read from the {@code tmlang.runtime} block.
 *
 * @param maxSteps The step budget of a run.
 * @param mode How the program is executed.
 */
public record RunSettings(long maxSteps, Mode mode) {

    /**
     * The execution strategy.
     */
    public enum Mode {
        /** Walk the syntax tree. */
        INTERPRET,
        /** Drive the compiled automaton. */
        AUTOMATON
    }

    public RunSettings {
        if (maxSteps <= 0) {
            throw new IllegalArgumentException("max-steps must be positive, was " + maxSteps);
        }
    }

    /**
     * @param config The application configuration.
     * @return The settings found at {@code tmlang.runtime}.
     */
    public static RunSettings fromConfig(Config config) {
        Config runtime = config.getConfig("tmlang.runtime");
        Mode mode = Mode.valueOf(runtime.getString("mode").toUpperCase(Locale.ROOT));
        return new RunSettings(runtime.getLong("max-steps"), mode);
    }
}
