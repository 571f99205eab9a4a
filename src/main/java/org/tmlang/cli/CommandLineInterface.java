package org.tmlang.cli;

import com.typesafe.config.Config;
import org.tmlang.cli.commands.CompileCommand;
import org.tmlang.cli.commands.RunCommand;
import org.tmlang.cli.config.ConfigLoader;
import org.tmlang.cli.config.LoggingConfigurator;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.io.File;
import java.util.concurrent.Callable;

@Command(
    name = "tmlang",
    mixinStandardHelpOptions = true,
    version = "tmlang 1.0",
    description = "Compiles and runs tape automaton programs",
    subcommands = {
        CompileCommand.class,
        RunCommand.class,
        CommandLine.HelpCommand.class
    }
)
public class CommandLineInterface implements Callable<Integer> {

    @Option(
        names = {"-c", "--config"},
        description = "Path to a configuration file (default: " + ConfigLoader.CONFIG_FILE_NAME + ")"
    )
    private File configFile;

    private Config config;

    @Override
    public Integer call() {
        // If no subcommand is specified, show the help message.
        CommandLine.usage(this, System.out);
        return 0;
    }

    public static void main(final String[] args) {
        System.exit(commandLine().execute(args));
    }

    /**
     * @return A ready to execute command line for a fresh interface instance.
     */
    public static CommandLine commandLine() {
        final CommandLine commandLine = new CommandLine(new CommandLineInterface());
        commandLine.setCommandName("tmlang");
        commandLine.setCaseInsensitiveEnumValuesAllowed(true);
        return commandLine;
    }

    /**
     * Loads the configuration on first use and applies its logging settings.
     * @return The application configuration.
     */
    public Config getConfig() {
        if (config == null) {
            config = ConfigLoader.load(configFile);
            LoggingConfigurator.configure(config);
        }
        return config;
    }
}
