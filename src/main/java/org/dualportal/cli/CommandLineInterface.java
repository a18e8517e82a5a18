package org.dualportal.cli;

import java.io.File;
import java.util.concurrent.Callable;

import org.dualportal.cli.commands.RunCommand;
import org.dualportal.cli.commands.SweepCommand;
import org.dualportal.cli.config.ConfigLoader;
import org.dualportal.cli.config.SimulationConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.typesafe.config.ConfigException;

import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

@Command(
    name = "dualportal",
    mixinStandardHelpOptions = true,
    version = "DualPortal 1.0",
    description = "DualPortal - Dual portal resonance bridge simulation",
    subcommands = {
        RunCommand.class,
        SweepCommand.class,
        CommandLine.HelpCommand.class
    }
)
public class CommandLineInterface implements Callable<Integer> {

    private static final Logger LOG = LoggerFactory.getLogger(CommandLineInterface.class);

    @Option(
        names = {"-c", "--config"},
        description = "Path to custom configuration file (default: config/dualportal.conf)"
    )
    private File configFile;

    private SimulationConfig config;

    @Override
    public Integer call() {
        // No subcommand: show usage.
        CommandLine.usage(this, System.out);
        return 0;
    }

    public static void main(final String[] args) {
        final int exitCode = createCommandLine().execute(args);
        System.exit(exitCode);
    }

    /**
     * Creates a fully configured CommandLine instance.
     * <p>
     * Use this method in tests to get the same configuration as the CLI entry point.
     *
     * @return A configured CommandLine instance.
     */
    public static CommandLine createCommandLine() {
        final CommandLine commandLine = new CommandLine(new CommandLineInterface());
        commandLine.setCommandName("dualportal");
        return commandLine;
    }

    /**
     * Returns the simulation configuration, loading it on first use.
     *
     * @return The typed {@code dualportal} configuration.
     * @throws IllegalArgumentException if an explicitly named config file does not exist or a value is out of range.
     * @throws ConfigException          if the configuration cannot be parsed.
     */
    public SimulationConfig getConfig() {
        if (config == null) {
            config = ConfigLoader.load(configFile, (level, message) -> {
                switch (level) {
                    case INFO -> LOG.info(message);
                    case WARN -> LOG.warn(message);
                }
            });
        }
        return config;
    }
}
