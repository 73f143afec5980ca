package org.irradcontrol.cli;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigException;
import org.irradcontrol.cli.commands.SendCommand;
import org.irradcontrol.cli.commands.StatusCommand;
import org.irradcontrol.cli.commands.interpreter.InterpreterCommand;
import org.irradcontrol.cli.commands.server.ServerCommand;
import org.irradcontrol.node.config.ConfigLoader;
import org.irradcontrol.node.config.LoggingConfigurator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.io.File;
import java.util.concurrent.Callable;

@Command(
    name = "irrad",
    mixinStandardHelpOptions = true,
    version = "irrad-control 1.0",
    description = "Process control of a multi-node beam irradiation facility",
    subcommands = {
        ServerCommand.class,
        InterpreterCommand.class,
        SendCommand.class,
        StatusCommand.class,
        CommandLine.HelpCommand.class
    }
)
public class CommandLineInterface implements Callable<Integer> {

    @Option(
        names = {"-c", "--config"},
        description = "Path to custom configuration file (default: " + ConfigLoader.CONFIG_FILE_NAME + ")"
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
        final CommandLine commandLine = new CommandLine(new CommandLineInterface());
        commandLine.setCommandName("irrad");
        final int exitCode = commandLine.execute(args);
        System.exit(exitCode);
    }

    /**
     * Loads the configuration on first use and applies its logging settings.
     *
     * @throws CommandLine.ParameterException if the configuration file is missing or invalid.
     */
    public Config getConfig() {
        if (config != null) {
            return config;
        }
        final Logger logger = LoggerFactory.getLogger(CommandLineInterface.class);
        if (configFile != null && !configFile.exists()) {
            throw new CommandLine.ParameterException(new CommandLine(this),
                "Configuration file specified via --config was not found: " + configFile.getAbsolutePath());
        }
        try {
            config = configFile != null ? ConfigLoader.load(configFile) : ConfigLoader.load();
        } catch (ConfigException e) {
            logger.error("Failed to load or parse configuration: {}", e.getMessage());
            throw new CommandLine.ParameterException(new CommandLine(this), "Invalid configuration: " + e.getMessage(), e, null, null);
        }
        LoggingConfigurator.configure(config);
        return config;
    }
}
