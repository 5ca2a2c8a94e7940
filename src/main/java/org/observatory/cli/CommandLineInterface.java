package org.observatory.cli;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigException;
import org.observatory.cli.commands.EventsCommand;
import org.observatory.cli.commands.ReplayCommand;
import org.observatory.cli.commands.RunCommand;
import org.observatory.cli.commands.VerifyCommand;
import org.observatory.node.config.ConfigLoader;
import org.observatory.node.config.LoggingConfigurator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.io.File;
import java.util.concurrent.Callable;

@Command(
    name = "observatory",
    mixinStandardHelpOptions = true,
    version = "Observatory 1.0",
    description = "Observatory - deterministic tick-based world simulation",
    subcommands = {
        RunCommand.class,
        ReplayCommand.class,
        VerifyCommand.class,
        EventsCommand.class,
        CommandLine.HelpCommand.class
    }
)
public class CommandLineInterface implements Callable<Integer> {

    @Option(
        names = {"-c", "--config"},
        description = "Path to custom configuration file (default: observatory.conf)"
    )
    private File configFile;

    private Config config;
    private boolean initialized = false;

    @Override
    public Integer call() {
        // If no subcommand is specified, show the help message.
        CommandLine.usage(this, System.out);
        return 0;
    }

    public static void main(final String[] args) {
        final CommandLine commandLine = new CommandLine(new CommandLineInterface());
        commandLine.setCommandName("observatory");
        final int exitCode = commandLine.execute(args);
        System.exit(exitCode);
    }

    private void initialize() {
        if (initialized) {
            return;
        }
        final Logger logger = LoggerFactory.getLogger(CommandLineInterface.class);

        if (configFile != null && !configFile.exists()) {
            logger.error("Configuration file specified via --config was not found: {}", configFile.getAbsolutePath());
            throw new IllegalArgumentException("Configuration file not found: " + configFile.getAbsolutePath());
        }
        try {
            config = configFile != null ? ConfigLoader.load(configFile) : ConfigLoader.load();
        } catch (ConfigException e) {
            logger.error("Failed to load or parse configuration: {}", e.getMessage());
            throw e;
        }
        LoggingConfigurator.configure(config);
        initialized = true;
    }

    public Config getConfig() {
        if (!initialized) {
            initialize();
        }
        return config;
    }
}
