package org.kestrel.cli;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigException;
import org.kestrel.cli.commands.EvalCommand;
import org.kestrel.cli.commands.ParseCommand;
import org.kestrel.cli.commands.TokensCommand;
import org.kestrel.cli.config.ConfigLoader;
import org.kestrel.cli.config.LoggingConfigurator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.io.File;
import java.util.concurrent.Callable;

@Command(
    name = "kestrel",
    mixinStandardHelpOptions = true,
    version = "Kestrel 1.0",
    description = "Kestrel - lexer, parser and expression evaluator for the Kestrel language",
    subcommands = {
        ParseCommand.class,
        TokensCommand.class,
        EvalCommand.class,
        CommandLine.HelpCommand.class
    }
)
public class CommandLineInterface implements Callable<Integer> {

    private static final Logger LOG = LoggerFactory.getLogger(CommandLineInterface.class);

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
        commandLine.setCommandName("kestrel");
        final int exitCode = commandLine.execute(args);
        System.exit(exitCode);
    }

    /**
     * Loads the configuration on first use and applies its logging settings.
     *
     * @return The resolved configuration.
     * @throws ConfigException if the configuration file is missing or malformed.
     */
    public Config getConfig() {
        if (config == null) {
            try {
                config = ConfigLoader.load(configFile);
            } catch (ConfigException e) {
                LOG.error("Failed to load or parse configuration: {}", e.getMessage());
                throw e;
            }
            LoggingConfigurator.configure(config);
        }
        return config;
    }
}
