package org.gridsnake.cli;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigException;
import org.gridsnake.cli.commands.PlayCommand;
import org.gridsnake.cli.commands.SimulateCommand;
import org.gridsnake.node.config.ConfigLoader;
import org.gridsnake.node.config.GameConfiguration;
import org.gridsnake.node.config.LoggingConfigurator;
import org.gridsnake.node.config.LoggingConfigurator.LogFormat;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Spec;
import picocli.CommandLine.Model.CommandSpec;

import java.io.File;
import java.util.concurrent.Callable;

/**
 * Entry point of the {@code gridsnake} command. Subcommands obtain the merged configuration
 * through {@link #getConfig()}, which also applies its logging settings on first use.
 */
@Command(
    name = "gridsnake",
    mixinStandardHelpOptions = true,
    version = "gridsnake 1.0",
    description = "Snake on a discrete grid.",
    subcommands = {
        PlayCommand.class,
        SimulateCommand.class,
        CommandLine.HelpCommand.class
    }
)
public class CommandLineInterface implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(CommandLineInterface.class);

    @Spec
    private CommandSpec spec;

    @Option(
        names = {"-c", "--config"},
        description = "Configuration file (default: ./" + ConfigLoader.CONFIG_FILE_NAME + " if present)"
    )
    private File configFile;

    private Config config;

    @Override
    public Integer call() {
        spec.commandLine().usage(spec.commandLine().getOut());
        return 0;
    }

    public static void main(final String[] args) {
        System.exit(new CommandLine(new CommandLineInterface()).execute(args));
    }

    /**
     * @return the merged configuration, loaded on the first call
     * @throws CommandLine.ExecutionException if the configuration file is missing or invalid
     */
    public synchronized Config getConfig() {
        if (config == null) {
            config = loadConfig();
            if (config.hasPath("logging.format")) {
                final LogFormat format = LogFormat.parse(config.getString("logging.format"));
                if (format != LogFormat.PLAIN) {
                    LoggingConfigurator.reload(format);
                }
            }
            LoggingConfigurator.configure(config);
        }
        return config;
    }

    /**
     * @return the validated game settings of the merged configuration
     * @throws CommandLine.ExecutionException if a game setting is invalid
     */
    public GameConfiguration getGameConfiguration() {
        final Config merged = getConfig();
        try {
            return GameConfiguration.fromConfig(merged);
        } catch (final ConfigException e) {
            log.error("Invalid game configuration: {}", e.getMessage());
            throw new CommandLine.ExecutionException(spec.commandLine(), e.getMessage(), e);
        }
    }

    private Config loadConfig() {
        if (configFile != null && !configFile.isFile()) {
            log.error("Configuration file given with --config does not exist: {}", configFile.getAbsolutePath());
            throw new CommandLine.ExecutionException(spec.commandLine(),
                "Configuration file not found: " + configFile.getAbsolutePath());
        }
        try {
            return configFile != null ? ConfigLoader.load(configFile) : ConfigLoader.load();
        } catch (final ConfigException e) {
            log.error("Invalid configuration: {}", e.getMessage());
            throw new CommandLine.ExecutionException(spec.commandLine(), e.getMessage(), e);
        }
    }
}
