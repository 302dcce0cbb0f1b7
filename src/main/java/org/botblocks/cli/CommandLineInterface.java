package org.botblocks.cli;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigException;
import com.typesafe.config.ConfigFactory;
import org.botblocks.cli.commands.BlocksCommand;
import org.botblocks.cli.commands.CompileCommand;
import org.botblocks.cli.config.LoggingConfigurator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Spec;

import java.io.File;
import java.util.concurrent.Callable;

@Command(
    name = "botblocks",
    mixinStandardHelpOptions = true,
    version = "botblocks 1.0",
    description = "Compiles visual robot block programs to event-driven script source",
    subcommands = {
        CompileCommand.class,
        BlocksCommand.class,
        CommandLine.HelpCommand.class
    }
)
public class CommandLineInterface implements Callable<Integer> {

    private static final String CONFIG_FILE_NAME = "botblocks.conf";

    @Option(
        names = {"-c", "--config"},
        description = "Path to custom configuration file (default: botblocks.conf)"
    )
    private File configFile;

    @Spec
    private CommandSpec spec;

    private Config config;

    @Override
    public Integer call() {
        // If no subcommand is specified, show the help message.
        spec.commandLine().usage(spec.commandLine().getOut());
        return 0;
    }

    public static void main(final String[] args) {
        final int exitCode = createCommandLine().execute(args);
        System.exit(exitCode);
    }

    /**
     * @return A command line with all subcommands and the parsing options of the tool.
     */
    public static CommandLine createCommandLine() {
        final CommandLine commandLine = new CommandLine(new CommandLineInterface());
        commandLine.setCommandName("botblocks");
        commandLine.setCaseInsensitiveEnumValuesAllowed(true);
        return commandLine;
    }

    /**
     * Loads the configuration on first use.
     * Load order: System Props > Env Vars > File > Classpath defaults.
     *
     * @return The resolved configuration.
     * @throws CommandLine.ParameterException if the configuration file is missing or invalid.
     */
    public Config getConfig() {
        if (config != null) {
            return config;
        }

        final Logger logger = LoggerFactory.getLogger(CommandLineInterface.class);
        final File file = resolveConfigFile(logger);
        try {
            Config layered = ConfigFactory.systemProperties()
                    .withFallback(ConfigFactory.systemEnvironment());
            if (file != null) {
                layered = layered.withFallback(ConfigFactory.parseFile(file));
            }
            config = layered.withFallback(ConfigFactory.load()).resolve();
        } catch (ConfigException e) {
            throw new CommandLine.ParameterException(spec.commandLine(),
                    "Failed to load or parse configuration: " + e.getMessage(), e);
        }

        LoggingConfigurator.configure(config);
        return config;
    }

    private File resolveConfigFile(final Logger logger) {
        // 1) Highest precedence: explicit CLI option --config
        if (configFile != null) {
            if (!configFile.exists()) {
                throw new CommandLine.ParameterException(spec.commandLine(),
                        "Configuration file specified via --config was not found: " + configFile.getAbsolutePath());
            }
            logger.info("Using configuration file specified via --config: {}", configFile.getAbsolutePath());
            return configFile;
        }
        // 2) Then: botblocks.conf in the current working directory
        final File cwdConfigFile = new File(CONFIG_FILE_NAME);
        if (cwdConfigFile.exists()) {
            logger.info("Using configuration file found in current directory: {}", cwdConfigFile.getAbsolutePath());
            return cwdConfigFile;
        }
        // 3) Finally: classpath defaults only
        logger.debug("No '{}' found in current directory. Using default configuration from classpath.", CONFIG_FILE_NAME);
        return null;
    }
}
