package org.spelunk.cli;

import com.typesafe.config.Config;
import org.spelunk.cli.commands.GenerateCommand;
import org.spelunk.config.ConfigLoader;
import org.spelunk.config.LoggingConfigurator;
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
    name = "spelunk",
    mixinStandardHelpOptions = true,
    version = "Spelunk 1.0",
    description = "Spelunk - procedural cave level generator for 2D platformers",
    subcommands = {
        GenerateCommand.class,
        CommandLine.HelpCommand.class
    }
)
public class CommandLineInterface implements Callable<Integer> {

    private static final Logger LOG = LoggerFactory.getLogger(CommandLineInterface.class);

    @Option(
        names = {"-c", "--config"},
        description = "Path to custom configuration file (default: spelunk.conf)"
    )
    private File configFile;

    @Spec
    private CommandSpec spec;

    private Config config;

    @Override
    public Integer call() {
        // No subcommand: show usage.
        spec.commandLine().usage(spec.commandLine().getOut());
        return 0;
    }

    public static void main(final String[] args) {
        final CommandLine commandLine = new CommandLine(new CommandLineInterface());
        commandLine.setCommandName("spelunk");
        System.exit(commandLine.execute(args));
    }

    /**
     * Loads the configuration once. Precedence: --config, then -Dconfig.file, then spelunk.conf in the
     * working directory, then the classpath defaults.
     *
     * @throws CommandLine.ParameterException if an explicitly named file does not exist
     */
    public Config getConfig() {
        if (config != null) {
            return config;
        }
        File file = configFile;
        if (file == null) {
            final String systemConfigPath = System.getProperty("config.file");
            if (systemConfigPath != null && !systemConfigPath.isBlank()) {
                file = new File(systemConfigPath).getAbsoluteFile();
            }
        }
        if (file != null && !file.isFile()) {
            throw new CommandLine.ParameterException(spec.commandLine(),
                "Configuration file not found: " + file.getAbsolutePath());
        }
        config = file != null ? ConfigLoader.load(file) : ConfigLoader.load();
        LoggingConfigurator.configure(config);
        LOG.debug("Configuration loaded");
        return config;
    }
}
