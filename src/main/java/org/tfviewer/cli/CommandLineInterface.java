package org.tfviewer.cli;

import ch.qos.logback.classic.LoggerContext;
import ch.qos.logback.classic.joran.JoranConfigurator;
import ch.qos.logback.core.joran.spi.JoranException;
import com.typesafe.config.Config;
import com.typesafe.config.ConfigException;
import com.typesafe.config.ConfigFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.tfviewer.cli.commands.InspectCommand;
import org.tfviewer.cli.commands.TailCommand;
import org.tfviewer.cli.config.LoggingConfigurator;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Spec;

import java.io.File;
import java.net.URL;
import java.util.concurrent.Callable;

@Command(
    name = "tfviewer",
    mixinStandardHelpOptions = true,
    version = "tfviewer 1.0",
    description = "Tails TensorFlow event logs and record files",
    subcommands = {
        TailCommand.class,
        InspectCommand.class,
        CommandLine.HelpCommand.class
    }
)
public class CommandLineInterface implements Callable<Integer> {

    private static final String CONFIG_FILE_NAME = "tfviewer.conf";

    @Option(
        names = {"-c", "--config"},
        description = "Path to custom configuration file (default: " + CONFIG_FILE_NAME + ")"
    )
    private File configFile;

    @Spec
    private CommandSpec spec;

    private Config config;

    @Override
    public Integer call() {
        CommandLine.usage(this, System.out);
        return 0;
    }

    public static void main(final String[] args) {
        final CommandLine commandLine = new CommandLine(new CommandLineInterface());
        commandLine.setCommandName("tfviewer");
        System.exit(commandLine.execute(args));
    }

    /**
     * Loads the configuration on first use. Precedence, highest first: system properties,
     * environment, the file given with {@code --config}, else the file given with
     * {@code -Dconfig.file}, else {@value #CONFIG_FILE_NAME} in the working directory, then the
     * classpath defaults.
     *
     * @throws CommandLine.ParameterException if a named config file does not exist or does not parse.
     */
    public Config getConfig() {
        if (config == null) {
            config = loadConfig();
            String format = LoggingConfigurator.formatProperty(config);
            if (!format.equals(System.getProperty(LoggingConfigurator.FORMAT_PROPERTY))) {
                System.setProperty(LoggingConfigurator.FORMAT_PROPERTY, format);
                reconfigureLogback();
            }
            LoggingConfigurator.configure(config);
        }
        return config;
    }

    private Config loadConfig() {
        final Logger logger = LoggerFactory.getLogger(CommandLineInterface.class);
        File file = null;
        if (configFile != null) {
            file = requireExisting(configFile, "--config");
            logger.info("Using configuration file specified via --config: {}", file.getAbsolutePath());
        } else {
            final String systemConfigPath = System.getProperty("config.file");
            if (systemConfigPath != null && !systemConfigPath.isBlank()) {
                file = requireExisting(new File(systemConfigPath).getAbsoluteFile(), "-Dconfig.file");
                logger.info("Using configuration file specified via -Dconfig.file: {}", file.getAbsolutePath());
            } else {
                final File cwdConfigFile = new File(CONFIG_FILE_NAME);
                if (cwdConfigFile.exists()) {
                    file = cwdConfigFile;
                    logger.info("Using configuration file found in current directory: {}", cwdConfigFile.getAbsolutePath());
                } else {
                    logger.debug("No '{}' in current directory, using classpath defaults", CONFIG_FILE_NAME);
                }
            }
        }

        try {
            Config layered = ConfigFactory.systemProperties().withFallback(ConfigFactory.systemEnvironment());
            if (file != null) {
                layered = layered.withFallback(ConfigFactory.parseFile(file));
            }
            return layered.withFallback(ConfigFactory.load()).resolve();
        } catch (ConfigException e) {
            throw new CommandLine.ParameterException(spec.commandLine(),
                "Failed to load or parse configuration: " + e.getMessage(), e);
        }
    }

    private File requireExisting(File file, String origin) {
        if (!file.exists()) {
            throw new CommandLine.ParameterException(spec.commandLine(),
                "Configuration file specified via " + origin + " was not found: " + file.getAbsolutePath());
        }
        return file;
    }

    private static void reconfigureLogback() {
        LoggerContext context = (LoggerContext) LoggerFactory.getILoggerFactory();
        URL configUrl = CommandLineInterface.class.getClassLoader().getResource("logback.xml");
        if (configUrl == null) {
            return;
        }
        JoranConfigurator configurator = new JoranConfigurator();
        configurator.setContext(context);
        context.reset();
        try {
            configurator.doConfigure(configUrl);
        } catch (JoranException e) {
            System.err.println("Failed to reconfigure Logback: " + e.getMessage());
        }
    }
}
