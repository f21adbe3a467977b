package org.jkconfig.cli;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigException;
import com.typesafe.config.ConfigFactory;
import org.jkconfig.api.KconfigException;
import org.jkconfig.cli.commands.AllDefConfigCommand;
import org.jkconfig.cli.commands.AllNoConfigCommand;
import org.jkconfig.cli.commands.AllYesConfigCommand;
import org.jkconfig.cli.commands.DefConfigCommand;
import org.jkconfig.cli.commands.EvalCommand;
import org.jkconfig.cli.config.LoggingConfigurator;
import org.jkconfig.config.Environment;
import org.jkconfig.config.KconfigSettings;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.io.File;
import java.util.concurrent.Callable;

@Command(
    name = "jkconfig",
    mixinStandardHelpOptions = true,
    version = "jkconfig 1.0",
    description = "jkconfig - Kconfig configuration tool",
    subcommands = {
        AllDefConfigCommand.class,
        DefConfigCommand.class,
        AllNoConfigCommand.class,
        AllYesConfigCommand.class,
        EvalCommand.class,
        CommandLine.HelpCommand.class
    }
)
public class CommandLineInterface implements Callable<Integer> {

    private static final String CONFIG_FILE_NAME = "jkconfig.conf";

    @Option(
        names = {"-c", "--config"},
        description = "Path to custom configuration file (default: jkconfig.conf)"
    )
    private File configFile;

    private final Environment environment;
    private Config config;
    private boolean initialized = false;

    public CommandLineInterface() {
        this(Environment.system());
    }

    /**
     * @param environment The environment Kconfig files are parsed against.
     */
    public CommandLineInterface(Environment environment) {
        this.environment = environment;
    }

    @Override
    public Integer call() {
        // If no subcommand is specified, show the help message.
        CommandLine.usage(this, System.out);
        return 0;
    }

    public static void main(final String[] args) {
        final CommandLine commandLine = new CommandLine(new CommandLineInterface());
        commandLine.setCommandName("jkconfig");
        final int exitCode = commandLine.execute(args);
        System.exit(exitCode);
    }

    private void initialize() throws KconfigException {
        if (initialized) {
            return;
        }

        final Logger logger = LoggerFactory.getLogger(CommandLineInterface.class);

        try {
            final Config fileConfig;
            if (this.configFile != null) {
                if (!this.configFile.exists()) {
                    throw new KconfigException("Configuration file specified via --config was not found: "
                            + this.configFile.getAbsolutePath());
                }
                logger.debug("Using configuration file specified via --config: {}", this.configFile.getAbsolutePath());
                fileConfig = ConfigFactory.parseFile(this.configFile);
            } else {
                final File cwdConfigFile = new File(CONFIG_FILE_NAME);
                if (cwdConfigFile.exists()) {
                    logger.debug("Using configuration file found in current directory: {}", cwdConfigFile.getAbsolutePath());
                    fileConfig = ConfigFactory.parseFile(cwdConfigFile);
                } else {
                    fileConfig = ConfigFactory.empty();
                }
            }
            // Config load order: System Props > Env Vars > File > Classpath defaults
            this.config = ConfigFactory.systemProperties()
                    .withFallback(ConfigFactory.systemEnvironment())
                    .withFallback(fileConfig)
                    .withFallback(ConfigFactory.load())
                    .resolve();
        } catch (ConfigException e) {
            throw new KconfigException("Failed to load or parse configuration: " + e.getMessage(), e);
        }

        if (config.hasPath("logging.format")) {
            final String format = config.getString("logging.format");
            System.setProperty(LoggingConfigurator.FORMAT_PROPERTY, LoggingConfigurator.appenderFor(format));
            reconfigureLogback();
        }
        LoggingConfigurator.configure(config);

        initialized = true;
    }

    private void reconfigureLogback() {
        try {
            ch.qos.logback.classic.LoggerContext context = (ch.qos.logback.classic.LoggerContext) LoggerFactory.getILoggerFactory();
            ch.qos.logback.classic.joran.JoranConfigurator configurator = new ch.qos.logback.classic.joran.JoranConfigurator();
            configurator.setContext(context);
            context.reset();
            java.net.URL configUrl = CommandLineInterface.class.getClassLoader().getResource("logback.xml");
            if (configUrl != null) {
                configurator.doConfigure(configUrl);
            }
        } catch (Exception e) {
            System.err.println("Failed to reconfigure Logback: " + e.getMessage());
        }
    }

    /**
     * @return The resolved application configuration.
     * @throws KconfigException if the configuration file is missing or malformed.
     */
    public Config getConfig() throws KconfigException {
        if (!initialized) {
            initialize();
        }
        return config;
    }

    /**
     * @return The tool settings from the {@code jkconfig} block of the configuration.
     * @throws KconfigException if the configuration cannot be loaded.
     */
    public KconfigSettings getSettings() throws KconfigException {
        try {
            return KconfigSettings.fromConfig(getConfig());
        } catch (ConfigException e) {
            throw new KconfigException("Invalid jkconfig settings: " + e.getMessage(), e);
        }
    }

    public Environment getEnvironment() {
        return environment;
    }
}
