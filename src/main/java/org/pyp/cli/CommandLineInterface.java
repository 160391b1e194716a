package org.pyp.cli;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigException;
import com.typesafe.config.ConfigFactory;
import org.pyp.cli.commands.RunCommand;
import org.pyp.cli.commands.TranslateCommand;
import org.pyp.config.LoggingConfigurator;
import org.pyp.config.PypSettings;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.io.File;
import java.util.concurrent.Callable;

@Command(
    name = "pyp",
    mixinStandardHelpOptions = true,
    version = "pyp 0.12",
    description = "Translates templates with embedded Python into Python scripts and runs them.",
    subcommands = {
        RunCommand.class,
        TranslateCommand.class,
        CommandLine.HelpCommand.class
    }
)
public class CommandLineInterface implements Callable<Integer> {

    private static final String CONFIG_FILE_NAME = "pyp.conf";

    @Option(
        names = {"-c", "--config"},
        description = "Path to custom configuration file (default: pyp.conf)"
    )
    private File configFile;

    @CommandLine.Spec
    private CommandLine.Model.CommandSpec spec;

    private Config config;
    private boolean initialized = false;

    @Override
    public Integer call() {
        // If no subcommand is specified, show the help message.
        spec.commandLine().usage(spec.commandLine().getOut());
        return 0;
    }

    public static void main(final String[] args) {
        final CommandLine commandLine = new CommandLine(new CommandLineInterface());
        commandLine.setCommandName("pyp");
        final int exitCode = commandLine.execute(args);
        System.exit(exitCode);
    }

    /**
     * Returns the resolved configuration, loading it on first use.
     * Load order: system properties > environment > configuration file > classpath defaults.
     *
     * @return The configuration.
     */
    public Config getConfig() {
        initialize();
        return config;
    }

    /**
     * @return The typed {@code pyp} settings of the configuration.
     */
    public PypSettings getSettings() {
        return PypSettings.fromConfig(getConfig());
    }

    private void initialize() {
        if (initialized) {
            return;
        }

        final Logger logger = LoggerFactory.getLogger(CommandLineInterface.class);
        final File file = selectConfigFile(logger);

        try {
            Config fileConfig = file != null ? ConfigFactory.parseFile(file) : ConfigFactory.empty();
            this.config = ConfigFactory.systemProperties()
                    .withFallback(ConfigFactory.systemEnvironment())
                    .withFallback(fileConfig)
                    .withFallback(ConfigFactory.load())
                    .resolve();
        } catch (ConfigException e) {
            throw new CommandLine.ParameterException(spec.commandLine(),
                    "Failed to load or parse configuration: " + e.getMessage(), e);
        }

        if (config.hasPath("logging.format")) {
            System.setProperty(LoggingConfigurator.FORMAT_PROPERTY,
                    LoggingConfigurator.appenderFor(config.getString("logging.format")));
            reconfigureLogback();
        }
        LoggingConfigurator.configure(config);

        initialized = true;
    }

    private File selectConfigFile(final Logger logger) {
        // 1) Highest precedence: explicit CLI option --config
        if (this.configFile != null) {
            if (!this.configFile.exists()) {
                throw new CommandLine.ParameterException(spec.commandLine(),
                        "Configuration file specified via --config was not found: " + this.configFile.getAbsolutePath());
            }
            logger.info("Using configuration file specified via --config: {}", this.configFile.getAbsolutePath());
            return this.configFile;
        }

        // 2) Next: standard Typesafe Config system property -Dconfig.file
        final String systemConfigPath = System.getProperty("config.file");
        if (systemConfigPath != null && !systemConfigPath.isBlank()) {
            final File systemConfigFile = new File(systemConfigPath).getAbsoluteFile();
            if (!systemConfigFile.exists()) {
                throw new CommandLine.ParameterException(spec.commandLine(),
                        "Configuration file specified via -Dconfig.file was not found: " + systemConfigFile);
            }
            logger.info("Using configuration file specified via -Dconfig.file: {}", systemConfigFile);
            return systemConfigFile;
        }

        // 3) Then: pyp.conf in the current working directory
        final File cwdConfigFile = new File(CONFIG_FILE_NAME);
        if (cwdConfigFile.exists()) {
            logger.info("Using configuration file found in current directory: {}", cwdConfigFile.getAbsolutePath());
            return cwdConfigFile;
        }

        // 4) Finally: classpath defaults only
        logger.debug("No '{}' found in current directory. Using default configuration from classpath.", CONFIG_FILE_NAME);
        return null;
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
}
