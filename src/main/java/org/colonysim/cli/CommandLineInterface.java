package org.colonysim.cli;

import java.io.File;
import java.net.URL;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;

import org.colonysim.cli.commands.RunCommand;
import org.colonysim.cli.config.ConfigLoader;
import org.colonysim.cli.config.LoggingConfigurator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import ch.qos.logback.classic.LoggerContext;
import ch.qos.logback.classic.joran.JoranConfigurator;
import ch.qos.logback.classic.turbo.TurboFilter;
import ch.qos.logback.core.joran.spi.JoranException;
import com.typesafe.config.Config;

import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

@Command(
    name = "colonysim",
    mixinStandardHelpOptions = true,
    version = "colonysim 1.0",
    description = "Colony simulation: tick-driven colonists foraging a shared resource pool",
    subcommands = {
        RunCommand.class,
        CommandLine.HelpCommand.class
    }
)
public class CommandLineInterface implements Callable<Integer> {

    private static final Logger LOG = LoggerFactory.getLogger(CommandLineInterface.class);

    @Option(
        names = {"-c", "--config"},
        description = "Path to custom configuration file (default: config/colonysim.conf)"
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
        commandLine.setCommandName("colonysim");
        return commandLine;
    }

    /**
     * Resolves the configuration on first use and applies its logging settings.
     *
     * @return the resolved configuration.
     * @throws IllegalArgumentException            if an explicit config file does not exist.
     * @throws com.typesafe.config.ConfigException if the configuration cannot be parsed.
     */
    public synchronized Config getConfig() {
        if (config == null) {
            final Config resolved = ConfigLoader.resolve(configFile, (level, message) -> {
                switch (level) {
                    case INFO -> LOG.info(message);
                    case WARN -> LOG.warn(message);
                }
            });
            if (resolved.hasPath("logging.format")) {
                final String format = resolved.getString("logging.format");
                System.setProperty("colonysim.logging.format", "PLAIN".equalsIgnoreCase(format) ? "STDOUT_PLAIN" : "STDOUT");
                reconfigureLogback();
            }
            LoggingConfigurator.configure(resolved);
            config = resolved;
        }
        return config;
    }

    /**
     * Reloads the Logback configuration so that {@code colonysim.logging.format} takes effect.
     * Logback configured itself before the property was set. Turbo filters installed at runtime
     * survive the reload.
     */
    static void reconfigureLogback() {
        final LoggerContext context = (LoggerContext) LoggerFactory.getILoggerFactory();
        final URL configUrl = findLogbackConfig();
        if (configUrl == null) {
            return;
        }
        final List<TurboFilter> turboFilters = new ArrayList<>(context.getTurboFilterList());
        try {
            final JoranConfigurator configurator = new JoranConfigurator();
            configurator.setContext(context);
            context.reset();
            configurator.doConfigure(configUrl);
        } catch (JoranException e) {
            System.err.println("Failed to reconfigure Logback: " + e.getMessage());
        } finally {
            for (final TurboFilter filter : turboFilters) {
                filter.start();
                context.addTurboFilter(filter);
            }
        }
    }

    private static URL findLogbackConfig() {
        final ClassLoader loader = CommandLineInterface.class.getClassLoader();
        final URL testConfig = loader.getResource("logback-test.xml");
        return testConfig != null ? testConfig : loader.getResource("logback.xml");
    }
}
