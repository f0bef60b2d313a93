package org.colonysim.cli.commands;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.LoggerContext;
import org.colonysim.cli.CommandLineInterface;
import org.colonysim.cli.config.LoggingConfigurator;
import org.colonysim.junit.extensions.logging.LogWatchExtension;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;

import java.io.File;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.net.URISyntaxException;
import java.net.URL;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for the run command: parsing, validation and a short deterministic run.
 */
@Tag("integration")
@ExtendWith(LogWatchExtension.class)
public class RunCommandTest {

    private final StringWriter out = new StringWriter();
    private final StringWriter err = new StringWriter();

    @AfterEach
    void tearDown() {
        LoggingConfigurator.reset();
        System.clearProperty("colonysim.logging.format");
        LoggerContext context = (LoggerContext) LoggerFactory.getILoggerFactory();
        context.getLogger(Logger.ROOT_LOGGER_NAME).setLevel(Level.WARN);
    }

    private CommandLine commandLine() {
        CommandLine cmdLine = CommandLineInterface.createCommandLine();
        cmdLine.setOut(new PrintWriter(out));
        cmdLine.setErr(new PrintWriter(err));
        return cmdLine;
    }

    @Test
    void testCommandParses() {
        assertThat(CommandLineInterface.createCommandLine().getSubcommands()).containsKey("run");
    }

    @Test
    void testHelpOutput() {
        commandLine().execute("run", "--help");

        String output = out.toString() + err.toString();
        assertThat(output).contains("run");
        assertThat(output).contains("--colonists");
        assertThat(output).contains("--ticks");
        assertThat(output).contains("--forage-every");
    }

    @Test
    void testFixedTickRunPrintsSummary() {
        int exitCode = commandLine().execute(
                "-c", testResource("run-config.conf").getPath(),
                "run", "--colonists", "3", "--ticks", "12");

        String output = out.toString();
        assertThat(exitCode).as(err.toString()).isEqualTo(0);
        assertThat(output).contains("Ticks issued: 12");
        assertThat(output).contains("Presence: 3 total, 3 idle, 0 foraging");
        assertThat(output).contains("Site forest:").contains("Site river:").contains("Site cave:");
        assertThat(output).contains("colonist-1:").contains("colonist-3:");
    }

    @Test
    void testInvalidForageIntervalIsRejected() {
        int exitCode = commandLine().execute(
                "-c", testResource("run-config.conf").getPath(),
                "run", "--ticks", "3", "--forage-every", "0");

        assertThat(exitCode).isEqualTo(1);
        assertThat(err.toString()).contains("--forage-every must be > 0");
    }

    @Test
    void testMissingConfigFileFails() {
        int exitCode = commandLine().execute(
                "-c", "no-such-dir/colonysim.conf", "run", "--ticks", "1");

        assertThat(exitCode).isEqualTo(1);
        assertThat(err.toString()).contains("Error: Configuration file not found");
    }

    private File testResource(final String name) {
        final URL url = getClass().getResource(name);
        assertThat(url).as("Test resource not found: " + name).isNotNull();
        try {
            return new File(url.toURI());
        } catch (URISyntaxException e) {
            throw new IllegalArgumentException("Invalid test resource URI: " + url, e);
        }
    }
}
