package org.irradcontrol.cli;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.LoggerContext;
import org.irradcontrol.junit.extensions.logging.ExpectLog;
import org.irradcontrol.junit.extensions.logging.LogLevel;
import org.irradcontrol.junit.extensions.logging.LogWatchExtension;
import org.irradcontrol.node.ProcessCore;
import org.irradcontrol.node.ProcessFixtures;
import org.irradcontrol.node.config.LoggingConfigurator;
import org.irradcontrol.node.discovery.DescriptorFile;
import org.irradcontrol.protocol.ChannelKind;
import org.irradcontrol.protocol.ProcessDescriptor;
import org.irradcontrol.roles.interpreter.ForwardingInterpreter;
import org.irradcontrol.roles.interpreter.InterpreterRole;
import org.irradcontrol.roles.interpreter.InterpreterSettings;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;

import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

@Tag("integration")
@ExtendWith(LogWatchExtension.class)
class CommandLineInterfaceTest {

    @TempDir
    Path tempDir;

    private Path configFile;
    private StringWriter out;
    private StringWriter err;
    private Level originalRootLevel;

    @BeforeEach
    void setUp() throws Exception {
        originalRootLevel = rootLogger().getLevel();
        LoggingConfigurator.reset();
        configFile = tempDir.resolve("irrad.conf");
        final String dir = tempDir.toAbsolutePath().toString().replace('\\', '/');
        Files.writeString(configFile, "irrad.process.descriptor-dir = \"" + dir + "\"\nlogging.default-level = WARN\n");
        out = new StringWriter();
        err = new StringWriter();
    }

    @AfterEach
    void tearDown() {
        rootLogger().setLevel(originalRootLevel);
        LoggingConfigurator.reset();
    }

    private static Logger rootLogger() {
        return ((LoggerContext) LoggerFactory.getILoggerFactory()).getLogger(Logger.ROOT_LOGGER_NAME);
    }

    private int execute(final String... args) {
        final CommandLine commandLine = new CommandLine(new CommandLineInterface());
        commandLine.setOut(new PrintWriter(out, true));
        commandLine.setErr(new PrintWriter(err, true));
        final String[] withConfig = new String[args.length + 2];
        withConfig[0] = "--config";
        withConfig[1] = configFile.toString();
        System.arraycopy(args, 0, withConfig, 2, args.length);
        return commandLine.execute(withConfig);
    }

    @Test
    @DisplayName("Without subcommand the usage is shown")
    void noSubcommand_showsUsage() {
        final CommandLine commandLine = new CommandLine(new CommandLineInterface());
        final StringWriter usage = new StringWriter();
        commandLine.setOut(new PrintWriter(usage, true));

        assertThat(commandLine.execute("--help")).isZero();
        assertThat(usage.toString()).contains("server", "interpreter", "send", "status");
    }

    @Test
    @DisplayName("Status lists running and missing processes")
    void status_listsDescriptors() {
        new DescriptorFile(tempDir, "server").write(
            ProcessDescriptor.of(ProcessHandle.current().pid(), "server", Map.of(ChannelKind.CMD, 8601)));

        final int exitCode = execute("status");

        assertThat(exitCode).isZero();
        assertThat(out.toString())
            .containsPattern("server\\s+pid " + ProcessHandle.current().pid() + "\\s+alive")
            .containsPattern("interpreter\\s+not running");
    }

    @Test
    @DisplayName("Sending to a role without descriptor is a usage error")
    void send_withoutDescriptor_fails() {
        final int exitCode = execute("send", "--role", "server", "server", "start");

        assertThat(exitCode).isNotZero();
        assertThat(err.toString()).contains("No running server found");
    }

    @Test
    @ExpectLog(level = LogLevel.ERROR, messagePattern = "Unknown command 'bogus' for target 'interpreter'")
    @DisplayName("Send prints the reply and signals errors in its exit code")
    void send_printsReplyAndExitCode() throws Exception {
        // Arrange
        final InterpreterRole role = new InterpreterRole(
            new InterpreterSettings(List.of(), "beam_current", 1e-9), new ForwardingInterpreter());
        final ProcessCore core = ProcessFixtures.startCore(new ProcessCore(role, ProcessFixtures.settings(tempDir)));
        try {
            // Act
            final int ok = execute("send", "--host", "127.0.0.1", "--role", "interpreter", "interpreter", "status");
            final int failed = execute("send", "--host", "127.0.0.1", "--port", String.valueOf(core.ports().get(ChannelKind.CMD)),
                "interpreter", "bogus");

            // Assert
            assertThat(ok).isZero();
            assertThat(failed).isEqualTo(1);
            assertThat(out.toString())
                .contains("\"reply\":\"status\"")
                .contains("\"type\":\"ERROR\"");
        } finally {
            core.stop();
        }
    }
}
