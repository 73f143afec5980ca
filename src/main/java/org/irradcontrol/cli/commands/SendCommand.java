package org.irradcontrol.cli.commands;

import com.fasterxml.jackson.databind.JsonNode;
import com.typesafe.config.Config;
import org.irradcontrol.cli.CommandLineInterface;
import org.irradcontrol.node.config.ProcessSettings;
import org.irradcontrol.node.discovery.DescriptorFile;
import org.irradcontrol.protocol.ChannelKind;
import org.irradcontrol.protocol.MessageCodec;
import org.irradcontrol.protocol.ProcessDescriptor;
import org.irradcontrol.protocol.Reply;
import org.irradcontrol.roles.console.ConsoleClient;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.ParentCommand;
import picocli.CommandLine.Spec;

import java.io.IOException;
import java.time.Duration;
import java.util.concurrent.Callable;

@Command(
    name = "send",
    description = "Sends a command to a process and prints its reply."
)
public class SendCommand implements Callable<Integer> {

    @ParentCommand
    private CommandLineInterface parent;

    @Spec
    private CommandLine.Model.CommandSpec spec;

    @Option(names = "--host", defaultValue = "localhost", description = "Host of the process (default: ${DEFAULT-VALUE}).")
    private String host;

    @Option(names = "--port", description = "Command port of the process. Looked up from the descriptor of --role if omitted.")
    private Integer port;

    @Option(names = "--role", defaultValue = "server", description = "Role whose local descriptor provides the port (default: ${DEFAULT-VALUE}).")
    private String role;

    @Option(names = "--timeout", defaultValue = "5000", description = "Reply timeout in milliseconds (default: ${DEFAULT-VALUE}).")
    private long timeoutMs;

    @Parameters(index = "0", description = "Target of the command, e.g. scan.")
    private String target;

    @Parameters(index = "1", description = "Command, e.g. status.")
    private String cmd;

    @Parameters(index = "2", arity = "0..1", description = "Command data as JSON.")
    private String data;

    @Override
    public Integer call() throws IOException {
        final int cmdPort = port != null ? port : lookUpPort();
        final JsonNode payload = data == null ? null : MessageCodec.mapper().readTree(data);
        try (ConsoleClient client = new ConsoleClient(host, cmdPort, Duration.ofMillis(timeoutMs))) {
            final Reply reply = client.send(target, cmd, payload);
            spec.commandLine().getOut().println(MessageCodec.encode(reply));
            return reply.isError() ? 1 : 0;
        }
    }

    private int lookUpPort() {
        final Config config = parent.getConfig();
        final DescriptorFile file = new DescriptorFile(ProcessSettings.fromConfig(config).descriptorDir(), role);
        final ProcessDescriptor descriptor = file.read()
            .orElseThrow(() -> new CommandLine.ParameterException(spec.commandLine(),
                "No running " + role + " found at " + file.path() + "; use --port"));
        return descriptor.port(ChannelKind.CMD)
            .orElseThrow(() -> new CommandLine.ParameterException(spec.commandLine(),
                "Descriptor " + file.path() + " has no cmd port"));
    }
}
