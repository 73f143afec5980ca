package org.irradcontrol.cli.commands;

import org.irradcontrol.cli.CommandLineInterface;
import org.irradcontrol.node.config.ProcessSettings;
import org.irradcontrol.node.discovery.DescriptorFile;
import org.irradcontrol.protocol.ProcessDescriptor;
import org.irradcontrol.roles.interpreter.InterpreterRole;
import org.irradcontrol.roles.server.ServerRole;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.ParentCommand;
import picocli.CommandLine.Spec;

import java.io.PrintWriter;
import java.nio.file.Path;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.Callable;

@Command(
    name = "status",
    description = "Shows the processes running on this host."
)
public class StatusCommand implements Callable<Integer> {

    @ParentCommand
    private CommandLineInterface parent;

    @Spec
    private CommandLine.Model.CommandSpec spec;

    @Parameters(arity = "0..*", description = "Roles to show (default: server and interpreter).")
    private List<String> roles = List.of(ServerRole.ROLE_NAME, InterpreterRole.ROLE_NAME);

    @Override
    public Integer call() {
        final Path dir = ProcessSettings.fromConfig(parent.getConfig()).descriptorDir();
        final PrintWriter out = spec.commandLine().getOut();
        for (final String role : roles) {
            final DescriptorFile file = new DescriptorFile(dir, role);
            final Optional<ProcessDescriptor> descriptor = file.read();
            if (descriptor.isEmpty()) {
                out.printf("%-12s not running%n", role);
                continue;
            }
            final ProcessDescriptor d = descriptor.get();
            final boolean alive = ProcessHandle.of(d.pid()).map(ProcessHandle::isAlive).orElse(false);
            out.printf("%-12s pid %-8d %-8s ports %s%n", role, d.pid(), alive ? "alive" : "stale", d.ports());
        }
        out.flush();
        return 0;
    }
}
