package org.irradcontrol.cli.commands.interpreter;

import com.typesafe.config.Config;
import org.irradcontrol.cli.commands.OrphanOptions;
import org.irradcontrol.cli.commands.ProcessLauncher;
import org.irradcontrol.node.config.ProcessSettings;
import org.irradcontrol.roles.interpreter.ForwardingInterpreter;
import org.irradcontrol.roles.interpreter.InterpreterRole;
import org.irradcontrol.roles.interpreter.InterpreterSettings;
import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;
import picocli.CommandLine.Option;
import picocli.CommandLine.ParentCommand;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;

@Command(
    name = "run",
    description = "Starts the interpreter in the foreground."
)
public class InterpreterRunCommand implements Callable<Integer> {

    @ParentCommand
    private InterpreterCommand parent;

    @Mixin
    private OrphanOptions orphanOptions;

    @Option(names = "--data-stream", description = "Server data stream to subscribe to, e.g. tcp://10.0.0.2:8500. Repeatable.")
    private List<String> dataStreams = new ArrayList<>();

    @Override
    public Integer call() throws Exception {
        final Config config = parent.getParent().getConfig();
        InterpreterSettings settings = InterpreterSettings.fromConfig(config);
        if (!dataStreams.isEmpty()) {
            final List<String> streams = new ArrayList<>(settings.dataStreams());
            streams.addAll(dataStreams);
            settings = settings.withDataStreams(streams);
        }
        return new ProcessLauncher(ProcessSettings.fromConfig(config), orphanOptions.policy())
            .run(new InterpreterRole(settings, new ForwardingInterpreter()));
    }
}
