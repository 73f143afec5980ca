package org.irradcontrol.cli.commands.server;

import com.typesafe.config.Config;
import org.irradcontrol.cli.commands.OrphanOptions;
import org.irradcontrol.cli.commands.ProcessLauncher;
import org.irradcontrol.node.config.ProcessSettings;
import org.irradcontrol.roles.server.ServerRole;
import org.irradcontrol.roles.server.ServerSettings;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;
import picocli.CommandLine.ParentCommand;

import java.util.concurrent.Callable;

@Command(
    name = "run",
    description = "Starts the server in the foreground."
)
public class ServerRunCommand implements Callable<Integer> {

    private static final Logger LOGGER = LoggerFactory.getLogger(ServerRunCommand.class);

    @ParentCommand
    private ServerCommand parent;

    @Mixin
    private OrphanOptions orphanOptions;

    @Override
    public Integer call() throws Exception {
        final Config config = parent.getParent().getConfig();
        final ServerSettings serverSettings = ServerSettings.fromConfig(config);
        LOGGER.info("Starting server {} with {} stage", serverSettings.id(), serverSettings.stage());
        return new ProcessLauncher(ProcessSettings.fromConfig(config), orphanOptions.policy())
            .run(ServerRole.create(serverSettings));
    }
}
