package org.irradcontrol.cli.commands.server;

import org.irradcontrol.cli.CommandLineInterface;
import picocli.CommandLine.Command;
import picocli.CommandLine.ParentCommand;

@Command(
    name = "server",
    description = "Manages the motorstage server of this host",
    subcommands = {
        ServerRunCommand.class
    }
)
public class ServerCommand {
    @ParentCommand
    private CommandLineInterface parent;

    public CommandLineInterface getParent() {
        return parent;
    }
}
