package org.irradcontrol.cli.commands.interpreter;

import org.irradcontrol.cli.CommandLineInterface;
import picocli.CommandLine.Command;
import picocli.CommandLine.ParentCommand;

@Command(
    name = "interpreter",
    description = "Manages the data interpreter",
    subcommands = {
        InterpreterRunCommand.class
    }
)
public class InterpreterCommand {
    @ParentCommand
    private CommandLineInterface parent;

    public CommandLineInterface getParent() {
        return parent;
    }
}
