package org.irradcontrol.node.spi;

/**
 * Executes one command. Runs on the command receiver thread; anything thrown is turned into an
 * {@code ERROR} reply.
 */
@FunctionalInterface
public interface ICommandHandler {

    void handle(CommandContext context) throws Exception;
}
