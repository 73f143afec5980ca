package org.irradcontrol.node.spi;

import com.fasterxml.jackson.databind.JsonNode;
import org.irradcontrol.protocol.Command;
import org.irradcontrol.protocol.MessageCodec;
import org.irradcontrol.protocol.Reply;

import java.util.function.Consumer;

/**
 * The command being executed and the means to answer it.
 * <p>
 * A handler either replies before it returns, or calls {@link #deferReply()} and replies later
 * from another thread. If it does neither, a generic {@code STANDARD} reply is sent for it.
 * The process does not read the next command until the reply has gone out.
 */
public final class CommandContext {

    private final Command command;
    private final Consumer<Reply> replySink;
    private boolean replied;
    private boolean deferred;

    public CommandContext(final Command command, final Consumer<Reply> replySink) {
        this.command = command;
        this.replySink = replySink;
    }

    public String target() {
        return command.target();
    }

    public String cmd() {
        return command.cmd();
    }

    /**
     * @return The raw payload, or {@code null} if the command carried none.
     */
    public JsonNode data() {
        return command.hasData() ? command.data() : null;
    }

    /**
     * Converts the payload to {@code type}.
     *
     * @throws IllegalArgumentException if the command has no payload.
     */
    public <T> T dataAs(final Class<T> type) {
        if (!command.hasData()) {
            throw new IllegalArgumentException("Command '" + command.cmd() + "' requires data");
        }
        return MessageCodec.convert(command.data(), type);
    }

    public void reply(final Object data) {
        send(Reply.standard(command.cmd(), command.target(), data));
    }

    public void replyError(final Object data) {
        send(Reply.error(command.cmd(), command.target(), data));
    }

    /**
     * Announces that the reply will be sent later, possibly from another thread.
     */
    public synchronized CommandContext deferReply() {
        deferred = true;
        return this;
    }

    public synchronized boolean isReplied() {
        return replied;
    }

    public synchronized boolean isDeferred() {
        return deferred;
    }

    private void send(final Reply reply) {
        synchronized (this) {
            if (replied) {
                throw new IllegalStateException("Command '" + command.target() + ":" + command.cmd() + "' already replied");
            }
            replied = true;
        }
        replySink.accept(reply);
    }
}
