package org.irradcontrol.roles.console;

import com.fasterxml.jackson.databind.JsonNode;
import org.irradcontrol.protocol.ChannelKind;
import org.irradcontrol.protocol.Command;
import org.irradcontrol.protocol.MessageCodec;
import org.irradcontrol.protocol.ProcessDescriptor;
import org.irradcontrol.protocol.Reply;
import org.irradcontrol.transport.Endpoint;
import org.irradcontrol.transport.RequestSocket;
import org.irradcontrol.transport.SubscriberSocket;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Operator side of a process: sends commands and subscribes to its publish channels.
 */
public final class ConsoleClient implements AutoCloseable {

    private static final Logger LOGGER = LoggerFactory.getLogger(ConsoleClient.class);

    private final String host;
    private final int cmdPort;
    private final Duration timeout;
    private final List<SubscriberSocket> subscriptions = new ArrayList<>();
    private RequestSocket requests;

    public ConsoleClient(final String host, final int cmdPort, final Duration timeout) {
        this.host = host;
        this.cmdPort = cmdPort;
        this.timeout = timeout;
    }

    /**
     * Creates a client for the process described by {@code descriptor} on {@code host}.
     *
     * @throws IllegalArgumentException if the descriptor has no command port.
     */
    public static ConsoleClient forDescriptor(final String host, final ProcessDescriptor descriptor, final Duration timeout) {
        final int port = descriptor.port(ChannelKind.CMD)
            .orElseThrow(() -> new IllegalArgumentException("Descriptor of " + descriptor.name() + " has no cmd port"));
        return new ConsoleClient(host, port, timeout);
    }

    /**
     * Sends a command and waits for its reply.
     *
     * @throws IOException if the process cannot be reached or does not reply in time.
     */
    public synchronized Reply send(final String target, final String cmd, final JsonNode data) throws IOException {
        if (requests == null) {
            requests = new RequestSocket(Endpoint.tcp(host, cmdPort), timeout);
        }
        try {
            final String reply = requests.request(MessageCodec.encode(new Command(target, cmd, data)), timeout);
            return MessageCodec.decode(reply, Reply.class);
        } catch (IOException e) {
            closeRequests();
            throw e;
        }
    }

    public Reply send(final String target, final String cmd) throws IOException {
        return send(target, cmd, null);
    }

    /**
     * Subscribes to a publish channel of a process.
     *
     * @param port Port of the channel, usually taken from the process descriptor.
     */
    public synchronized SubscriberSocket subscribe(final ChannelKind channel, final String publisherHost, final int port) {
        if (!channel.isBroadcast()) {
            throw new IllegalArgumentException("Channel '" + channel + "' cannot be subscribed to");
        }
        final SubscriberSocket subscriber = new SubscriberSocket("console-" + channel);
        subscriber.connect(Endpoint.tcp(publisherHost, port));
        subscriptions.add(subscriber);
        return subscriber;
    }

    @Override
    public synchronized void close() {
        closeRequests();
        subscriptions.forEach(SubscriberSocket::close);
        subscriptions.clear();
    }

    private void closeRequests() {
        if (requests == null) {
            return;
        }
        try {
            requests.close();
        } catch (IOException e) {
            LOGGER.debug("Error closing command connection: {}", e.getMessage());
        }
        requests = null;
    }
}
