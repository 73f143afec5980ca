package org.irradcontrol.transport;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.InetSocketAddress;
import java.net.ServerSocket;
import java.util.concurrent.ThreadLocalRandom;

/**
 * Binds server sockets to random free ports within a bounded range.
 */
public final class PortAllocator {

    private static final Logger LOGGER = LoggerFactory.getLogger(PortAllocator.class);

    private final String bindHost;
    private final int minPort;
    private final int maxPort;
    private final int maxTries;

    /**
     * @param bindHost Interface to bind to, e.g. {@code 0.0.0.0}.
     * @param minPort  Lowest port to try (inclusive).
     * @param maxPort  Highest port to try (exclusive).
     * @param maxTries Number of bind attempts before giving up.
     */
    public PortAllocator(final String bindHost, final int minPort, final int maxPort, final int maxTries) {
        if (minPort <= 0 || maxPort <= minPort) {
            throw new IllegalArgumentException("Invalid port range [" + minPort + ", " + maxPort + ")");
        }
        if (maxTries <= 0) {
            throw new IllegalArgumentException("maxTries must be positive, was " + maxTries);
        }
        this.bindHost = bindHost;
        this.minPort = minPort;
        this.maxPort = maxPort;
        this.maxTries = maxTries;
    }

    /**
     * Binds a new server socket to a random port of the range.
     *
     * @return The bound server socket.
     * @throws TransportException if no port could be bound within {@code maxTries} attempts.
     */
    public ServerSocket bindRandomPort() {
        for (int attempt = 1; attempt <= maxTries; attempt++) {
            final int port = ThreadLocalRandom.current().nextInt(minPort, maxPort);
            final ServerSocket socket = tryBind(port);
            if (socket != null) {
                return socket;
            }
            LOGGER.debug("Port {} unavailable (attempt {}/{})", port, attempt, maxTries);
        }
        throw new TransportException(String.format(
            "Could not bind to a port in range [%d, %d) on %s after %d tries", minPort, maxPort, bindHost, maxTries));
    }

    private ServerSocket tryBind(final int port) {
        ServerSocket socket = null;
        try {
            socket = new ServerSocket();
            socket.setReuseAddress(false);
            socket.bind(new InetSocketAddress(bindHost, port));
            return socket;
        } catch (IOException e) {
            closeQuietly(socket);
            return null;
        }
    }

    private static void closeQuietly(final ServerSocket socket) {
        if (socket == null) {
            return;
        }
        try {
            socket.close();
        } catch (IOException e) {
            LOGGER.debug("Failed to close unbound socket: {}", e.getMessage());
        }
    }
}
