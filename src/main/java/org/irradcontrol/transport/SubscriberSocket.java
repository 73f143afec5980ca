package org.irradcontrol.transport;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.net.InetSocketAddress;
import java.net.Socket;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.BlockingDeque;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.LinkedBlockingDeque;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Receives messages from any number of {@link PublisherSocket}s. Connections are
 * re-established automatically until the socket is closed.
 * <p>
 * Received messages wait in an inbox bounded by the high-water mark. Once it is full the oldest
 * message is dropped, so a slow consumer never stalls the connections.
 */
public final class SubscriberSocket implements AutoCloseable {

    private static final Logger LOGGER = LoggerFactory.getLogger(SubscriberSocket.class);
    private static final int CONNECT_TIMEOUT_MS = 1000;
    public static final int DEFAULT_HIGH_WATER_MARK = 1000;

    private final String name;
    private final Duration reconnectInterval;
    private final BlockingDeque<String> inbox;
    private final AtomicLong dropped = new AtomicLong();
    private final List<Connection> connections = new CopyOnWriteArrayList<>();
    private volatile boolean closed;

    /**
     * @param name              Name used for threads and log messages.
     * @param highWaterMark     Maximum number of received messages waiting to be polled.
     * @param reconnectInterval Pause before a lost connection is retried.
     */
    public SubscriberSocket(final String name, final int highWaterMark, final Duration reconnectInterval) {
        if (highWaterMark <= 0) {
            throw new IllegalArgumentException("High-water mark must be positive, was " + highWaterMark);
        }
        this.name = name;
        this.inbox = new LinkedBlockingDeque<>(highWaterMark);
        this.reconnectInterval = reconnectInterval;
    }

    public SubscriberSocket(final String name, final int highWaterMark) {
        this(name, highWaterMark, Duration.ofMillis(100));
    }

    public SubscriberSocket(final String name) {
        this(name, DEFAULT_HIGH_WATER_MARK);
    }

    /**
     * Connects to a publisher. Safe to call from any thread, also while another thread polls.
     *
     * @param endpoint A tcp endpoint of a publisher.
     */
    public void connect(final Endpoint endpoint) {
        if (!endpoint.isTcp()) {
            throw new IllegalArgumentException("Subscriber '" + name + "' can only connect to tcp endpoints, got " + endpoint);
        }
        if (closed) {
            throw new IllegalStateException("Subscriber '" + name + "' is closed");
        }
        final Connection connection = new Connection(endpoint);
        connections.add(connection);
        connection.thread.start();
    }

    /**
     * Waits up to {@code timeout} for the next message.
     *
     * @return The message, or {@code null} if none arrived in time.
     */
    public String poll(final Duration timeout) throws InterruptedException {
        return inbox.pollFirst(timeout.toNanos(), TimeUnit.NANOSECONDS);
    }

    public int pending() {
        return inbox.size();
    }

    /**
     * @return Number of received messages dropped because the inbox exceeded the high-water mark.
     */
    public long droppedMessages() {
        return dropped.get();
    }

    public int connectedCount() {
        return (int) connections.stream().filter(c -> c.connected).count();
    }

    @Override
    public void close() {
        closed = true;
        for (final Connection connection : connections) {
            connection.close();
        }
        connections.clear();
    }

    private void enqueue(final String message) {
        while (!inbox.offerLast(message)) {
            if (inbox.pollFirst() != null) {
                dropped.incrementAndGet();
            }
        }
    }

    private final class Connection {

        private final Endpoint endpoint;
        private final Thread thread;
        private volatile Socket socket;
        private volatile boolean connected;

        Connection(final Endpoint endpoint) {
            this.endpoint = endpoint;
            this.thread = new Thread(this::readLoop, name + "-" + endpoint.host() + ":" + endpoint.port());
            this.thread.setDaemon(true);
        }

        private void readLoop() {
            while (!closed) {
                try (Socket s = new Socket()) {
                    socket = s;
                    s.connect(new InetSocketAddress(endpoint.host(), endpoint.port()), CONNECT_TIMEOUT_MS);
                    connected = true;
                    LOGGER.debug("Subscriber '{}' connected to {}", name, endpoint);
                    final BufferedReader in = new BufferedReader(
                        new InputStreamReader(s.getInputStream(), StandardCharsets.UTF_8));
                    String line;
                    while (!closed && (line = in.readLine()) != null) {
                        enqueue(line);
                    }
                } catch (IOException e) {
                    LOGGER.trace("Subscriber '{}' lost {}: {}", name, endpoint, e.getMessage());
                } finally {
                    connected = false;
                    socket = null;
                }
                if (closed) {
                    return;
                }
                try {
                    Thread.sleep(reconnectInterval.toMillis());
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    return;
                }
            }
        }

        void close() {
            final Socket current = socket;
            if (current != null) {
                try {
                    current.close();
                } catch (IOException e) {
                    LOGGER.debug("Error closing connection to {}: {}", endpoint, e.getMessage());
                }
            }
            thread.interrupt();
        }
    }
}
