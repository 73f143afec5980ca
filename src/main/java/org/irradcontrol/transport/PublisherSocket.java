package org.irradcontrol.transport;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedWriter;
import java.io.IOException;
import java.io.OutputStreamWriter;
import java.net.ServerSocket;
import java.net.Socket;
import java.net.SocketException;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.concurrent.BlockingDeque;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.LinkedBlockingDeque;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Fan-out endpoint: every message sent is delivered to all currently connected subscribers.
 * <p>
 * Each subscriber has its own outgoing queue bounded by the high-water mark. Once a queue is
 * full the oldest unsent message is dropped, so a slow subscriber never blocks the sender.
 * Messages sent while no subscriber is connected are discarded.
 * <p>
 * Only the owning thread may call {@link #send(String)}.
 */
public final class PublisherSocket implements AutoCloseable {

    private static final Logger LOGGER = LoggerFactory.getLogger(PublisherSocket.class);
    private static final long WRITER_POLL_MS = 100;

    private final String name;
    private final ServerSocket serverSocket;
    private final int highWaterMark;
    private final List<Subscription> subscriptions = new CopyOnWriteArrayList<>();
    private final AtomicLong dropped = new AtomicLong();
    private final Thread acceptor;
    private volatile boolean closed;

    /**
     * @param name          Name used for threads and log messages.
     * @param serverSocket  An already bound server socket.
     * @param highWaterMark Maximum number of queued messages per subscriber.
     */
    public PublisherSocket(final String name, final ServerSocket serverSocket, final int highWaterMark) {
        if (highWaterMark <= 0) {
            throw new IllegalArgumentException("High-water mark must be positive, was " + highWaterMark);
        }
        this.name = name;
        this.serverSocket = serverSocket;
        this.highWaterMark = highWaterMark;
        this.acceptor = new Thread(this::acceptLoop, name + "-accept");
        this.acceptor.setDaemon(true);
        this.acceptor.start();
    }

    public int port() {
        return serverSocket.getLocalPort();
    }

    public int subscriberCount() {
        return subscriptions.size();
    }

    /**
     * @return Number of messages dropped because a subscriber queue exceeded the high-water mark.
     */
    public long droppedMessages() {
        return dropped.get();
    }

    public void send(final String message) {
        if (closed) {
            throw new IllegalStateException("Publisher '" + name + "' is closed");
        }
        for (final Subscription subscription : subscriptions) {
            subscription.enqueue(message);
        }
    }

    private void acceptLoop() {
        while (!closed) {
            try {
                final Socket socket = serverSocket.accept();
                socket.setTcpNoDelay(true);
                final Subscription subscription = new Subscription(socket);
                subscriptions.add(subscription);
                subscription.start();
                LOGGER.debug("Subscriber {} connected to '{}'", socket.getRemoteSocketAddress(), name);
            } catch (SocketException e) {
                if (!closed) {
                    LOGGER.warn("Publisher '{}' stopped accepting subscribers: {}", name, e.getMessage());
                }
                return;
            } catch (IOException e) {
                if (!closed) {
                    LOGGER.warn("Failed to accept subscriber on '{}': {}", name, e.getMessage());
                }
            }
        }
    }

    @Override
    public void close() {
        closed = true;
        try {
            serverSocket.close();
        } catch (IOException e) {
            LOGGER.debug("Error closing server socket of '{}': {}", name, e.getMessage());
        }
        subscriptions.forEach(Subscription::close);
        subscriptions.clear();
    }

    private final class Subscription {

        private final Socket socket;
        private final BlockingDeque<String> queue = new LinkedBlockingDeque<>(highWaterMark);
        private final Thread writer;

        Subscription(final Socket socket) {
            this.socket = socket;
            this.writer = new Thread(this::writeLoop, name + "-writer-" + socket.getPort());
            this.writer.setDaemon(true);
        }

        void start() {
            writer.start();
        }

        void enqueue(final String message) {
            while (!queue.offerLast(message)) {
                if (queue.pollFirst() != null) {
                    dropped.incrementAndGet();
                }
            }
        }

        private void writeLoop() {
            try (BufferedWriter out = new BufferedWriter(
                new OutputStreamWriter(socket.getOutputStream(), StandardCharsets.UTF_8))) {
                while (!closed && !socket.isClosed()) {
                    final String message = queue.pollFirst(WRITER_POLL_MS, TimeUnit.MILLISECONDS);
                    if (message == null) {
                        continue;
                    }
                    out.write(message);
                    out.write('\n');
                    out.flush();
                }
            } catch (IOException e) {
                LOGGER.debug("Subscriber {} of '{}' disconnected: {}", socket.getRemoteSocketAddress(), name, e.getMessage());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            } finally {
                subscriptions.remove(this);
                close();
            }
        }

        void close() {
            try {
                socket.close();
            } catch (IOException e) {
                LOGGER.debug("Error closing subscriber socket: {}", e.getMessage());
            }
        }
    }
}
