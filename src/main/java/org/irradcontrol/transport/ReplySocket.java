package org.irradcontrol.transport;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.BufferedWriter;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.OutputStreamWriter;
import java.net.ServerSocket;
import java.net.Socket;
import java.net.SocketException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;

/**
 * Request/reply endpoint. Requests from all connected requesters are queued in arrival order
 * and handed out one at a time by {@link #poll(Duration)}; each is answered on the connection
 * it came from. Requests are never dropped.
 */
public final class ReplySocket implements AutoCloseable {

    private static final Logger LOGGER = LoggerFactory.getLogger(ReplySocket.class);

    private final String name;
    private final ServerSocket serverSocket;
    private final BlockingQueue<Request> inbox = new LinkedBlockingQueue<>();
    private final List<Peer> peers = new CopyOnWriteArrayList<>();
    private final Thread acceptor;
    private volatile boolean closed;

    public ReplySocket(final String name, final ServerSocket serverSocket) {
        this.name = name;
        this.serverSocket = serverSocket;
        this.acceptor = new Thread(this::acceptLoop, name + "-accept");
        this.acceptor.setDaemon(true);
        this.acceptor.start();
    }

    public int port() {
        return serverSocket.getLocalPort();
    }

    /**
     * Waits up to {@code timeout} for the next queued request.
     *
     * @return The request, or {@code null} if none arrived in time.
     */
    public Request poll(final Duration timeout) throws InterruptedException {
        return inbox.poll(timeout.toNanos(), TimeUnit.NANOSECONDS);
    }

    /**
     * Answers a request on the connection it arrived on.
     *
     * @throws TransportException if the requester is gone.
     */
    public void reply(final Request request, final String message) {
        try {
            request.peer.write(message);
        } catch (IOException e) {
            throw new TransportException("Could not deliver reply on '" + name + "': " + e.getMessage(), e);
        }
    }

    private void acceptLoop() {
        while (!closed) {
            try {
                final Socket socket = serverSocket.accept();
                socket.setTcpNoDelay(true);
                final Peer peer = new Peer(socket);
                peers.add(peer);
                peer.reader.start();
            } catch (SocketException e) {
                if (!closed) {
                    LOGGER.warn("Reply socket '{}' stopped accepting requesters: {}", name, e.getMessage());
                }
                return;
            } catch (IOException e) {
                if (!closed) {
                    LOGGER.warn("Failed to accept requester on '{}': {}", name, e.getMessage());
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
        peers.forEach(Peer::close);
        peers.clear();
    }

    /**
     * A received request together with the connection to answer on.
     */
    public static final class Request {

        private final Peer peer;
        private final String payload;

        private Request(final Peer peer, final String payload) {
            this.peer = peer;
            this.payload = payload;
        }

        public String payload() {
            return payload;
        }
    }

    private final class Peer {

        private final Socket socket;
        private final Thread reader;
        private final Object writeLock = new Object();
        private BufferedWriter out;

        Peer(final Socket socket) {
            this.socket = socket;
            this.reader = new Thread(this::readLoop, name + "-peer-" + socket.getPort());
            this.reader.setDaemon(true);
        }

        private void readLoop() {
            try (BufferedReader in = new BufferedReader(
                new InputStreamReader(socket.getInputStream(), StandardCharsets.UTF_8))) {
                String line;
                while (!closed && (line = in.readLine()) != null) {
                    if (!line.isBlank()) {
                        inbox.offer(new Request(this, line));
                    }
                }
            } catch (IOException e) {
                LOGGER.debug("Requester {} on '{}' disconnected: {}", socket.getRemoteSocketAddress(), name, e.getMessage());
            } finally {
                peers.remove(this);
            }
        }

        void write(final String message) throws IOException {
            synchronized (writeLock) {
                if (out == null) {
                    out = new BufferedWriter(new OutputStreamWriter(socket.getOutputStream(), StandardCharsets.UTF_8));
                }
                out.write(message);
                out.write('\n');
                out.flush();
            }
        }

        void close() {
            try {
                socket.close();
            } catch (IOException e) {
                LOGGER.debug("Error closing requester socket: {}", e.getMessage());
            }
        }
    }
}
