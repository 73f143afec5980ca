package org.irradcontrol.transport;

import java.io.BufferedReader;
import java.io.BufferedWriter;
import java.io.EOFException;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.OutputStreamWriter;
import java.net.InetSocketAddress;
import java.net.Socket;
import java.net.SocketTimeoutException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;

/**
 * Client side of a {@link ReplySocket}: one request in flight at a time.
 * <p>
 * A request that timed out leaves the exchange out of step, so the socket refuses further
 * requests afterwards and must be replaced.
 */
public final class RequestSocket implements AutoCloseable {

    private final Endpoint endpoint;
    private final Socket socket;
    private final BufferedReader in;
    private final BufferedWriter out;
    private boolean broken;

    public RequestSocket(final Endpoint endpoint, final Duration connectTimeout) throws IOException {
        if (!endpoint.isTcp()) {
            throw new IllegalArgumentException("Requests need a tcp endpoint, got " + endpoint);
        }
        this.endpoint = endpoint;
        this.socket = new Socket();
        this.socket.setTcpNoDelay(true);
        this.socket.connect(new InetSocketAddress(endpoint.host(), endpoint.port()), (int) connectTimeout.toMillis());
        this.in = new BufferedReader(new InputStreamReader(socket.getInputStream(), StandardCharsets.UTF_8));
        this.out = new BufferedWriter(new OutputStreamWriter(socket.getOutputStream(), StandardCharsets.UTF_8));
    }

    /**
     * Sends a request and blocks until its reply arrives.
     *
     * @throws SocketTimeoutException if no reply arrives within {@code timeout}.
     * @throws IOException            if the connection fails.
     */
    public synchronized String request(final String payload, final Duration timeout) throws IOException {
        if (broken) {
            throw new IOException("Request socket to " + endpoint + " is out of step after a failed request");
        }
        try {
            socket.setSoTimeout((int) Math.max(1, timeout.toMillis()));
            out.write(payload);
            out.write('\n');
            out.flush();
            final String reply = in.readLine();
            if (reply == null) {
                throw new EOFException("Connection to " + endpoint + " closed before reply");
            }
            return reply;
        } catch (IOException e) {
            broken = true;
            throw e;
        }
    }

    public Endpoint endpoint() {
        return endpoint;
    }

    @Override
    public void close() throws IOException {
        socket.close();
    }
}
