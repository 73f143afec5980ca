package org.irradcontrol.transport;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;

/**
 * Address of a channel endpoint: either {@code tcp://host:port} or {@code inproc://name}.
 *
 * @param protocol {@code tcp} or {@code inproc}.
 * @param host     Host name for tcp addresses, the bus name for inproc addresses.
 * @param port     Port for tcp addresses, {@code -1} otherwise.
 */
public record Endpoint(String protocol, String host, int port) {

    private static final Logger LOGGER = LoggerFactory.getLogger(Endpoint.class);

    public static final String TCP = "tcp";
    public static final String INPROC = "inproc";
    private static final int MAX_PORT = (1 << 16) - 1;

    public static Endpoint tcp(final String host, final int port) {
        return new Endpoint(TCP, host, port);
    }

    public static Endpoint inproc(final String name) {
        return new Endpoint(INPROC, name, -1);
    }

    /**
     * Parses an address string. Malformed addresses are logged and yield an empty result.
     *
     * @param address The address, e.g. {@code tcp://192.168.1.2:8500}.
     * @return The parsed endpoint, or empty if the address is invalid.
     */
    public static Optional<Endpoint> parse(final String address) {
        if (address == null) {
            LOGGER.error("Address must not be null");
            return Optional.empty();
        }
        final int separator = address.indexOf("://");
        if (separator <= 0) {
            LOGGER.error("Incorrect address format '{}'. Must be 'protocol://endpoint'", address);
            return Optional.empty();
        }
        final String protocol = address.substring(0, separator);
        final String rest = address.substring(separator + 3);

        if (INPROC.equals(protocol)) {
            if (rest.isEmpty() || rest.contains(":")) {
                LOGGER.error("Incorrect address format '{}'. Must be 'inproc://name'", address);
                return Optional.empty();
            }
            return Optional.of(inproc(rest));
        }
        if (!TCP.equals(protocol)) {
            LOGGER.error("Unsupported protocol '{}' in address '{}'", protocol, address);
            return Optional.empty();
        }

        final int colon = rest.lastIndexOf(':');
        if (colon <= 0) {
            LOGGER.error("Incorrect address format '{}'. Must be 'tcp://address:port'", address);
            return Optional.empty();
        }
        try {
            final int port = Integer.parseInt(rest.substring(colon + 1));
            if (port <= 0 || port >= MAX_PORT) {
                throw new NumberFormatException();
            }
            return Optional.of(tcp(rest.substring(0, colon), port));
        } catch (NumberFormatException e) {
            LOGGER.error("'port' of address '{}' must be an integer between 1 and {}", address, MAX_PORT - 1);
            return Optional.empty();
        }
    }

    public boolean isTcp() {
        return TCP.equals(protocol);
    }

    @Override
    public String toString() {
        return isTcp() ? protocol + "://" + host + ":" + port : protocol + "://" + host;
    }
}
