package org.irradcontrol.transport;

/**
 * Raised when a channel endpoint cannot be bound or connected.
 */
public class TransportException extends RuntimeException {

    public TransportException(final String message) {
        super(message);
    }

    public TransportException(final String message, final Throwable cause) {
        super(message, cause);
    }
}
