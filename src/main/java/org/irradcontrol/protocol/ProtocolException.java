package org.irradcontrol.protocol;

/**
 * Raised when a message cannot be encoded or decoded.
 */
public class ProtocolException extends RuntimeException {

    public ProtocolException(final String message, final Throwable cause) {
        super(message, cause);
    }
}
