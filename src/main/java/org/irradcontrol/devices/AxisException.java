package org.irradcontrol.devices;

/**
 * Raised by an axis that could not execute a command.
 */
public class AxisException extends Exception {

    public AxisException(final String message) {
        super(message);
    }

    public AxisException(final String message, final Throwable cause) {
        super(message, cause);
    }
}
