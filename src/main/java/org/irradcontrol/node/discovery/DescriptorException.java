package org.irradcontrol.node.discovery;

/**
 * Raised when a process descriptor cannot be written or read.
 */
public class DescriptorException extends RuntimeException {

    public DescriptorException(final String message, final Throwable cause) {
        super(message, cause);
    }
}
