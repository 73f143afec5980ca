package org.irradcontrol.scan;

/**
 * Raised when a scan cannot continue: an axis failed or the scan was stopped manually.
 */
public class ScanException extends Exception {

    public ScanException(final String message) {
        super(message);
    }

    public ScanException(final String message, final Throwable cause) {
        super(message, cause);
    }
}
