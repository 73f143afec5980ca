package org.irradcontrol.scan;

/**
 * Snapshot of the scan controller's state, sent in reply to {@code scan:status}.
 */
public record ScanStatus(
    boolean prepared,
    boolean running,
    boolean scanning,
    boolean stopRequested,
    boolean finishRequested,
    boolean paused,
    boolean standby,
    int nRows) {
}
