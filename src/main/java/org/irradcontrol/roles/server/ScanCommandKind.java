package org.irradcontrol.roles.server;

import org.irradcontrol.node.spi.ICommandKind;

/**
 * Commands addressed to the scan controller of a server.
 */
public enum ScanCommandKind implements ICommandKind {
    SETUP_SCAN("setup_scan"),
    SCAN_ROW("scan_row"),
    SCAN_DEVICE("scan_device"),
    HANDLE_EVENT("handle_event"),
    STATUS("status");

    public static final String TARGET = "scan";

    private final String wireName;

    ScanCommandKind(final String wireName) {
        this.wireName = wireName;
    }

    @Override
    public String target() {
        return TARGET;
    }

    @Override
    public String wireName() {
        return wireName;
    }
}
