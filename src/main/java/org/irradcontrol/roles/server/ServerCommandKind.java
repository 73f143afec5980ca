package org.irradcontrol.roles.server;

import org.irradcontrol.node.spi.ICommandKind;

/**
 * Commands addressed to the server itself.
 */
public enum ServerCommandKind implements ICommandKind {
    START("start"),
    SHUTDOWN("shutdown"),
    MOTORSTAGES("motorstages"),
    EVENTS("events");

    public static final String TARGET = "server";

    private final String wireName;

    ServerCommandKind(final String wireName) {
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
