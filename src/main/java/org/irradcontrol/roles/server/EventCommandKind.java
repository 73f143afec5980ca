package org.irradcontrol.roles.server;

import org.irradcontrol.node.spi.ICommandKind;

/**
 * Operator overrides of server events.
 */
public enum EventCommandKind implements ICommandKind {
    DISABLE("disable"),
    ENABLE("enable");

    public static final String TARGET = "event";

    private final String wireName;

    EventCommandKind(final String wireName) {
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
