package org.irradcontrol.roles.interpreter;

import org.irradcontrol.node.spi.ICommandKind;

/**
 * Commands addressed to the interpreter.
 */
public enum InterpreterCommandKind implements ICommandKind {
    SHUTDOWN("shutdown"),
    ADD_STREAM("add_stream"),
    EVENTS("events"),
    STATUS("status");

    public static final String TARGET = "interpreter";

    private final String wireName;

    InterpreterCommandKind(final String wireName) {
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
