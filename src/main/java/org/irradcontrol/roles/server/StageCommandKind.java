package org.irradcontrol.roles.server;

import org.irradcontrol.node.spi.ICommandKind;

/**
 * Direct control of the motorstage of a server, e.g. to place the sample before a scan is set
 * up. Payloads name the axis by index ({@code 0} horizontal, {@code 1} vertical) and carry an
 * optional {@code unit}, {@code mm} by default.
 */
public enum StageCommandKind implements ICommandKind {
    MOVE_ABS("move_abs"),
    MOVE_REL("move_rel"),
    SET_SPEED("set_speed"),
    GET_SPEED("get_speed"),
    GET_POSITION("get_position");

    public static final String TARGET = "stage";

    private final String wireName;

    StageCommandKind(final String wireName) {
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
