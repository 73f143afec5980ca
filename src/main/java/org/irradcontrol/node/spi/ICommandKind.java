package org.irradcontrol.node.spi;

/**
 * A command a role understands. Roles declare their commands as enums implementing this
 * interface, one enum per target.
 */
public interface ICommandKind {

    /**
     * @return The target this command is addressed to, e.g. {@code scan}.
     */
    String target();

    /**
     * @return The command name on the wire, e.g. {@code setup_scan}.
     */
    String wireName();
}
