package org.irradcontrol.node.spi;

import org.irradcontrol.protocol.DataPacket;
import org.irradcontrol.protocol.EventRecord;

import java.util.List;

/**
 * The behaviour of one process role (server, interpreter, ...). The process core owns sockets,
 * threads and the command loop; the role only supplies what to do.
 */
public interface IRoleHandler {

    /**
     * @return Name of the role; used for the process name, thread names and the descriptor file.
     */
    String roleName();

    /**
     * @return The commands this role accepts. Called once at start.
     */
    CommandTable commands();

    /**
     * Called once the process' sockets are bound, before any command is read. Roles add their
     * upstream streams and create their collaborators here.
     */
    default void attach(final IProcessContext context) {
    }

    /**
     * Handles a packet received from an upstream data stream.
     *
     * @return Derived packets to republish on this process' data channel.
     */
    default List<DataPacket> handleData(final DataPacket packet) {
        return List.of();
    }

    /**
     * Handles an event record received from an upstream event stream.
     */
    default void handleEvent(final EventRecord record) {
    }

    /**
     * Flushes and closes persistent resources. Called after all worker threads have ended.
     */
    default void cleanUp() {
    }
}
