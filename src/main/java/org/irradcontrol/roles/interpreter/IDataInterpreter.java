package org.irradcontrol.roles.interpreter;

import org.irradcontrol.protocol.DataPacket;

import java.util.List;

/**
 * Turns raw packets of a server into derived packets.
 */
@FunctionalInterface
public interface IDataInterpreter {

    /**
     * @param raw A packet received from a server's data stream.
     * @return The packets to republish; empty to publish nothing.
     */
    List<DataPacket> interpret(DataPacket raw);
}
