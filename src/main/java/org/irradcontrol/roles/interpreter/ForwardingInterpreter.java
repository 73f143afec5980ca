package org.irradcontrol.roles.interpreter;

import org.irradcontrol.protocol.DataPacket;

import java.util.List;

/**
 * Republishes every packet unchanged.
 */
public final class ForwardingInterpreter implements IDataInterpreter {

    @Override
    public List<DataPacket> interpret(final DataPacket raw) {
        return List.of(raw);
    }
}
