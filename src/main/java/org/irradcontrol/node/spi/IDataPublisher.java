package org.irradcontrol.node.spi;

import org.irradcontrol.protocol.DataPacket;

/**
 * Publishes data packets on the process' {@code data} channel. An instance is bound to the
 * thread it was obtained on.
 */
@FunctionalInterface
public interface IDataPublisher {

    void publish(DataPacket packet);
}
