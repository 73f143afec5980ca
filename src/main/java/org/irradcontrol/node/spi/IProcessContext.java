package org.irradcontrol.node.spi;

import org.irradcontrol.node.threads.Flag;
import org.irradcontrol.node.threads.IThreadLauncher;
import org.irradcontrol.protocol.ChannelKind;
import org.irradcontrol.protocol.EventRecord;

import java.util.Map;

/**
 * What a running process offers its role handler.
 */
public interface IProcessContext extends IThreadLauncher {

    String name();

    long pid();

    Map<ChannelKind, Integer> ports();

    /**
     * @return A publisher for the data channel bound to the calling thread.
     */
    IDataPublisher dataPublisher();

    /**
     * Broadcasts an event record on the event channel. May be called from any thread.
     */
    void publishEvent(EventRecord record);

    /**
     * Subscribes to an upstream data stream and launches its receiver thread.
     *
     * @return {@code false} if the address is invalid.
     */
    boolean addDataStream(String address);

    /**
     * Subscribes to an upstream event stream.
     *
     * @return {@code false} if the address is invalid.
     */
    boolean addEventStream(String address);

    /**
     * Creates a stop flag that is set when the process shuts down.
     */
    Flag stopFlag(String purpose);

    /**
     * Sets all stop flags. Returns immediately; the process winds down on its own threads.
     */
    void shutdown();

    boolean isStopping();
}
