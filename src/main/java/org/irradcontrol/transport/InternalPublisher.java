package org.irradcontrol.transport;

import org.irradcontrol.protocol.ChannelKind;

/**
 * A producer's private handle on an {@link InternalBus}. It may only be used by the thread
 * that created it.
 */
public final class InternalPublisher implements AutoCloseable {

    private final InternalBus bus;
    private final Thread owner;
    private volatile boolean closed;

    InternalPublisher(final InternalBus bus, final Thread owner) {
        this.bus = bus;
        this.owner = owner;
    }

    /**
     * Queues a message for the given publish channel.
     *
     * @throws IllegalStateException if called from a thread other than the owner, or after close.
     */
    public void send(final ChannelKind channel, final String payload) {
        if (Thread.currentThread() != owner) {
            throw new IllegalStateException("Internal publisher of thread '" + owner.getName()
                + "' used from thread '" + Thread.currentThread().getName() + "'");
        }
        if (closed) {
            throw new IllegalStateException("Internal publisher is closed");
        }
        if (!channel.isBroadcast()) {
            throw new IllegalArgumentException("Channel '" + channel + "' is not a publish channel");
        }
        bus.offer(new InternalBus.Message(channel, payload));
    }

    public Thread owner() {
        return owner;
    }

    @Override
    public void close() {
        closed = true;
    }
}
