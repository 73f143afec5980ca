package org.irradcontrol.transport;

import org.irradcontrol.protocol.ChannelKind;

import java.time.Duration;
import java.util.concurrent.BlockingDeque;
import java.util.concurrent.LinkedBlockingDeque;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

/**
 * In-process address that producer threads publish to through their own
 * {@link InternalPublisher}; a single consumer (the publish bridge) drains it in FIFO order
 * and forwards each message to the external socket of its channel.
 */
public final class InternalBus {

    /**
     * A message waiting to be forwarded.
     *
     * @param channel The publish channel the message is meant for.
     * @param payload The encoded message.
     */
    public record Message(ChannelKind channel, String payload) {
    }

    private final Endpoint address;
    private final BlockingDeque<Message> queue;
    private final AtomicLong dropped = new AtomicLong();

    /**
     * @param name     Name of the in-process address.
     * @param capacity Maximum number of pending messages; the oldest is dropped beyond it.
     */
    public InternalBus(final String name, final int capacity) {
        if (capacity <= 0) {
            throw new IllegalArgumentException("Capacity must be positive, was " + capacity);
        }
        this.address = Endpoint.inproc(name);
        this.queue = new LinkedBlockingDeque<>(capacity);
    }

    public Endpoint address() {
        return address;
    }

    /**
     * Creates a publisher bound to the calling thread.
     */
    public InternalPublisher createPublisher() {
        return new InternalPublisher(this, Thread.currentThread());
    }

    /**
     * Waits up to {@code timeout} for the next pending message.
     *
     * @return The message, or {@code null} if none is pending.
     */
    public Message poll(final Duration timeout) throws InterruptedException {
        return queue.pollFirst(timeout.toNanos(), TimeUnit.NANOSECONDS);
    }

    public int pending() {
        return queue.size();
    }

    public long droppedMessages() {
        return dropped.get();
    }

    void offer(final Message message) {
        while (!queue.offerLast(message)) {
            if (queue.pollFirst() != null) {
                dropped.incrementAndGet();
            }
        }
    }
}
