package org.irradcontrol.protocol;

import java.util.Arrays;
import java.util.Optional;

/**
 * The four independent message streams every process exposes.
 */
public enum ChannelKind {
    /** Fan-out of log records. */
    LOG("log", true),
    /** Request/reply channel for commands. */
    CMD("cmd", false),
    /** Fan-out of data packets. */
    DATA("data", true),
    /** Fan-out of event records. */
    EVENT("event", true);

    private final String wireName;
    private final boolean broadcast;

    ChannelKind(final String wireName, final boolean broadcast) {
        this.wireName = wireName;
        this.broadcast = broadcast;
    }

    /**
     * @return The name used for this channel in process descriptors.
     */
    public String wireName() {
        return wireName;
    }

    /**
     * @return {@code true} if the channel is a publish channel with many subscribers.
     */
    public boolean isBroadcast() {
        return broadcast;
    }

    public static Optional<ChannelKind> fromWireName(final String name) {
        return Arrays.stream(values()).filter(kind -> kind.wireName.equals(name)).findFirst();
    }

    @Override
    public String toString() {
        return wireName;
    }
}
