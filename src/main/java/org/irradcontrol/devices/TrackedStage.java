package org.irradcontrol.devices;

import org.irradcontrol.node.spi.IDataPublisher;

import java.util.function.Supplier;

/**
 * A stage whose axes publish movement telemetry.
 */
public final class TrackedStage implements IScanStage {

    private final IScanStage delegate;
    private final TrackedAxis horizontal;
    private final TrackedAxis vertical;

    public TrackedStage(final IScanStage delegate, final String sender, final Supplier<IDataPublisher> publishers) {
        this.delegate = delegate;
        this.horizontal = new TrackedAxis(delegate.horizontal(), 0, delegate.name(), sender, publishers);
        this.vertical = new TrackedAxis(delegate.vertical(), 1, delegate.name(), sender, publishers);
    }

    @Override
    public String name() {
        return delegate.name();
    }

    @Override
    public TrackedAxis horizontal() {
        return horizontal;
    }

    @Override
    public TrackedAxis vertical() {
        return vertical;
    }

    @Override
    public void shutdown() {
        delegate.shutdown();
    }
}
