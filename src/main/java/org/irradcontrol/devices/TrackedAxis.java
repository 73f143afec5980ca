package org.irradcontrol.devices;

import org.irradcontrol.node.spi.IDataPublisher;
import org.irradcontrol.protocol.DataPacket;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.function.Supplier;

/**
 * Decorates an axis with movement telemetry. Every movement publishes an {@code axis} packet
 * with status {@code move_start} before and {@code move_stop} after it, and adds the distance
 * moved to the axis' total travel.
 * <p>
 * Packets go out through the publisher of the thread that commands the movement.
 */
public final class TrackedAxis implements IAxis {

    private static final Logger LOGGER = LoggerFactory.getLogger(TrackedAxis.class);

    public static final String PACKET_TYPE = "axis";
    public static final String MOVE_START = "move_start";
    public static final String MOVE_STOP = "move_stop";

    private final IAxis delegate;
    private final int axisId;
    private final String domain;
    private final String sender;
    private final Supplier<IDataPublisher> publishers;
    private double totalTravel;

    /**
     * @param delegate   The axis to track.
     * @param axisId     Index of the axis within its stage.
     * @param domain     Name of the stage the axis belongs to.
     * @param sender     Name put into the packets' meta block.
     * @param publishers Supplies the publisher of the calling thread.
     */
    public TrackedAxis(final IAxis delegate, final int axisId, final String domain, final String sender,
                       final Supplier<IDataPublisher> publishers) {
        this.delegate = delegate;
        this.axisId = axisId;
        this.domain = domain;
        this.sender = sender;
        this.publishers = publishers;
    }

    @Override
    public void moveAbs(final double value, final AxisUnit unit) throws AxisException {
        final double start = beginMove();
        try {
            delegate.moveAbs(value, unit);
        } finally {
            endMove(start, unit);
        }
    }

    @Override
    public void moveRel(final double value, final AxisUnit unit) throws AxisException {
        final double start = beginMove();
        try {
            delegate.moveRel(value, unit);
        } finally {
            endMove(start, unit);
        }
    }

    /**
     * @return Total distance moved since creation, in native units.
     */
    public synchronized double totalTravel() {
        return totalTravel;
    }

    private double beginMove() throws AxisException {
        final double start = delegate.getPosition(AxisUnit.NATIVE);
        final Map<String, Object> data = new LinkedHashMap<>();
        data.put("status", MOVE_START);
        data.put("axis", axisId);
        data.put("axis_domain", domain);
        data.put("position", delegate.convertFromNative(start, AxisUnit.MM));
        data.put("speed", delegate.getSpeed(AxisUnit.MM));
        data.put("accel", delegate.getAccel(AxisUnit.MM));
        data.put("unit", AxisUnit.MM.symbol());
        publishers.get().publish(DataPacket.of(sender, PACKET_TYPE, data));
        return start;
    }

    private void endMove(final double start, final AxisUnit unit) {
        final double stop;
        try {
            stop = delegate.getPosition(AxisUnit.NATIVE);
        } catch (AxisException e) {
            LOGGER.warn("Could not read position of axis {} of {} after movement: {}", axisId, domain, e.getMessage());
            return;
        }
        final double travel = Math.abs(stop - start);
        synchronized (this) {
            totalTravel += travel;
        }
        final Map<String, Object> data = new LinkedHashMap<>();
        data.put("status", MOVE_STOP);
        data.put("axis", axisId);
        data.put("axis_domain", domain);
        data.put("travel", delegate.convertFromNative(travel, unit));
        data.put("unit", unit.symbol());
        publishers.get().publish(DataPacket.of(sender, PACKET_TYPE, data));
    }

    @Override
    public double getPosition(final AxisUnit unit) throws AxisException {
        return delegate.getPosition(unit);
    }

    @Override
    public void setSpeed(final double value, final AxisUnit unit) throws AxisException {
        delegate.setSpeed(value, unit);
    }

    @Override
    public double getSpeed(final AxisUnit unit) throws AxisException {
        return delegate.getSpeed(unit);
    }

    @Override
    public double getAccel(final AxisUnit unit) throws AxisException {
        return delegate.getAccel(unit);
    }

    @Override
    public double convertToNative(final double value, final AxisUnit unit) {
        return delegate.convertToNative(value, unit);
    }

    @Override
    public double convertFromNative(final double nativeValue, final AxisUnit unit) {
        return delegate.convertFromNative(nativeValue, unit);
    }
}
