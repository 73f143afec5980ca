package org.irradcontrol.devices.sim;

import org.irradcontrol.devices.AbstractAxis;
import org.irradcontrol.devices.AxisException;
import org.irradcontrol.devices.AxisUnit;

/**
 * A software axis with a bounded travel range. Movements complete instantly unless a time
 * scale is set, in which case the calling thread sleeps for the scaled travel time.
 */
public class SimulatedAxis extends AbstractAxis {

    private final double minPosition;
    private final double maxPosition;
    private final double accel;
    private final double timeScale;
    private double position;
    private double speed;

    /**
     * @param nativeLength Length of one native unit in metres.
     * @param minPosition  Lower travel limit in native units.
     * @param maxPosition  Upper travel limit in native units.
     * @param speed        Initial speed in native units per second.
     * @param accel        Acceleration in native units per second squared.
     * @param timeScale    Factor applied to the real travel time; 0 for instant moves.
     */
    public SimulatedAxis(final double nativeLength, final double minPosition, final double maxPosition,
                         final double speed, final double accel, final double timeScale) {
        super(nativeLength);
        if (maxPosition < minPosition) {
            throw new IllegalArgumentException("Invalid travel range [" + minPosition + ", " + maxPosition + "]");
        }
        this.minPosition = minPosition;
        this.maxPosition = maxPosition;
        this.speed = speed;
        this.accel = accel;
        this.timeScale = timeScale;
    }

    @Override
    public synchronized double getPosition(final AxisUnit unit) {
        return convertFromNative(position, unit);
    }

    @Override
    public void moveAbs(final double value, final AxisUnit unit) throws AxisException {
        final double target = convertToNative(value, unit);
        if (target < minPosition || target > maxPosition) {
            throw new AxisException(String.format("Target %.3f %s out of range [%.3f, %.3f] native",
                value, unit.symbol(), minPosition, maxPosition));
        }
        final double distance;
        final double currentSpeed;
        synchronized (this) {
            distance = Math.abs(target - position);
            currentSpeed = speed;
        }
        simulateTravel(distance, currentSpeed);
        synchronized (this) {
            position = target;
        }
    }

    @Override
    public void moveRel(final double value, final AxisUnit unit) throws AxisException {
        final double current;
        synchronized (this) {
            current = position;
        }
        moveAbs(current + convertToNative(value, unit), AxisUnit.NATIVE);
    }

    @Override
    public synchronized void setSpeed(final double value, final AxisUnit unit) throws AxisException {
        if (!(value > 0)) {
            throw new AxisException("Speed must be positive, was " + value);
        }
        speed = convertToNative(value, unit);
    }

    @Override
    public synchronized double getSpeed(final AxisUnit unit) {
        return convertFromNative(speed, unit);
    }

    @Override
    public double getAccel(final AxisUnit unit) {
        return convertFromNative(accel, unit);
    }

    private void simulateTravel(final double distance, final double currentSpeed) throws AxisException {
        if (timeScale <= 0 || distance == 0) {
            return;
        }
        final long millis = (long) (distance / currentSpeed * timeScale * 1000);
        try {
            Thread.sleep(millis);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new AxisException("Movement interrupted", e);
        }
    }
}
