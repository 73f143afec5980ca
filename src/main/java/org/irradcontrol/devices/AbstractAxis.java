package org.irradcontrol.devices;

/**
 * Base class of axes whose native unit is a fixed length, e.g. one motor step.
 */
public abstract class AbstractAxis implements IAxis {

    private final double nativeLength;

    /**
     * @param nativeLength Length of one native unit in metres.
     */
    protected AbstractAxis(final double nativeLength) {
        if (!(nativeLength > 0)) {
            throw new IllegalArgumentException("Native length must be positive, was " + nativeLength);
        }
        this.nativeLength = nativeLength;
    }

    @Override
    public double convertToNative(final double value, final AxisUnit unit) {
        return unit.isNative() ? value : unit.toMetres(value) / nativeLength;
    }

    @Override
    public double convertFromNative(final double nativeValue, final AxisUnit unit) {
        return unit.isNative() ? nativeValue : unit.fromMetres(nativeValue * nativeLength);
    }
}
