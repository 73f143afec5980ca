package org.irradcontrol.devices;

/**
 * A single motorized axis. Each call completes synchronously or throws.
 */
public interface IAxis {

    double getPosition(AxisUnit unit) throws AxisException;

    void moveAbs(double value, AxisUnit unit) throws AxisException;

    void moveRel(double value, AxisUnit unit) throws AxisException;

    void setSpeed(double value, AxisUnit unit) throws AxisException;

    double getSpeed(AxisUnit unit) throws AxisException;

    double getAccel(AxisUnit unit) throws AxisException;

    /**
     * Converts a length from {@code unit} to native units.
     */
    double convertToNative(double value, AxisUnit unit);

    /**
     * Converts a length from native units to {@code unit}.
     */
    double convertFromNative(double nativeValue, AxisUnit unit);
}
