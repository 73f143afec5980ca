package org.irradcontrol.devices;

import java.util.Arrays;
import java.util.Optional;

/**
 * Length units of an axis. Speeds are expressed in unit per second, accelerations in unit per
 * second squared. {@link #NATIVE} is the axis' own unit (usually motor steps).
 */
public enum AxisUnit {
    NATIVE("native", Double.NaN),
    MM("mm", 1e-3),
    CM("cm", 1e-2),
    M("m", 1.0);

    private final String symbol;
    private final double metres;

    AxisUnit(final String symbol, final double metres) {
        this.symbol = symbol;
        this.metres = metres;
    }

    public String symbol() {
        return symbol;
    }

    public boolean isNative() {
        return this == NATIVE;
    }

    /**
     * Converts a length given in this unit to metres.
     */
    public double toMetres(final double value) {
        requirePhysical();
        return value * metres;
    }

    /**
     * Converts a length given in metres to this unit.
     */
    public double fromMetres(final double value) {
        requirePhysical();
        return value / metres;
    }

    public static Optional<AxisUnit> fromSymbol(final String symbol) {
        return Arrays.stream(values()).filter(unit -> unit.symbol.equals(symbol)).findFirst();
    }

    private void requirePhysical() {
        if (this == NATIVE) {
            throw new IllegalArgumentException("Native unit has no fixed length");
        }
    }
}
