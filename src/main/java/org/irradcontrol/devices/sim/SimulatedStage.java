package org.irradcontrol.devices.sim;

import com.typesafe.config.Config;
import org.irradcontrol.devices.IScanStage;

/**
 * A software two-axis stage for dry runs without hardware.
 */
public final class SimulatedStage implements IScanStage {

    private final String name;
    private final SimulatedAxis horizontal;
    private final SimulatedAxis vertical;

    public SimulatedStage(final String name, final SimulatedAxis horizontal, final SimulatedAxis vertical) {
        this.name = name;
        this.horizontal = horizontal;
        this.vertical = vertical;
    }

    /**
     * Creates a stage from an {@code irrad.server.simulated-stage} block.
     */
    public static SimulatedStage fromConfig(final String name, final Config config) {
        final double nativeLength = config.getDouble("native-length");
        final double range = config.getDouble("range");
        final double speed = config.getDouble("speed");
        final double accel = config.getDouble("accel");
        final double timeScale = config.getDouble("time-scale");
        return new SimulatedStage(name,
            new SimulatedAxis(nativeLength, -range, range, speed, accel, timeScale),
            new SimulatedAxis(nativeLength, -range, range, speed, accel, timeScale));
    }

    @Override
    public String name() {
        return name;
    }

    @Override
    public SimulatedAxis horizontal() {
        return horizontal;
    }

    @Override
    public SimulatedAxis vertical() {
        return vertical;
    }
}
