package org.irradcontrol.scan;

import com.typesafe.config.Config;

import java.time.Duration;

/**
 * Settings of the scan controller, read from {@code irrad.scan}.
 *
 * @param returnSpeed       Speed in mm/s both axes are set to before returning to the origin.
 * @param standbyPoll       Interval at which a held scan re-checks whether it may continue.
 * @param positionTolerance Largest deviation in native units still counted as the same position.
 */
public record ScanSettings(double returnSpeed, Duration standbyPoll, double positionTolerance) {

    public static final String CONFIG_PATH = "irrad.scan";

    public static ScanSettings fromConfig(final Config root) {
        final Config c = root.getConfig(CONFIG_PATH);
        return new ScanSettings(
            c.getDouble("return-speed"),
            c.getDuration("standby-poll"),
            c.getDouble("position-tolerance"));
    }
}
