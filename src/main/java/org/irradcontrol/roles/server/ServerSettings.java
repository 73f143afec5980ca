package org.irradcontrol.roles.server;

import com.typesafe.config.Config;
import org.irradcontrol.scan.ScanSettings;

/**
 * Settings of the server role, read from {@code irrad.server} and {@code irrad.scan}.
 *
 * @param id             Identifier of this server in event records.
 * @param stage          Kind of stage driver; only {@code simulated} is built in.
 * @param simulatedStage Parameters of the simulated stage.
 * @param scan           Scan controller settings.
 */
public record ServerSettings(String id, String stage, Config simulatedStage, ScanSettings scan) {

    public static final String CONFIG_PATH = "irrad.server";
    public static final String SIMULATED = "simulated";

    public static ServerSettings fromConfig(final Config root) {
        final Config c = root.getConfig(CONFIG_PATH);
        return new ServerSettings(
            c.getString("id"),
            c.getString("stage"),
            c.getConfig("simulated-stage"),
            ScanSettings.fromConfig(root));
    }
}
