package org.irradcontrol.roles.interpreter;

import com.typesafe.config.Config;

import java.util.List;

/**
 * Settings of the interpreter role, read from {@code irrad.interpreter}.
 *
 * @param dataStreams      Server data streams to subscribe to at start.
 * @param currentField     Payload field carrying the beam current.
 * @param beamOffThreshold Beam current below which the beam counts as off.
 */
public record InterpreterSettings(List<String> dataStreams, String currentField, double beamOffThreshold) {

    public static final String CONFIG_PATH = "irrad.interpreter";

    public InterpreterSettings {
        dataStreams = List.copyOf(dataStreams);
    }

    public static InterpreterSettings fromConfig(final Config root) {
        final Config c = root.getConfig(CONFIG_PATH);
        return new InterpreterSettings(
            c.getStringList("data-streams"),
            c.getString("current-field"),
            c.getDouble("beam-off-threshold"));
    }

    public InterpreterSettings withDataStreams(final List<String> streams) {
        return new InterpreterSettings(streams, currentField, beamOffThreshold);
    }
}
