package org.irradcontrol.events;

import java.time.Duration;
import java.util.Arrays;
import java.util.Optional;

/**
 * The fixed catalogue of conditions a server can be in.
 */
public enum EventKind {
    // Beam
    BEAM_OFF("BeamOff", 1, true, "Beam current below measurable resolution"),
    BEAM_UNSTABLE("BeamUnstable", 1, true, "Beam current fluctuates"),
    BEAM_LOSS("BeamLoss", 1, true, "Beam current lost at extraction"),
    BEAM_DRIFT("BeamDrift", 1, true, "Beam position deviates from center"),
    BEAM_LOW("BeamLow", 1, true, "Beam current below threshold"),

    // Temperature
    DUT_TEMP_HIGH("DUTTempHigh", 20, false, "Temperature of DUT high"),
    BLM_TEMP_HIGH("BLMTempHigh", 20, false, "Temperature of beam loss monitor high"),
    GENERIC_TEMP_HIGH("GenericTempHigh", 20, false, "Temperature of a sensor high"),

    // Misc
    DOSE_RATE_HIGH("DoseRateHigh", 60, false, "Dose rate high"),
    IRRADIATION_COMPLETE("IrradiationComplete", 0, false, "Irradiation aim reached");

    private final String wireName;
    private final Duration cooldown;
    private final boolean beamRelated;
    private final String description;

    EventKind(final String wireName, final long cooldownSeconds, final boolean beamRelated, final String description) {
        this.wireName = wireName;
        this.cooldown = Duration.ofSeconds(cooldownSeconds);
        this.beamRelated = beamRelated;
        this.description = description;
    }

    public String wireName() {
        return wireName;
    }

    public Duration cooldown() {
        return cooldown;
    }

    public boolean isBeamRelated() {
        return beamRelated;
    }

    public String description() {
        return description;
    }

    public static Optional<EventKind> fromWireName(final String name) {
        return Arrays.stream(values()).filter(kind -> kind.wireName.equals(name)).findFirst();
    }
}
