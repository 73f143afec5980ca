package org.irradcontrol.scan;

import java.util.Arrays;
import java.util.Optional;

/**
 * Signals a running scan reacts to.
 */
public enum ScanSignal {
    /** Stop after the current row and return to the origin. */
    ABORT("abort"),
    /** Stop after the current pass over all rows. */
    FINISH("finish"),
    /** Hold before the next row. */
    PAUSE("pause"),
    /** Release a pause. */
    CONTINUE("continue"),
    /** Beam is gone; hold before the next row until it recovers. */
    BEAM_DOWN("beam_down"),
    /** Beam is unstable; hold before the next row until it recovers. */
    BEAM_JITTER("beam_jitter"),
    /** Beam has recovered. */
    BEAM_OK("beam_ok");

    private final String wireName;

    ScanSignal(final String wireName) {
        this.wireName = wireName;
    }

    public String wireName() {
        return wireName;
    }

    public static Optional<ScanSignal> fromWireName(final String name) {
        return Arrays.stream(values()).filter(signal -> signal.wireName.equals(name)).findFirst();
    }
}
