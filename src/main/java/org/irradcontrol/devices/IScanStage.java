package org.irradcontrol.devices;

import java.util.List;

/**
 * A two-axis stage moving a sample through the beam.
 */
public interface IScanStage {

    String name();

    IAxis horizontal();

    IAxis vertical();

    default List<IAxis> axes() {
        return List.of(horizontal(), vertical());
    }

    /**
     * Releases the stage hardware.
     */
    default void shutdown() {
    }
}
