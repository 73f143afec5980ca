package org.irradcontrol.scan;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Raster requested by the operator, relative to the current stage position.
 *
 * @param relStart      Upper left corner {@code [x, y]} in mm, relative to the current position.
 * @param relEnd        Lower right corner {@code [x, y]} in mm, relative to the current position.
 * @param speed         Horizontal scan speed in mm/s.
 * @param rowSeparation Vertical distance between rows in mm.
 */
public record ScanGeometry(
    @JsonProperty("rel_start") double[] relStart,
    @JsonProperty("rel_end") double[] relEnd,
    @JsonProperty("speed") double speed,
    @JsonProperty("step") double rowSeparation) {

    public ScanGeometry {
        if (relStart == null || relStart.length != 2 || relEnd == null || relEnd.length != 2) {
            throw new IllegalArgumentException("Start and end point must both be [x, y]");
        }
        if (!(speed > 0)) {
            throw new IllegalArgumentException("Scan speed must be positive, was " + speed);
        }
        if (!(rowSeparation > 0)) {
            throw new IllegalArgumentException("Row separation must be positive, was " + rowSeparation);
        }
        relStart = relStart.clone();
        relEnd = relEnd.clone();
    }

    public static ScanGeometry of(final Point relStart, final Point relEnd, final double speed, final double rowSeparation) {
        return new ScanGeometry(new double[] {relStart.x(), relStart.y()}, new double[] {relEnd.x(), relEnd.y()},
            speed, rowSeparation);
    }

    public Point start() {
        return new Point(relStart[0], relStart[1]);
    }

    public Point end() {
        return new Point(relEnd[0], relEnd[1]);
    }
}
