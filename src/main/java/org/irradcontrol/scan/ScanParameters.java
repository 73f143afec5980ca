package org.irradcontrol.scan;

import java.util.Collections;
import java.util.Map;
import java.util.TreeMap;

/**
 * Absolute raster derived once when a scan is set up. All positions are in native axis units.
 *
 * @param origin              Stage position at setup time.
 * @param start               Upper left corner of the raster.
 * @param end                 Lower right corner of the raster.
 * @param speed               Horizontal scan speed in mm/s.
 * @param rowSeparation       Distance between rows in mm.
 * @param nativeRowSeparation Distance between rows in native units of the vertical axis.
 * @param rows                Vertical position of each row, by row index.
 */
public record ScanParameters(
    Point origin,
    Point start,
    Point end,
    double speed,
    double rowSeparation,
    double nativeRowSeparation,
    Map<Integer, Double> rows) {

    public ScanParameters {
        rows = Collections.unmodifiableMap(new TreeMap<>(rows));
    }

    public int nRows() {
        return rows.size();
    }

    public boolean hasRow(final int row) {
        return rows.containsKey(row);
    }
}
