package org.irradcontrol.scan;

import org.irradcontrol.devices.AxisException;
import org.irradcontrol.devices.AxisUnit;
import org.irradcontrol.devices.IAxis;
import org.irradcontrol.devices.IScanStage;
import org.irradcontrol.node.spi.IDataPublisher;
import org.irradcontrol.node.threads.Flag;
import org.irradcontrol.node.threads.IThreadLauncher;
import org.irradcontrol.protocol.DataPacket;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.BooleanSupplier;
import java.util.function.Supplier;

/**
 * Sweeps a sample through the beam row by row.
 * <p>
 * A scan covers a rectangular raster: the vertical axis steps from row to row while the
 * horizontal axis sweeps each row at the scan speed. Full scans repeat the raster pass after
 * pass, alternating between top-to-bottom and bottom-to-top order, until they are finished or
 * aborted. Before each row the controller holds while the scan is paused or the beam is not
 * usable.
 * <p>
 * All motion runs on threads started through the {@link IThreadLauncher}; the public methods
 * return immediately. Scans are controlled only through {@link #handleSignal(ScanSignal)}.
 * Whatever ends a full scan, it publishes {@code scan_finished}, returns the stage to the
 * origin and clears all control flags. Since that clears standby too, every new scan consults
 * the beam state again before it starts.
 */
public final class ScanController {

    private static final Logger LOGGER = LoggerFactory.getLogger(ScanController.class);

    /** Scan number of a row scanned on its own rather than as part of a full scan. */
    public static final int SINGLE_ROW_SCAN = -1;

    public static final String PACKET_TYPE = "stage";
    public static final String SCAN_INIT = "scan_init";
    public static final String SCAN_START = "scan_start";
    public static final String SCAN_STOP = "scan_stop";
    public static final String SCAN_FINISHED = "scan_finished";

    // Absorbs rounding in the mm to native conversion when counting rows.
    private static final double ROW_EPSILON = 1e-9;

    private final IScanStage stage;
    private final String sender;
    private final Supplier<IDataPublisher> publishers;
    private final IThreadLauncher launcher;
    private final ScanSettings settings;
    private final BooleanSupplier beamUnusable;

    private final Flag stop;
    private final Flag complete = new Flag();
    private final Flag wait = new Flag();
    private final Flag standby = new Flag();
    private final Flag scanning = new Flag();
    private final AtomicBoolean running = new AtomicBoolean();
    private volatile ScanParameters parameters;

    /**
     * @param stage        The stage to move.
     * @param sender       Name put into the packets' meta block.
     * @param publishers   Supplies the data publisher of the calling thread.
     * @param launcher     Starts the scan threads.
     * @param settings     Scan settings.
     * @param stop         Stop flag of the scan; may be shared with the hosting process.
     * @param beamUnusable Tells whether the beam currently forbids scanning; asked whenever a
     *                     scan starts.
     */
    public ScanController(final IScanStage stage, final String sender, final Supplier<IDataPublisher> publishers,
                          final IThreadLauncher launcher, final ScanSettings settings, final Flag stop,
                          final BooleanSupplier beamUnusable) {
        this.stage = stage;
        this.sender = sender;
        this.publishers = publishers;
        this.launcher = launcher;
        this.settings = settings;
        this.stop = stop;
        this.beamUnusable = beamUnusable;
    }

    /**
     * Creates a controller whose standby is driven by signals only.
     */
    public ScanController(final IScanStage stage, final String sender, final Supplier<IDataPublisher> publishers,
                          final IThreadLauncher launcher, final ScanSettings settings, final Flag stop) {
        this(stage, sender, publishers, launcher, settings, stop, () -> false);
    }

    /**
     * Derives the absolute raster from the current stage position. Lengths are converted to
     * native units here and nowhere else.
     *
     * @throws ScanException if a scan is running or the stage position cannot be read.
     */
    public ScanParameters prepare(final ScanGeometry geometry) throws ScanException {
        if (running.get()) {
            throw new ScanException("Cannot set up a scan while scanning");
        }
        final IAxis x = stage.horizontal();
        final IAxis y = stage.vertical();
        final Point origin;
        try {
            origin = new Point(x.getPosition(AxisUnit.NATIVE), y.getPosition(AxisUnit.NATIVE));
        } catch (AxisException e) {
            throw new ScanException("Could not read stage position: " + e.getMessage(), e);
        }
        final Point start = new Point(
            origin.x() - x.convertToNative(geometry.start().x(), AxisUnit.MM),
            origin.y() - y.convertToNative(geometry.start().y(), AxisUnit.MM));
        final Point end = new Point(
            origin.x() - x.convertToNative(geometry.end().x(), AxisUnit.MM),
            origin.y() - y.convertToNative(geometry.end().y(), AxisUnit.MM));
        final double rowSep = y.convertToNative(geometry.rowSeparation(), AxisUnit.MM);
        final int nRows = (int) Math.floor(Math.abs(end.y() - start.y()) / rowSep + ROW_EPSILON);

        final Map<Integer, Double> rows = new TreeMap<>();
        for (int row = 0; row < nRows; row++) {
            rows.put(row, start.y() - row * rowSep);
        }
        final ScanParameters prepared = new ScanParameters(origin, start, end, geometry.speed(),
            geometry.rowSeparation(), rowSep, rows);
        parameters = prepared;
        LOGGER.info("Prepared scan of {} rows from {} to {} (origin {})", nRows, start, end, origin);
        return prepared;
    }

    /**
     * Scans a single row on a new thread. Started at the raster origin, the row is approached
     * from the raster's start edge and the stage returns to the origin afterwards.
     *
     * @param row   Index of the row.
     * @param speed Horizontal speed in mm/s, or {@code null} to keep the current speed.
     * @throws ScanException if no scan is prepared, the row does not exist or a scan is running.
     */
    public Thread scanRow(final int row, final Double speed) throws ScanException {
        final ScanParameters p = requireParameters();
        if (!p.hasRow(row)) {
            throw new ScanException(String.format("Row %d is not in range of rows starting from 0 to %d", row, p.nRows()));
        }
        claim();
        return launcher.launch("scan row", () -> {
            try {
                final boolean fromOrigin = isAtOrigin(p);
                sweepRow(p, row, speed, SINGLE_ROW_SCAN, fromOrigin, publishers.get());
            } catch (ScanException e) {
                LOGGER.error("Scan of row {} aborted: {}", row, e.getMessage());
            } finally {
                stop.clear();
                running.set(false);
            }
        });
    }

    /**
     * Scans the whole raster on a new thread, pass after pass, until finished or aborted.
     *
     * @throws ScanException if no scan is prepared or a scan is running.
     */
    public Thread scanDevice() throws ScanException {
        final ScanParameters p = requireParameters();
        claim();
        return launcher.launch("scan device", () -> runScan(p));
    }

    public void handleSignal(final ScanSignal signal) {
        LOGGER.debug("Scan signal {}", signal.wireName());
        switch (signal) {
            case ABORT -> stop.set();
            case FINISH -> complete.set();
            case PAUSE -> wait.set();
            case CONTINUE -> wait.clear();
            case BEAM_DOWN, BEAM_JITTER -> standby.set();
            case BEAM_OK -> standby.clear();
            default -> throw new IllegalArgumentException("Unhandled scan signal " + signal);
        }
    }

    public ScanStatus status() {
        final ScanParameters p = parameters;
        return new ScanStatus(p != null, running.get(), scanning.isSet(), stop.isSet(), complete.isSet(),
            wait.isSet(), standby.isSet(), p == null ? 0 : p.nRows());
    }

    public ScanParameters parameters() {
        return parameters;
    }

    public boolean isRunning() {
        return running.get();
    }

    /**
     * Order in which the rows are scanned in a given pass: top to bottom on even passes,
     * bottom to top on odd ones.
     */
    public static List<Integer> rowOrder(final int nRows, final int pass) {
        final List<Integer> order = new ArrayList<>(nRows);
        for (int row = 0; row < nRows; row++) {
            order.add(row);
        }
        if (pass % 2 != 0) {
            Collections.reverse(order);
        }
        return order;
    }

    private void runScan(final ScanParameters p) {
        final IDataPublisher publisher = publishers.get();
        final IAxis x = stage.horizontal();
        final IAxis y = stage.vertical();

        final Map<String, Object> init = new LinkedHashMap<>();
        init.put("status", SCAN_INIT);
        init.put("n_rows", p.nRows());
        init.put("row_sep", p.rowSeparation());
        publish(publisher, init);

        try {
            move(x, p.start().x(), "X-axis did not move to start point");
            move(y, p.start().y(), "Y-axis did not move to start point");
            try {
                x.setSpeed(p.speed(), AxisUnit.MM);
            } catch (AxisException e) {
                throw new ScanException("Could not set scan speed: " + e.getMessage(), e);
            }

            int scan = 0;
            while (!complete.isSet()) {
                for (final int row : rowOrder(p.nRows(), scan)) {
                    if (stop.isSet()) {
                        throw new ScanException("Scan was stopped manually");
                    }
                    sweepRow(p, row, null, scan, false, publisher);
                }
                scan++;
            }
            LOGGER.info("Scan finished after {} pass(es)", scan);
        } catch (ScanException e) {
            LOGGER.error("Scan aborted: {}", e.getMessage());
        } finally {
            final Map<String, Object> finished = new LinkedHashMap<>();
            finished.put("status", SCAN_FINISHED);
            publish(publisher, finished);
            returnToOrigin(p);
            stop.clear();
            complete.clear();
            wait.clear();
            standby.clear();
            scanning.clear();
            running.set(false);
        }
    }

    private void sweepRow(final ScanParameters p, final int row, final Double speed, final int scan,
                          final boolean fromOrigin, final IDataPublisher publisher) throws ScanException {
        final IAxis x = stage.horizontal();
        final IAxis y = stage.vertical();

        awaitClearance(row, scan);

        if (speed != null) {
            try {
                x.setSpeed(speed, AxisUnit.MM);
            } catch (AxisException e) {
                throw new ScanException("Could not set speed of row " + row + ": " + e.getMessage(), e);
            }
        }
        if (fromOrigin) {
            move(x, p.start().x(), "X-axis did not move to start point");
        }
        move(y, p.rows().get(row), "Y-axis did not move to row " + row);

        try {
            final Map<String, Object> start = new LinkedHashMap<>();
            start.put("status", SCAN_START);
            start.put("scan", scan);
            start.put("row", row);
            start.put("speed", x.getSpeed(AxisUnit.MM));
            start.put("accel", x.getAccel(AxisUnit.MM));
            start.put("x_start", x.getPosition(AxisUnit.MM));
            start.put("y_start", y.getPosition(AxisUnit.MM));
            publish(publisher, start);

            final double current = x.getPosition(AxisUnit.NATIVE);
            final double target = isSame(current, p.start().x()) ? p.end().x() : p.start().x();
            scanning.set();
            try {
                x.moveAbs(target, AxisUnit.NATIVE);
            } finally {
                scanning.clear();
            }

            final Map<String, Object> stopData = new LinkedHashMap<>();
            stopData.put("status", SCAN_STOP);
            stopData.put("scan", scan);
            stopData.put("row", row);
            stopData.put("x_stop", x.getPosition(AxisUnit.MM));
            stopData.put("y_stop", y.getPosition(AxisUnit.MM));
            publish(publisher, stopData);
        } catch (AxisException e) {
            throw new ScanException("X-axis did not scan row " + row + ": " + e.getMessage(), e);
        }

        if (fromOrigin) {
            returnToOrigin(p);
        }
    }

    private void awaitClearance(final int row, final int scan) throws ScanException {
        try {
            while (wait.isSet() || standby.isSet()) {
                if (stop.isSet()) {
                    throw new ScanException("Scan was stopped manually");
                }
                final StringBuilder reason = new StringBuilder();
                if (wait.isSet()) {
                    reason.append("Scan paused manually. ");
                }
                if (standby.isSet()) {
                    reason.append("Low beam current or no beam in row ").append(row).append(" of scan ").append(scan)
                        .append(". Waiting for beam current to rise.");
                }
                LOGGER.warn(reason.toString().trim());
                stop.await(settings.standbyPoll());
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ScanException("Interrupted while waiting to scan row " + row, e);
        }
        if (stop.isSet()) {
            throw new ScanException("Scan was stopped manually");
        }
    }

    private void returnToOrigin(final ScanParameters p) {
        // Vertical first so the sample is not dragged back through the beam.
        returnAxis(stage.vertical(), p.origin().y(), "vertical");
        returnAxis(stage.horizontal(), p.origin().x(), "horizontal");
    }

    private void returnAxis(final IAxis axis, final double origin, final String label) {
        try {
            axis.setSpeed(settings.returnSpeed(), AxisUnit.MM);
            axis.moveAbs(origin, AxisUnit.NATIVE);
        } catch (AxisException e) {
            LOGGER.error("Could not return {} axis to origin: {}", label, e.getMessage());
        }
    }

    private void move(final IAxis axis, final double target, final String failure) throws ScanException {
        try {
            axis.moveAbs(target, AxisUnit.NATIVE);
        } catch (AxisException e) {
            throw new ScanException(failure + ": " + e.getMessage(), e);
        }
    }

    private boolean isAtOrigin(final ScanParameters p) throws ScanException {
        try {
            return isSame(stage.horizontal().getPosition(AxisUnit.NATIVE), p.origin().x())
                && isSame(stage.vertical().getPosition(AxisUnit.NATIVE), p.origin().y());
        } catch (AxisException e) {
            throw new ScanException("Could not read stage position: " + e.getMessage(), e);
        }
    }

    private boolean isSame(final double a, final double b) {
        return Math.abs(a - b) <= settings.positionTolerance();
    }

    private ScanParameters requireParameters() throws ScanException {
        final ScanParameters p = parameters;
        if (p == null) {
            throw new ScanException("No scan set up. Use setup_scan first");
        }
        if (p.nRows() == 0) {
            throw new ScanException("Scan area has no rows");
        }
        return p;
    }

    private void claim() throws ScanException {
        if (!running.compareAndSet(false, true)) {
            throw new ScanException("A scan is already running");
        }
        if (beamUnusable.getAsBoolean()) {
            standby.set();
        }
    }

    private void publish(final IDataPublisher publisher, final Map<String, Object> data) {
        publisher.publish(DataPacket.of(sender, PACKET_TYPE, data));
    }
}
