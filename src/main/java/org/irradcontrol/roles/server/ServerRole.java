package org.irradcontrol.roles.server;

import com.fasterxml.jackson.databind.JsonNode;
import org.irradcontrol.devices.AxisException;
import org.irradcontrol.devices.AxisUnit;
import org.irradcontrol.devices.IScanStage;
import org.irradcontrol.devices.TrackedAxis;
import org.irradcontrol.devices.TrackedStage;
import org.irradcontrol.devices.sim.SimulatedStage;
import org.irradcontrol.events.EventKind;
import org.irradcontrol.events.EventRegistry;
import org.irradcontrol.node.spi.CommandContext;
import org.irradcontrol.node.spi.CommandTable;
import org.irradcontrol.node.spi.IProcessContext;
import org.irradcontrol.node.spi.IRoleHandler;
import org.irradcontrol.protocol.EventRecord;
import org.irradcontrol.scan.ScanController;
import org.irradcontrol.scan.ScanGeometry;
import org.irradcontrol.scan.ScanSignal;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Role of a node driving a motorstage. Hosts the scan controller and mirrors the events the
 * interpreter raises for this server; changes of the beam events hold or release the scan.
 */
public final class ServerRole implements IRoleHandler {

    private static final Logger LOGGER = LoggerFactory.getLogger(ServerRole.class);

    public static final String ROLE_NAME = "server";

    private final ServerSettings settings;
    private final IScanStage rawStage;
    private final EventRegistry events;
    private IProcessContext context;
    private TrackedStage stage;
    private ScanController scan;
    private volatile JsonNode setup;

    public ServerRole(final ServerSettings settings, final IScanStage stage) {
        this.settings = settings;
        this.rawStage = stage;
        this.events = new EventRegistry(settings.id());
    }

    /**
     * Creates the role with the stage named in the settings.
     *
     * @throws IllegalArgumentException if the stage kind is not supported.
     */
    public static ServerRole create(final ServerSettings settings) {
        if (!ServerSettings.SIMULATED.equals(settings.stage())) {
            throw new IllegalArgumentException("Unsupported stage '" + settings.stage() + "'");
        }
        return new ServerRole(settings, SimulatedStage.fromConfig(settings.id() + "-stage", settings.simulatedStage()));
    }

    @Override
    public String roleName() {
        return ROLE_NAME;
    }

    @Override
    public CommandTable commands() {
        return new CommandTable()
            .register(ServerCommandKind.START, this::start)
            .register(ServerCommandKind.SHUTDOWN, this::shutdown)
            .register(ServerCommandKind.MOTORSTAGES, this::motorstages)
            .register(ServerCommandKind.EVENTS, ctx -> ctx.reply(events.snapshot()))
            .register(ScanCommandKind.SETUP_SCAN, ctx -> ctx.reply(scan.prepare(ctx.dataAs(ScanGeometry.class))))
            .register(ScanCommandKind.SCAN_ROW, this::scanRow)
            .register(ScanCommandKind.SCAN_DEVICE, ctx -> scan.scanDevice())
            .register(ScanCommandKind.HANDLE_EVENT, this::handleScanEvent)
            .register(ScanCommandKind.STATUS, ctx -> ctx.reply(scan.status()))
            .register(StageCommandKind.MOVE_ABS, ctx -> move(ctx, false))
            .register(StageCommandKind.MOVE_REL, ctx -> move(ctx, true))
            .register(StageCommandKind.SET_SPEED, this::setSpeed)
            .register(StageCommandKind.GET_SPEED, ctx -> ctx.reply(reading(ctx, "speed", axis(ctx).getSpeed(unit(ctx)))))
            .register(StageCommandKind.GET_POSITION,
                ctx -> ctx.reply(reading(ctx, "position", axis(ctx).getPosition(unit(ctx)))))
            .register(EventCommandKind.DISABLE, ctx -> override(ctx, true))
            .register(EventCommandKind.ENABLE, ctx -> override(ctx, false));
    }

    @Override
    public void attach(final IProcessContext processContext) {
        this.context = processContext;
        this.stage = new TrackedStage(rawStage, settings.id(), processContext::dataPublisher);
        this.scan = new ScanController(stage, settings.id(), processContext::dataPublisher, processContext,
            settings.scan(), processContext.stopFlag("scan"), () -> !events.allBeamEventsInvalid());
    }

    @Override
    public void handleEvent(final EventRecord record) {
        if (!settings.id().equals(record.server())) {
            LOGGER.warn("Received event of server {} not meant for this server {}", record.server(), settings.id());
            return;
        }
        final EventKind kind = EventKind.fromWireName(record.event()).orElse(null);
        if (kind == null) {
            LOGGER.error("Event {} unknown", record.event());
            return;
        }
        events.apply(kind, record);
        LOGGER.debug("Event {} on server {} is {}active", record.event(), settings.id(), record.active() ? "" : "in");
        if (kind.isBeamRelated()) {
            scan.handleSignal(standbySignal());
        }
    }

    @Override
    public void cleanUp() {
        rawStage.shutdown();
    }

    public EventRegistry events() {
        return events;
    }

    public ScanController scan() {
        return scan;
    }

    public JsonNode setup() {
        return setup;
    }

    /**
     * Derives the standby signal for the scan from the current beam events.
     */
    ScanSignal standbySignal() {
        if (events.allBeamEventsInvalid()) {
            return ScanSignal.BEAM_OK;
        }
        if (events.isValid(EventKind.BEAM_OFF) || events.isValid(EventKind.BEAM_LOSS)) {
            return ScanSignal.BEAM_DOWN;
        }
        return ScanSignal.BEAM_JITTER;
    }

    private void start(final CommandContext ctx) {
        final JsonNode data = ctx.data();
        if (data == null) {
            throw new IllegalArgumentException("Server start requires a session setup");
        }
        setup = data;
        for (final JsonNode address : data.path("event_streams")) {
            if (!context.addEventStream(address.asText())) {
                LOGGER.error("Could not add event stream {}", address.asText());
            }
        }
        LOGGER.info("Server {} started", settings.id());
        ctx.reply(context.pid());
    }

    private void shutdown(final CommandContext ctx) {
        ctx.reply(null);
        context.shutdown();
    }

    private void motorstages(final CommandContext ctx) throws AxisException {
        final Map<String, Object> positions = new LinkedHashMap<>();
        positions.put("horizontal", stage.horizontal().getPosition(AxisUnit.MM));
        positions.put("vertical", stage.vertical().getPosition(AxisUnit.MM));
        final Map<String, Object> travel = new LinkedHashMap<>();
        travel.put("horizontal", stage.horizontal().convertFromNative(stage.horizontal().totalTravel(), AxisUnit.MM));
        travel.put("vertical", stage.vertical().convertFromNative(stage.vertical().totalTravel(), AxisUnit.MM));
        final Map<String, Object> info = new LinkedHashMap<>();
        info.put("positions", positions);
        info.put("travel", travel);
        info.put("unit", AxisUnit.MM.symbol());
        ctx.reply(Map.of(stage.name(), info));
    }

    private void scanRow(final CommandContext ctx) throws Exception {
        final JsonNode data = ctx.data();
        if (data == null || !data.path("row").canConvertToInt()) {
            throw new IllegalArgumentException("scan_row requires an integer 'row'");
        }
        final JsonNode speed = data.path("speed");
        scan.scanRow(data.get("row").asInt(), speed.isNumber() ? speed.asDouble() : null);
    }

    private void handleScanEvent(final CommandContext ctx) {
        final JsonNode data = ctx.data();
        final String name = data == null ? null : data.isTextual() ? data.asText() : data.path("kind").asText(null);
        final ScanSignal signal = ScanSignal.fromWireName(name)
            .orElseThrow(() -> new IllegalArgumentException("Unknown scan signal '" + name + "'"));
        scan.handleSignal(signal);
    }

    /**
     * Moves one axis on its own thread and replies with the position reached. The command
     * thread keeps observing its stop flag meanwhile; the next command is read after the reply.
     */
    private void move(final CommandContext ctx, final boolean relative) {
        if (scan.isRunning()) {
            throw new IllegalStateException("Cannot move the stage while scanning");
        }
        final TrackedAxis axis = axis(ctx);
        final AxisUnit unit = unit(ctx);
        final double value = value(ctx);
        ctx.deferReply();
        context.launch("stage " + ctx.cmd(), () -> {
            try {
                if (relative) {
                    axis.moveRel(value, unit);
                } else {
                    axis.moveAbs(value, unit);
                }
                ctx.reply(reading(ctx, "position", axis.getPosition(unit)));
            } catch (AxisException | RuntimeException e) {
                LOGGER.error("Command stage:{} failed: {}", ctx.cmd(), e.getMessage());
                ctx.replyError(e.getMessage() != null ? e.getMessage() : e.toString());
            }
        });
    }

    private void setSpeed(final CommandContext ctx) throws AxisException {
        final TrackedAxis axis = axis(ctx);
        final AxisUnit unit = unit(ctx);
        axis.setSpeed(value(ctx), unit);
        ctx.reply(reading(ctx, "speed", axis.getSpeed(unit)));
    }

    private TrackedAxis axis(final CommandContext ctx) {
        final JsonNode id = ctx.data() == null ? null : ctx.data().get("axis");
        if (id == null || !id.canConvertToInt()) {
            throw new IllegalArgumentException(ctx.cmd() + " requires an integer 'axis'");
        }
        return switch (id.asInt()) {
            case 0 -> stage.horizontal();
            case 1 -> stage.vertical();
            default -> throw new IllegalArgumentException("Stage " + stage.name() + " has no axis " + id.asInt());
        };
    }

    private static AxisUnit unit(final CommandContext ctx) {
        final JsonNode unit = ctx.data() == null ? null : ctx.data().get("unit");
        if (unit == null || unit.isNull()) {
            return AxisUnit.MM;
        }
        return AxisUnit.fromSymbol(unit.asText())
            .orElseThrow(() -> new IllegalArgumentException("Unknown unit '" + unit.asText() + "'"));
    }

    private static double value(final CommandContext ctx) {
        final JsonNode value = ctx.data() == null ? null : ctx.data().get("value");
        if (value == null || !value.isNumber()) {
            throw new IllegalArgumentException(ctx.cmd() + " requires a numeric 'value'");
        }
        return value.asDouble();
    }

    private static Map<String, Object> reading(final CommandContext ctx, final String key, final double value) {
        final Map<String, Object> data = new LinkedHashMap<>();
        data.put("axis", ctx.data().get("axis").asInt());
        data.put(key, value);
        data.put("unit", unit(ctx).symbol());
        return data;
    }

    private void override(final CommandContext ctx, final boolean disabled) {
        final JsonNode data = ctx.data();
        final String name = data == null ? null : data.isTextual() ? data.asText() : data.path("event").asText(null);
        final EventKind kind = EventKind.fromWireName(name)
            .orElseThrow(() -> new IllegalArgumentException("Event '" + name + "' unknown"));
        events.setDisabled(kind, disabled).ifPresent(record -> {
            context.publishEvent(record);
            if (kind.isBeamRelated()) {
                scan.handleSignal(standbySignal());
            }
        });
        ctx.reply(events.toRecord(kind));
    }
}
