package org.irradcontrol.roles.interpreter;

import com.fasterxml.jackson.databind.JsonNode;
import org.irradcontrol.events.EventKind;
import org.irradcontrol.events.EventRegistry;
import org.irradcontrol.node.spi.CommandContext;
import org.irradcontrol.node.spi.CommandTable;
import org.irradcontrol.node.spi.IProcessContext;
import org.irradcontrol.node.spi.IRoleHandler;
import org.irradcontrol.protocol.DataPacket;
import org.irradcontrol.protocol.EventRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Role of the central node that consumes the raw data of all servers, republishes derived data
 * and raises beam events for each server.
 */
public final class InterpreterRole implements IRoleHandler {

    private static final Logger LOGGER = LoggerFactory.getLogger(InterpreterRole.class);

    public static final String ROLE_NAME = "interpreter";

    private final InterpreterSettings settings;
    private final IDataInterpreter interpreter;
    private final Map<String, EventRegistry> registries = new ConcurrentHashMap<>();
    private final List<String> streams = new CopyOnWriteArrayList<>();
    private final AtomicLong received = new AtomicLong();
    private IProcessContext context;

    public InterpreterRole(final InterpreterSettings settings, final IDataInterpreter interpreter) {
        this.settings = settings;
        this.interpreter = interpreter;
    }

    @Override
    public String roleName() {
        return ROLE_NAME;
    }

    @Override
    public CommandTable commands() {
        return new CommandTable()
            .register(InterpreterCommandKind.SHUTDOWN, ctx -> {
                ctx.reply(null);
                context.shutdown();
            })
            .register(InterpreterCommandKind.ADD_STREAM, this::addStream)
            .register(InterpreterCommandKind.EVENTS, ctx -> ctx.reply(eventSnapshot()))
            .register(InterpreterCommandKind.STATUS, ctx -> ctx.reply(status()));
    }

    @Override
    public void attach(final IProcessContext processContext) {
        this.context = processContext;
        settings.dataStreams().forEach(this::subscribe);
    }

    @Override
    public List<DataPacket> handleData(final DataPacket packet) {
        received.incrementAndGet();
        checkBeamOff(packet);
        return interpreter.interpret(packet);
    }

    public EventRegistry registry(final String server) {
        return registries.computeIfAbsent(server, EventRegistry::new);
    }

    private void checkBeamOff(final DataPacket packet) {
        final Object current = packet.dataAsMap().get(settings.currentField());
        if (!(current instanceof Number number) || packet.name() == null) {
            return;
        }
        final EventRegistry registry = registry(packet.name());
        registry.check(EventKind.BEAM_OFF, () -> number.doubleValue() < settings.beamOffThreshold())
            .ifPresent(record -> {
                LOGGER.debug("Event {} of {} is {}active", record.event(), record.server(), record.active() ? "" : "in");
                context.publishEvent(record);
            });
    }

    private boolean subscribe(final String address) {
        if (context.addDataStream(address)) {
            streams.add(address);
            return true;
        }
        return false;
    }

    private void addStream(final CommandContext ctx) {
        final JsonNode data = ctx.data();
        final String address = data == null ? null : data.isTextual() ? data.asText() : data.path("address").asText(null);
        if (address == null || !subscribe(address)) {
            ctx.replyError("Invalid stream address '" + address + "'");
            return;
        }
        ctx.reply(address);
    }

    private List<EventRecord> eventSnapshot() {
        final List<EventRecord> records = new ArrayList<>();
        registries.values().forEach(registry -> records.addAll(registry.snapshot()));
        return records;
    }

    private Map<String, Object> status() {
        final Map<String, Object> status = new LinkedHashMap<>();
        status.put("streams", List.copyOf(streams));
        status.put("received", received.get());
        status.put("servers", List.copyOf(registries.keySet()));
        return status;
    }
}
