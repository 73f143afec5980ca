package org.irradcontrol.events;

import org.irradcontrol.protocol.EventRecord;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.BooleanSupplier;

/**
 * The events of one server. Each server owns its own registry; other processes mirror it from
 * the event records it broadcasts.
 */
public final class EventRegistry {

    private final String server;
    private final Map<EventKind, IrradEvent> events;

    public EventRegistry(final String server) {
        this(server, Clock.systemUTC());
    }

    public EventRegistry(final String server, final Clock clock) {
        this.server = server;
        final Map<EventKind, IrradEvent> map = new EnumMap<>(EventKind.class);
        for (final EventKind kind : EventKind.values()) {
            map.put(kind, new IrradEvent(kind, clock));
        }
        this.events = Collections.unmodifiableMap(map);
    }

    public String server() {
        return server;
    }

    public IrradEvent get(final EventKind kind) {
        return events.get(kind);
    }

    /**
     * @return {@code true} if no beam-related event is currently valid.
     */
    public boolean allBeamEventsInvalid() {
        return events.values().stream()
            .filter(event -> event.kind().isBeamRelated())
            .noneMatch(IrradEvent::isValid);
    }

    /**
     * @return {@code true} if the given event is currently valid.
     */
    public boolean isValid(final EventKind kind) {
        return events.get(kind).isValid();
    }

    /**
     * Evaluates the trigger condition of an event.
     * <p>
     * Nothing is evaluated while the event cools down or is disabled, nor for beam events other
     * than {@link EventKind#BEAM_OFF} while the beam is off. A met condition (re)activates the
     * event; an unmet condition deactivates an active one.
     *
     * @return The record to broadcast, or empty if the event was left unchanged.
     */
    public Optional<EventRecord> check(final EventKind kind, final BooleanSupplier condition) {
        final IrradEvent event = events.get(kind);
        if (!event.isReady() || event.isDisabled()) {
            return Optional.empty();
        }
        if (kind.isBeamRelated() && kind != EventKind.BEAM_OFF && events.get(EventKind.BEAM_OFF).isActive()) {
            return Optional.empty();
        }
        final boolean triggered = condition.getAsBoolean();
        if (triggered || event.isActive()) {
            event.setActive(triggered);
            return Optional.of(toRecord(kind));
        }
        return Optional.empty();
    }

    /**
     * Applies a record received from another process. Only the activity is mirrored; the
     * operator override is owned by this registry and kept as it is.
     *
     * @return {@code true} if the local state changed.
     */
    public boolean apply(final EventKind kind, final EventRecord record) {
        final IrradEvent event = events.get(kind);
        synchronized (event) {
            if (event.isActive() == record.active()) {
                return false;
            }
            event.setActive(record.active());
            return true;
        }
    }

    /**
     * Sets the operator override of an event.
     *
     * @return The record to broadcast, or empty if the override did not change.
     */
    public Optional<EventRecord> setDisabled(final EventKind kind, final boolean disabled) {
        final IrradEvent event = events.get(kind);
        if (event.isDisabled() == disabled) {
            return Optional.empty();
        }
        event.setDisabled(disabled);
        return Optional.of(toRecord(kind));
    }

    public EventRecord toRecord(final EventKind kind) {
        final IrradEvent event = events.get(kind);
        synchronized (event) {
            return new EventRecord(server, kind.wireName(), event.isActive(), event.isDisabled());
        }
    }

    public List<EventRecord> snapshot() {
        final List<EventRecord> records = new ArrayList<>();
        for (final EventKind kind : EventKind.values()) {
            records.add(toRecord(kind));
        }
        return records;
    }
}
