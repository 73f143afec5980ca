package org.irradcontrol.events;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;

/**
 * State of one event of one server.
 * <p>
 * Activating the event stamps the trigger time; the event is ready to be evaluated again once
 * more than its cooldown has passed since. It is valid while active and not disabled.
 */
public final class IrradEvent {

    private final EventKind kind;
    private final Duration cooldown;
    private final Clock clock;
    private boolean active;
    private boolean disabled;
    private Instant lastTriggered;

    public IrradEvent(final EventKind kind, final Clock clock) {
        this(kind, kind.cooldown(), clock);
    }

    public IrradEvent(final EventKind kind, final Duration cooldown, final Clock clock) {
        this.kind = kind;
        this.cooldown = cooldown;
        this.clock = clock;
    }

    public EventKind kind() {
        return kind;
    }

    public Duration cooldown() {
        return cooldown;
    }

    public synchronized boolean isActive() {
        return active;
    }

    public synchronized void setActive(final boolean active) {
        this.active = active;
        if (active) {
            lastTriggered = clock.instant();
        }
    }

    public synchronized boolean isDisabled() {
        return disabled;
    }

    public synchronized void setDisabled(final boolean disabled) {
        this.disabled = disabled;
    }

    public synchronized Optional<Instant> lastTriggered() {
        return Optional.ofNullable(lastTriggered);
    }

    public synchronized boolean isReady() {
        return lastTriggered == null || Duration.between(lastTriggered, clock.instant()).compareTo(cooldown) > 0;
    }

    public synchronized boolean isValid() {
        return active && !disabled;
    }

    @Override
    public synchronized String toString() {
        return kind.wireName() + "[active=" + active + ", disabled=" + disabled + "]";
    }
}
