package org.irradcontrol.protocol;

/**
 * Broadcast whenever an event changes its active or disabled state.
 *
 * @param server   Identifier of the server the event belongs to.
 * @param event    Name of the event, e.g. {@code BeamOff}.
 * @param active   Whether the event condition is currently met.
 * @param disabled Whether an operator has overridden the event.
 */
public record EventRecord(String server, String event, boolean active, boolean disabled) {
}
