package org.irradcontrol.node.spi;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Maps each command kind of a role to its handler. A {@code (target, cmd)} pair without an
 * entry is rejected before any handler runs.
 */
public final class CommandTable {

    private final Map<String, Map<String, Entry>> byTarget = new LinkedHashMap<>();

    /**
     * A resolved command.
     *
     * @param kind    The command kind.
     * @param handler Its handler.
     */
    public record Entry(ICommandKind kind, ICommandHandler handler) {
    }

    /**
     * Registers the handler of a command kind.
     *
     * @throws IllegalArgumentException if the kind is already registered.
     */
    public CommandTable register(final ICommandKind kind, final ICommandHandler handler) {
        final Map<String, Entry> commands = byTarget.computeIfAbsent(kind.target(), t -> new LinkedHashMap<>());
        if (commands.putIfAbsent(kind.wireName(), new Entry(kind, handler)) != null) {
            throw new IllegalArgumentException("Command '" + kind.target() + ":" + kind.wireName() + "' registered twice");
        }
        return this;
    }

    public Optional<Entry> resolve(final String target, final String cmd) {
        final Map<String, Entry> commands = byTarget.get(target);
        return commands == null ? Optional.empty() : Optional.ofNullable(commands.get(cmd));
    }

    public boolean hasTarget(final String target) {
        return byTarget.containsKey(target);
    }

    public Set<String> targets() {
        return Collections.unmodifiableSet(byTarget.keySet());
    }

    public Set<String> commands(final String target) {
        final Map<String, Entry> commands = byTarget.get(target);
        return commands == null ? Set.of() : Collections.unmodifiableSet(commands.keySet());
    }
}
