package org.irradcontrol.protocol;

import com.fasterxml.jackson.annotation.JsonIgnore;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.OptionalInt;

/**
 * Discovery record persisted while a process is alive.
 *
 * @param pid   Operating system id of the process.
 * @param name  Role name of the process.
 * @param ports Bound port per channel, keyed by {@link ChannelKind#wireName()}.
 */
public record ProcessDescriptor(long pid, String name, Map<String, Integer> ports) {

    public ProcessDescriptor {
        ports = ports == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(ports));
    }

    public static ProcessDescriptor of(final long pid, final String name, final Map<ChannelKind, Integer> ports) {
        final Map<String, Integer> byName = new LinkedHashMap<>();
        ports.forEach((kind, port) -> byName.put(kind.wireName(), port));
        return new ProcessDescriptor(pid, name, byName);
    }

    @JsonIgnore
    public OptionalInt port(final ChannelKind kind) {
        final Integer port = ports.get(kind.wireName());
        return port == null ? OptionalInt.empty() : OptionalInt.of(port);
    }
}
