package org.irradcontrol.protocol;

import com.fasterxml.jackson.annotation.JsonIgnore;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * An immutable telemetry packet. The {@code type} entry of the meta block discriminates the
 * payload shape (raw samples, scan progress, axis movement, ...).
 *
 * @param meta Meta information; always contains {@code timestamp}, {@code name} and {@code type}.
 * @param data The payload.
 */
public record DataPacket(Map<String, Object> meta, Object data) {

    public static final String TIMESTAMP = "timestamp";
    public static final String NAME = "name";
    public static final String TYPE = "type";

    public DataPacket {
        meta = meta == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(meta));
        if (data instanceof Map<?, ?> map) {
            data = Collections.unmodifiableMap(new LinkedHashMap<>(map));
        }
    }

    /**
     * Creates a packet stamped with the current wall-clock time in seconds.
     */
    public static DataPacket of(final String name, final String type, final Object data) {
        final Map<String, Object> meta = new LinkedHashMap<>();
        meta.put(TIMESTAMP, System.currentTimeMillis() / 1000.0);
        meta.put(NAME, name);
        meta.put(TYPE, type);
        return new DataPacket(meta, data);
    }

    @JsonIgnore
    public String type() {
        final Object type = meta.get(TYPE);
        return type == null ? null : type.toString();
    }

    @JsonIgnore
    public String name() {
        final Object name = meta.get(NAME);
        return name == null ? null : name.toString();
    }

    @JsonIgnore
    public double timestamp() {
        return meta.get(TIMESTAMP) instanceof Number number ? number.doubleValue() : Double.NaN;
    }

    /**
     * @return The payload as a map, or an empty map if the payload is not an object.
     */
    @JsonIgnore
    @SuppressWarnings("unchecked")
    public Map<String, Object> dataAsMap() {
        return data instanceof Map<?, ?> ? (Map<String, Object>) data : Map.of();
    }
}
