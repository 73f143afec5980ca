package org.irradcontrol.protocol;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.JsonNode;

import java.util.ArrayList;
import java.util.List;

/**
 * A command addressed to a target within a process.
 *
 * @param target The device, role or process addressed; {@code null} if missing on the wire.
 * @param cmd    The operation to perform; {@code null} if missing on the wire.
 * @param data   Optional payload, forwarded to the handler unopened.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record Command(String target, String cmd, JsonNode data) {

    public static Command of(final String target, final String cmd) {
        return new Command(target, cmd, null);
    }

    /**
     * @return The names of the mandatory fields this command lacks.
     */
    @JsonIgnore
    public List<String> missingFields() {
        final List<String> missing = new ArrayList<>(2);
        if (target == null || target.isBlank()) {
            missing.add("target");
        }
        if (cmd == null || cmd.isBlank()) {
            missing.add("cmd");
        }
        return missing;
    }

    @JsonIgnore
    public boolean hasData() {
        return data != null && !data.isNull() && !data.isMissingNode();
    }
}
