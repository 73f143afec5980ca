package org.irradcontrol.protocol;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * The single answer to a {@link Command}.
 *
 * @param reply  The command string this reply answers.
 * @param type   Whether the command succeeded.
 * @param sender The target (or process) that handled the command.
 * @param data   Optional result payload or error description.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record Reply(String reply, ReplyType type, String sender, Object data) {

    public static Reply standard(final String reply, final String sender, final Object data) {
        return new Reply(reply, ReplyType.STANDARD, sender, data);
    }

    public static Reply error(final String reply, final String sender, final Object data) {
        return new Reply(reply, ReplyType.ERROR, sender, data);
    }

    @JsonIgnore
    public boolean isError() {
        return type == ReplyType.ERROR;
    }
}
