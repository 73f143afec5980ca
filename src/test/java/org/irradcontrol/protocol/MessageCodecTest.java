package org.irradcontrol.protocol;

import com.fasterxml.jackson.databind.JsonNode;
import org.irradcontrol.junit.extensions.logging.LogWatchExtension;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@Tag("unit")
@ExtendWith(LogWatchExtension.class)
class MessageCodecTest {

    @Test
    @DisplayName("A command without data is encoded without a data field")
    void encode_commandWithoutData_omitsDataField() {
        final String json = MessageCodec.encode(Command.of("scan", "status"));

        assertThat(json).isEqualTo("{\"target\":\"scan\",\"cmd\":\"status\"}");
    }

    @Test
    @DisplayName("Missing target and cmd are reported as missing fields")
    void decode_commandWithoutTargetAndCmd_reportsMissingFields() {
        final Command command = MessageCodec.decode("{\"data\":{\"row\":3}}", Command.class);

        assertThat(command.missingFields()).containsExactly("target", "cmd");
        assertThat(command.hasData()).isTrue();
        assertThat(command.data().get("row").asInt()).isEqualTo(3);
    }

    @Test
    @DisplayName("Blank fields count as missing")
    void missingFields_blankCmd_isMissing() {
        final Command command = new Command("server", " ", null);

        assertThat(command.missingFields()).containsExactly("cmd");
        assertThat(command.hasData()).isFalse();
    }

    @Test
    @DisplayName("Unknown fields in a message are ignored")
    void decode_unknownFields_areIgnored() {
        final Command command = MessageCodec.decode("{\"target\":\"scan\",\"cmd\":\"abort\",\"extra\":1}", Command.class);

        assertThat(command.target()).isEqualTo("scan");
        assertThat(command.missingFields()).isEmpty();
    }

    @Test
    @DisplayName("Malformed JSON raises a ProtocolException")
    void decode_malformedJson_throwsProtocolException() {
        assertThatThrownBy(() -> MessageCodec.decode("{not json", Command.class))
            .isInstanceOf(ProtocolException.class)
            .hasMessageStartingWith("Malformed Command message");
    }

    @Test
    @DisplayName("Replies carry reply, type, sender and data")
    void encode_errorReply_containsAllFields() {
        final JsonNode tree = MessageCodec.toTree(Reply.error("scan_row", "server", "Stage is busy"));

        assertThat(tree.get("reply").asText()).isEqualTo("scan_row");
        assertThat(tree.get("type").asText()).isEqualTo("ERROR");
        assertThat(tree.get("sender").asText()).isEqualTo("server");
        assertThat(tree.get("data").asText()).isEqualTo("Stage is busy");
    }

    @Test
    @DisplayName("Data packets keep the order of their meta entries")
    void decode_dataPacket_keepsMetaAndPayload() {
        final DataPacket packet = DataPacket.of("server", "stage", Map.of("status", "scan_init", "n_rows", 10));

        final DataPacket decoded = MessageCodec.decode(MessageCodec.encode(packet), DataPacket.class);

        assertThat(decoded.meta().keySet()).containsExactly(DataPacket.TIMESTAMP, DataPacket.NAME, DataPacket.TYPE);
        assertThat(decoded.type()).isEqualTo("stage");
        assertThat(decoded.name()).isEqualTo("server");
        assertThat(decoded.timestamp()).isPositive();
        assertThat(decoded.dataAsMap()).containsEntry("status", "scan_init").containsEntry("n_rows", 10);
    }

    @Test
    @DisplayName("A non-object payload yields an empty map")
    void dataAsMap_listPayload_isEmpty() {
        final DataPacket packet = DataPacket.of("dut", "raw", List.of(1, 2, 3));

        assertThat(packet.dataAsMap()).isEmpty();
    }

    @Test
    @DisplayName("Descriptor ports are looked up by channel")
    void descriptor_port_isLookedUpByChannel() {
        final ProcessDescriptor descriptor = ProcessDescriptor.of(42L, "server", Map.of(ChannelKind.CMD, 8601));

        final ProcessDescriptor decoded = MessageCodec.decode(MessageCodec.encode(descriptor), ProcessDescriptor.class);

        assertThat(decoded.port(ChannelKind.CMD)).hasValue(8601);
        assertThat(decoded.port(ChannelKind.DATA)).isEmpty();
        assertThat(decoded.ports()).containsOnlyKeys("cmd");
    }

    @Test
    @DisplayName("Channels are resolved by their wire name")
    void channelKind_fromWireName() {
        assertThat(ChannelKind.fromWireName("event")).contains(ChannelKind.EVENT);
        assertThat(ChannelKind.fromWireName("bogus")).isEmpty();
        assertThat(ChannelKind.CMD.isBroadcast()).isFalse();
    }
}
