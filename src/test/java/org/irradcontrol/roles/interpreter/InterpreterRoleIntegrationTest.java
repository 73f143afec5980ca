package org.irradcontrol.roles.interpreter;

import com.fasterxml.jackson.databind.node.TextNode;
import org.irradcontrol.events.EventKind;
import org.irradcontrol.junit.extensions.logging.ExpectLog;
import org.irradcontrol.junit.extensions.logging.LogLevel;
import org.irradcontrol.junit.extensions.logging.LogWatchExtension;
import org.irradcontrol.node.ProcessCore;
import org.irradcontrol.node.ProcessFixtures;
import org.irradcontrol.protocol.ChannelKind;
import org.irradcontrol.protocol.DataPacket;
import org.irradcontrol.protocol.EventRecord;
import org.irradcontrol.protocol.MessageCodec;
import org.irradcontrol.protocol.Reply;
import org.irradcontrol.roles.console.ConsoleClient;
import org.irradcontrol.transport.PortAllocator;
import org.irradcontrol.transport.PublisherSocket;
import org.irradcontrol.transport.SubscriberSocket;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.awaitility.Awaitility.await;

@Tag("integration")
@ExtendWith(LogWatchExtension.class)
class InterpreterRoleIntegrationTest {

    private static final Duration TIMEOUT = Duration.ofSeconds(5);

    @TempDir
    Path tempDir;

    private PublisherSocket upstream;
    private InterpreterRole role;
    private ProcessCore core;
    private ConsoleClient client;

    @BeforeEach
    void setUp() throws Exception {
        upstream = new PublisherSocket("server-data", new PortAllocator("127.0.0.1", 20000, 40000, 100).bindRandomPort(), 1000);
        final InterpreterSettings settings = new InterpreterSettings(
            List.of("tcp://127.0.0.1:" + upstream.port()), "beam_current", 1e-9);
        role = new InterpreterRole(settings, new ForwardingInterpreter());
        core = ProcessFixtures.startCore(new ProcessCore(role, ProcessFixtures.settings(tempDir)));
        client = new ConsoleClient("127.0.0.1", core.ports().get(ChannelKind.CMD), TIMEOUT);
        await().atMost(5, TimeUnit.SECONDS).until(() -> upstream.subscriberCount() == 1);
    }

    @AfterEach
    void tearDown() {
        client.close();
        core.stop();
        upstream.close();
    }

    @Test
    @DisplayName("Received packets are republished and a missing beam raises BeamOff")
    void lowCurrent_raisesBeamOffAndRepublishes() throws Exception {
        // Arrange
        final SubscriberSocket data = client.subscribe(ChannelKind.DATA, "127.0.0.1", core.ports().get(ChannelKind.DATA));
        final SubscriberSocket events = client.subscribe(ChannelKind.EVENT, "127.0.0.1", core.ports().get(ChannelKind.EVENT));
        await().atMost(5, TimeUnit.SECONDS).until(() -> {
            upstream.send(MessageCodec.encode(DataPacket.of("server-1", "raw", Map.of("beam_current", 1e-6))));
            return data.poll(Duration.ofMillis(100)) != null;
        });
        await().atMost(2, TimeUnit.SECONDS).until(() -> events.connectedCount() == 1);

        // Act
        upstream.send(MessageCodec.encode(DataPacket.of("server-1", "raw", Map.of("beam_current", 0.0))));

        // Assert
        final EventRecord record = MessageCodec.decode(events.poll(TIMEOUT), EventRecord.class);
        assertThat(record).isEqualTo(new EventRecord("server-1", "BeamOff", true, false));
        assertThat(role.registry("server-1").isValid(EventKind.BEAM_OFF)).isTrue();
    }

    @Test
    @DisplayName("Packets without a current reading raise no events")
    void packetWithoutCurrent_raisesNoEvent() throws Exception {
        upstream.send(MessageCodec.encode(DataPacket.of("server-1", "raw", Map.of("temperature", 25.0))));

        await().atMost(5, TimeUnit.SECONDS).untilAsserted(() -> {
            @SuppressWarnings("unchecked")
            final Map<String, Object> status = (Map<String, Object>) client.send("interpreter", "status").data();
            assertThat(((Number) status.get("received")).longValue()).isEqualTo(1L);
        });
        final Reply events = client.send("interpreter", "events");
        assertThat((List<?>) events.data()).isEmpty();
    }

    @Test
    @ExpectLog(level = LogLevel.ERROR, messagePattern = "Incorrect address format 'nowhere'.*")
    @DisplayName("Streams can be added at runtime and invalid addresses are rejected")
    void addStream_validAndInvalid() throws Exception {
        final PublisherSocket second = new PublisherSocket("server-2-data",
            new PortAllocator("127.0.0.1", 20000, 40000, 100).bindRandomPort(), 10);
        try {
            final Reply added = client.send("interpreter", "add_stream", TextNode.valueOf("tcp://127.0.0.1:" + second.port()));
            final Reply rejected = client.send("interpreter", "add_stream", TextNode.valueOf("nowhere"));

            assertThat(added.isError()).isFalse();
            assertThat(rejected.isError()).isTrue();
            await().atMost(5, TimeUnit.SECONDS).until(() -> second.subscriberCount() == 1);
        } finally {
            second.close();
        }
    }
}
