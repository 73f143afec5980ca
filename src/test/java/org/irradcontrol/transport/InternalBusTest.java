package org.irradcontrol.transport;

import org.irradcontrol.junit.extensions.logging.LogWatchExtension;
import org.irradcontrol.protocol.ChannelKind;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@Tag("unit")
@ExtendWith(LogWatchExtension.class)
class InternalBusTest {

    @Test
    @DisplayName("Messages keep their channel and publish order")
    void send_keepsChannelAndOrder() throws Exception {
        final InternalBus bus = new InternalBus("bridge", 10);
        final InternalPublisher publisher = bus.createPublisher();

        publisher.send(ChannelKind.DATA, "d1");
        publisher.send(ChannelKind.EVENT, "e1");
        publisher.send(ChannelKind.DATA, "d2");

        assertThat(bus.poll(Duration.ZERO)).isEqualTo(new InternalBus.Message(ChannelKind.DATA, "d1"));
        assertThat(bus.poll(Duration.ZERO)).isEqualTo(new InternalBus.Message(ChannelKind.EVENT, "e1"));
        assertThat(bus.poll(Duration.ZERO)).isEqualTo(new InternalBus.Message(ChannelKind.DATA, "d2"));
        assertThat(bus.poll(Duration.ofMillis(10))).isNull();
    }

    @Test
    @DisplayName("A full bus drops its oldest message")
    void send_fullBus_dropsOldest() throws Exception {
        final InternalBus bus = new InternalBus("bridge", 2);
        final InternalPublisher publisher = bus.createPublisher();

        publisher.send(ChannelKind.LOG, "1");
        publisher.send(ChannelKind.LOG, "2");
        publisher.send(ChannelKind.LOG, "3");

        assertThat(bus.droppedMessages()).isEqualTo(1);
        assertThat(bus.pending()).isEqualTo(2);
        assertThat(bus.poll(Duration.ZERO).payload()).isEqualTo("2");
    }

    @Test
    @DisplayName("A publisher can only be used by the thread that created it")
    void send_fromForeignThread_isRejected() throws Exception {
        final InternalBus bus = new InternalBus("bridge", 10);
        final InternalPublisher publisher = bus.createPublisher();
        final AtomicReference<Throwable> failure = new AtomicReference<>();

        final Thread foreign = new Thread(() -> {
            try {
                publisher.send(ChannelKind.DATA, "x");
            } catch (IllegalStateException e) {
                failure.set(e);
            }
        });
        foreign.start();
        foreign.join();

        assertThat(failure.get()).isInstanceOf(IllegalStateException.class);
        assertThat(bus.pending()).isZero();
    }

    @Test
    @DisplayName("The command channel cannot be published to")
    void send_toCommandChannel_isRejected() {
        final InternalPublisher publisher = new InternalBus("bridge", 10).createPublisher();

        assertThatThrownBy(() -> publisher.send(ChannelKind.CMD, "x"))
            .isInstanceOf(IllegalArgumentException.class);
    }
}
