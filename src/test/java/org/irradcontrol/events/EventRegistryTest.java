package org.irradcontrol.events;

import org.irradcontrol.junit.extensions.logging.LogWatchExtension;
import org.irradcontrol.protocol.EventRecord;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;

@Tag("unit")
@ExtendWith(LogWatchExtension.class)
class EventRegistryTest {

    private MutableClock clock;
    private EventRegistry registry;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(Instant.parse("2024-05-01T10:00:00Z"));
        registry = new EventRegistry("server-1", clock);
    }

    @Test
    @DisplayName("A met condition activates the event and starts its cooldown")
    void check_metCondition_activatesAndCoolsDown() {
        // Act
        final Optional<EventRecord> first = registry.check(EventKind.BEAM_OFF, () -> true);
        final Optional<EventRecord> duringCooldown = registry.check(EventKind.BEAM_OFF, () -> false);

        // Assert
        assertThat(first).contains(new EventRecord("server-1", "BeamOff", true, false));
        assertThat(duringCooldown).isEmpty();
        assertThat(registry.isValid(EventKind.BEAM_OFF)).isTrue();
    }

    @Test
    @DisplayName("An active event is re-broadcast after its cooldown and cleared once the condition is gone")
    void check_afterCooldown_reactivatesOrClears() {
        registry.check(EventKind.DUT_TEMP_HIGH, () -> true);

        clock.advance(Duration.ofSeconds(21));
        final Optional<EventRecord> stillHot = registry.check(EventKind.DUT_TEMP_HIGH, () -> true);
        clock.advance(Duration.ofSeconds(21));
        final Optional<EventRecord> cooled = registry.check(EventKind.DUT_TEMP_HIGH, () -> false);
        final Optional<EventRecord> idle = registry.check(EventKind.DUT_TEMP_HIGH, () -> false);

        assertThat(stillHot).map(EventRecord::active).contains(true);
        assertThat(cooled).map(EventRecord::active).contains(false);
        assertThat(idle).isEmpty();
    }

    @Test
    @DisplayName("Exactly the cooldown is not enough to be evaluated again")
    void isReady_exactlyCooldown_isFalse() {
        registry.check(EventKind.BEAM_OFF, () -> true);

        clock.advance(Duration.ofSeconds(1));
        assertThat(registry.get(EventKind.BEAM_OFF).isReady()).isFalse();
        clock.advance(Duration.ofMillis(1));
        assertThat(registry.get(EventKind.BEAM_OFF).isReady()).isTrue();
    }

    @Test
    @DisplayName("Other beam events are not evaluated while the beam is off")
    void check_beamEventWhileBeamOff_isSuppressed() {
        registry.check(EventKind.BEAM_OFF, () -> true);

        final Optional<EventRecord> unstable = registry.check(EventKind.BEAM_UNSTABLE, () -> true);
        final Optional<EventRecord> temperature = registry.check(EventKind.BLM_TEMP_HIGH, () -> true);

        assertThat(unstable).isEmpty();
        assertThat(registry.get(EventKind.BEAM_UNSTABLE).isActive()).isFalse();
        assertThat(temperature).isPresent();
    }

    @Test
    @DisplayName("A disabled event is neither evaluated nor valid")
    void setDisabled_suppressesEvaluation() {
        final Optional<EventRecord> disabled = registry.setDisabled(EventKind.DOSE_RATE_HIGH, true);
        final Optional<EventRecord> again = registry.setDisabled(EventKind.DOSE_RATE_HIGH, true);
        final Optional<EventRecord> checked = registry.check(EventKind.DOSE_RATE_HIGH, () -> true);

        assertThat(disabled).contains(new EventRecord("server-1", "DoseRateHigh", false, true));
        assertThat(again).isEmpty();
        assertThat(checked).isEmpty();
        assertThat(registry.isValid(EventKind.DOSE_RATE_HIGH)).isFalse();
    }

    @Test
    @DisplayName("Disabling an active beam event makes all beam events invalid")
    void allBeamEventsInvalid_afterDisablingActiveEvent() {
        registry.check(EventKind.BEAM_LOSS, () -> true);
        assertThat(registry.allBeamEventsInvalid()).isFalse();

        registry.setDisabled(EventKind.BEAM_LOSS, true);

        assertThat(registry.allBeamEventsInvalid()).isTrue();
    }

    @Test
    @DisplayName("Applying a foreign record reports whether anything changed")
    void apply_reportsChange() {
        final EventRecord active = new EventRecord("server-1", "BeamDrift", true, false);

        assertThat(registry.apply(EventKind.BEAM_DRIFT, active)).isTrue();
        assertThat(registry.apply(EventKind.BEAM_DRIFT, active)).isFalse();
        assertThat(registry.get(EventKind.BEAM_DRIFT).lastTriggered()).contains(clock.instant());
    }

    @Test
    @DisplayName("A foreign record does not lift the local operator override")
    void apply_keepsLocalOverride() {
        registry.apply(EventKind.BEAM_OFF, new EventRecord("interpreter", "BeamOff", true, false));
        registry.setDisabled(EventKind.BEAM_OFF, true);

        final boolean changed = registry.apply(EventKind.BEAM_OFF, new EventRecord("interpreter", "BeamOff", true, false));

        assertThat(changed).isFalse();
        assertThat(registry.get(EventKind.BEAM_OFF).isDisabled()).isTrue();
        assertThat(registry.isValid(EventKind.BEAM_OFF)).isFalse();
        assertThat(registry.allBeamEventsInvalid()).isTrue();

        registry.apply(EventKind.BEAM_OFF, new EventRecord("interpreter", "BeamOff", false, true));
        assertThat(registry.toRecord(EventKind.BEAM_OFF)).isEqualTo(new EventRecord("server-1", "BeamOff", false, true));
    }

    @Test
    @DisplayName("The snapshot lists every event of the catalogue")
    void snapshot_listsAllEvents() {
        assertThat(registry.snapshot())
            .hasSize(EventKind.values().length)
            .allMatch(record -> record.server().equals("server-1") && !record.active());
        assertThat(EventKind.fromWireName("IrradiationComplete")).contains(EventKind.IRRADIATION_COMPLETE);
    }

    static final class MutableClock extends Clock {
        private Instant now;

        MutableClock(final Instant now) {
            this.now = now;
        }

        void advance(final Duration duration) {
            now = now.plus(duration);
        }

        @Override
        public ZoneId getZone() {
            return ZoneOffset.UTC;
        }

        @Override
        public Clock withZone(final ZoneId zone) {
            return this;
        }

        @Override
        public Instant instant() {
            return now;
        }
    }
}
