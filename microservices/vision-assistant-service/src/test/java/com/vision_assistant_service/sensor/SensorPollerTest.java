package com.vision_assistant_service.sensor;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.web.client.ResourceAccessException;

import com.vision_assistant_service.safety.AssistanceType;
import com.vision_assistant_service.safety.SafetyEventMonitor;
import com.vision_assistant_service.safety.SafetyEventType;

class SensorPollerTest {

    private static final Instant T0 = Instant.parse("2024-05-01T10:00:00Z");

    private final PiSensorClient client = mock(PiSensorClient.class);
    private final ConnectivityStatus connectivity = new ConnectivityStatus();
    private final MutableClock clock = new MutableClock(T0);
    private SafetyEventMonitor monitor;
    private SensorPoller poller;

    @BeforeEach
    void setUp() {
        monitor = new SafetyEventMonitor(clock);
        poller = new SensorPoller(client, monitor, new EnvironmentalMonitor(), connectivity, clock,
                Duration.ofSeconds(2), Duration.ofSeconds(30));
        monitor.addListener(poller);
    }

    @Test
    void activeReadingRaisesEvent() {
        when(client.readSafety(SafetyEventType.ASSISTANCE))
                .thenReturn(new SensorReading(true, AssistanceType.BATHROOM, T0.minusSeconds(1)));

        assertThat(poller.pollSafety(SafetyEventType.ASSISTANCE)).isTrue();

        assertThat(monitor.isActive(SafetyEventType.ASSISTANCE)).isTrue();
        assertThat(monitor.status(SafetyEventType.ASSISTANCE).assistanceType()).isEqualTo(AssistanceType.BATHROOM);
    }

    @Test
    void inactiveReadingNeverClearsActiveEvent() {
        monitor.raise(SafetyEventType.FALL);
        when(client.readSafety(SafetyEventType.FALL)).thenReturn(new SensorReading(false, null, null));

        poller.pollSafety(SafetyEventType.FALL);

        assertThat(monitor.isActive(SafetyEventType.FALL)).isTrue();
    }

    @Test
    void failedPollLeavesSafetyStateAndBacksOff() {
        monitor.raise(SafetyEventType.EMERGENCY);
        when(client.readSafety(SafetyEventType.EMERGENCY)).thenThrow(new ResourceAccessException("timed out"));

        assertThat(poller.pollSafety(SafetyEventType.EMERGENCY)).isFalse();

        assertThat(monitor.isActive(SafetyEventType.EMERGENCY)).isTrue();
        assertThat(connectivity.isDegraded()).isTrue();
        assertThat(connectivity.health("emergency").nextAttempt()).isEqualTo(T0.plusSeconds(2));

        clock.advance(Duration.ofSeconds(1));
        assertThat(poller.pollSafety(SafetyEventType.EMERGENCY)).isFalse();
        assertThat(connectivity.health("emergency").consecutiveFailures()).isEqualTo(1);

        clock.advance(Duration.ofSeconds(1));
        poller.pollSafety(SafetyEventType.EMERGENCY);
        assertThat(connectivity.health("emergency").consecutiveFailures()).isEqualTo(2);
        assertThat(connectivity.health("emergency").nextAttempt()).isEqualTo(T0.plusSeconds(6));
    }

    @Test
    void recoveryClearsDegradedState() {
        when(client.readSafety(SafetyEventType.FALL))
                .thenThrow(new ResourceAccessException("refused"))
                .thenReturn(new SensorReading(false, null, null));

        poller.pollSafety(SafetyEventType.FALL);
        clock.advance(Duration.ofSeconds(2));
        poller.pollSafety(SafetyEventType.FALL);

        assertThat(connectivity.isDegraded()).isFalse();
        assertThat(connectivity.health("fall").lastSuccess()).isEqualTo(T0.plusSeconds(2));
    }

    @Test
    void backoffDoublesUpToCap() {
        assertThat(poller.backoffFor(0)).isEqualTo(Duration.ZERO);
        assertThat(poller.backoffFor(1)).isEqualTo(Duration.ofSeconds(2));
        assertThat(poller.backoffFor(3)).isEqualTo(Duration.ofSeconds(8));
        assertThat(poller.backoffFor(10)).isEqualTo(Duration.ofSeconds(30));
    }

    @Test
    void acknowledgementIsForwardedToBoard() {
        monitor.raise(SafetyEventType.FALL);

        monitor.acknowledge(SafetyEventType.FALL);

        verify(client).acknowledge(SafetyEventType.FALL);
    }

    @Test
    void unreachableBoardDoesNotUndoAcknowledgement() {
        doThrow(new ResourceAccessException("refused")).when(client).acknowledge(SafetyEventType.FALL);
        monitor.raise(SafetyEventType.FALL);

        monitor.acknowledge(SafetyEventType.FALL);

        assertThat(monitor.isActive(SafetyEventType.FALL)).isFalse();
    }

    @Test
    void staleBoardFlagDoesNotReopenAcknowledgedFall() {
        Instant fallAt = T0.minusSeconds(3);
        when(client.readSafety(SafetyEventType.FALL)).thenReturn(new SensorReading(true, null, fallAt));
        poller.pollSafety(SafetyEventType.FALL);
        monitor.acknowledge(SafetyEventType.FALL);

        clock.advance(Duration.ofSeconds(2));
        poller.pollSafety(SafetyEventType.FALL);

        assertThat(monitor.isActive(SafetyEventType.FALL)).isFalse();
    }

    @Test
    void raiseWithoutPollDoesNotCallBoard() {
        monitor.raise(SafetyEventType.EMERGENCY);

        verify(client, never()).acknowledge(SafetyEventType.EMERGENCY);
    }

    static final class MutableClock extends Clock {

        private Instant now;

        MutableClock(Instant now) {
            this.now = now;
        }

        void advance(Duration by) {
            now = now.plus(by);
        }

        @Override
        public ZoneId getZone() {
            return ZoneOffset.UTC;
        }

        @Override
        public Clock withZone(ZoneId zone) {
            return this;
        }

        @Override
        public Instant instant() {
            return now;
        }
    }
}
