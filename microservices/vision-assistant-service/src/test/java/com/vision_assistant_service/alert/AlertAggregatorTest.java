package com.vision_assistant_service.alert;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;

import java.time.Instant;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;

import org.junit.jupiter.api.Test;

import com.vision_assistant_service.safety.SafetyEventType;
import com.vision_assistant_service.safety.SafetyTransition;

class AlertAggregatorTest {

    private static final Instant T0 = Instant.parse("2024-05-01T10:00:00Z");

    private final AlertSink sink = mock(AlertSink.class);
    private final AlertAggregator aggregator = new AlertAggregator(List.of(sink));

    private static Alert proximity(String type, ProximityZone zone) {
        return Alert.proximity(new ProximityEvent(type, Direction.AHEAD, zone, 0.5, 0.9, null, T0));
    }

    private static Alert fall() {
        return Alert.safety(new SafetyTransition(SafetyEventType.FALL, SafetyTransition.Kind.RAISED,
                null, T0, null), T0);
    }

    @Test
    void deliversMostSevereFirstAndFifoWithinSeverity() throws InterruptedException {
        aggregator.publish(proximity("chair", ProximityZone.WARNING));
        aggregator.publish(proximity("bench", ProximityZone.WARNING));
        aggregator.publish(proximity("person", ProximityZone.CRITICAL));
        aggregator.publish(fall());

        assertThat(aggregator.next().message()).isEqualTo("Fall detected");
        assertThat(aggregator.next().message()).isEqualTo("person ahead, critical");
        assertThat(aggregator.next().message()).isEqualTo("chair ahead, warning");
        assertThat(aggregator.next().message()).isEqualTo("bench ahead, warning");
        assertThat(aggregator.lastDelivered().message()).isEqualTo("bench ahead, warning");
    }

    @Test
    void farAlertsAreRecordedButNeverQueued() {
        Alert far = proximity("car", ProximityZone.FAR);

        assertThat(aggregator.publish(far)).isFalse();

        assertThat(aggregator.pendingCount()).isZero();
        verify(sink).recordAlert(far);
    }

    @Test
    void failingSinkDoesNotBlockDelivery() throws InterruptedException {
        doThrow(new IllegalStateException("db down")).when(sink).recordAlert(any());

        assertThat(aggregator.publish(proximity("person", ProximityZone.CRITICAL))).isTrue();

        assertThat(aggregator.next(1, TimeUnit.SECONDS)).isNotNull();
    }

    @Test
    void withdrawDropsQueuedRaiseOnly() {
        aggregator.publish(fall());
        aggregator.publish(proximity("person", ProximityZone.CRITICAL));

        assertThat(aggregator.withdraw(SafetyEventType.FALL)).isEqualTo(1);
        assertThat(aggregator.withdraw(SafetyEventType.EMERGENCY)).isZero();
        assertThat(aggregator.pendingSnapshot()).extracting(Alert::message)
                .containsExactly("person ahead, critical");
        verify(sink, times(2)).recordAlert(any());
    }

    @Test
    void timedNextReturnsNullWhenEmpty() throws InterruptedException {
        assertThat(aggregator.next(20, TimeUnit.MILLISECONDS)).isNull();
    }

    @Test
    void closeWakesWaitingConsumer() throws Exception {
        CompletableFuture<Alert> waiting = CompletableFuture.supplyAsync(() -> {
            try {
                return aggregator.next();
            } catch (InterruptedException e) {
                throw new IllegalStateException(e);
            }
        });
        Thread.sleep(50);

        aggregator.close();

        assertThat(waiting.get(2, TimeUnit.SECONDS)).isNull();
        assertThat(aggregator.publish(proximity("person", ProximityZone.CRITICAL))).isFalse();
        assertThat(aggregator.isClosed()).isTrue();
    }
}
