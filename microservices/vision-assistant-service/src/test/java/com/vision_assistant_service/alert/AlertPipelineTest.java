package com.vision_assistant_service.alert;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import com.vision_assistant_service.safety.SafetyEventMonitor;
import com.vision_assistant_service.safety.SafetyEventType;
import com.vision_assistant_service.safety.SafetyTransition;

class AlertPipelineTest {

    private static final Instant T0 = Instant.parse("2024-05-01T10:00:00Z");

    private final AlertSink alertSink = mock(AlertSink.class);
    private final DetectionSink detectionSink = mock(DetectionSink.class);
    private final Clock clock = Clock.fixed(T0, ZoneOffset.UTC);

    private AlertAggregator aggregator;
    private AlertPipeline pipeline;
    private SafetyEventMonitor monitor;

    @BeforeEach
    void setUp() {
        aggregator = new AlertAggregator(List.of(alertSink));
        pipeline = new AlertPipeline(new ProximityClassifier(Set.of("person", "chair", "car")),
                new CooldownTracker(), aggregator, detectionSink, clock);
        monitor = new SafetyEventMonitor(clock);
        monitor.addListener(pipeline);
    }

    private static DetectionEvent detection(String type, double size, double xCenter, Instant at) {
        return new DetectionEvent(type, size, xCenter, 640, 0.9, null, at);
    }

    @Test
    void repeatedDetectionIsAnnouncedOncePerWindow() throws InterruptedException {
        AlertPipeline.IngestResult first = pipeline.ingest(List.of(detection("person", 0.75, 320, T0)));
        AlertPipeline.IngestResult second = pipeline.ingest(List.of(detection("person", 0.75, 320, T0.plusSeconds(1))));
        AlertPipeline.IngestResult third = pipeline.ingest(
                List.of(detection("person", 0.75, 320, T0.plusMillis(3100))));

        assertThat(first.admitted()).isEqualTo(1);
        assertThat(second.admitted()).isZero();
        assertThat(second.classified()).isEqualTo(1);
        assertThat(third.admitted()).isEqualTo(1);
        verify(detectionSink, times(3)).recordDetection(any(), any(Boolean.class));
        verify(detectionSink).recordDetection(any(), eq(false));
        assertThat(aggregator.pendingCount()).isEqualTo(2);
    }

    @Test
    void criticalIsAnnouncedBeforeQueuedWarning() throws InterruptedException {
        pipeline.ingest(List.of(
                detection("chair", 0.45, 100, T0),
                detection("person", 0.75, 320, T0)));

        assertThat(aggregator.next().message()).isEqualTo("person ahead, critical");
        assertThat(aggregator.next().message()).isEqualTo("chair on the left, warning");
    }

    @Test
    void farDetectionIsRecordedNotQueued() {
        AlertPipeline.IngestResult result = pipeline.ingest(List.of(detection("car", 0.1, 600, T0)));

        assertThat(result.admitted()).isEqualTo(1);
        assertThat(aggregator.pendingCount()).isZero();
        verify(alertSink).recordAlert(any());
    }

    @Test
    void untrackedObjectsAreDropped() {
        AlertPipeline.IngestResult result = pipeline.ingest(List.of(detection("kite", 0.9, 320, T0)));

        assertThat(result.received()).isEqualTo(1);
        assertThat(result.classified()).isZero();
        assertThat(pipeline.describeScene()).isEqualTo("I don't see anything nearby.");
    }

    @Test
    void safetyRaiseJumpsAheadOfProximity() throws InterruptedException {
        pipeline.ingest(List.of(detection("person", 0.75, 320, T0)));
        monitor.raise(SafetyEventType.FALL);

        assertThat(aggregator.next().message()).isEqualTo("Fall detected");
        assertThat(aggregator.next().message()).isEqualTo("person ahead, critical");
    }

    @Test
    void raiseAndAcknowledgementAreBothAnnouncedInOrder() throws InterruptedException {
        monitor.raise(SafetyEventType.FALL);
        monitor.acknowledge(SafetyEventType.FALL);

        assertThat(aggregator.pendingSnapshot()).extracting(Alert::message)
                .containsExactly("Fall detected", "Fall alert acknowledged");
        verify(alertSink, times(2)).recordAlert(any());
    }

    @Test
    void acknowledgementCanWithdrawQueuedRaise() throws InterruptedException {
        AlertAggregator withdrawing = new AlertAggregator(List.of(alertSink));
        SafetyEventMonitor acknowledging = new SafetyEventMonitor(clock);
        acknowledging.addListener(new AlertPipeline(new ProximityClassifier(Set.of("person")),
                new CooldownTracker(), withdrawing, detectionSink, clock, true));

        acknowledging.raise(SafetyEventType.FALL);
        acknowledging.acknowledge(SafetyEventType.FALL);

        assertThat(withdrawing.pendingSnapshot()).extracting(Alert::message)
                .containsExactly("Fall alert acknowledged");
        verify(alertSink, times(2)).recordAlert(any());
    }

    @Test
    void acknowledgementDuringSlowRaiseDeliveryIsQueuedBehindRaise() throws InterruptedException {
        SafetyEventMonitor slow = new SafetyEventMonitor(clock);
        CountDownLatch delivering = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        slow.addListener(t -> {
            if (t.kind() == SafetyTransition.Kind.RAISED) {
                delivering.countDown();
                awaitQuietly(release);
            }
        });
        slow.addListener(pipeline);

        Thread raiser = new Thread(() -> slow.raise(SafetyEventType.FALL), "raiser");
        raiser.start();
        assertThat(delivering.await(5, TimeUnit.SECONDS)).isTrue();

        slow.acknowledge(SafetyEventType.FALL);
        assertThat(aggregator.pendingCount()).isZero();

        release.countDown();
        raiser.join(5000);

        assertThat(raiser.isAlive()).isFalse();
        assertThat(aggregator.pendingSnapshot()).extracting(Alert::message)
                .containsExactly("Fall detected", "Fall alert acknowledged");
    }

    @Test
    void describesLatestScene() {
        pipeline.ingest(List.of(
                detection("person", 0.75, 320, T0),
                detection("chair", 0.45, 100, T0),
                detection("chair", 0.2, 120, T0)));

        assertThat(pipeline.describeScene()).isEqualTo("I see a person ahead and 2 chairs on the left.");
        assertThat(pipeline.latestSceneAt()).isEqualTo(T0);
    }

    private static void awaitQuietly(CountDownLatch latch) {
        try {
            latch.await(5, TimeUnit.SECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }
}
