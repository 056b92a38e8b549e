package com.vision_assistant_service.audio;

import static org.assertj.core.api.Assertions.assertThat;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import com.vision_assistant_service.alert.Alert;
import com.vision_assistant_service.alert.AlertAggregator;
import com.vision_assistant_service.alert.Direction;
import com.vision_assistant_service.alert.ProximityEvent;
import com.vision_assistant_service.alert.ProximityZone;

class AnnouncerTest {

    private static final Instant T0 = Instant.parse("2024-05-01T10:00:00Z");

    private final AlertAggregator aggregator = new AlertAggregator(List.of());
    private final List<String> spoken = new CopyOnWriteArrayList<>();
    private Announcer announcer;

    @AfterEach
    void tearDown() {
        if (announcer != null) {
            announcer.stop(Duration.ofSeconds(1));
        }
    }

    private static Alert alert(String type, ProximityZone zone) {
        return Alert.proximity(new ProximityEvent(type, Direction.AHEAD, zone, 0.5, 0.9, null, T0));
    }

    @Test
    void speaksQueuedAlertsInPriorityOrder() throws InterruptedException {
        CountDownLatch done = new CountDownLatch(2);
        announcer = new Announcer(aggregator, text -> {
            spoken.add(text);
            done.countDown();
        });
        aggregator.publish(alert("chair", ProximityZone.WARNING));
        aggregator.publish(alert("person", ProximityZone.CRITICAL));

        announcer.start();

        assertThat(done.await(2, TimeUnit.SECONDS)).isTrue();
        assertThat(spoken).containsExactly("person ahead, critical", "chair ahead, warning");
        assertThat(announcer.getUtterances()).isEqualTo(2);
    }

    @Test
    void engineFailureIsCountedAndDrainingContinues() throws InterruptedException {
        CountDownLatch done = new CountDownLatch(2);
        announcer = new Announcer(aggregator, text -> {
            done.countDown();
            if (text.startsWith("person")) {
                throw new SpeechException("audio device busy");
            }
            spoken.add(text);
        });
        aggregator.publish(alert("person", ProximityZone.CRITICAL));
        aggregator.publish(alert("chair", ProximityZone.WARNING));

        announcer.start();

        assertThat(done.await(2, TimeUnit.SECONDS)).isTrue();
        Thread.sleep(50);
        assertThat(spoken).containsExactly("chair ahead, warning");
        assertThat(announcer.getFailures()).isEqualTo(1);
    }

    @Test
    void stopEndsDrainingAndRejectsImmediateSpeech() throws InterruptedException {
        announcer = new Announcer(aggregator, spoken::add);
        announcer.start();
        assertThat(announcer.isRunning()).isTrue();

        announcer.stop(Duration.ofSeconds(1));

        assertThat(announcer.isRunning()).isFalse();
        assertThat(aggregator.isClosed()).isTrue();
        assertThat(announcer.speakNow("hello")).isFalse();
        assertThat(spoken).isEmpty();
    }

    @Test
    void speakNowWorksWithoutDrainThread() {
        announcer = new Announcer(aggregator, spoken::add);

        assertThat(announcer.speakNow("It is 10:00 AM.")).isTrue();
        assertThat(spoken).containsExactly("It is 10:00 AM.");
    }
}
