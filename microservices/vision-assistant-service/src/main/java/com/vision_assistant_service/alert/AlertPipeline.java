package com.vision_assistant_service.alert;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.vision_assistant_service.safety.SafetyTransition;
import com.vision_assistant_service.safety.SafetyTransitionListener;

/**
 * Routes producer input into the aggregator.
 *
 * <p>Detections go classifier, then cooldown, then aggregator; every classified detection is
 * recorded whether admitted or not. Safety transitions skip the cooldown and are all announced,
 * unless {@code withdrawAcknowledgedRaises} is set: then an acknowledgement first drops the
 * still-queued raise of the same type.
 */
public class AlertPipeline implements SafetyTransitionListener {

    private static final Logger log = LoggerFactory.getLogger(AlertPipeline.class);

    private final ProximityClassifier classifier;
    private final CooldownTracker cooldown;
    private final AlertAggregator aggregator;
    private final DetectionSink detectionSink;
    private final Clock clock;
    private final boolean withdrawAcknowledgedRaises;

    private final ReentrantLock sceneLock = new ReentrantLock();
    private List<ProximityEvent> latestScene = List.of();
    private Instant latestSceneAt;

    public AlertPipeline(ProximityClassifier classifier, CooldownTracker cooldown, AlertAggregator aggregator,
                         DetectionSink detectionSink, Clock clock) {
        this(classifier, cooldown, aggregator, detectionSink, clock, false);
    }

    public AlertPipeline(ProximityClassifier classifier, CooldownTracker cooldown, AlertAggregator aggregator,
                         DetectionSink detectionSink, Clock clock, boolean withdrawAcknowledgedRaises) {
        this.classifier = classifier;
        this.cooldown = cooldown;
        this.aggregator = aggregator;
        this.detectionSink = detectionSink;
        this.clock = clock;
        this.withdrawAcknowledgedRaises = withdrawAcknowledgedRaises;
    }

    /**
     * Processes the detections of one inference cycle.
     */
    public IngestResult ingest(List<DetectionEvent> batch) {
        List<ProximityEvent> scene = new ArrayList<>();
        int admitted = 0;
        for (DetectionEvent detection : batch) {
            Optional<ProximityEvent> classified = classifier.classify(detection);
            if (classified.isEmpty()) {
                continue;
            }
            ProximityEvent event = classified.get();
            scene.add(event);

            boolean admit = cooldown.admit(event);
            detectionSink.recordDetection(event, admit);
            if (admit) {
                admitted++;
                aggregator.publish(Alert.proximity(event));
            } else {
                log.debug("Cooldown suppressed {} ({})", event.key(), event.zone().getLabel());
            }
        }

        sceneLock.lock();
        try {
            latestScene = List.copyOf(scene);
            latestSceneAt = clock.instant();
        } finally {
            sceneLock.unlock();
        }
        return new IngestResult(batch.size(), scene.size(), admitted);
    }

    @Override
    public void onTransition(SafetyTransition transition) {
        if (withdrawAcknowledgedRaises && transition.kind() == SafetyTransition.Kind.ACKNOWLEDGED) {
            aggregator.withdraw(transition.type());
        }
        aggregator.publish(Alert.safety(transition, clock.instant()));
    }

    public List<ProximityEvent> latestScene() {
        sceneLock.lock();
        try {
            return latestScene;
        } finally {
            sceneLock.unlock();
        }
    }

    public Instant latestSceneAt() {
        sceneLock.lock();
        try {
            return latestSceneAt;
        } finally {
            sceneLock.unlock();
        }
    }

    /**
     * Spoken summary of the last inference cycle, e.g. "I see a person ahead and 2 chairs on the left."
     */
    public String describeScene() {
        List<ProximityEvent> scene = latestScene();
        if (scene.isEmpty()) {
            return "I don't see anything nearby.";
        }
        Map<AlertKey, Integer> counts = new LinkedHashMap<>();
        for (ProximityEvent event : scene) {
            counts.merge(event.key(), 1, Integer::sum);
        }
        List<String> parts = new ArrayList<>();
        for (Map.Entry<AlertKey, Integer> entry : counts.entrySet()) {
            parts.add(quantity(entry.getKey().objectType(), entry.getValue()) + " "
                    + entry.getKey().direction().getPhrase());
        }
        StringBuilder text = new StringBuilder("I see ");
        for (int i = 0; i < parts.size(); i++) {
            if (i > 0) {
                text.append(i == parts.size() - 1 ? " and " : ", ");
            }
            text.append(parts.get(i));
        }
        return text.append('.').toString();
    }

    private static String quantity(String objectType, int count) {
        if (count == 1) {
            return ("aeiou".indexOf(objectType.charAt(0)) >= 0 ? "an " : "a ") + objectType;
        }
        if (objectType.equals("person")) {
            return count + " people";
        }
        return count + " " + objectType + (objectType.endsWith("s") ? "es" : "s");
    }

    public record IngestResult(int received, int classified, int admitted) {
    }
}
