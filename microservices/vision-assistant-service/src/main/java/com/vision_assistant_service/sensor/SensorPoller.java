package com.vision_assistant_service.sensor;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.web.client.RestClientException;

import com.vision_assistant_service.safety.SafetyEventMonitor;
import com.vision_assistant_service.safety.SafetyEventType;
import com.vision_assistant_service.safety.SafetyTransition;
import com.vision_assistant_service.safety.SafetyTransitionListener;

/**
 * Periodic polling of the sensor board. Each source is polled by its own scheduled task
 * with its own backoff, and only talks to the safety monitor through raise calls.
 *
 * <p>A false reading never clears an event; clearing happens through acknowledgement only.
 * Local acknowledgements are forwarded to the board so its flag clears as well.
 */
public class SensorPoller implements SafetyTransitionListener {

    private static final Logger log = LoggerFactory.getLogger(SensorPoller.class);

    static final String ENVIRONMENT_SOURCE = "environment";

    private final PiSensorClient client;
    private final SafetyEventMonitor monitor;
    private final EnvironmentalMonitor environment;
    private final ConnectivityStatus connectivity;
    private final Clock clock;
    private final Duration baseBackoff;
    private final Duration maxBackoff;

    public SensorPoller(PiSensorClient client, SafetyEventMonitor monitor, EnvironmentalMonitor environment,
                        ConnectivityStatus connectivity, Clock clock, Duration baseBackoff, Duration maxBackoff) {
        this.client = client;
        this.monitor = monitor;
        this.environment = environment;
        this.connectivity = connectivity;
        this.clock = clock;
        this.baseBackoff = baseBackoff;
        this.maxBackoff = maxBackoff;
    }

    @Scheduled(fixedDelayString = "${vision.sensors.poll-interval:PT2S}", initialDelayString = "${vision.sensors.initial-delay:PT2S}")
    public void pollFall() {
        pollSafety(SafetyEventType.FALL);
    }

    @Scheduled(fixedDelayString = "${vision.sensors.poll-interval:PT2S}", initialDelayString = "${vision.sensors.initial-delay:PT2S}")
    public void pollEmergency() {
        pollSafety(SafetyEventType.EMERGENCY);
    }

    @Scheduled(fixedDelayString = "${vision.sensors.poll-interval:PT2S}", initialDelayString = "${vision.sensors.initial-delay:PT2S}")
    public void pollAssistance() {
        pollSafety(SafetyEventType.ASSISTANCE);
    }

    @Scheduled(fixedDelayString = "${vision.sensors.environment-interval:PT30S}", initialDelayString = "${vision.sensors.initial-delay:PT2S}")
    public void pollEnvironment() {
        Instant now = clock.instant();
        if (inBackoff(ENVIRONMENT_SOURCE, now)) {
            return;
        }
        try {
            environment.update(client.readEnvironment());
            connectivity.recordSuccess(ENVIRONMENT_SOURCE, now);
        } catch (RuntimeException e) {
            recordFailure(ENVIRONMENT_SOURCE, now, e);
        }
    }

    /**
     * Polls one safety signal.
     *
     * @return true if the poll reached the sensor board
     */
    public boolean pollSafety(SafetyEventType type) {
        Instant now = clock.instant();
        String source = type.getKey();
        if (inBackoff(source, now)) {
            return false;
        }
        SensorReading reading;
        try {
            reading = client.readSafety(type);
        } catch (RuntimeException e) {
            recordFailure(source, now, e);
            return false;
        }
        ConnectivityStatus.SourceHealth before = connectivity.health(source);
        connectivity.recordSuccess(source, now);
        if (before != null && before.degraded()) {
            log.info("Sensor source {} reachable again after {} failure(s)", source, before.consecutiveFailures());
        }

        if (reading.active()) {
            monitor.raise(type, reading.assistanceType(), reading.sensorTimestamp());
        }
        return true;
    }

    @Override
    public void onTransition(SafetyTransition transition) {
        if (transition.kind() != SafetyTransition.Kind.ACKNOWLEDGED) {
            return;
        }
        try {
            client.acknowledge(transition.type());
        } catch (RestClientException e) {
            log.warn("Could not forward {} acknowledgement to {}: {}", transition.type().getKey(),
                    client.getBaseUrl(), e.getMessage());
        }
    }

    Duration backoffFor(int consecutiveFailures) {
        if (consecutiveFailures <= 0) {
            return Duration.ZERO;
        }
        Duration delay = baseBackoff;
        for (int i = 1; i < consecutiveFailures && delay.compareTo(maxBackoff) < 0; i++) {
            delay = delay.multipliedBy(2);
        }
        return delay.compareTo(maxBackoff) > 0 ? maxBackoff : delay;
    }

    private boolean inBackoff(String source, Instant now) {
        ConnectivityStatus.SourceHealth health = connectivity.health(source);
        return health != null && health.nextAttempt() != null && now.isBefore(health.nextAttempt());
    }

    private void recordFailure(String source, Instant now, RuntimeException e) {
        ConnectivityStatus.SourceHealth previous = connectivity.health(source);
        int failures = previous == null ? 1 : previous.consecutiveFailures() + 1;
        Instant nextAttempt = now.plus(backoffFor(failures));
        connectivity.recordFailure(source, now, e.getMessage(), nextAttempt);
        if (failures == 1) {
            log.warn("Sensor source {} unreachable: {}", source, e.getMessage());
        } else {
            log.debug("Sensor source {} still unreachable ({} failures), next attempt at {}", source, failures, nextAttempt);
        }
    }
}
