package com.vision_assistant_service.alert;

import java.time.Duration;
import java.time.Instant;
import java.util.HashMap;
import java.util.Map;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Suppresses repeated proximity alerts for the same object and direction.
 * At most one event per {@link AlertKey} is admitted per cooldown window.
 */
public class CooldownTracker {

    public static final Duration DEFAULT_WINDOW = Duration.ofSeconds(3);

    private final Duration window;
    private final boolean escalationBypassesCooldown;
    private final ReentrantLock lock = new ReentrantLock();
    private final Map<AlertKey, Admission> lastAdmitted = new HashMap<>();

    public CooldownTracker() {
        this(DEFAULT_WINDOW, false);
    }

    /**
     * @param window                     minimum spacing between two admissions of one key
     * @param escalationBypassesCooldown admit inside the window when the zone got more severe
     */
    public CooldownTracker(Duration window, boolean escalationBypassesCooldown) {
        if (window.isNegative()) {
            throw new IllegalArgumentException("cooldown window must not be negative");
        }
        this.window = window;
        this.escalationBypassesCooldown = escalationBypassesCooldown;
    }

    /**
     * Decides whether the event may be announced. Admission is final and updates the
     * key's timestamp; a rejected event is never replayed.
     */
    public boolean admit(ProximityEvent event) {
        AlertKey key = event.key();
        lock.lock();
        try {
            Admission previous = lastAdmitted.get(key);
            if (previous == null
                    || !Duration.between(previous.at(), event.timestamp()).minus(window).isNegative()
                    || (escalationBypassesCooldown
                        && !event.timestamp().isBefore(previous.at())
                        && event.zone().isMoreSevereThan(previous.zone()))) {
                lastAdmitted.put(key, new Admission(event.timestamp(), event.zone()));
                return true;
            }
            return false;
        } finally {
            lock.unlock();
        }
    }

    public Map<AlertKey, Admission> snapshot() {
        lock.lock();
        try {
            return Map.copyOf(lastAdmitted);
        } finally {
            lock.unlock();
        }
    }

    public Duration getWindow() {
        return window;
    }

    public boolean isEscalationBypassesCooldown() {
        return escalationBypassesCooldown;
    }

    public record Admission(Instant at, ProximityZone zone) {
    }
}
