package com.vision_assistant_service.sensor;

import java.time.Instant;
import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;

/** A failed poll only lands here, never in safety state. */
public class ConnectivityStatus {

    private final Map<String, SourceHealth> sources = new ConcurrentHashMap<>();

    public void recordSuccess(String source, Instant at) {
        sources.put(source, new SourceHealth(0, at, null, null, null));
    }

    /**
     * @return the updated health, including the consecutive failure count
     */
    public SourceHealth recordFailure(String source, Instant at, String error, Instant nextAttempt) {
        return sources.compute(source, (name, previous) -> new SourceHealth(
                previous == null ? 1 : previous.consecutiveFailures() + 1,
                previous == null ? null : previous.lastSuccess(),
                at,
                error,
                nextAttempt));
    }

    public SourceHealth health(String source) {
        return sources.get(source);
    }

    public boolean isDegraded() {
        for (SourceHealth health : sources.values()) {
            if (health.degraded()) {
                return true;
            }
        }
        return false;
    }

    public Map<String, SourceHealth> snapshot() {
        return new TreeMap<>(sources);
    }

    public record SourceHealth(
            int consecutiveFailures,
            Instant lastSuccess,
            Instant lastFailure,
            String lastError,
            Instant nextAttempt) {

        public boolean degraded() {
            return consecutiveFailures > 0;
        }
    }
}
