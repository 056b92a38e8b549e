package com.vision_assistant_service.safety;

import java.util.EnumSet;
import java.util.Map;
import java.util.Set;

/**
 * Lifecycle of one safety event type.
 *
 * <pre>
 * IDLE         --raise-->       ACTIVE
 * ACTIVE       --raise-->       ACTIVE        (refresh only)
 * ACTIVE       --acknowledge--> ACKNOWLEDGED
 * ACKNOWLEDGED --raise-->       ACTIVE        (new incident)
 * </pre>
 *
 * Acknowledgement is terminal until the next raise; there is no way back to IDLE.
 */
public enum SafetyState {
    IDLE,
    ACTIVE,
    ACKNOWLEDGED;

    private static final Map<SafetyState, Set<SafetyState>> ALLOWED = Map.of(
            IDLE, EnumSet.of(ACTIVE),
            ACTIVE, EnumSet.of(ACTIVE, ACKNOWLEDGED),
            ACKNOWLEDGED, EnumSet.of(ACTIVE));

    public boolean canTransitionTo(SafetyState target) {
        return ALLOWED.get(this).contains(target);
    }

    public SafetyState transitionTo(SafetyState target) {
        if (!canTransitionTo(target)) {
            throw new IllegalStateException("Illegal safety transition " + this + " -> " + target);
        }
        return target;
    }

    public boolean isActive() {
        return this == ACTIVE;
    }
}
