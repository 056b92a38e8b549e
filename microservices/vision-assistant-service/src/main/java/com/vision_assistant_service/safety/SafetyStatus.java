package com.vision_assistant_service.safety;

import java.time.Instant;
import java.util.List;

public record SafetyStatus(
        SafetyEventType type,
        SafetyState state,
        AssistanceType assistanceType,
        Instant raisedAt,
        Instant acknowledgedAt,
        List<SafetyIncident> history) {

    /** Both IDLE and ACKNOWLEDGED read as inactive. */
    public boolean active() {
        return state.isActive();
    }
}
