package com.vision_assistant_service.safety;

import java.time.Instant;

public record SafetyTransition(
        SafetyEventType type,
        Kind kind,
        AssistanceType assistanceType,
        Instant raisedAt,
        Instant acknowledgedAt) {

    public enum Kind {
        RAISED,
        ACKNOWLEDGED
    }

    public String message() {
        if (kind == Kind.ACKNOWLEDGED) {
            return type.getDisplayName() + " alert acknowledged";
        }
        switch (type) {
            case FALL:
                return "Fall detected";
            case EMERGENCY:
                return "Emergency button pressed";
            default:
                AssistanceType requested = assistanceType != null ? assistanceType : AssistanceType.GENERAL;
                return "Assistance requested: " + requested.getSpoken();
        }
    }
}
