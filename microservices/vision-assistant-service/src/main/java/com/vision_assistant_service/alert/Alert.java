package com.vision_assistant_service.alert;

import java.time.Instant;

import com.vision_assistant_service.safety.SafetyEventType;
import com.vision_assistant_service.safety.SafetyTransition;

/**
 * One item of the outgoing alert stream. Proximity alerts carry object, direction and zone;
 * safety alerts carry the event type and transition kind.
 */
public record Alert(
        Category category,
        AlertSeverity severity,
        String message,
        String objectType,
        Direction direction,
        ProximityZone zone,
        SafetyEventType safetyType,
        SafetyTransition.Kind transitionKind,
        Instant createdAt) {

    public enum Category {
        PROXIMITY("proximity"),
        SAFETY("safety");

        private final String label;

        Category(String label) {
            this.label = label;
        }

        public String getLabel() {
            return label;
        }
    }

    public static Alert proximity(ProximityEvent event) {
        return new Alert(Category.PROXIMITY, AlertSeverity.of(event.zone()), event.describe(),
                event.objectType(), event.direction(), event.zone(), null, null, event.timestamp());
    }

    public static Alert safety(SafetyTransition transition, Instant at) {
        return new Alert(Category.SAFETY, AlertSeverity.SAFETY, transition.message(),
                null, null, null, transition.type(), transition.kind(), at);
    }

    public boolean isSafetyRaise(SafetyEventType type) {
        return category == Category.SAFETY
                && safetyType == type
                && transitionKind == SafetyTransition.Kind.RAISED;
    }
}
