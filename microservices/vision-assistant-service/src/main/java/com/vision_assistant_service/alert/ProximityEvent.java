package com.vision_assistant_service.alert;

import java.time.Instant;

public record ProximityEvent(
        String objectType,
        Direction direction,
        ProximityZone zone,
        double sizeFraction,
        double confidence,
        DetectionEvent.BoundingBox box,
        Instant timestamp) {

    public AlertKey key() {
        return new AlertKey(objectType, direction);
    }

    public String describe() {
        return objectType + " " + direction.getPhrase() + ", " + zone.getLabel();
    }
}
