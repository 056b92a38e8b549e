package com.vision_assistant_service.alert;

public interface DetectionSink {

    /**
     * Records a classified detection whether or not the cooldown admitted it.
     * Implementations must not block the caller.
     */
    void recordDetection(ProximityEvent event, boolean admitted);
}
