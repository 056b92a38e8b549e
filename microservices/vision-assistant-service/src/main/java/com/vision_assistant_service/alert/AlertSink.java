package com.vision_assistant_service.alert;

/**
 * Receives every alert the aggregator accepts, announced or not. Implementations must
 * not block the caller.
 */
public interface AlertSink {

    void recordAlert(Alert alert);
}
