package com.vision_assistant_service.safety;

import java.time.Instant;

public record SafetyIncident(
        Instant raisedAt,
        Instant sensorTimestamp,
        AssistanceType assistanceType,
        Instant acknowledgedAt) {

    SafetyIncident refreshed(Instant at, Instant sensorAt, AssistanceType latestType) {
        return new SafetyIncident(at, sensorAt != null ? sensorAt : sensorTimestamp,
                latestType != null ? latestType : assistanceType, acknowledgedAt);
    }

    SafetyIncident acknowledged(Instant at) {
        return new SafetyIncident(raisedAt, sensorTimestamp, assistanceType, at);
    }
}
