package com.vision_assistant_service.sensor;

import java.time.Instant;

import com.vision_assistant_service.safety.AssistanceType;

public record SensorReading(boolean active, AssistanceType assistanceType, Instant sensorTimestamp) {
}
