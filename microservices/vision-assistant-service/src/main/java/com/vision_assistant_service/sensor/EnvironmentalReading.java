package com.vision_assistant_service.sensor;

import java.time.LocalDateTime;

import com.fasterxml.jackson.annotation.JsonProperty;

public record EnvironmentalReading(
        @JsonProperty("temperature_f") Double temperatureF,
        @JsonProperty("humidity") Double humidity,
        @JsonProperty("pressure") Double pressure,
        @JsonProperty("last_update") LocalDateTime lastUpdate) {

    public static EnvironmentalReading empty() {
        return new EnvironmentalReading(null, null, null, null);
    }
}
