package com.vision_assistant_service.sensor;

import java.util.concurrent.atomic.AtomicReference;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Latest room conditions reported by the sensor board.
 */
public class EnvironmentalMonitor {

    private static final Logger log = LoggerFactory.getLogger(EnvironmentalMonitor.class);

    static final double HIGH_TEMPERATURE_F = 85;
    static final double LOW_TEMPERATURE_F = 60;
    static final double HIGH_HUMIDITY = 70;
    static final double LOW_HUMIDITY = 30;

    private final AtomicReference<EnvironmentalReading> latest = new AtomicReference<>(EnvironmentalReading.empty());

    public void update(EnvironmentalReading reading) {
        latest.set(reading);
        Double temperature = reading.temperatureF();
        if (temperature != null) {
            if (temperature > HIGH_TEMPERATURE_F) {
                log.warn("High temperature: {} F", temperature);
            } else if (temperature < LOW_TEMPERATURE_F) {
                log.warn("Low temperature: {} F", temperature);
            }
        }
        Double humidity = reading.humidity();
        if (humidity != null) {
            if (humidity > HIGH_HUMIDITY) {
                log.warn("High humidity: {}%", humidity);
            } else if (humidity < LOW_HUMIDITY) {
                log.warn("Low humidity: {}%", humidity);
            }
        }
    }

    public EnvironmentalReading latest() {
        return latest.get();
    }
}
