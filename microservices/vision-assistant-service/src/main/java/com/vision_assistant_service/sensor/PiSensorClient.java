package com.vision_assistant_service.sensor;

import java.time.Instant;
import java.time.LocalDateTime;
import java.time.format.DateTimeParseException;

import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

import com.fasterxml.jackson.databind.JsonNode;
import com.vision_assistant_service.safety.AssistanceType;
import com.vision_assistant_service.safety.SafetyEventType;

/**
 * HTTP client for the sensor board. Timeouts are configured on the {@link RestTemplate}.
 */
public class PiSensorClient {

    private final RestTemplate restTemplate;
    private final String baseUrl;

    public PiSensorClient(RestTemplate restTemplate, String baseUrl) {
        this.restTemplate = restTemplate;
        this.baseUrl = baseUrl.endsWith("/") ? baseUrl.substring(0, baseUrl.length() - 1) : baseUrl;
    }

    public SensorReading readSafety(SafetyEventType type) {
        JsonNode body = get("/api/" + type.getKey() + "_status");
        switch (type) {
            case FALL:
                return new SensorReading(
                        body.path("fall_detected").asBoolean(false),
                        null,
                        epochSeconds(body.get("last_fall_timestamp")));
            case EMERGENCY:
                return new SensorReading(
                        body.path("emergency_active").asBoolean(false),
                        null,
                        epochSeconds(body.get("last_emergency_timestamp")));
            default:
                AssistanceType assistanceType = AssistanceType
                        .fromLabel(body.path("assistance_type").asText(null))
                        .orElse(AssistanceType.GENERAL);
                return new SensorReading(
                        body.path("assistance_active").asBoolean(false),
                        assistanceType,
                        epochSeconds(body.get("last_assistance_timestamp")));
        }
    }

    public EnvironmentalReading readEnvironment() {
        JsonNode body = get("/api/environmental");
        return new EnvironmentalReading(
                number(body.get("temperature_f")),
                number(body.get("humidity")),
                number(body.get("pressure")),
                dateTime(body.get("last_update")));
    }

    /** Clears the incident flag on the board itself. */
    public void acknowledge(SafetyEventType type) {
        get("/api/" + type.getKey() + "_acknowledge");
    }

    public String getBaseUrl() {
        return baseUrl;
    }

    private JsonNode get(String path) {
        JsonNode body = restTemplate.getForObject(baseUrl + path, JsonNode.class);
        if (body == null) {
            throw new RestClientException("Empty response from " + path);
        }
        return body;
    }

    private static Instant epochSeconds(JsonNode node) {
        if (node == null || !node.isNumber()) {
            return null;
        }
        return Instant.ofEpochMilli(Math.round(node.asDouble() * 1000));
    }

    private static Double number(JsonNode node) {
        return node != null && node.isNumber() ? node.asDouble() : null;
    }

    private static LocalDateTime dateTime(JsonNode node) {
        if (node == null || !node.isTextual()) {
            return null;
        }
        try {
            return LocalDateTime.parse(node.asText());
        } catch (DateTimeParseException e) {
            return null;
        }
    }
}
