package com.vision_assistant_service.controller;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.CrossOrigin;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import com.vision_assistant_service.controller.dto.AcknowledgeResponse;
import com.vision_assistant_service.safety.SafetyEventMonitor;
import com.vision_assistant_service.safety.SafetyEventType;
import com.vision_assistant_service.safety.SafetyIncident;
import com.vision_assistant_service.safety.SafetyStatus;
import com.vision_assistant_service.sensor.EnvironmentalMonitor;
import com.vision_assistant_service.sensor.EnvironmentalReading;

/**
 * Safety status and acknowledgement endpoints, keeping the sensor board's JSON shape.
 * Acknowledging is idempotent.
 */
@RestController
@CrossOrigin(origins = "*")
@RequestMapping("/api")
public class SafetyController {

    private final SafetyEventMonitor monitor;
    private final EnvironmentalMonitor environment;
    private final Clock clock;

    public SafetyController(SafetyEventMonitor monitor, EnvironmentalMonitor environment, Clock clock) {
        this.monitor = monitor;
        this.environment = environment;
        this.clock = clock;
    }

    @GetMapping("/fall_status")
    public ResponseEntity<Map<String, Object>> fallStatus() {
        return ResponseEntity.ok(status(SafetyEventType.FALL, "fall_detected"));
    }

    @GetMapping("/fall_acknowledge")
    public ResponseEntity<AcknowledgeResponse> acknowledgeFall() {
        return ResponseEntity.ok(acknowledge(SafetyEventType.FALL));
    }

    @GetMapping("/emergency_status")
    public ResponseEntity<Map<String, Object>> emergencyStatus() {
        return ResponseEntity.ok(status(SafetyEventType.EMERGENCY, "emergency_active"));
    }

    @GetMapping("/emergency_acknowledge")
    public ResponseEntity<AcknowledgeResponse> acknowledgeEmergency() {
        return ResponseEntity.ok(acknowledge(SafetyEventType.EMERGENCY));
    }

    @GetMapping("/assistance_status")
    public ResponseEntity<Map<String, Object>> assistanceStatus() {
        return ResponseEntity.ok(status(SafetyEventType.ASSISTANCE, "assistance_active"));
    }

    @GetMapping("/assistance_acknowledge")
    public ResponseEntity<AcknowledgeResponse> acknowledgeAssistance() {
        return ResponseEntity.ok(acknowledge(SafetyEventType.ASSISTANCE));
    }

    @GetMapping("/environmental")
    public ResponseEntity<EnvironmentalReading> environmental() {
        return ResponseEntity.ok(environment.latest());
    }

    private AcknowledgeResponse acknowledge(SafetyEventType type) {
        boolean changed = monitor.acknowledge(type).isPresent();
        return new AcknowledgeResponse("acknowledged", LocalDateTime.now(clock), changed);
    }

    private Map<String, Object> status(SafetyEventType type, String activeKey) {
        SafetyStatus status = monitor.status(type);
        String prefix = type.getKey();

        Map<String, Object> body = new LinkedHashMap<>();
        body.put(activeKey, status.active());
        if (type == SafetyEventType.ASSISTANCE) {
            body.put("assistance_type", status.active() && status.assistanceType() != null
                    ? status.assistanceType().getLabel()
                    : null);
        }
        body.put("last_" + prefix + "_timestamp", epochSeconds(status.raisedAt()));
        body.put("state", status.state().name().toLowerCase());

        List<Map<String, Object>> history = new ArrayList<>();
        for (SafetyIncident incident : status.history()) {
            Map<String, Object> entry = new LinkedHashMap<>();
            entry.put("timestamp", toLocal(incident.raisedAt()));
            if (incident.assistanceType() != null) {
                entry.put("type", incident.assistanceType().getLabel());
            }
            entry.put("acknowledged_at", toLocal(incident.acknowledgedAt()));
            history.add(entry);
        }
        body.put(prefix + "_history", history);
        return body;
    }

    private LocalDateTime toLocal(Instant instant) {
        return instant == null ? null : LocalDateTime.ofInstant(instant, clock.getZone());
    }

    private static Double epochSeconds(Instant instant) {
        return instant == null ? null : instant.toEpochMilli() / 1000.0;
    }
}
