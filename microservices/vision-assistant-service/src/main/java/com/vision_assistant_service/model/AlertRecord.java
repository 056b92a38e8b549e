package com.vision_assistant_service.model;

import java.time.LocalDateTime;

import org.hibernate.annotations.Immutable;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.Table;

/**
 * Audit entry for one alert. Written once, never updated or deleted.
 */
@Entity
@Immutable
@Table(name = "alerts", indexes = {
        @Index(name = "idx_alerts_session", columnList = "session_id"),
        @Index(name = "idx_alerts_time", columnList = "recorded_at")
})
public class AlertRecord {

    public static final String CATEGORY_PROXIMITY = "proximity";
    public static final String CATEGORY_SAFETY = "safety";

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "session_id", nullable = false, updatable = false)
    private Long sessionId;

    @Column(name = "recorded_at", nullable = false, updatable = false)
    private LocalDateTime timestamp;

    @Column(nullable = false, length = 20, updatable = false)
    private String category;

    @Column(nullable = false, length = 20, updatable = false)
    private String severity;

    @Column(nullable = false, updatable = false)
    private String message;

    @Column(name = "object_type", length = 50, updatable = false)
    private String objectType;

    @Column(name = "distance_category", length = 20, updatable = false)
    private String distanceCategory;

    @Column(length = 20, updatable = false)
    private String direction;

    @Column(name = "safety_type", length = 20, updatable = false)
    private String safetyType;

    protected AlertRecord() {
    }

    public AlertRecord(Long sessionId, LocalDateTime timestamp, String category, String severity, String message,
                       String objectType, String distanceCategory, String direction, String safetyType) {
        this.sessionId = sessionId;
        this.timestamp = timestamp;
        this.category = category;
        this.severity = severity;
        this.message = message;
        this.objectType = objectType;
        this.distanceCategory = distanceCategory;
        this.direction = direction;
        this.safetyType = safetyType;
    }

    public Long getId() {
        return id;
    }

    public Long getSessionId() {
        return sessionId;
    }

    public LocalDateTime getTimestamp() {
        return timestamp;
    }

    public String getCategory() {
        return category;
    }

    public String getSeverity() {
        return severity;
    }

    public String getMessage() {
        return message;
    }

    public String getObjectType() {
        return objectType;
    }

    public String getDistanceCategory() {
        return distanceCategory;
    }

    public String getDirection() {
        return direction;
    }

    public String getSafetyType() {
        return safetyType;
    }
}
