package com.vision_assistant_service.model;

import java.time.LocalDateTime;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.Table;

@Entity
@Table(name = "detections", indexes = {
        @Index(name = "idx_detections_session", columnList = "session_id"),
        @Index(name = "idx_detections_time", columnList = "recorded_at")
})
public class Detection {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "session_id", nullable = false)
    private Long sessionId;

    @Column(name = "recorded_at", nullable = false)
    private LocalDateTime timestamp;

    @Column(name = "object_type", nullable = false, length = 50)
    private String objectType;

    @Column(name = "distance_category", length = 20)
    private String distanceCategory;

    @Column(name = "distance_score")
    private Double distanceScore;

    @Column(length = 20)
    private String direction;

    @Column(name = "bbox_x1")
    private Integer bboxX1;

    @Column(name = "bbox_y1")
    private Integer bboxY1;

    @Column(name = "bbox_x2")
    private Integer bboxX2;

    @Column(name = "bbox_y2")
    private Integer bboxY2;

    private Double confidence;

    // false when the cooldown suppressed the announcement
    private boolean admitted;

    public Detection() {
    }

    public Long getId() {
        return id;
    }

    public void setId(Long id) {
        this.id = id;
    }

    public Long getSessionId() {
        return sessionId;
    }

    public void setSessionId(Long sessionId) {
        this.sessionId = sessionId;
    }

    public LocalDateTime getTimestamp() {
        return timestamp;
    }

    public void setTimestamp(LocalDateTime timestamp) {
        this.timestamp = timestamp;
    }

    public String getObjectType() {
        return objectType;
    }

    public void setObjectType(String objectType) {
        this.objectType = objectType;
    }

    public String getDistanceCategory() {
        return distanceCategory;
    }

    public void setDistanceCategory(String distanceCategory) {
        this.distanceCategory = distanceCategory;
    }

    public Double getDistanceScore() {
        return distanceScore;
    }

    public void setDistanceScore(Double distanceScore) {
        this.distanceScore = distanceScore;
    }

    public String getDirection() {
        return direction;
    }

    public void setDirection(String direction) {
        this.direction = direction;
    }

    public Integer getBboxX1() {
        return bboxX1;
    }

    public void setBboxX1(Integer bboxX1) {
        this.bboxX1 = bboxX1;
    }

    public Integer getBboxY1() {
        return bboxY1;
    }

    public void setBboxY1(Integer bboxY1) {
        this.bboxY1 = bboxY1;
    }

    public Integer getBboxX2() {
        return bboxX2;
    }

    public void setBboxX2(Integer bboxX2) {
        this.bboxX2 = bboxX2;
    }

    public Integer getBboxY2() {
        return bboxY2;
    }

    public void setBboxY2(Integer bboxY2) {
        this.bboxY2 = bboxY2;
    }

    public Double getConfidence() {
        return confidence;
    }

    public void setConfidence(Double confidence) {
        this.confidence = confidence;
    }

    public boolean isAdmitted() {
        return admitted;
    }

    public void setAdmitted(boolean admitted) {
        this.admitted = admitted;
    }
}
