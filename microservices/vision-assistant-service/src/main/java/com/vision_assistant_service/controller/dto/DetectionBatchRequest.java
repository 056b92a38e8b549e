package com.vision_assistant_service.controller.dto;

import java.util.ArrayList;
import java.util.List;

/**
 * One inference cycle as pushed by the detector. JSON keys are snake_case.
 */
public class DetectionBatchRequest {

    private Integer frameWidth;
    private Integer frameHeight;

    // epoch seconds of the analysed frame; defaults to the time of arrival
    private Double timestamp;

    private List<DetectionItem> detections = new ArrayList<>();

    public Integer getFrameWidth() {
        return frameWidth;
    }

    public void setFrameWidth(Integer frameWidth) {
        this.frameWidth = frameWidth;
    }

    public Integer getFrameHeight() {
        return frameHeight;
    }

    public void setFrameHeight(Integer frameHeight) {
        this.frameHeight = frameHeight;
    }

    public Double getTimestamp() {
        return timestamp;
    }

    public void setTimestamp(Double timestamp) {
        this.timestamp = timestamp;
    }

    public List<DetectionItem> getDetections() {
        return detections;
    }

    public void setDetections(List<DetectionItem> detections) {
        this.detections = detections;
    }

    public static class DetectionItem {

        private String objectType;
        private double confidence;
        private int x1;
        private int y1;
        private int x2;
        private int y2;

        public String getObjectType() {
            return objectType;
        }

        public void setObjectType(String objectType) {
            this.objectType = objectType;
        }

        public double getConfidence() {
            return confidence;
        }

        public void setConfidence(double confidence) {
            this.confidence = confidence;
        }

        public int getX1() {
            return x1;
        }

        public void setX1(int x1) {
            this.x1 = x1;
        }

        public int getY1() {
            return y1;
        }

        public void setY1(int y1) {
            this.y1 = y1;
        }

        public int getX2() {
            return x2;
        }

        public void setX2(int x2) {
            this.x2 = x2;
        }

        public int getY2() {
            return y2;
        }

        public void setY2(int y2) {
            this.y2 = y2;
        }
    }
}
