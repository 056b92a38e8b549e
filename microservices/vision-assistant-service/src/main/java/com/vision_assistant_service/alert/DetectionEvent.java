package com.vision_assistant_service.alert;

import java.time.Instant;

/**
 * One detected object from a single inference cycle.
 *
 * @param objectType   class label reported by the detector
 * @param sizeFraction frame-relative box size, 0..1
 * @param xCenter      horizontal box centre in pixels
 * @param frameWidth   frame width in pixels
 * @param confidence   detector confidence
 * @param box          pixel bounding box, may be null for synthetic events
 * @param timestamp    when the frame was analysed
 */
public record DetectionEvent(
        String objectType,
        double sizeFraction,
        double xCenter,
        int frameWidth,
        double confidence,
        BoundingBox box,
        Instant timestamp) {

    public record BoundingBox(int x1, int y1, int x2, int y2) {

        public int width() {
            return Math.max(0, x2 - x1);
        }

        public int height() {
            return Math.max(0, y2 - y1);
        }

        public double centerX() {
            return (x1 + x2) / 2.0;
        }
    }

    /**
     * Builds an event from a pixel box, sizing it by whichever side of the box
     * fills more of the frame.
     */
    public static DetectionEvent fromBox(String objectType, double confidence, BoundingBox box,
                                         int frameWidth, int frameHeight, Instant timestamp) {
        double widthFraction = frameWidth > 0 ? (double) box.width() / frameWidth : Double.NaN;
        double heightFraction = frameHeight > 0 ? (double) box.height() / frameHeight : Double.NaN;
        double size = Math.max(widthFraction, heightFraction);
        return new DetectionEvent(objectType, size, box.centerX(), frameWidth, confidence, box, timestamp);
    }
}
