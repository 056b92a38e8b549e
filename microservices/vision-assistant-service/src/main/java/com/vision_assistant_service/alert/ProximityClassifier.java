package com.vision_assistant_service.alert;

import java.util.Locale;
import java.util.Optional;
import java.util.Set;

/**
 * Maps raw detections to proximity events. Stateless; safe to share between threads.
 */
public class ProximityClassifier {

    public static final double DEFAULT_CRITICAL_THRESHOLD = 0.60;
    public static final double DEFAULT_WARNING_THRESHOLD = 0.40;
    public static final double DEFAULT_LEFT_BOUNDARY = 0.33;
    public static final double DEFAULT_RIGHT_BOUNDARY = 0.67;

    private final Set<String> relevantClasses;
    private final double criticalThreshold;
    private final double warningThreshold;
    private final double leftBoundary;
    private final double rightBoundary;

    public ProximityClassifier(Set<String> relevantClasses) {
        this(relevantClasses, DEFAULT_CRITICAL_THRESHOLD, DEFAULT_WARNING_THRESHOLD,
                DEFAULT_LEFT_BOUNDARY, DEFAULT_RIGHT_BOUNDARY);
    }

    public ProximityClassifier(Set<String> relevantClasses, double criticalThreshold, double warningThreshold,
                               double leftBoundary, double rightBoundary) {
        if (warningThreshold > criticalThreshold) {
            throw new IllegalArgumentException("warning threshold must not exceed critical threshold");
        }
        if (leftBoundary >= rightBoundary) {
            throw new IllegalArgumentException("left boundary must be below right boundary");
        }
        this.relevantClasses = Set.copyOf(relevantClasses);
        this.criticalThreshold = criticalThreshold;
        this.warningThreshold = warningThreshold;
        this.leftBoundary = leftBoundary;
        this.rightBoundary = rightBoundary;
    }

    /**
     * Classifies one detection.
     *
     * @return the proximity event, or empty when the class is not tracked or the
     *         geometry cannot be interpreted
     */
    public Optional<ProximityEvent> classify(DetectionEvent detection) {
        if (detection.objectType() == null) {
            return Optional.empty();
        }
        String objectType = detection.objectType().trim().toLowerCase(Locale.ROOT);
        if (!relevantClasses.contains(objectType)) {
            return Optional.empty();
        }
        if (detection.frameWidth() <= 0 || !Double.isFinite(detection.xCenter())) {
            return Optional.empty();
        }
        double size = detection.sizeFraction();
        if (!Double.isFinite(size) || size < 0) {
            return Optional.empty();
        }
        // boxes clipped at the frame edge can overshoot by a pixel
        size = Math.min(size, 1.0);

        return Optional.of(new ProximityEvent(
                objectType,
                directionOf(detection.xCenter() / detection.frameWidth()),
                zoneOf(size),
                size,
                detection.confidence(),
                detection.box(),
                detection.timestamp()));
    }

    public ProximityZone zoneOf(double sizeFraction) {
        if (sizeFraction >= criticalThreshold) {
            return ProximityZone.CRITICAL;
        }
        if (sizeFraction >= warningThreshold) {
            return ProximityZone.WARNING;
        }
        return ProximityZone.FAR;
    }

    public Direction directionOf(double relativeX) {
        if (relativeX < leftBoundary) {
            return Direction.LEFT;
        }
        if (relativeX > rightBoundary) {
            return Direction.RIGHT;
        }
        return Direction.AHEAD;
    }

    public Set<String> getRelevantClasses() {
        return relevantClasses;
    }
}
