package com.vision_assistant_service.config;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "vision")
public class VisionProperties {

    private final Detection detection = new Detection();
    private final Alerts alerts = new Alerts();
    private final Sensors sensors = new Sensors();
    private final Speech speech = new Speech();
    private final Persistence persistence = new Persistence();

    public Detection getDetection() {
        return detection;
    }

    public Alerts getAlerts() {
        return alerts;
    }

    public Sensors getSensors() {
        return sensors;
    }

    public Speech getSpeech() {
        return speech;
    }

    public Persistence getPersistence() {
        return persistence;
    }

    public static class Detection {

        /** Newline-separated list of class labels worth alerting on. Required. */
        private String relevantClasses = "classpath:relevant_classes.txt";
        private double criticalThreshold = 0.60;
        private double warningThreshold = 0.40;
        private double leftBoundary = 0.33;
        private double rightBoundary = 0.67;

        public String getRelevantClasses() {
            return relevantClasses;
        }

        public void setRelevantClasses(String relevantClasses) {
            this.relevantClasses = relevantClasses;
        }

        public double getCriticalThreshold() {
            return criticalThreshold;
        }

        public void setCriticalThreshold(double criticalThreshold) {
            this.criticalThreshold = criticalThreshold;
        }

        public double getWarningThreshold() {
            return warningThreshold;
        }

        public void setWarningThreshold(double warningThreshold) {
            this.warningThreshold = warningThreshold;
        }

        public double getLeftBoundary() {
            return leftBoundary;
        }

        public void setLeftBoundary(double leftBoundary) {
            this.leftBoundary = leftBoundary;
        }

        public double getRightBoundary() {
            return rightBoundary;
        }

        public void setRightBoundary(double rightBoundary) {
            this.rightBoundary = rightBoundary;
        }
    }

    public static class Alerts {

        private Duration cooldown = Duration.ofSeconds(3);

        /** Re-announce inside the cooldown window when an object moves into a more severe zone. */
        private boolean escalationBypassesCooldown = false;

        /** Drop a still-queued safety raise once its incident is acknowledged. */
        private boolean withdrawAcknowledgedRaises = false;

        public Duration getCooldown() {
            return cooldown;
        }

        public void setCooldown(Duration cooldown) {
            this.cooldown = cooldown;
        }

        public boolean isEscalationBypassesCooldown() {
            return escalationBypassesCooldown;
        }

        public void setEscalationBypassesCooldown(boolean escalationBypassesCooldown) {
            this.escalationBypassesCooldown = escalationBypassesCooldown;
        }

        public boolean isWithdrawAcknowledgedRaises() {
            return withdrawAcknowledgedRaises;
        }

        public void setWithdrawAcknowledgedRaises(boolean withdrawAcknowledgedRaises) {
            this.withdrawAcknowledgedRaises = withdrawAcknowledgedRaises;
        }
    }

    public static class Sensors {

        private boolean enabled = true;
        private String baseUrl = "http://localhost:5000";
        private Duration pollInterval = Duration.ofSeconds(2);
        private Duration environmentInterval = Duration.ofSeconds(30);
        private Duration initialDelay = Duration.ofSeconds(2);
        private Duration connectTimeout = Duration.ofSeconds(2);
        private Duration readTimeout = Duration.ofSeconds(2);
        private Duration backoff = Duration.ofSeconds(2);
        private Duration maxBackoff = Duration.ofSeconds(30);

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public String getBaseUrl() {
            return baseUrl;
        }

        public void setBaseUrl(String baseUrl) {
            this.baseUrl = baseUrl;
        }

        public Duration getPollInterval() {
            return pollInterval;
        }

        public void setPollInterval(Duration pollInterval) {
            this.pollInterval = pollInterval;
        }

        public Duration getEnvironmentInterval() {
            return environmentInterval;
        }

        public void setEnvironmentInterval(Duration environmentInterval) {
            this.environmentInterval = environmentInterval;
        }

        public Duration getInitialDelay() {
            return initialDelay;
        }

        public void setInitialDelay(Duration initialDelay) {
            this.initialDelay = initialDelay;
        }

        public Duration getConnectTimeout() {
            return connectTimeout;
        }

        public void setConnectTimeout(Duration connectTimeout) {
            this.connectTimeout = connectTimeout;
        }

        public Duration getReadTimeout() {
            return readTimeout;
        }

        public void setReadTimeout(Duration readTimeout) {
            this.readTimeout = readTimeout;
        }

        public Duration getBackoff() {
            return backoff;
        }

        public void setBackoff(Duration backoff) {
            this.backoff = backoff;
        }

        public Duration getMaxBackoff() {
            return maxBackoff;
        }

        public void setMaxBackoff(Duration maxBackoff) {
            this.maxBackoff = maxBackoff;
        }
    }

    public static class Speech {

        /** Text-to-speech program and arguments; the utterance is appended. Empty logs instead. */
        private List<String> synthesisCommand = new ArrayList<>();
        private List<String> recognitionCommand = new ArrayList<>();
        private Duration synthesisTimeout = Duration.ofSeconds(15);
        private Duration recognitionTimeout = Duration.ofSeconds(10);

        public List<String> getSynthesisCommand() {
            return synthesisCommand;
        }

        public void setSynthesisCommand(List<String> synthesisCommand) {
            this.synthesisCommand = synthesisCommand;
        }

        public List<String> getRecognitionCommand() {
            return recognitionCommand;
        }

        public void setRecognitionCommand(List<String> recognitionCommand) {
            this.recognitionCommand = recognitionCommand;
        }

        public Duration getSynthesisTimeout() {
            return synthesisTimeout;
        }

        public void setSynthesisTimeout(Duration synthesisTimeout) {
            this.synthesisTimeout = synthesisTimeout;
        }

        public Duration getRecognitionTimeout() {
            return recognitionTimeout;
        }

        public void setRecognitionTimeout(Duration recognitionTimeout) {
            this.recognitionTimeout = recognitionTimeout;
        }
    }

    public static class Persistence {

        /** When false, writes run on the calling thread, still one at a time. */
        private boolean async = true;
        private Duration shutdownWait = Duration.ofSeconds(5);

        public boolean isAsync() {
            return async;
        }

        public void setAsync(boolean async) {
            this.async = async;
        }

        public Duration getShutdownWait() {
            return shutdownWait;
        }

        public void setShutdownWait(Duration shutdownWait) {
            this.shutdownWait = shutdownWait;
        }
    }
}
