package com.vision_assistant_service.config;

import java.time.Clock;
import java.util.List;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.io.ResourceLoader;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;
import org.springframework.web.client.RestTemplate;

import com.vision_assistant_service.alert.AlertAggregator;
import com.vision_assistant_service.alert.AlertPipeline;
import com.vision_assistant_service.alert.CooldownTracker;
import com.vision_assistant_service.alert.ProximityClassifier;
import com.vision_assistant_service.audio.Announcer;
import com.vision_assistant_service.audio.CommandLineSpeechRecognizer;
import com.vision_assistant_service.audio.CommandLineSpeechSynthesizer;
import com.vision_assistant_service.audio.LoggingSpeechSynthesizer;
import com.vision_assistant_service.audio.SpeechRecognizer;
import com.vision_assistant_service.audio.SpeechSynthesizer;
import com.vision_assistant_service.repository.AlertRecordRepository;
import com.vision_assistant_service.repository.DetectionRepository;
import com.vision_assistant_service.repository.SceneSummaryRepository;
import com.vision_assistant_service.repository.SessionRepository;
import com.vision_assistant_service.repository.VoiceCommandRepository;
import com.vision_assistant_service.safety.SafetyEventMonitor;
import com.vision_assistant_service.sensor.ConnectivityStatus;
import com.vision_assistant_service.sensor.EnvironmentalMonitor;
import com.vision_assistant_service.sensor.PiSensorClient;
import com.vision_assistant_service.sensor.SensorPoller;
import com.vision_assistant_service.service.PersistenceSink;
import com.vision_assistant_service.service.SerializedCallerExecutor;
import com.vision_assistant_service.service.SessionManager;
import com.vision_assistant_service.service.VoiceCommandService;

/**
 * Wires the coordination core. Each shared component is a single bean handed to its
 * producers and consumers by reference.
 */
@Configuration
@EnableConfigurationProperties(VisionProperties.class)
public class VisionConfig {

    @Bean
    public Clock clock() {
        return Clock.systemDefaultZone();
    }

    @Bean
    public ProximityClassifier proximityClassifier(VisionProperties properties, ResourceLoader resourceLoader) {
        VisionProperties.Detection detection = properties.getDetection();
        return new ProximityClassifier(
                RelevantClassesLoader.load(resourceLoader, detection.getRelevantClasses()),
                detection.getCriticalThreshold(),
                detection.getWarningThreshold(),
                detection.getLeftBoundary(),
                detection.getRightBoundary());
    }

    @Bean
    public CooldownTracker cooldownTracker(VisionProperties properties) {
        return new CooldownTracker(properties.getAlerts().getCooldown(),
                properties.getAlerts().isEscalationBypassesCooldown());
    }

    @Bean
    public Executor persistenceExecutor(VisionProperties properties) {
        if (!properties.getPersistence().isAsync()) {
            return new SerializedCallerExecutor();
        }
        return Executors.newSingleThreadExecutor(new CustomizableThreadFactory("persistence-"));
    }

    @Bean
    public PersistenceSink persistenceSink(@Qualifier("persistenceExecutor") Executor persistenceExecutor,
                                           SessionManager sessionManager, SessionRepository sessionRepository,
                                           DetectionRepository detectionRepository,
                                           AlertRecordRepository alertRepository,
                                           VoiceCommandRepository voiceCommandRepository,
                                           SceneSummaryRepository sceneSummaryRepository, Clock clock) {
        return new PersistenceSink(persistenceExecutor, sessionManager, sessionRepository, detectionRepository,
                alertRepository, voiceCommandRepository, sceneSummaryRepository, clock);
    }

    @Bean
    public AlertAggregator alertAggregator(PersistenceSink persistenceSink) {
        return new AlertAggregator(List.of(persistenceSink));
    }

    @Bean
    public SafetyEventMonitor safetyEventMonitor(Clock clock) {
        return new SafetyEventMonitor(clock);
    }

    @Bean
    public AlertPipeline alertPipeline(ProximityClassifier classifier, CooldownTracker cooldownTracker,
                                       AlertAggregator aggregator, PersistenceSink persistenceSink,
                                       SafetyEventMonitor monitor, Clock clock, VisionProperties properties) {
        AlertPipeline pipeline = new AlertPipeline(classifier, cooldownTracker, aggregator, persistenceSink, clock,
                properties.getAlerts().isWithdrawAcknowledgedRaises());
        monitor.addListener(pipeline);
        return pipeline;
    }

    @Bean
    public SpeechSynthesizer speechSynthesizer(VisionProperties properties) {
        VisionProperties.Speech speech = properties.getSpeech();
        if (speech.getSynthesisCommand().isEmpty()) {
            return new LoggingSpeechSynthesizer();
        }
        return new CommandLineSpeechSynthesizer(speech.getSynthesisCommand(), speech.getSynthesisTimeout());
    }

    @Bean
    public SpeechRecognizer speechRecognizer(VisionProperties properties) {
        VisionProperties.Speech speech = properties.getSpeech();
        return new CommandLineSpeechRecognizer(speech.getRecognitionCommand(), speech.getRecognitionTimeout());
    }

    @Bean
    public Announcer announcer(AlertAggregator aggregator, SpeechSynthesizer synthesizer) {
        return new Announcer(aggregator, synthesizer);
    }

    @Bean(destroyMethod = "shutdownNow")
    public ExecutorService voiceExecutor() {
        return Executors.newSingleThreadExecutor(new CustomizableThreadFactory("voice-"));
    }

    @Bean
    public VoiceCommandService voiceCommandService(SpeechRecognizer recognizer, Announcer announcer,
                                                   AlertPipeline pipeline, AlertAggregator aggregator,
                                                   SafetyEventMonitor monitor, PersistenceSink persistenceSink,
                                                   @Qualifier("voiceExecutor") ExecutorService voiceExecutor,
                                                   Clock clock) {
        return new VoiceCommandService(recognizer, announcer, pipeline, aggregator, monitor, persistenceSink,
                voiceExecutor, clock);
    }

    @Bean
    public ConnectivityStatus connectivityStatus() {
        return new ConnectivityStatus();
    }

    @Bean
    public EnvironmentalMonitor environmentalMonitor() {
        return new EnvironmentalMonitor();
    }

    @Bean
    public RestTemplate sensorRestTemplate(VisionProperties properties) {
        SimpleClientHttpRequestFactory requestFactory = new SimpleClientHttpRequestFactory();
        requestFactory.setConnectTimeout((int) properties.getSensors().getConnectTimeout().toMillis());
        requestFactory.setReadTimeout((int) properties.getSensors().getReadTimeout().toMillis());
        return new RestTemplate(requestFactory);
    }

    @Bean
    public PiSensorClient piSensorClient(RestTemplate sensorRestTemplate, VisionProperties properties) {
        return new PiSensorClient(sensorRestTemplate, properties.getSensors().getBaseUrl());
    }

    @Bean
    @ConditionalOnProperty(prefix = "vision.sensors", name = "enabled", havingValue = "true", matchIfMissing = true)
    public SensorPoller sensorPoller(PiSensorClient client, SafetyEventMonitor monitor,
                                     EnvironmentalMonitor environmentalMonitor, ConnectivityStatus connectivity,
                                     Clock clock, VisionProperties properties) {
        SensorPoller poller = new SensorPoller(client, monitor, environmentalMonitor, connectivity, clock,
                properties.getSensors().getBackoff(), properties.getSensors().getMaxBackoff());
        monitor.addListener(poller);
        return poller;
    }
}
