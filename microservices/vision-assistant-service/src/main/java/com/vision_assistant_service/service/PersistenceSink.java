package com.vision_assistant_service.service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDateTime;
import java.util.Locale;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.vision_assistant_service.alert.Alert;
import com.vision_assistant_service.alert.AlertSink;
import com.vision_assistant_service.alert.DetectionSink;
import com.vision_assistant_service.alert.ProximityEvent;
import com.vision_assistant_service.model.AlertRecord;
import com.vision_assistant_service.model.Detection;
import com.vision_assistant_service.model.SceneSummary;
import com.vision_assistant_service.model.Session;
import com.vision_assistant_service.model.VoiceCommand;
import com.vision_assistant_service.repository.AlertRecordRepository;
import com.vision_assistant_service.repository.DetectionRepository;
import com.vision_assistant_service.repository.SceneSummaryRepository;
import com.vision_assistant_service.repository.SessionRepository;
import com.vision_assistant_service.repository.VoiceCommandRepository;

/**
 * Writes every fact against the open session.
 *
 * <p>All writes, including session open and close, run on one executor, so a fact can
 * never land in a session that closed after the fact was accepted. Failed writes are
 * logged and dropped.
 */
public class PersistenceSink implements AlertSink, DetectionSink {

    private static final Logger log = LoggerFactory.getLogger(PersistenceSink.class);

    private final Executor executor;
    private final SessionManager sessions;
    private final SessionRepository sessionRepository;
    private final DetectionRepository detectionRepository;
    private final AlertRecordRepository alertRepository;
    private final VoiceCommandRepository voiceCommandRepository;
    private final SceneSummaryRepository sceneSummaryRepository;
    private final Clock clock;

    public PersistenceSink(Executor executor, SessionManager sessions, SessionRepository sessionRepository,
                           DetectionRepository detectionRepository, AlertRecordRepository alertRepository,
                           VoiceCommandRepository voiceCommandRepository, SceneSummaryRepository sceneSummaryRepository,
                           Clock clock) {
        this.executor = executor;
        this.sessions = sessions;
        this.sessionRepository = sessionRepository;
        this.detectionRepository = detectionRepository;
        this.alertRepository = alertRepository;
        this.voiceCommandRepository = voiceCommandRepository;
        this.sceneSummaryRepository = sceneSummaryRepository;
        this.clock = clock;
    }

    @Override
    public void recordDetection(ProximityEvent event, boolean admitted) {
        submit("detection " + event.objectType(), () -> {
            Long sessionId = sessions.currentSessionId();
            Detection detection = new Detection();
            detection.setSessionId(sessionId);
            detection.setTimestamp(toLocal(event.timestamp()));
            detection.setObjectType(event.objectType());
            detection.setDistanceCategory(event.zone().getLabel());
            detection.setDistanceScore(event.sizeFraction());
            detection.setDirection(event.direction().getLabel());
            detection.setConfidence(event.confidence());
            detection.setAdmitted(admitted);
            if (event.box() != null) {
                detection.setBboxX1(event.box().x1());
                detection.setBboxY1(event.box().y1());
                detection.setBboxX2(event.box().x2());
                detection.setBboxY2(event.box().y2());
            }
            detectionRepository.save(detection);
            sessionRepository.incrementDetections(sessionId);
        });
    }

    @Override
    public void recordAlert(Alert alert) {
        submit("alert '" + alert.message() + "'", () -> {
            Long sessionId = sessions.currentSessionId();
            AlertRecord record = new AlertRecord(
                    sessionId,
                    toLocal(alert.createdAt()),
                    alert.category().getLabel(),
                    alert.severity().name().toLowerCase(Locale.ROOT),
                    alert.message(),
                    alert.objectType(),
                    alert.zone() != null ? alert.zone().getLabel() : null,
                    alert.direction() != null ? alert.direction().getLabel() : null,
                    alert.safetyType() != null ? alert.safetyType().getKey() : null);
            alertRepository.save(record);
            sessionRepository.incrementAlerts(sessionId, SessionManager.isCritical(record) ? 1 : 0);
        });
    }

    public void recordVoiceCommand(String command, String response) {
        submit("voice command", () -> {
            VoiceCommand voiceCommand = new VoiceCommand();
            voiceCommand.setSessionId(sessions.currentSessionId());
            voiceCommand.setTimestamp(LocalDateTime.now(clock));
            voiceCommand.setCommand(command);
            voiceCommand.setResponse(response);
            voiceCommandRepository.save(voiceCommand);
        });
    }

    public void recordSceneSummary(String summaryText, int objectCount) {
        submit("scene summary", () -> {
            SceneSummary summary = new SceneSummary();
            summary.setSessionId(sessions.currentSessionId());
            summary.setTimestamp(LocalDateTime.now(clock));
            summary.setSummaryText(summaryText);
            summary.setObjectCount(objectCount);
            sceneSummaryRepository.save(summary);
        });
    }

    public CompletableFuture<Long> startSession() {
        return CompletableFuture.supplyAsync(sessions::start, executor);
    }

    public CompletableFuture<Optional<Session>> endSession() {
        return CompletableFuture.supplyAsync(sessions::endCurrentSession, executor);
    }

    /**
     * Lets queued writes finish, then stops the writer.
     */
    public void shutdown(Duration wait) {
        if (!(executor instanceof ExecutorService)) {
            return;
        }
        ExecutorService service = (ExecutorService) executor;
        service.shutdown();
        try {
            if (!service.awaitTermination(wait.toMillis(), TimeUnit.MILLISECONDS)) {
                log.warn("Dropping {} pending write(s) at shutdown", service.shutdownNow().size());
            }
        } catch (InterruptedException e) {
            service.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    private void submit(String what, Runnable write) {
        try {
            executor.execute(() -> {
                try {
                    write.run();
                } catch (RuntimeException e) {
                    log.warn("Could not record {}: {}", what, e.getMessage());
                }
            });
        } catch (RejectedExecutionException e) {
            log.warn("Could not record {}: writer stopped", what);
        }
    }

    private LocalDateTime toLocal(Instant instant) {
        return LocalDateTime.ofInstant(instant != null ? instant : clock.instant(), clock.getZone());
    }
}
