package com.vision_assistant_service.service;

import java.time.Clock;
import java.time.LocalTime;
import java.time.format.DateTimeFormatter;
import java.util.List;
import java.util.Locale;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.stream.Collectors;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.vision_assistant_service.alert.Alert;
import com.vision_assistant_service.alert.AlertAggregator;
import com.vision_assistant_service.alert.AlertPipeline;
import com.vision_assistant_service.audio.Announcer;
import com.vision_assistant_service.audio.SpeechException;
import com.vision_assistant_service.audio.SpeechRecognizer;
import com.vision_assistant_service.safety.AssistanceType;
import com.vision_assistant_service.safety.SafetyEventMonitor;
import com.vision_assistant_service.safety.SafetyEventType;
import com.vision_assistant_service.safety.SafetyStatus;

/**
 * On-demand voice interaction. Listening blocks on the recogniser, so it runs on its own
 * executor; the reply is spoken through the announcer's immediate path.
 */
public class VoiceCommandService {

    private static final Logger log = LoggerFactory.getLogger(VoiceCommandService.class);

    static final String NOT_HEARD = "Sorry, I didn't catch that.";
    static final String HELP = "You can say describe, repeat, status, or time.";

    private static final DateTimeFormatter SPOKEN_TIME = DateTimeFormatter.ofPattern("h:mm a", Locale.US);

    private final SpeechRecognizer recognizer;
    private final Announcer announcer;
    private final AlertPipeline pipeline;
    private final AlertAggregator aggregator;
    private final SafetyEventMonitor monitor;
    private final PersistenceSink persistence;
    private final ExecutorService voiceExecutor;
    private final Clock clock;
    private final AtomicBoolean busy = new AtomicBoolean();

    public VoiceCommandService(SpeechRecognizer recognizer, Announcer announcer, AlertPipeline pipeline,
                               AlertAggregator aggregator, SafetyEventMonitor monitor, PersistenceSink persistence,
                               ExecutorService voiceExecutor, Clock clock) {
        this.recognizer = recognizer;
        this.announcer = announcer;
        this.pipeline = pipeline;
        this.aggregator = aggregator;
        this.monitor = monitor;
        this.persistence = persistence;
        this.voiceExecutor = voiceExecutor;
        this.clock = clock;
    }

    /**
     * Starts listening in the background.
     *
     * @return false if a voice interaction is already running
     */
    public boolean listenAsync() {
        return submit(this::listenOnce);
    }

    /**
     * Handles an already transcribed command in the background.
     *
     * @return false if a voice interaction is already running
     */
    public boolean handleAsync(String command) {
        return submit(() -> handle(command));
    }

    /**
     * Listens once and answers. A recognition failure gets a spoken fallback.
     *
     * @return the spoken reply
     */
    public String listenOnce() {
        String transcript;
        try {
            transcript = recognizer.listen();
        } catch (SpeechException e) {
            log.warn("Speech recognition failed: {}", e.getMessage());
            announcer.speakNow(NOT_HEARD);
            return NOT_HEARD;
        }
        return handle(transcript);
    }

    /**
     * Resolves, speaks and records a reply to one command.
     */
    public String handle(String command) {
        String response = respond(command);
        log.info("Voice command '{}' -> '{}'", command, response);
        announcer.speakNow(response);
        persistence.recordVoiceCommand(command, response);
        return response;
    }

    String respond(String command) {
        String text = command == null ? "" : command.toLowerCase(Locale.ROOT);
        if (text.contains("describe") || text.contains("around") || text.contains("scene")) {
            String summary = pipeline.describeScene();
            persistence.recordSceneSummary(summary, pipeline.latestScene().size());
            return summary;
        }
        if (text.contains("repeat") || text.contains("last")) {
            Alert last = aggregator.lastDelivered();
            return last != null ? "Last alert: " + last.message() + "." : "There have been no alerts yet.";
        }
        if (text.contains("status") || text.contains("safety")) {
            return safetySummary();
        }
        if (text.contains("time")) {
            return "It is " + LocalTime.now(clock).format(SPOKEN_TIME) + ".";
        }
        return HELP;
    }

    private String safetySummary() {
        List<SafetyEventType> active = monitor.activeTypes();
        if (active.isEmpty()) {
            return "No active safety alerts.";
        }
        return "Active alerts: " + active.stream()
                .map(this::describeActive)
                .collect(Collectors.joining(", ")) + ".";
    }

    private String describeActive(SafetyEventType type) {
        if (type != SafetyEventType.ASSISTANCE) {
            return type.getKey();
        }
        SafetyStatus status = monitor.status(type);
        AssistanceType requested = status.assistanceType() != null ? status.assistanceType() : AssistanceType.GENERAL;
        return "assistance for " + requested.getSpoken();
    }

    private boolean submit(Runnable task) {
        if (!busy.compareAndSet(false, true)) {
            return false;
        }
        try {
            voiceExecutor.execute(() -> {
                try {
                    task.run();
                } catch (RuntimeException e) {
                    log.warn("Voice interaction failed", e);
                } finally {
                    busy.set(false);
                }
            });
            return true;
        } catch (RejectedExecutionException e) {
            busy.set(false);
            log.warn("Voice executor stopped; ignoring request");
            return false;
        }
    }
}
