package com.vision_assistant_service.controller;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.CrossOrigin;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import com.vision_assistant_service.audio.Announcer;
import com.vision_assistant_service.config.VisionProperties;
import com.vision_assistant_service.model.AlertRecord;
import com.vision_assistant_service.model.Session;
import com.vision_assistant_service.service.PersistenceSink;
import com.vision_assistant_service.service.QueryService;

@RestController
@CrossOrigin(origins = "*")
@RequestMapping("/api")
public class StatusController {

    private final QueryService queryService;
    private final PersistenceSink persistenceSink;
    private final Announcer announcer;
    private final VisionProperties properties;
    private final Clock clock;

    public StatusController(QueryService queryService, PersistenceSink persistenceSink, Announcer announcer,
                            VisionProperties properties, Clock clock) {
        this.queryService = queryService;
        this.persistenceSink = persistenceSink;
        this.announcer = announcer;
        this.properties = properties;
        this.clock = clock;
    }

    @GetMapping("/status")
    public ResponseEntity<Map<String, Object>> status() {
        return ResponseEntity.ok(queryService.status());
    }

    @GetMapping("/health")
    public ResponseEntity<Map<String, Object>> health() {
        Map<String, Object> health = new LinkedHashMap<>();
        health.put("status", "ok");
        health.put("announcer_running", announcer.isRunning());
        health.put("utterances", announcer.getUtterances());
        health.put("speech_failures", announcer.getFailures());
        health.put("timestamp", LocalDateTime.now(clock));
        return ResponseEntity.ok(health);
    }

    @GetMapping("/stats/overview")
    public ResponseEntity<Map<String, Object>> overview() {
        return ResponseEntity.ok(queryService.overview());
    }

    @GetMapping("/stats/safety")
    public ResponseEntity<Map<String, Object>> safetyMetrics() {
        return ResponseEntity.ok(queryService.safetyMetrics());
    }

    @GetMapping("/stats/objects")
    public ResponseEntity<Map<String, Object>> objectStats() {
        return ResponseEntity.ok(queryService.objectStats());
    }

    @GetMapping("/stats/timeline")
    public ResponseEntity<Map<String, Object>> timeline(@RequestParam(defaultValue = "24") int hours) {
        return ResponseEntity.ok(queryService.timeline(hours));
    }

    @GetMapping("/alerts/recent")
    public ResponseEntity<List<AlertRecord>> recentAlerts(@RequestParam(defaultValue = "50") int limit) {
        return ResponseEntity.ok(queryService.recentAlerts(limit));
    }

    @GetMapping("/sessions")
    public ResponseEntity<List<Session>> sessions() {
        return ResponseEntity.ok(queryService.sessions());
    }

    @GetMapping("/sessions/{id}")
    public ResponseEntity<Map<String, Object>> session(@PathVariable Long id) {
        return queryService.sessionStats(id)
                .map(ResponseEntity::ok)
                .orElse(ResponseEntity.notFound().build());
    }

    /**
     * Closes the open session. The next recorded event opens a new one.
     */
    @PostMapping("/sessions/end")
    public ResponseEntity<Session> endSession()
            throws InterruptedException, ExecutionException, TimeoutException {
        long waitMillis = properties.getPersistence().getShutdownWait().toMillis();
        Optional<Session> closed = persistenceSink.endSession().get(waitMillis, TimeUnit.MILLISECONDS);
        return closed.map(ResponseEntity::ok).orElse(ResponseEntity.notFound().build());
    }

    @GetMapping("/diagnostics")
    public ResponseEntity<Map<String, Object>> diagnostics() {
        return ResponseEntity.ok(queryService.diagnostics());
    }
}
