package com.vision_assistant_service.service;

import java.time.Clock;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import java.util.TreeSet;

import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;

import com.vision_assistant_service.alert.AlertAggregator;
import com.vision_assistant_service.alert.CooldownTracker;
import com.vision_assistant_service.alert.ProximityClassifier;
import com.vision_assistant_service.model.AlertRecord;
import com.vision_assistant_service.model.Session;
import com.vision_assistant_service.model.VoiceCommand;
import com.vision_assistant_service.repository.AlertRecordRepository;
import com.vision_assistant_service.repository.DetectionRepository;
import com.vision_assistant_service.repository.SessionRepository;
import com.vision_assistant_service.repository.VoiceCommandRepository;
import com.vision_assistant_service.sensor.ConnectivityStatus;

/**
 * Read-only projections for the dashboard.
 */
@Service
public class QueryService {

    static final int MAX_LIMIT = 500;

    private static final DateTimeFormatter HOUR_BUCKET = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:00");

    @Autowired
    private SessionRepository sessionRepository;

    @Autowired
    private DetectionRepository detectionRepository;

    @Autowired
    private AlertRecordRepository alertRepository;

    @Autowired
    private VoiceCommandRepository voiceCommandRepository;

    @Autowired
    private SessionManager sessionManager;

    @Autowired
    private ConnectivityStatus connectivity;

    @Autowired
    private CooldownTracker cooldownTracker;

    @Autowired
    private ProximityClassifier classifier;

    @Autowired
    private AlertAggregator aggregator;

    @Autowired
    private Clock clock;

    public Map<String, Object> status() {
        Optional<Long> current = sessionManager.openSessionId();
        Map<String, Object> status = new LinkedHashMap<>();
        status.put("status", current.isPresent() ? "active" : "inactive");
        status.put("current_session_id", current.orElse(null));
        status.put("timestamp", LocalDateTime.now(clock));
        status.put("sensor_connectivity", connectivity.isDegraded() ? "degraded" : "ok");
        return status;
    }

    public Map<String, Object> overview() {
        Object[] totals = sessionRepository.overallTotals().stream().findFirst().orElse(new Object[5]);
        Map<String, Object> overall = new LinkedHashMap<>();
        overall.put("total_sessions", number(totals[0]));
        overall.put("total_duration", number(totals[1]));
        overall.put("total_detections", number(totals[2]));
        overall.put("total_alerts", number(totals[3]));
        overall.put("total_critical_alerts", number(totals[4]));

        Map<String, Object> overview = new LinkedHashMap<>();
        overview.put("overall", overall);
        overview.put("current_session", sessionManager.openSessionId().flatMap(this::sessionStats).orElse(null));
        return overview;
    }

    public Optional<Map<String, Object>> sessionStats(Long sessionId) {
        Optional<Session> found = sessionRepository.findById(sessionId);
        if (found.isEmpty()) {
            return Optional.empty();
        }
        Session session = found.get();
        Map<String, Object> stats = new LinkedHashMap<>();
        stats.put("id", session.getId());
        stats.put("start_time", session.getStartTime());
        stats.put("end_time", session.getEndTime());
        stats.put("duration_seconds", session.getDurationSeconds());
        stats.put("total_detections", session.getTotalDetections());
        stats.put("total_alerts", session.getTotalAlerts());
        stats.put("critical_alerts", session.getCriticalAlerts());
        stats.put("safety_alerts", alertRepository.countBySessionIdAndCategory(sessionId, AlertRecord.CATEGORY_SAFETY));
        stats.put("object_distribution", rows(detectionRepository.countByObjectTypeForSession(sessionId), "object_type"));

        List<Map<String, Object>> timeline = new ArrayList<>();
        for (AlertRecord alert : alertRepository.findBySessionIdOrderByTimestampAscIdAsc(sessionId)) {
            Map<String, Object> row = new LinkedHashMap<>();
            row.put("timestamp", alert.getTimestamp());
            row.put("category", alert.getCategory());
            row.put("object_type", alert.getObjectType());
            row.put("distance_category", alert.getDistanceCategory());
            row.put("direction", alert.getDirection());
            row.put("message", alert.getMessage());
            timeline.add(row);
        }
        stats.put("alert_timeline", timeline);
        return Optional.of(stats);
    }

    public Map<String, Object> safetyMetrics() {
        LocalDateTime cutoff = LocalDateTime.now(clock).minusHours(24);

        Map<String, Long> byHour = new TreeMap<>();
        for (LocalDateTime at : alertRepository.findTimestampsByDistanceCategoryIn(List.of("critical", "warning"))) {
            byHour.merge(String.format("%02d", at.getHour()), 1L, Long::sum);
        }
        List<Map<String, Object>> dangerousHours = new ArrayList<>();
        byHour.entrySet().stream()
                .sorted(Map.Entry.<String, Long>comparingByValue(Comparator.reverseOrder()))
                .limit(5)
                .forEach(e -> dangerousHours.add(row("hour", e.getKey(), e.getValue())));

        Map<String, Object> metrics = new LinkedHashMap<>();
        metrics.put("critical_alerts_24h", alertRepository.countByDistanceCategoryAndTimestampAfter("critical", cutoff));
        metrics.put("warning_alerts_24h", alertRepository.countByDistanceCategoryAndTimestampAfter("warning", cutoff));
        metrics.put("dangerous_hours", dangerousHours);
        metrics.put("dangerous_objects",
                rows(alertRepository.countObjectsByDistanceCategory("critical", PageRequest.of(0, 5)), "object_type"));
        return metrics;
    }

    public Map<String, Object> objectStats() {
        Map<String, Object> stats = new LinkedHashMap<>();
        stats.put("common_objects", rows(detectionRepository.countByObjectType(PageRequest.of(0, 10)), "object_type"));
        stats.put("distance_distribution", rows(detectionRepository.countByDistanceCategory(), "distance_category"));
        stats.put("direction_distribution", rows(detectionRepository.countByDirection(), "direction"));
        return stats;
    }

    public Map<String, Object> timeline(int hours) {
        LocalDateTime cutoff = LocalDateTime.now(clock).minusHours(Math.max(1, hours));

        Map<String, Long> detections = new TreeMap<>();
        for (LocalDateTime at : detectionRepository.findTimestampsAfter(cutoff)) {
            detections.merge(at.format(HOUR_BUCKET), 1L, Long::sum);
        }
        List<Map<String, Object>> detectionRows = new ArrayList<>();
        detections.forEach((hour, count) -> detectionRows.add(row("hour", hour, count)));

        Map<String, Map<String, Long>> alerts = new TreeMap<>();
        for (AlertRecord alert : alertRepository.findByTimestampAfterOrderByTimestampAsc(cutoff)) {
            if (alert.getDistanceCategory() == null) {
                continue;
            }
            alerts.computeIfAbsent(alert.getTimestamp().format(HOUR_BUCKET), h -> new TreeMap<>())
                    .merge(alert.getDistanceCategory(), 1L, Long::sum);
        }
        List<Map<String, Object>> alertRows = new ArrayList<>();
        alerts.forEach((hour, categories) -> categories.forEach((category, count) -> {
            Map<String, Object> row = new LinkedHashMap<>();
            row.put("hour", hour);
            row.put("distance_category", category);
            row.put("count", count);
            alertRows.add(row);
        }));

        Map<String, Object> timeline = new LinkedHashMap<>();
        timeline.put("detections", detectionRows);
        timeline.put("alerts", alertRows);
        return timeline;
    }

    public List<AlertRecord> recentAlerts(int limit) {
        return alertRepository.findAllByOrderByTimestampDescIdDesc(PageRequest.of(0, clamp(limit)));
    }

    public List<VoiceCommand> voiceCommands(int limit) {
        return voiceCommandRepository.findAllByOrderByTimestampDescIdDesc(PageRequest.of(0, clamp(limit)));
    }

    public List<Session> sessions() {
        return sessionRepository.findAllByOrderByStartTimeDesc();
    }

    public Map<String, Object> diagnostics() {
        Map<String, Object> cooldown = new TreeMap<>();
        cooldownTracker.snapshot().forEach((key, admission) -> cooldown.put(key.toString(), admission));

        Map<String, Object> diagnostics = new LinkedHashMap<>();
        diagnostics.put("cooldown_window_ms", cooldownTracker.getWindow().toMillis());
        diagnostics.put("escalation_bypasses_cooldown", cooldownTracker.isEscalationBypassesCooldown());
        diagnostics.put("cooldown", cooldown);
        diagnostics.put("relevant_classes", new TreeSet<>(classifier.getRelevantClasses()));
        diagnostics.put("pending_announcements", aggregator.pendingCount());
        diagnostics.put("connectivity", connectivity.snapshot());
        return diagnostics;
    }

    static int clamp(int limit) {
        return Math.max(1, Math.min(limit, MAX_LIMIT));
    }

    private static List<Map<String, Object>> rows(List<Object[]> grouped, String keyName) {
        List<Map<String, Object>> rows = new ArrayList<>(grouped.size());
        for (Object[] group : grouped) {
            rows.add(row(keyName, group[0], number(group[1])));
        }
        return rows;
    }

    private static Map<String, Object> row(String keyName, Object key, long count) {
        Map<String, Object> row = new LinkedHashMap<>();
        row.put(keyName, key);
        row.put("count", count);
        return row;
    }

    private static long number(Object value) {
        return value instanceof Number ? ((Number) value).longValue() : 0L;
    }
}
