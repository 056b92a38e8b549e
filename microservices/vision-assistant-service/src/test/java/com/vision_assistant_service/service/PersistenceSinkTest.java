package com.vision_assistant_service.service;

import static org.assertj.core.api.Assertions.assertThat;

import java.time.Clock;
import java.time.Instant;
import java.util.List;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;
import org.springframework.boot.test.context.TestConfiguration;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Import;
import org.springframework.context.annotation.Primary;
import org.springframework.test.annotation.DirtiesContext;
import org.springframework.test.context.ActiveProfiles;

import com.vision_assistant_service.alert.Alert;
import com.vision_assistant_service.alert.Direction;
import com.vision_assistant_service.alert.ProximityEvent;
import com.vision_assistant_service.alert.ProximityZone;
import com.vision_assistant_service.model.AlertRecord;
import com.vision_assistant_service.model.Detection;
import com.vision_assistant_service.model.Session;
import com.vision_assistant_service.repository.AlertRecordRepository;
import com.vision_assistant_service.repository.DetectionRepository;
import com.vision_assistant_service.repository.SceneSummaryRepository;
import com.vision_assistant_service.repository.SessionRepository;
import com.vision_assistant_service.repository.VoiceCommandRepository;
import com.vision_assistant_service.safety.SafetyEventType;
import com.vision_assistant_service.safety.SafetyTransition;

@DataJpaTest
@ActiveProfiles("test")
@Import(SessionManager.class)
@DirtiesContext(classMode = DirtiesContext.ClassMode.AFTER_EACH_TEST_METHOD)
class PersistenceSinkTest {

    @TestConfiguration
    static class ClockConfig {
        @Bean
        @Primary
        Clock testClock() {
            return Clock.systemDefaultZone();
        }
    }

    @Autowired
    private SessionManager sessionManager;

    @Autowired
    private SessionRepository sessionRepository;

    @Autowired
    private DetectionRepository detectionRepository;

    @Autowired
    private AlertRecordRepository alertRepository;

    @Autowired
    private VoiceCommandRepository voiceCommandRepository;

    @Autowired
    private SceneSummaryRepository sceneSummaryRepository;

    @Autowired
    private Clock clock;

    private PersistenceSink sink;

    @BeforeEach
    void setUp() {
        sink = new PersistenceSink(Runnable::run, sessionManager, sessionRepository, detectionRepository,
                alertRepository, voiceCommandRepository, sceneSummaryRepository, clock);
    }

    private static ProximityEvent event(ProximityZone zone) {
        return new ProximityEvent("person", Direction.AHEAD, zone, 0.7, 0.91, null, Instant.now());
    }

    @Test
    void recordsDetectionsAgainstOpenSession() {
        sink.recordDetection(event(ProximityZone.CRITICAL), true);
        sink.recordDetection(event(ProximityZone.CRITICAL), false);

        Long sessionId = sessionManager.openSessionId().orElseThrow();
        List<Detection> stored = detectionRepository.findBySessionIdOrderByTimestampAsc(sessionId);
        assertThat(stored).hasSize(2);
        assertThat(stored).extracting(Detection::isAdmitted).containsExactlyInAnyOrder(true, false);
        assertThat(stored.get(0).getDirection()).isEqualTo("ahead");
        assertThat(sessionRepository.findById(sessionId).orElseThrow().getTotalDetections()).isEqualTo(2);
    }

    @Test
    void recordsProximityAndSafetyAlerts() {
        sink.recordAlert(Alert.proximity(event(ProximityZone.CRITICAL)));
        sink.recordAlert(Alert.proximity(event(ProximityZone.FAR)));
        sink.recordAlert(Alert.safety(new SafetyTransition(SafetyEventType.FALL, SafetyTransition.Kind.RAISED,
                null, Instant.now(), null), Instant.now()));

        Long sessionId = sessionManager.openSessionId().orElseThrow();
        List<AlertRecord> stored = alertRepository.findBySessionIdOrderByTimestampAscIdAsc(sessionId);
        assertThat(stored).extracting(AlertRecord::getSeverity).containsExactly("critical", "far", "safety");
        assertThat(stored.get(2).getCategory()).isEqualTo(AlertRecord.CATEGORY_SAFETY);
        assertThat(stored.get(2).getSafetyType()).isEqualTo("fall");

        Session session = sessionRepository.findById(sessionId).orElseThrow();
        assertThat(session.getTotalAlerts()).isEqualTo(3);
        assertThat(session.getCriticalAlerts()).isEqualTo(1);
    }

    @Test
    void detectionAfterCloseCountsAgainstNewSession() throws Exception {
        sink.recordDetection(event(ProximityZone.CRITICAL), true);
        sink.recordAlert(Alert.proximity(event(ProximityZone.CRITICAL)));
        Long first = sessionManager.openSessionId().orElseThrow();

        assertThat(sink.endSession().get()).map(Session::getId).contains(first);
        sink.recordDetection(event(ProximityZone.WARNING), true);

        Long second = sessionManager.openSessionId().orElseThrow();
        assertThat(second).isNotEqualTo(first);
        Session current = sessionRepository.findById(second).orElseThrow();
        assertThat(current.getTotalDetections()).isEqualTo(1);
        assertThat(current.getTotalAlerts()).isZero();
        assertThat(detectionRepository.findBySessionIdOrderByTimestampAsc(second)).hasSize(1);

        Session closed = sessionRepository.findById(first).orElseThrow();
        assertThat(closed.getEndTime()).isNotNull();
        assertThat(closed.getTotalDetections()).isEqualTo(1);
        assertThat(closed.getTotalAlerts()).isEqualTo(1);
        assertThat(closed.getCriticalAlerts()).isEqualTo(1);
        assertThat(detectionRepository.findBySessionIdOrderByTimestampAsc(first)).hasSize(1);
    }

    @Test
    void voiceCommandAfterCloseOpensNewSession() throws Exception {
        sink.recordDetection(event(ProximityZone.WARNING), true);
        Long first = sessionManager.openSessionId().orElseThrow();

        sink.endSession().get();
        sink.recordVoiceCommand("time", "It is 10:00 AM.");

        Long second = sessionManager.openSessionId().orElseThrow();
        assertThat(second).isNotEqualTo(first);
        assertThat(voiceCommandRepository.findBySessionIdOrderByTimestampAsc(second)).hasSize(1);
        assertThat(sessionRepository.findById(first).orElseThrow().getTotalDetections()).isEqualTo(1);
    }
}
