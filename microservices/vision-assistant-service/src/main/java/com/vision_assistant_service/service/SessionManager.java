package com.vision_assistant_service.service;

import java.time.Clock;
import java.time.Duration;
import java.time.LocalDateTime;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import com.vision_assistant_service.model.AlertRecord;
import com.vision_assistant_service.model.Session;
import com.vision_assistant_service.repository.AlertRecordRepository;
import com.vision_assistant_service.repository.DetectionRepository;
import com.vision_assistant_service.repository.SessionRepository;

/**
 * Owns the open-session handle. Exactly one session is open at a time; the first write
 * after a close opens a fresh one.
 *
 * <p>The handle is guarded by its own lock, which is never held while talking to the
 * database.
 */
@Service
public class SessionManager {

    private static final Logger log = LoggerFactory.getLogger(SessionManager.class);

    private final SessionRepository sessionRepository;
    private final DetectionRepository detectionRepository;
    private final AlertRecordRepository alertRepository;
    private final Clock clock;
    private final ReentrantLock lock = new ReentrantLock();
    private Long openSessionId;

    public SessionManager(SessionRepository sessionRepository, DetectionRepository detectionRepository,
                          AlertRecordRepository alertRepository, Clock clock) {
        this.sessionRepository = sessionRepository;
        this.detectionRepository = detectionRepository;
        this.alertRepository = alertRepository;
        this.clock = clock;
    }

    /**
     * Closes sessions left open by an unclean shutdown, then opens a new one.
     */
    public Long start() {
        for (Session stale : sessionRepository.findByEndTimeIsNull()) {
            lock.lock();
            try {
                if (stale.getId().equals(openSessionId)) {
                    continue;
                }
            } finally {
                lock.unlock();
            }
            log.info("Closing session {} left open since {}", stale.getId(), stale.getStartTime());
            finish(stale.getId());
        }
        return currentSessionId();
    }

    /**
     * @return the open session, opening one if none is open
     */
    public Long currentSessionId() {
        lock.lock();
        try {
            if (openSessionId != null) {
                return openSessionId;
            }
        } finally {
            lock.unlock();
        }

        Session created = sessionRepository.save(new Session(LocalDateTime.now(clock)));
        Long winner;
        lock.lock();
        try {
            if (openSessionId == null) {
                openSessionId = created.getId();
                log.info("Opened session {}", openSessionId);
                return openSessionId;
            }
            winner = openSessionId;
        } finally {
            lock.unlock();
        }
        // another writer opened one first; the spare row never received any data
        sessionRepository.deleteById(created.getId());
        return winner;
    }

    public Optional<Long> openSessionId() {
        lock.lock();
        try {
            return Optional.ofNullable(openSessionId);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Closes the open session. One-way: the closed session's counters are final.
     *
     * @return the closed session, or empty if none was open
     */
    public Optional<Session> endCurrentSession() {
        Long id;
        lock.lock();
        try {
            id = openSessionId;
            openSessionId = null;
        } finally {
            lock.unlock();
        }
        if (id == null) {
            return Optional.empty();
        }
        finish(id);
        log.info("Closed session {}", id);
        return sessionRepository.findById(id);
    }

    private void finish(Long id) {
        Optional<Session> session = sessionRepository.findById(id);
        if (session.isEmpty()) {
            return;
        }
        LocalDateTime end = LocalDateTime.now(clock);
        long duration = Math.max(0, Duration.between(session.get().getStartTime(), end).getSeconds());
        sessionRepository.close(id, end, duration,
                detectionRepository.countBySessionId(id),
                alertRepository.countBySessionId(id),
                alertRepository.countBySessionIdAndDistanceCategory(id, "critical"));
    }

    static boolean isCritical(AlertRecord record) {
        return "critical".equals(record.getDistanceCategory());
    }
}
