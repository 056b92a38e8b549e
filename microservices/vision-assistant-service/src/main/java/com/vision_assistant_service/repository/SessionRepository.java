package com.vision_assistant_service.repository;

import java.time.LocalDateTime;
import java.util.List;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import com.vision_assistant_service.model.Session;

/**
 * Counter updates only match open sessions, so a closed session never changes again.
 */
@Repository
public interface SessionRepository extends JpaRepository<Session, Long> {

    List<Session> findByEndTimeIsNull();

    List<Session> findAllByOrderByStartTimeDesc();

    @Transactional
    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("update Session s set s.totalDetections = s.totalDetections + 1 where s.id = :id and s.endTime is null")
    int incrementDetections(@Param("id") Long id);

    @Transactional
    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("update Session s set s.totalAlerts = s.totalAlerts + 1, s.criticalAlerts = s.criticalAlerts + :critical "
            + "where s.id = :id and s.endTime is null")
    int incrementAlerts(@Param("id") Long id, @Param("critical") long critical);

    @Transactional
    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("update Session s set s.endTime = :endTime, s.durationSeconds = :duration, "
            + "s.totalDetections = :detections, s.totalAlerts = :alerts, s.criticalAlerts = :critical "
            + "where s.id = :id and s.endTime is null")
    int close(@Param("id") Long id,
              @Param("endTime") LocalDateTime endTime,
              @Param("duration") long duration,
              @Param("detections") long detections,
              @Param("alerts") long alerts,
              @Param("critical") long critical);

    @Query("select count(s), sum(s.durationSeconds), sum(s.totalDetections), sum(s.totalAlerts), sum(s.criticalAlerts) "
            + "from Session s")
    List<Object[]> overallTotals();
}
