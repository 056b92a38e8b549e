package com.vision_assistant_service.repository;

import java.time.LocalDateTime;
import java.util.List;

import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import com.vision_assistant_service.model.Detection;

@Repository
public interface DetectionRepository extends JpaRepository<Detection, Long> {

    long countBySessionId(Long sessionId);

    List<Detection> findBySessionIdOrderByTimestampAsc(Long sessionId);

    @Query("select d.objectType, count(d) from Detection d group by d.objectType order by count(d) desc")
    List<Object[]> countByObjectType(Pageable pageable);

    @Query("select d.objectType, count(d) from Detection d where d.sessionId = :sessionId "
            + "group by d.objectType order by count(d) desc")
    List<Object[]> countByObjectTypeForSession(@Param("sessionId") Long sessionId);

    @Query("select d.distanceCategory, count(d) from Detection d where d.distanceCategory is not null "
            + "group by d.distanceCategory")
    List<Object[]> countByDistanceCategory();

    @Query("select d.direction, count(d) from Detection d where d.direction is not null group by d.direction")
    List<Object[]> countByDirection();

    @Query("select d.timestamp from Detection d where d.timestamp > :cutoff order by d.timestamp")
    List<LocalDateTime> findTimestampsAfter(@Param("cutoff") LocalDateTime cutoff);
}
