package com.vision_assistant_service.repository;

import java.time.LocalDateTime;
import java.util.Collection;
import java.util.List;
import java.util.Optional;

import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.Repository;
import org.springframework.data.repository.query.Param;

import com.vision_assistant_service.model.AlertRecord;

/**
 * Append-only: exposes no update or delete operations.
 */
@org.springframework.stereotype.Repository
public interface AlertRecordRepository extends Repository<AlertRecord, Long> {

    AlertRecord save(AlertRecord record);

    Optional<AlertRecord> findById(Long id);

    long count();

    List<AlertRecord> findAllByOrderByTimestampDescIdDesc(Pageable pageable);

    List<AlertRecord> findBySessionIdOrderByTimestampAscIdAsc(Long sessionId);

    List<AlertRecord> findByTimestampAfterOrderByTimestampAsc(LocalDateTime cutoff);

    long countBySessionId(Long sessionId);

    long countBySessionIdAndDistanceCategory(Long sessionId, String distanceCategory);

    long countBySessionIdAndCategory(Long sessionId, String category);

    long countByDistanceCategoryAndTimestampAfter(String distanceCategory, LocalDateTime cutoff);

    @Query("select a.timestamp from AlertRecord a where a.distanceCategory in :categories")
    List<LocalDateTime> findTimestampsByDistanceCategoryIn(@Param("categories") Collection<String> categories);

    @Query("select a.objectType, count(a) from AlertRecord a where a.distanceCategory = :category "
            + "group by a.objectType order by count(a) desc")
    List<Object[]> countObjectsByDistanceCategory(@Param("category") String category, Pageable pageable);
}
