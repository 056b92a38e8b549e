package com.vision_assistant_service.repository;

import java.util.List;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import com.vision_assistant_service.model.SceneSummary;

@Repository
public interface SceneSummaryRepository extends JpaRepository<SceneSummary, Long> {

    List<SceneSummary> findBySessionIdOrderByTimestampAsc(Long sessionId);
}
