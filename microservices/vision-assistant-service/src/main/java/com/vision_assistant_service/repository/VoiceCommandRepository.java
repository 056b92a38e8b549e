package com.vision_assistant_service.repository;

import java.util.List;

import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import com.vision_assistant_service.model.VoiceCommand;

@Repository
public interface VoiceCommandRepository extends JpaRepository<VoiceCommand, Long> {

    List<VoiceCommand> findAllByOrderByTimestampDescIdDesc(Pageable pageable);

    List<VoiceCommand> findBySessionIdOrderByTimestampAsc(Long sessionId);
}
