package com.vision_assistant_service.controller;

import java.util.List;
import java.util.Map;

import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.CrossOrigin;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import com.vision_assistant_service.controller.dto.VoiceCommandRequest;
import com.vision_assistant_service.model.VoiceCommand;
import com.vision_assistant_service.service.QueryService;
import com.vision_assistant_service.service.VoiceCommandService;

@RestController
@CrossOrigin(origins = "*")
@RequestMapping("/api/voice_commands")
public class VoiceCommandController {

    private final VoiceCommandService voiceCommandService;
    private final QueryService queryService;

    public VoiceCommandController(VoiceCommandService voiceCommandService, QueryService queryService) {
        this.voiceCommandService = voiceCommandService;
        this.queryService = queryService;
    }

    @GetMapping
    public ResponseEntity<List<VoiceCommand>> list(@RequestParam(defaultValue = "50") int limit) {
        return ResponseEntity.ok(queryService.voiceCommands(limit));
    }

    @PostMapping
    public ResponseEntity<Map<String, Object>> command(@RequestBody VoiceCommandRequest request) {
        if (request.getCommand() == null || request.getCommand().isBlank()) {
            throw new IllegalArgumentException("command is required");
        }
        return accepted(voiceCommandService.handleAsync(request.getCommand().trim()));
    }

    @PostMapping("/listen")
    public ResponseEntity<Map<String, Object>> listen() {
        return accepted(voiceCommandService.listenAsync());
    }

    private static ResponseEntity<Map<String, Object>> accepted(boolean accepted) {
        if (!accepted) {
            return ResponseEntity.status(HttpStatus.CONFLICT)
                    .body(Map.of("accepted", false, "error", "voice interaction already in progress"));
        }
        return ResponseEntity.status(HttpStatus.ACCEPTED).body(Map.of("accepted", true));
    }
}
