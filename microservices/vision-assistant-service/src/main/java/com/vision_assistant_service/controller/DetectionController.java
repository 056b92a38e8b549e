package com.vision_assistant_service.controller;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.CrossOrigin;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import com.vision_assistant_service.alert.AlertPipeline;
import com.vision_assistant_service.alert.DetectionEvent;
import com.vision_assistant_service.controller.dto.DetectionBatchRequest;

@RestController
@CrossOrigin(origins = "*")
@RequestMapping("/api/detections")
public class DetectionController {

    private final AlertPipeline pipeline;
    private final Clock clock;

    public DetectionController(AlertPipeline pipeline, Clock clock) {
        this.pipeline = pipeline;
        this.clock = clock;
    }

    @PostMapping
    public ResponseEntity<AlertPipeline.IngestResult> ingest(@RequestBody DetectionBatchRequest batch) {
        if (batch.getFrameWidth() == null || batch.getFrameWidth() <= 0
                || batch.getFrameHeight() == null || batch.getFrameHeight() <= 0) {
            throw new IllegalArgumentException("frame_width and frame_height must be positive");
        }
        if (batch.getDetections() == null) {
            throw new IllegalArgumentException("detections is required");
        }
        Instant frameTime = batch.getTimestamp() != null
                ? Instant.ofEpochMilli(Math.round(batch.getTimestamp() * 1000))
                : clock.instant();

        List<DetectionEvent> events = new ArrayList<>(batch.getDetections().size());
        for (DetectionBatchRequest.DetectionItem item : batch.getDetections()) {
            if (item == null) {
                continue;
            }
            DetectionEvent.BoundingBox box = new DetectionEvent.BoundingBox(item.getX1(), item.getY1(), item.getX2(), item.getY2());
            events.add(DetectionEvent.fromBox(item.getObjectType(), item.getConfidence(), box,
                    batch.getFrameWidth(), batch.getFrameHeight(), frameTime));
        }
        return ResponseEntity.ok(pipeline.ingest(events));
    }
}
