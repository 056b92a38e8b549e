package com.vision_assistant_service.controller.dto;

import java.time.LocalDateTime;

/**
 * @param changed false when the event was not active, i.e. the call was a no-op
 */
public record AcknowledgeResponse(String status, LocalDateTime timestamp, boolean changed) {
}
