package com.example.knowledgesync.dto;

import lombok.Builder;

/**
 * Immediate response of a background sync request.
 */
@Builder
public record SyncAcknowledgement(
    String status,
    String message,
    boolean async,
    String correlationId,
    String timestamp
) {}
