package com.example.knowledgesync.dto;

import lombok.Builder;

/**
 * Error body returned when a trigger request is rejected.
 */
@Builder
public record ErrorResponse(
    Error error,
    String timestamp
) {

    @Builder
    public record Error(
        String code,
        String message,
        Object details
    ) {}
}
