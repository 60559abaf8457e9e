package com.example.knowledgesync.exception;

import com.example.knowledgesync.dto.ErrorResponse;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.time.Instant;
import java.util.concurrent.RejectedExecutionException;

/**
 * Maps trigger failures to the ErrorResponse format.
 * Run-level failures are not exceptions; they come back as a SyncReport with status=error.
 */
@RestControllerAdvice
@Slf4j
public class GlobalExceptionHandler {

    @ExceptionHandler(SyncInProgressException.class)
    public ResponseEntity<ErrorResponse> handleSyncInProgress(SyncInProgressException ex) {
        log.warn("Sync request rejected: {}", ex.getMessage());
        return buildErrorResponse(
            HttpStatus.CONFLICT,
            "SYNC_IN_PROGRESS",
            ex.getMessage()
        );
    }

    @ExceptionHandler(RejectedExecutionException.class)
    public ResponseEntity<ErrorResponse> handleRejectedExecution(RejectedExecutionException ex) {
        log.warn("Sync executor overloaded - rejected task");
        return buildErrorResponse(
            HttpStatus.SERVICE_UNAVAILABLE,
            "SERVICE_OVERLOADED",
            "Sync executor is temporarily overloaded. Please retry later."
        );
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<ErrorResponse> handleUnreadableBody(HttpMessageNotReadableException ex) {
        log.warn("Malformed request body: {}", ex.getMessage());
        return buildErrorResponse(
            HttpStatus.BAD_REQUEST,
            "BAD_REQUEST",
            "Request body is not valid JSON"
        );
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> handleGeneric(Exception ex) {
        log.error("Unexpected error: {}", ex.getMessage(), ex);
        return buildErrorResponse(
            HttpStatus.INTERNAL_SERVER_ERROR,
            "INTERNAL_SERVER_ERROR",
            "An unexpected error occurred"
        );
    }

    private ResponseEntity<ErrorResponse> buildErrorResponse(HttpStatus status, String code, String message) {
        ErrorResponse response = ErrorResponse.builder()
            .error(ErrorResponse.Error.builder()
                .code(code)
                .message(message)
                .build())
            .timestamp(Instant.now().toString())
            .build();

        return ResponseEntity.status(status).body(response);
    }
}
