package com.example.knowledgesync.dto;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonValue;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;

/**
 * Result of one reconciliation run.
 * Immutable so the last-run holder can swap it in atomically.
 *
 * status is ERROR only when the run aborted before producing per-item counts;
 * a completed run with failed items is still SUCCESS.
 */
@Value
@Builder
public class SyncReport {

    RunStatus status;
    int synced;
    int skipped;
    int failed;
    int total;
    Instant startTime;
    Instant endTime;
    String message;
    String errorDetail;
    String correlationId;

    @JsonIgnore
    public boolean isError() {
        return status == RunStatus.ERROR;
    }

    public enum RunStatus {
        SUCCESS("success"),
        ERROR("error");

        private final String value;

        RunStatus(String value) {
            this.value = value;
        }

        @JsonValue
        public String getValue() {
            return value;
        }
    }
}
