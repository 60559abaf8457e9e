package com.example.knowledgesync.controller;

import com.example.knowledgesync.dto.SyncAcknowledgement;
import com.example.knowledgesync.dto.SyncReport;
import com.example.knowledgesync.dto.SyncRequest;
import com.example.knowledgesync.logging.CorrelationIds;
import com.example.knowledgesync.service.LastRunHolder;
import com.example.knowledgesync.service.SyncTriggerService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RestController;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Manual trigger and status endpoints.
 *
 * POST /sync     run now; {"async": true} returns 202 and runs in the background
 * GET  /status   last run report, or never_run
 * GET  /         service descriptor
 */
@RestController
@RequiredArgsConstructor
@Slf4j
public class SyncController {

    private final SyncTriggerService syncTriggerService;
    private final LastRunHolder lastRunHolder;

    @GetMapping("/")
    public Map<String, Object> describe() {
        Map<String, Object> endpoints = new LinkedHashMap<>();
        endpoints.put("POST /sync", "Trigger a sync run (body {\"async\": true} to run in background)");
        endpoints.put("GET /status", "Report of the most recent run");
        endpoints.put("GET /actuator/health", "Liveness");

        Map<String, Object> descriptor = new LinkedHashMap<>();
        descriptor.put("service", "knowledge-sync-service");
        descriptor.put("description", "Incremental Jira/Confluence to Dify knowledge base sync");
        descriptor.put("endpoints", endpoints);
        return descriptor;
    }

    @PostMapping("/sync")
    public ResponseEntity<?> triggerSync(@RequestBody(required = false) SyncRequest request) {
        boolean async = request != null && request.isAsync();
        log.info("Manual sync requested (async={})", async);

        if (async) {
            syncTriggerService.runInBackground();
            return ResponseEntity.status(HttpStatus.ACCEPTED).body(SyncAcknowledgement.builder()
                    .status("started")
                    .message("Sync started in background")
                    .async(true)
                    .correlationId(CorrelationIds.current().orElse(null))
                    .timestamp(Instant.now().toString())
                    .build());
        }

        SyncReport report = syncTriggerService.runNow();
        return ResponseEntity.ok(report);
    }

    @GetMapping("/status")
    public ResponseEntity<?> status() {
        return lastRunHolder.get()
                .<ResponseEntity<?>>map(ResponseEntity::ok)
                .orElseGet(() -> ResponseEntity.ok(Map.of(
                        "status", "never_run",
                        "message", "No sync has run since startup")));
    }
}
