package com.example.knowledgesync.metrics;

import com.example.knowledgesync.dto.SyncReport;
import com.example.knowledgesync.entity.SourceType;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * Metrics component for Prometheus monitoring.
 *
 * Exposes:
 * - sync_runs_total: runs by status (success / error)
 * - sync_run_duration_seconds: duration of complete runs
 * - sync_items_total: reconciled items by source type and outcome (synced / skipped / failed)
 * - sync_runs_rejected_total: trigger requests refused because a run was in flight
 * - source_fetch_fallback_total: source fetches degraded to an empty result
 * - tracker_store_errors_total: tracker store failures by operation (read / write)
 *
 * Access metrics: /actuator/prometheus
 */
@Component
@Slf4j
public class SyncMetrics {

    private final MeterRegistry meterRegistry;

    private final Counter runSuccessCounter;
    private final Counter runErrorCounter;
    private final Counter runRejectedCounter;
    private final Counter trackerReadErrorCounter;
    private final Counter trackerWriteErrorCounter;

    private final Timer runTimer;

    public SyncMetrics(MeterRegistry meterRegistry) {
        this.meterRegistry = meterRegistry;

        this.runSuccessCounter = Counter.builder("sync_runs_total")
                .description("Total number of sync runs")
                .tag("status", "success")
                .register(meterRegistry);

        this.runErrorCounter = Counter.builder("sync_runs_total")
                .tag("status", "error")
                .register(meterRegistry);

        this.runRejectedCounter = Counter.builder("sync_runs_rejected_total")
                .description("Sync requests rejected because another run was in flight")
                .register(meterRegistry);

        this.trackerReadErrorCounter = Counter.builder("tracker_store_errors_total")
                .description("Tracker store failures")
                .tag("operation", "read")
                .register(meterRegistry);

        this.trackerWriteErrorCounter = Counter.builder("tracker_store_errors_total")
                .tag("operation", "write")
                .register(meterRegistry);

        this.runTimer = Timer.builder("sync_run_duration_seconds")
                .description("Duration of sync runs")
                .register(meterRegistry);
    }

    /**
     * Record a finished run (either status) with its duration.
     */
    public void recordRun(SyncReport report) {
        if (report.isError()) {
            runErrorCounter.increment();
        } else {
            runSuccessCounter.increment();
        }
        if (report.getStartTime() != null && report.getEndTime() != null) {
            runTimer.record(Duration.between(report.getStartTime(), report.getEndTime()));
        }
        log.debug("Recorded sync run: status={}, synced={}, skipped={}, failed={}",
                report.getStatus(), report.getSynced(), report.getSkipped(), report.getFailed());
    }

    public void recordItemSynced(SourceType sourceType) {
        itemCounter(sourceType, "synced").increment();
    }

    public void recordItemSkipped(SourceType sourceType) {
        itemCounter(sourceType, "skipped").increment();
    }

    public void recordItemFailed(SourceType sourceType) {
        itemCounter(sourceType, "failed").increment();
    }

    public void recordRunRejected() {
        runRejectedCounter.increment();
        log.warn("Sync request rejected: a run is already in progress");
    }

    /**
     * Source fetch degraded to an empty list (retry exhausted, circuit open or fetch error).
     */
    public void recordSourceFallback(SourceType sourceType) {
        Counter.builder("source_fetch_fallback_total")
                .description("Source fetches degraded to an empty result")
                .tag("source_type", sourceType.name().toLowerCase())
                .register(meterRegistry)
                .increment();
    }

    public void recordTrackerReadError() {
        trackerReadErrorCounter.increment();
    }

    public void recordTrackerWriteError() {
        trackerWriteErrorCounter.increment();
    }

    private Counter itemCounter(SourceType sourceType, String outcome) {
        // Micrometer returns the already registered meter for identical name and tags
        return Counter.builder("sync_items_total")
                .description("Reconciled items by outcome")
                .tag("source_type", sourceType.name().toLowerCase())
                .tag("outcome", outcome)
                .register(meterRegistry);
    }
}
