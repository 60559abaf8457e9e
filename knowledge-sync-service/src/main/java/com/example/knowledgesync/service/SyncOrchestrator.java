package com.example.knowledgesync.service;

import com.example.knowledgesync.client.DestinationPublisher;
import com.example.knowledgesync.client.SourceAdapter;
import com.example.knowledgesync.client.SourceFetchException;
import com.example.knowledgesync.config.SyncProperties;
import com.example.knowledgesync.dto.SourceQuery;
import com.example.knowledgesync.dto.SyncItem;
import com.example.knowledgesync.dto.SyncReport;
import com.example.knowledgesync.entity.SyncStatus;
import com.example.knowledgesync.entity.SyncTracker;
import com.example.knowledgesync.exception.SyncConfigurationException;
import com.example.knowledgesync.logging.CorrelationIds;
import com.example.knowledgesync.metrics.SyncMetrics;
import com.example.knowledgesync.repository.TrackerStore;
import com.example.knowledgesync.repository.TrackerStoreException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Reconciliation engine: validate config, fetch from every source, then for each item
 * decide, publish and record the outcome, and aggregate the counts into a SyncReport.
 *
 * Runs synchronously on the caller's thread and processes items in fetch order.
 * Overlap protection lives in SyncTriggerService, not here.
 *
 * Failure handling:
 * - configuration errors and unexpected exceptions abort the run (status=error, no counts)
 * - a failing source contributes zero items
 * - a failing item is recorded as FAILED and counted; the loop moves on
 * - tracker read failures count as "never synced", tracker write failures as a failed item
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class SyncOrchestrator {

    private final ConfigValidator configValidator;
    private final List<SourceAdapter> sourceAdapters;
    private final ChangeDetector changeDetector;
    private final DestinationPublisher destinationPublisher;
    private final TrackerStore trackerStore;
    private final LastRunHolder lastRunHolder;
    private final SyncMetrics syncMetrics;
    private final SyncProperties properties;

    /**
     * Execute one full reconciliation run. Never throws; every outcome is a report.
     */
    public SyncReport runSync() {
        String correlationId = CorrelationIds.current().orElse(null);
        boolean ownsCorrelationId = correlationId == null;
        if (ownsCorrelationId) {
            correlationId = CorrelationIds.newId("SYNC");
            MDC.put(CorrelationIds.MDC_KEY, correlationId);
        }

        Instant startTime = Instant.now();
        SyncReport.SyncReportBuilder report = SyncReport.builder()
                .correlationId(correlationId)
                .startTime(startTime);

        try {
            log.info("Starting knowledge sync: correlationId={}", correlationId);

            configValidator.validate();

            List<SyncItem> items = fetchAll();
            if (items.isEmpty()) {
                log.info("No data to sync");
                return complete(report
                        .status(SyncReport.RunStatus.SUCCESS)
                        .message("No data to sync"));
            }

            log.info("Fetched {} items in total, checking for changes", items.size());
            Counts counts = reconcile(items);

            log.info("Sync finished: synced={}, skipped={}, failed={}, total={}",
                    counts.synced, counts.skipped, counts.failed, items.size());
            return complete(report
                    .status(SyncReport.RunStatus.SUCCESS)
                    .synced(counts.synced)
                    .skipped(counts.skipped)
                    .failed(counts.failed)
                    .total(items.size())
                    .message(String.format("Sync completed: %d synced, %d skipped, %d failed",
                            counts.synced, counts.skipped, counts.failed)));

        } catch (SyncConfigurationException e) {
            String error = "Configuration error: " + e.getMessage();
            log.error("Sync aborted. {}", error);
            return complete(report
                    .status(SyncReport.RunStatus.ERROR)
                    .message(error)
                    .errorDetail(error));

        } catch (Exception e) {
            String error = "Unexpected sync error: " + e.getMessage();
            log.error("Sync aborted. {}", error, e);
            return complete(report
                    .status(SyncReport.RunStatus.ERROR)
                    .message(error)
                    .errorDetail(error));

        } finally {
            if (ownsCorrelationId) {
                MDC.remove(CorrelationIds.MDC_KEY);
            }
        }
    }

    private SyncReport complete(SyncReport.SyncReportBuilder builder) {
        SyncReport report = builder.endTime(Instant.now()).build();
        lastRunHolder.publish(report);
        syncMetrics.recordRun(report);
        return report;
    }

    private List<SyncItem> fetchAll() {
        List<SyncItem> items = new ArrayList<>();
        for (SourceAdapter adapter : sourceAdapters) {
            Optional<SourceQuery> query = adapter.configuredQuery();
            if (query.isEmpty()) {
                log.info("{} not configured, skipping", adapter.type());
                continue;
            }

            try {
                List<SyncItem> fetched = adapter.fetch(query.get());
                log.info("{} returned {} items for scope={}", adapter.type(), fetched.size(), query.get().getScope());
                items.addAll(fetched);
            } catch (SourceFetchException e) {
                log.warn("{} fetch failed, continuing without it: {}", adapter.type(), e.getMessage());
                syncMetrics.recordSourceFallback(adapter.type());
            }
        }
        return items;
    }

    private Counts reconcile(List<SyncItem> items) {
        Counts counts = new Counts();
        int index = 0;

        for (SyncItem item : items) {
            index++;
            log.info("[{}/{}] Processing {} {}", index, items.size(), item.getType(), item.getId());

            switch (reconcileItem(item)) {
                case SYNCED -> {
                    counts.synced++;
                    syncMetrics.recordItemSynced(item.getType());
                }
                case SKIPPED -> {
                    counts.skipped++;
                    syncMetrics.recordItemSkipped(item.getType());
                }
                case FAILED -> {
                    counts.failed++;
                    syncMetrics.recordItemFailed(item.getType());
                }
            }
        }
        return counts;
    }

    private ItemOutcome reconcileItem(SyncItem item) {
        Optional<SyncTracker> tracked = lookup(item);

        boolean shouldSync;
        try {
            shouldSync = changeDetector.shouldSync(item, tracked);
        } catch (DateTimeParseException e) {
            log.error("  {} has an unparsable remote timestamp '{}', not publishing", item.getId(), item.getUpdatedAt());
            return ItemOutcome.FAILED;
        }

        if (!shouldSync) {
            log.info("  {} unchanged, skipping", item.getId());
            return ItemOutcome.SKIPPED;
        }

        Optional<String> documentId = publish(item);
        if (documentId.isPresent()) {
            try {
                trackerStore.upsert(item.getId(), item.getType(), item.getUpdatedAt(), documentId.get(), SyncStatus.SUCCESS);
            } catch (TrackerStoreException e) {
                log.error("  {} published as {} but its tracker record could not be written: {}",
                        item.getId(), documentId.get(), e.getMessage());
                syncMetrics.recordTrackerWriteError();
                return ItemOutcome.FAILED;
            }
            log.info("  {} synced (destination id: {})", item.getId(), documentId.get());
            return ItemOutcome.SYNCED;
        }

        recordFailure(item, tracked);
        return ItemOutcome.FAILED;
    }

    /**
     * Read failures fail open: the item is treated as never synced and gets republished.
     */
    private Optional<SyncTracker> lookup(SyncItem item) {
        try {
            return trackerStore.get(item.getId());
        } catch (TrackerStoreException e) {
            log.warn("  Tracker lookup for {} failed, treating as new: {}", item.getId(), e.getMessage());
            syncMetrics.recordTrackerReadError();
            return Optional.empty();
        }
    }

    private Optional<String> publish(SyncItem item) {
        try {
            return destinationPublisher.publish(item.getId(), item.getContent());
        } catch (RuntimeException e) {
            log.error("  Publishing {} failed: {}", item.getId(), e.getMessage());
            return Optional.empty();
        }
    }

    /**
     * Which timestamp a FAILED row carries depends on sync.tracker.advance-on-failure;
     * keeping the previous one makes the next run retry the item.
     */
    private void recordFailure(SyncItem item, Optional<SyncTracker> tracked) {
        String recordedTime = properties.getTracker().isAdvanceOnFailure()
                ? item.getUpdatedAt()
                : tracked.map(SyncTracker::getLastSyncedUpdateTime).orElse(null);

        log.error("  {} sync failed", item.getId());
        try {
            trackerStore.upsert(item.getId(), item.getType(), recordedTime, "", SyncStatus.FAILED);
        } catch (TrackerStoreException e) {
            log.error("  Could not record failure of {}: {}", item.getId(), e.getMessage());
            syncMetrics.recordTrackerWriteError();
        }
    }

    private enum ItemOutcome {
        SYNCED,
        SKIPPED,
        FAILED
    }

    private static final class Counts {
        int synced;
        int skipped;
        int failed;
    }
}
