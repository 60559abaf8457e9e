package com.example.knowledgesync.scheduler;

import com.example.knowledgesync.dto.SyncReport;
import com.example.knowledgesync.exception.SyncInProgressException;
import com.example.knowledgesync.logging.CorrelationIds;
import com.example.knowledgesync.service.SyncTriggerService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import net.javacrumbs.shedlock.spring.annotation.SchedulerLock;
import org.slf4j.MDC;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Daily knowledge sync.
 *
 * - @SchedulerLock keeps the job on one replica at a time
 * - delegates to SyncTriggerService, so a manual run in flight makes the tick a no-op
 * - disabled with sync.scheduler.enabled=false
 */
@Component
@RequiredArgsConstructor
@Slf4j
@ConditionalOnProperty(name = "sync.scheduler.enabled", havingValue = "true", matchIfMissing = true)
public class SyncScheduler {

    private final SyncTriggerService syncTriggerService;

    /**
     * Default: every day at 04:00 Asia/Shanghai.
     */
    @Scheduled(cron = "0 ${sync.scheduler.minute:0} ${sync.scheduler.hour:4} * * *",
            zone = "${sync.scheduler.timezone:Asia/Shanghai}")
    @SchedulerLock(
            name = "dailyKnowledgeSync",
            lockAtMostFor = "2h",
            lockAtLeastFor = "1m"
    )
    public void dailySync() {
        String correlationId = CorrelationIds.newId("SCHEDULER");
        MDC.put(CorrelationIds.MDC_KEY, correlationId);

        try {
            log.info("=== Starting scheduled knowledge sync: correlationId={} ===", correlationId);
            SyncReport report = syncTriggerService.runNow();
            log.info("=== Completed scheduled knowledge sync: status={}, message={} ===",
                    report.getStatus().getValue(), report.getMessage());
        } catch (SyncInProgressException e) {
            log.warn("Skipping scheduled sync: {}", e.getMessage());
        } catch (Exception e) {
            log.error("Error in scheduled knowledge sync: {}", e.getMessage(), e);
        } finally {
            MDC.remove(CorrelationIds.MDC_KEY);
        }
    }
}
