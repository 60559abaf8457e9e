package com.example.knowledgesync.service;

import com.example.knowledgesync.dto.SyncReport;
import com.example.knowledgesync.exception.SyncInProgressException;
import com.example.knowledgesync.metrics.SyncMetrics;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.task.TaskExecutor;
import org.springframework.stereotype.Service;

import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Single entry point for starting a run, shared by the HTTP endpoint, the scheduler and
 * the run-once runner.
 *
 * At most one run per process: a trigger arriving while a run is in flight is refused with
 * SyncInProgressException instead of queued. Across replicas the scheduler is additionally
 * guarded by ShedLock.
 */
@Service
@Slf4j
public class SyncTriggerService {

    private final SyncOrchestrator syncOrchestrator;
    private final TaskExecutor syncTaskExecutor;
    private final SyncMetrics syncMetrics;

    private final AtomicBoolean running = new AtomicBoolean(false);

    public SyncTriggerService(SyncOrchestrator syncOrchestrator,
                              @Qualifier("syncTaskExecutor") TaskExecutor syncTaskExecutor,
                              SyncMetrics syncMetrics) {
        this.syncOrchestrator = syncOrchestrator;
        this.syncTaskExecutor = syncTaskExecutor;
        this.syncMetrics = syncMetrics;
    }

    /**
     * Run on the calling thread and return the finished report.
     *
     * @throws SyncInProgressException if another run holds the guard
     */
    public SyncReport runNow() {
        acquire();
        try {
            return syncOrchestrator.runSync();
        } finally {
            running.set(false);
        }
    }

    /**
     * Claim the guard on the calling thread, then hand the run to the sync executor.
     * The guard is released by the worker when the run ends.
     *
     * @throws SyncInProgressException if another run holds the guard
     * @throws RejectedExecutionException if the executor cannot take the task
     */
    public void runInBackground() {
        acquire();
        try {
            syncTaskExecutor.execute(() -> {
                try {
                    SyncReport report = syncOrchestrator.runSync();
                    log.info("Background sync finished: status={}, message={}",
                            report.getStatus().getValue(), report.getMessage());
                } finally {
                    running.set(false);
                }
            });
        } catch (RejectedExecutionException e) {
            running.set(false);
            log.error("Sync executor rejected background run: {}", e.getMessage());
            throw e;
        }
    }

    boolean isRunning() {
        return running.get();
    }

    private void acquire() {
        if (!running.compareAndSet(false, true)) {
            syncMetrics.recordRunRejected();
            throw new SyncInProgressException("A sync run is already in progress");
        }
    }
}
