package com.example.knowledgesync.service;

import com.example.knowledgesync.dto.SyncReport;
import com.example.knowledgesync.exception.SyncInProgressException;
import com.example.knowledgesync.metrics.SyncMetrics;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.core.task.TaskExecutor;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class SyncTriggerServiceTest {

    @Mock
    private SyncOrchestrator syncOrchestrator;

    private SimpleMeterRegistry meterRegistry;
    private List<Runnable> submitted;

    @BeforeEach
    void setUp() {
        meterRegistry = new SimpleMeterRegistry();
        submitted = new ArrayList<>();
    }

    @Test
    void runNowReturnsOrchestratorReportAndReleasesGuard() {
        SyncReport report = SyncReport.builder().status(SyncReport.RunStatus.SUCCESS).build();
        when(syncOrchestrator.runSync()).thenReturn(report);
        SyncTriggerService service = service(submitted::add);

        assertThat(service.runNow()).isSameAs(report);
        assertThat(service.isRunning()).isFalse();
    }

    @Test
    void concurrentRunIsRejected() throws Exception {
        CountDownLatch started = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        when(syncOrchestrator.runSync()).thenAnswer(invocation -> {
            started.countDown();
            release.await(5, TimeUnit.SECONDS);
            return SyncReport.builder().status(SyncReport.RunStatus.SUCCESS).build();
        });
        SyncTriggerService service = service(submitted::add);

        ExecutorService caller = Executors.newSingleThreadExecutor();
        try {
            Future<SyncReport> first = caller.submit(service::runNow);
            assertThat(started.await(5, TimeUnit.SECONDS)).isTrue();

            assertThat(service.isRunning()).isTrue();
            assertThatThrownBy(service::runNow).isInstanceOf(SyncInProgressException.class);
            assertThatThrownBy(service::runInBackground).isInstanceOf(SyncInProgressException.class);

            release.countDown();
            assertThat(first.get(5, TimeUnit.SECONDS).getStatus()).isEqualTo(SyncReport.RunStatus.SUCCESS);
        } finally {
            caller.shutdownNow();
        }

        verify(syncOrchestrator, times(1)).runSync();
        assertThat(meterRegistry.get("sync_runs_rejected_total").counter().count()).isEqualTo(2.0);
    }

    @Test
    void backgroundRunHoldsGuardUntilWorkerFinishes() {
        when(syncOrchestrator.runSync()).thenReturn(SyncReport.builder().status(SyncReport.RunStatus.SUCCESS).build());
        SyncTriggerService service = service(submitted::add);

        service.runInBackground();

        assertThat(submitted).hasSize(1);
        assertThat(service.isRunning()).isTrue();
        assertThatThrownBy(service::runNow).isInstanceOf(SyncInProgressException.class);

        submitted.get(0).run();

        assertThat(service.isRunning()).isFalse();
        verify(syncOrchestrator, times(1)).runSync();
    }

    @Test
    void rejectedBackgroundRunReleasesGuard() {
        SyncTriggerService service = service(task -> {
            throw new RejectedExecutionException("queue full");
        });

        assertThatThrownBy(service::runInBackground).isInstanceOf(RejectedExecutionException.class);

        assertThat(service.isRunning()).isFalse();
        verify(syncOrchestrator, never()).runSync();
    }

    private SyncTriggerService service(TaskExecutor executor) {
        return new SyncTriggerService(syncOrchestrator, executor, new SyncMetrics(meterRegistry));
    }
}
