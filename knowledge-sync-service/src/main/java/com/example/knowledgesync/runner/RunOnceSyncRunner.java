package com.example.knowledgesync.runner;

import com.example.knowledgesync.dto.SyncReport;
import com.example.knowledgesync.exception.SyncInProgressException;
import com.example.knowledgesync.service.SyncTriggerService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

/**
 * Command-line mode: start with --sync.run-once=true to run one sync and exit.
 * Exit code is 0 for a completed run (even with failed items) and 1 for an aborted one.
 */
@Component
@RequiredArgsConstructor
@Slf4j
@ConditionalOnProperty(name = "sync.run-once", havingValue = "true")
public class RunOnceSyncRunner implements ApplicationRunner, ExitCodeGenerator {

    private final SyncTriggerService syncTriggerService;

    private volatile int exitCode = 0;

    @Override
    public void run(ApplicationArguments args) {
        log.info("Running a single sync from the command line");
        SyncReport report;
        try {
            report = syncTriggerService.runNow();
        } catch (SyncInProgressException e) {
            log.error("Cannot run: {}", e.getMessage());
            exitCode = 1;
            return;
        }

        if (report.isError()) {
            log.error("Sync failed: {}", report.getErrorDetail());
            exitCode = 1;
        } else {
            log.info("{} (total={})", report.getMessage(), report.getTotal());
        }
    }

    @Override
    public int getExitCode() {
        return exitCode;
    }
}
