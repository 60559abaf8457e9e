package com.example.knowledgesync.service;

import com.example.knowledgesync.dto.SyncReport;
import org.springframework.stereotype.Component;

import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Most recent run report, shared between the run that writes it and the status endpoint.
 * Reports are immutable and swapped in whole, so readers never see a partial one.
 */
@Component
public class LastRunHolder {

    private final AtomicReference<SyncReport> lastRun = new AtomicReference<>();

    public void publish(SyncReport report) {
        lastRun.set(report);
    }

    public Optional<SyncReport> get() {
        return Optional.ofNullable(lastRun.get());
    }
}
