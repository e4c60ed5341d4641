package com.storefront.identitysync.adapters.in.scheduler;

import org.springframework.stereotype.Component;

import com.storefront.identitysync.application.port.in.DrainSyncQueueUseCase.DrainSummary;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;

/**
 * Publishes drain outcomes as {@code identity_sync.job.outcome} counters.
 * Skipped and blocked jobs are completions, never failures.
 */
@Component
public class SyncOutcomeRecorder {

    private final Counter synced;
    private final Counter skipped;
    private final Counter blocked;
    private final Counter retried;
    private final Counter failed;

    public SyncOutcomeRecorder(MeterRegistry meterRegistry) {
        this.synced = meterRegistry.counter("identity_sync.job.outcome", "status", "synced");
        this.skipped = meterRegistry.counter("identity_sync.job.outcome", "status", "skipped");
        this.blocked = meterRegistry.counter("identity_sync.job.outcome", "status", "blocked");
        this.retried = meterRegistry.counter("identity_sync.job.outcome", "status", "retry_scheduled");
        this.failed = meterRegistry.counter("identity_sync.job.outcome", "status", "failed");
    }

    public DrainSummary record(DrainSummary summary) {
        synced.increment(summary.synced());
        skipped.increment(summary.skipped());
        blocked.increment(summary.blocked());
        retried.increment(summary.retried());
        failed.increment(summary.failed());
        return summary;
    }
}
