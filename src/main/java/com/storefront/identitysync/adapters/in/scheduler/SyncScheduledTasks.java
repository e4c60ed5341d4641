package com.storefront.identitysync.adapters.in.scheduler;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import com.storefront.identitysync.application.port.in.DrainSyncQueueUseCase;
import com.storefront.identitysync.application.port.in.DrainSyncQueueUseCase.DrainSummary;
import com.storefront.identitysync.application.port.in.RunMaintenanceUseCase;
import com.storefront.identitysync.application.port.in.RunMaintenanceUseCase.MaintenanceReport;
import com.storefront.identitysync.bootstrap.config.IdentitySyncProperties;

/**
 * Periodic triggers for the sync drain and the maintenance run.
 * Every instance may run these concurrently; coordination lives in the store.
 */
@Component
@ConditionalOnProperty(prefix = "identity-sync.scheduling", name = "enabled", havingValue = "true", matchIfMissing = true)
public class SyncScheduledTasks {

    private static final Logger log = LoggerFactory.getLogger(SyncScheduledTasks.class);

    private final DrainSyncQueueUseCase drainSyncQueueUseCase;
    private final RunMaintenanceUseCase runMaintenanceUseCase;
    private final SyncOutcomeRecorder outcomeRecorder;
    private final int batchSize;

    public SyncScheduledTasks(DrainSyncQueueUseCase drainSyncQueueUseCase,
            RunMaintenanceUseCase runMaintenanceUseCase,
            SyncOutcomeRecorder outcomeRecorder,
            IdentitySyncProperties properties) {
        this.drainSyncQueueUseCase = drainSyncQueueUseCase;
        this.runMaintenanceUseCase = runMaintenanceUseCase;
        this.outcomeRecorder = outcomeRecorder;
        this.batchSize = Math.max(1, properties.getSync().getBatchSize());
    }

    @Scheduled(fixedDelayString = "${identity-sync.scheduling.drain-interval-ms:60000}")
    public void drainSyncQueue() {
        try {
            DrainSummary summary = outcomeRecorder.record(drainSyncQueueUseCase.drain(batchSize));
            if (summary.claimed() > 0) {
                log.info("action=scheduled_drain claimed={} synced={} failed={}",
                        summary.claimed(), summary.synced(), summary.failed());
            }
        } catch (Exception e) {
            log.error("action=scheduled_drain_failed error={}", e.getMessage(), e);
        }
    }

    @Scheduled(fixedDelayString = "${identity-sync.scheduling.maintenance-interval-ms:300000}",
            initialDelayString = "${identity-sync.scheduling.maintenance-interval-ms:300000}")
    public void runMaintenance() {
        try {
            MaintenanceReport report = runMaintenanceUseCase.runMaintenance();
            log.info("action=scheduled_maintenance ok={} durationMs={}", report.allSucceeded(), report.durationMs());
        } catch (Exception e) {
            log.error("action=scheduled_maintenance_failed error={}", e.getMessage(), e);
        }
    }
}
